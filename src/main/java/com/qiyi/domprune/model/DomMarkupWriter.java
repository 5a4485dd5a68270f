package com.qiyi.domprune.model;

import java.util.List;
import java.util.Map;

/**
 * 把节点树写回 XML 风格的标记。
 * 无子节点的元素输出为 {@code <tag ... />}；text 伪节点输出为 {@code <text>内容</text>}。
 * 文本转义 &amp; &lt; &gt;，属性值另外转义双引号。
 */
public final class DomMarkupWriter {

    private DomMarkupWriter() {
    }

    public static String write(DomNode node) {
        StringBuilder sb = new StringBuilder();
        write(node, sb);
        return sb.toString();
    }

    private static void write(DomNode node, StringBuilder sb) {
        sb.append('<').append(node.getTag());
        for (Map.Entry<String, String> e : node.getAttributes().entrySet()) {
            sb.append(' ').append(e.getKey()).append("=\"").append(escapeAttribute(e.getValue())).append('"');
        }
        if (node.isText()) {
            sb.append('>').append(escapeText(node.getText())).append("</").append(node.getTag()).append('>');
            return;
        }
        List<DomNode> children = node.getChildren();
        if (children.isEmpty()) {
            sb.append(" />");
            return;
        }
        sb.append('>');
        for (DomNode child : children) {
            write(child, sb);
        }
        sb.append("</").append(node.getTag()).append('>');
    }

    static String escapeText(String s) {
        if (s == null) return "";
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&': sb.append("&amp;"); break;
                case '<': sb.append("&lt;"); break;
                case '>': sb.append("&gt;"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    static String escapeAttribute(String s) {
        if (s == null) return "";
        return escapeText(s).replace("\"", "&quot;");
    }
}
