package com.qiyi.domprune.serialize;

import com.qiyi.domprune.model.DomMarkupWriter;
import com.qiyi.domprune.model.DomNode;
import com.qiyi.domprune.model.DomTree;
import com.qiyi.domprune.util.TextUtil;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 紧凑序列化：把（通常已剪枝的）树渲染成适合放进模型上下文的括号文本。
 *
 * 每个元素的属性按固定优先级压缩成一个 meta 串，backend_node_id 通过调用方持有的
 * {@link IdentifierMap} 改写为小整数 id；随后去掉引号、展开 text 节点、
 * 把尖括号标记改写成圆括号记法，并做一轮固定的 HTML 实体反转义。
 */
public class CompactSerializer {
    private static final Logger logger = LogManager.getLogger(CompactSerializer.class);

    /**
     * 属性优先级（meta 串里的先后顺序）
     */
    public static final List<String> ATTRIBUTE_PRIORITY = Collections.unmodifiableList(Arrays.asList(
            "role", "aria_role", "type", "alt", "aria_description", "aria_label",
            "label", "title", "name", "text_value", "value", "placeholder",
            "input_checked", "input_value", "option_selected", "class"
    ));

    // 没有信息量的取值
    private static final Set<String> MEANINGLESS_VALUES = new HashSet<>(Arrays.asList(
            "hidden", "none", "presentation", "null", "undefined"
    ));

    // 长度达到该值的 token 视为噪声（哈希、编码串等）
    private static final int MAX_TOKEN_CHARS = 15;

    public static final String ID_ATTR = "id";
    public static final String META_ATTR = "meta";

    private static final String[][] HTML_ESCAPE_TABLE = {
            {"&quot;", "\""},
            {"&amp;", "&"},
            {"&lt;", "<"},
            {"&gt;", ">"},
            {"&nbsp;", " "},
            {"&ndash;", "-"},
            {"&rsquo;", "'"},
            {"&lsquo;", "'"},
            {"&ldquo;", "\""},
            {"&rdquo;", "\""},
            {"&#39;", "'"},
            {"&#40;", "("},
            {"&#41;", ")"},
    };

    private static final Pattern TEXT_ELEMENT = Pattern.compile("<text>(.*?)</text>");
    private static final Pattern CLOSE_TAG = Pattern.compile("</(.+?)>");
    private static final Pattern OPEN_TAG = Pattern.compile("<(.+?)>");
    private static final String SELF_CLOSE_MARK = "$/$";

    public static String serialize(DomTree tree, IdentifierMap idMap) {
        return serialize(tree.getRoot(), idMap, SerializeOptions.defaults());
    }

    public static String serialize(DomTree tree, IdentifierMap idMap, SerializeOptions options) {
        return serialize(tree.getRoot(), idMap, options);
    }

    /**
     * 序列化以 node 为根的子树。节点本身不会被修改，idMap 会被就地更新。
     *
     * @param node 子树根
     * @param idMap 本步骤共享的标识映射
     * @param options 截断与括号选项
     * @return 紧凑文本
     */
    public static String serialize(DomNode node, IdentifierMap idMap, SerializeOptions options) {
        if (idMap == null) throw new IllegalArgumentException("idMap must not be null");
        SerializeOptions opts = options == null ? SerializeOptions.defaults() : options;
        DomNode copy = node.deepCopy();

        for (DomNode n : DomTree.preOrder(copy)) {
            if (n.isText()) {
                n.getAttributes().clear();
                n.setText(TextUtil.firstTokens(n.getText(), opts.getMaxMetaTokens()));
                continue;
            }
            // 先重映射标识，再压缩属性
            if (n.hasBackendId()) {
                int id = idMap.idFor(n.getBackendId());
                n.setAttribute(DomNode.BACKEND_ID_ATTR, String.valueOf(id));
            }
            condenseAttributes(n, opts.getMaxValueTokens(), opts.getMaxMetaTokens());
        }

        String markup = DomMarkupWriter.write(copy);
        String out = render(markup, opts.isKeepHtmlBrackets());
        logger.debug("[SERIALIZE] markup chars={} -> compact chars={}, idMap size={}", markup.length(), out.length(), idMap.size());
        return out;
    }

    /**
     * 按优先级把属性压缩成 meta 串；原属性全部清空，只回填 id 与 meta。
     */
    static void condenseAttributes(DomNode node, int maxValueTokens, int maxMetaTokens) {
        Map<String, String> attributes = node.getAttributes();
        Set<String> accepted = new HashSet<>();
        StringBuilder meta = new StringBuilder();
        for (String attr : ATTRIBUTE_PRIORITY) {
            String raw = attributes.get(attr);
            if (raw == null) continue;
            String value = raw.toLowerCase(Locale.ROOT);
            if (MEANINGLESS_VALUES.contains(value) || value.startsWith("http")) continue;

            List<String> kept = new ArrayList<>();
            for (String token : TextUtil.tokens(value)) {
                if (kept.size() >= maxValueTokens) break;
                if (token.length() < MAX_TOKEN_CHARS) kept.add(token);
            }
            String condensed = String.join(" ", kept);
            if (!condensed.isEmpty() && accepted.add(condensed)) {
                meta.append(condensed).append(' ');
            }
        }

        String uid = attributes.get(DomNode.BACKEND_ID_ATTR);
        attributes.clear();
        if (uid != null && !uid.isEmpty()) {
            attributes.put(ID_ATTR, uid);
        }
        if (meta.length() > 0) {
            attributes.put(META_ATTR, TextUtil.firstTokens(meta.toString(), maxMetaTokens));
        }
    }

    /**
     * 对压缩后的标记做文本级改写。
     */
    static String render(String markup, boolean keepHtmlBrackets) {
        String s = markup.replace("\"", " ");
        s = s.replace("meta= ", "").replace("id= ", "id=").replace(" >", ">");
        s = TEXT_ELEMENT.matcher(s).replaceAll("$1");
        if (!keepHtmlBrackets) {
            s = s.replace("/>", SELF_CLOSE_MARK + ">");
            s = CLOSE_TAG.matcher(s).replaceAll(")");
            // 开标签保留 '>' 作为属性与内容之间的分隔；自闭合标签由标记处收尾
            s = OPEN_TAG.matcher(s).replaceAll(mr -> {
                String inner = mr.group(1);
                String rewritten = inner.endsWith(SELF_CLOSE_MARK) ? "(" + inner : "(" + inner + ">";
                return Matcher.quoteReplacement(rewritten);
            });
            s = s.replace(SELF_CLOSE_MARK, ")");
        }
        for (String[] entry : HTML_ESCAPE_TABLE) {
            s = s.replace(entry[0], entry[1]);
        }
        return TextUtil.cleanText(s);
    }
}
