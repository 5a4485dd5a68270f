package com.qiyi.domprune.ingest;

import com.qiyi.domprune.error.StructuralInvariantException;
import com.qiyi.domprune.model.DomNode;
import com.qiyi.domprune.model.DomTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.List;

/**
 * 快照解析器：把序列化的 DOM/无障碍快照解析为 {@link DomTree}。
 *
 * 约定：
 * - 使用 jsoup 的 XML 解析器，保留标签与属性大小写；
 * - {@code <text>} 元素成为 text 伪节点（保留其属性，内容取完整文本）；
 * - 其他元素内的裸文本成为合成 text 伪节点（没有 backend_node_id）；
 * - 注释、声明、doctype 忽略。
 */
public class SnapshotParser {
    private static final Logger logger = LogManager.getLogger(SnapshotParser.class);

    public static DomTree parse(String snapshot) {
        if (snapshot == null || snapshot.trim().isEmpty()) {
            throw new StructuralInvariantException("Snapshot is empty");
        }
        Document doc = Jsoup.parse(snapshot, "", Parser.xmlParser());

        List<Element> roots = new ArrayList<>();
        for (Node child : doc.childNodes()) {
            if (child instanceof Element) roots.add((Element) child);
        }
        if (roots.isEmpty()) {
            throw new StructuralInvariantException("Snapshot has no root element");
        }
        if (roots.size() > 1) {
            throw new StructuralInvariantException("Snapshot has " + roots.size() + " top-level elements, expected exactly one");
        }

        DomTree tree = new DomTree(convert(roots.get(0)));
        logger.debug("[INGEST] parsed snapshot | chars={}, nodes={}", snapshot.length(), tree.size());
        return tree;
    }

    /**
     * 把 jsoup 元素递归转换为 DomNode。
     */
    private static DomNode convert(Element el) {
        String tag = el.tagName();
        DomNode node;
        if (DomNode.TEXT_TAG.equals(tag)) {
            node = DomNode.text(el.wholeText());
        } else {
            node = DomNode.element(tag);
        }
        for (Attribute attr : el.attributes()) {
            node.setAttribute(attr.getKey(), attr.getValue());
        }
        if (node.isText()) return node;

        for (Node child : el.childNodes()) {
            if (child instanceof Element) {
                node.appendChild(convert((Element) child));
            } else if (child instanceof TextNode) {
                // CDATA 也是 TextNode
                node.appendChild(DomNode.text(((TextNode) child).getWholeText()));
            }
        }
        return node;
    }
}
