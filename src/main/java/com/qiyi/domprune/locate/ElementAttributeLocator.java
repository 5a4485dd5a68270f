package com.qiyi.domprune.locate;

import com.qiyi.domprune.model.DomNode;
import com.qiyi.domprune.model.DomTree;
import com.qiyi.domprune.serialize.CompactSerializer;
import com.qiyi.domprune.serialize.IdentifierMap;
import com.qiyi.domprune.serialize.SerializeOptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 列出树中所有带 backend_node_id 的节点的属性、标签与文本，
 * 并给出序列化产生的 整数 id -> backend_node_id 反向映射，供动作落地阶段定位元素。
 */
public class ElementAttributeLocator {

    public static class ElementAttributes {
        public final String tag;
        public final Map<String, String> attributes;
        public final String text;

        ElementAttributes(String tag, Map<String, String> attributes, String text) {
            this.tag = tag;
            this.attributes = Collections.unmodifiableMap(attributes);
            this.text = text;
        }
    }

    public static class LocateResult {
        public final String treeRepr;
        public final List<ElementAttributes> elements;
        public final Map<Integer, String> idToBackendId;

        LocateResult(String treeRepr, List<ElementAttributes> elements, Map<Integer, String> idToBackendId) {
            this.treeRepr = treeRepr;
            this.elements = Collections.unmodifiableList(elements);
            this.idToBackendId = Collections.unmodifiableMap(idToBackendId);
        }
    }

    public static LocateResult locate(DomTree tree, SerializeOptions options) {
        IdentifierMap idMap = new IdentifierMap();
        String repr = CompactSerializer.serialize(tree, idMap, options);

        List<ElementAttributes> elements = new ArrayList<>();
        for (DomNode node : tree.preOrder()) {
            if (!node.hasBackendId()) continue;
            elements.add(new ElementAttributes(node.getTag(), new LinkedHashMap<>(node.getAttributes()), leadingText(node)));
        }
        return new LocateResult(repr, elements, idMap.inverseMap());
    }

    /**
     * text 节点取自身内容；元素取紧跟在开标签后的文本（第一个子节点为 text 时）。
     */
    private static String leadingText(DomNode node) {
        if (node.isText()) return node.getText();
        List<DomNode> children = node.getChildren();
        if (!children.isEmpty() && children.get(0).isText()) return children.get(0).getText();
        return null;
    }
}
