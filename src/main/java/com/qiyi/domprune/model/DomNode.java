package com.qiyi.domprune.model;

import com.qiyi.domprune.error.StructuralInvariantException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DOM 快照节点。
 * 元素节点携带标签、有序属性与子节点；"text" 伪节点携带文本内容。
 * backend_node_id 作为普通属性保存，合成/合并出的节点没有该属性。
 * parent 只是反向引用，子节点归父节点独占。
 */
public class DomNode {

    public static final String TEXT_TAG = "text";
    public static final String BACKEND_ID_ATTR = "backend_node_id";

    private final String tag;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<DomNode> children = new ArrayList<>();
    private DomNode parent;
    private String text;

    public DomNode(String tag) {
        if (tag == null || tag.isEmpty()) {
            throw new IllegalArgumentException("tag must not be empty");
        }
        this.tag = tag;
    }

    public static DomNode element(String tag) {
        return new DomNode(tag);
    }

    public static DomNode text(String content) {
        DomNode node = new DomNode(TEXT_TAG);
        node.text = content == null ? "" : content;
        return node;
    }

    public String getTag() {
        return tag;
    }

    public boolean isText() {
        return TEXT_TAG.equals(tag);
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    /**
     * 属性表的可变视图，迭代顺序即插入顺序。
     */
    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String getAttribute(String name) {
        return attributes.get(name);
    }

    public DomNode setAttribute(String name, String value) {
        attributes.put(name, value);
        return this;
    }

    public String removeAttribute(String name) {
        return attributes.remove(name);
    }

    public String getBackendId() {
        return attributes.get(BACKEND_ID_ATTR);
    }

    public boolean hasBackendId() {
        String id = attributes.get(BACKEND_ID_ATTR);
        return id != null && !id.isEmpty();
    }

    public DomNode getParent() {
        return parent;
    }

    public List<DomNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int childCount() {
        return children.size();
    }

    public boolean hasTextChild() {
        for (DomNode child : children) {
            if (child.isText()) return true;
        }
        return false;
    }

    public DomNode appendChild(DomNode child) {
        insertChild(children.size(), child);
        return this;
    }

    public void insertChild(int index, DomNode child) {
        if (child == null) throw new IllegalArgumentException("child must not be null");
        if (child.parent != null) {
            throw new StructuralInvariantException("Node already has a parent | tag=" + child.tag);
        }
        if (child == this || isDescendantOf(child)) {
            throw new StructuralInvariantException("Insertion would create a cycle | tag=" + child.tag);
        }
        children.add(index, child);
        child.parent = this;
    }

    /**
     * 在父节点的子列表中的位置（按引用比较）。
     */
    public int indexInParent() {
        if (parent == null) return -1;
        List<DomNode> siblings = parent.children;
        for (int i = 0; i < siblings.size(); i++) {
            if (siblings.get(i) == this) return i;
        }
        throw new StructuralInvariantException("Node is not among its parent's children | tag=" + tag);
    }

    /**
     * 从父节点摘除（连同整棵子树）。
     */
    public void detach() {
        if (parent == null) return;
        int idx = indexInParent();
        parent.children.remove(idx);
        parent = null;
    }

    /**
     * 把自己的子节点按原顺序拼接到自己原来的位置，然后移除自己。
     */
    public void unwrap() {
        if (parent == null) {
            throw new StructuralInvariantException("Cannot unwrap a node without parent | tag=" + tag);
        }
        DomNode p = parent;
        int idx = indexInParent();
        p.children.remove(idx);
        parent = null;
        List<DomNode> moved = new ArrayList<>(children);
        children.clear();
        for (DomNode child : moved) {
            child.parent = null;
            p.children.add(idx, child);
            child.parent = p;
            idx++;
        }
    }

    /**
     * 深拷贝整棵子树，返回的副本没有父节点。
     */
    public DomNode deepCopy() {
        DomNode copy = new DomNode(tag);
        copy.text = text;
        copy.attributes.putAll(attributes);
        for (DomNode child : children) {
            DomNode childCopy = child.deepCopy();
            copy.children.add(childCopy);
            childCopy.parent = copy;
        }
        return copy;
    }

    private boolean isDescendantOf(DomNode candidateAncestor) {
        DomNode p = parent;
        while (p != null) {
            if (p == candidateAncestor) return true;
            p = p.parent;
        }
        return false;
    }

    @Override
    public String toString() {
        return "DomNode{" +
                "tag='" + tag + '\'' +
                ", attributes=" + attributes +
                (text != null ? ", text='" + text + '\'' : "") +
                ", children=" + children.size() +
                '}';
    }
}
