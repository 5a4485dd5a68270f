package com.qiyi.domprune.model;

import com.qiyi.domprune.error.StructuralInvariantException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 以单一根节点表示的快照树。
 * 不变式：每个非根节点恰有一个父节点，且不存在环。
 */
public class DomTree {

    private final DomNode root;

    public DomTree(DomNode root) {
        if (root == null) {
            throw new StructuralInvariantException("Tree root must not be null");
        }
        if (root.getParent() != null) {
            throw new StructuralInvariantException("Tree root must not have a parent | tag=" + root.getTag());
        }
        this.root = root;
    }

    public DomNode getRoot() {
        return root;
    }

    /**
     * 深拷贝。副本与原树完全独立，清洗/剪枝都在副本上进行。
     */
    public DomTree copy() {
        return new DomTree(root.deepCopy());
    }

    /**
     * 文档顺序（先序）列出所有节点，包括 text 伪节点。
     */
    public List<DomNode> preOrder() {
        return preOrder(root);
    }

    public static List<DomNode> preOrder(DomNode start) {
        List<DomNode> out = new ArrayList<>();
        Deque<DomNode> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            DomNode node = stack.pop();
            out.add(node);
            List<DomNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return out;
    }

    /**
     * 逆文档顺序：最深/最后的节点在前，保证子节点先于祖先被处理。
     */
    public List<DomNode> reverseDocumentOrder() {
        List<DomNode> nodes = preOrder();
        Collections.reverse(nodes);
        return nodes;
    }

    public int size() {
        return preOrder().size();
    }

    /**
     * 按 backend_node_id 查找，文档顺序中的第一个匹配；不存在返回 null。
     */
    public DomNode findByBackendId(String backendId) {
        if (backendId == null) return null;
        for (DomNode node : preOrder()) {
            if (backendId.equals(node.getBackendId())) return node;
        }
        return null;
    }

    /**
     * 从父节点到根的祖先链。
     * 如果链条到不了本树的根（节点被摘除或存在环），抛出 StructuralInvariantException。
     */
    public List<DomNode> ancestorsOf(DomNode node) {
        List<DomNode> ancestors = new ArrayList<>();
        Map<DomNode, Boolean> seen = new IdentityHashMap<>();
        seen.put(node, Boolean.TRUE);
        DomNode current = node;
        while (current != root) {
            DomNode parent = current.getParent();
            if (parent == null) {
                throw new StructuralInvariantException("Node has no ancestor chain to root | node=" + node);
            }
            if (seen.put(parent, Boolean.TRUE) != null) {
                throw new StructuralInvariantException("Cycle detected in ancestor chain | node=" + node);
            }
            ancestors.add(parent);
            current = parent;
        }
        return ancestors;
    }

    /**
     * 校验整棵树：每个子节点的 parent 指回其所在节点，且没有节点被访问两次。
     */
    public void verify() {
        Map<DomNode, Boolean> seen = new IdentityHashMap<>();
        Deque<DomNode> stack = new ArrayDeque<>();
        stack.push(root);
        seen.put(root, Boolean.TRUE);
        while (!stack.isEmpty()) {
            DomNode node = stack.pop();
            for (DomNode child : node.getChildren()) {
                if (child.getParent() != node) {
                    throw new StructuralInvariantException("Parent link mismatch | child=" + child + ", expectedParent=" + node);
                }
                if (seen.put(child, Boolean.TRUE) != null) {
                    throw new StructuralInvariantException("Node reachable twice | node=" + child);
                }
                stack.push(child);
            }
        }
    }

    public String toMarkup() {
        return DomMarkupWriter.write(root);
    }

    @Override
    public String toString() {
        return toMarkup();
    }
}
