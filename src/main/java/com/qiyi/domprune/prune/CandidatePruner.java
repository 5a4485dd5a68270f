package com.qiyi.domprune.prune;

import com.qiyi.domprune.error.CandidateNotFoundException;
import com.qiyi.domprune.model.DomNode;
import com.qiyi.domprune.model.DomTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 以候选元素为中心的剪枝。
 *
 * 每个候选的邻域 = 自身 + 到根的全部祖先 + 深度受限的前若干个后代 + 前后若干个元素兄弟；
 * 所有候选的邻域取并集后，在深拷贝上删除邻域外的节点，
 * 非候选节点与 text 节点去掉 backend_node_id（仍可见，但不可寻址），
 * 最后重新折叠因删除而暴露出来的包装层。
 */
public class CandidatePruner {
    private static final Logger logger = LogManager.getLogger(CandidatePruner.class);

    public static PruneResult prune(DomTree tree, Collection<String> candidateIds) {
        return prune(tree, candidateIds, PruneBounds.defaults());
    }

    /**
     * 剪枝。所有候选先逐个解析邻域，任何一个不存在都会在构造新树之前抛出
     * {@link CandidateNotFoundException}，因此不会返回半成品。
     *
     * @param tree 已清洗的树，不会被修改
     * @param candidateIds 候选 backend_node_id，可为空
     * @param bounds 邻域范围
     * @return 剪枝后的树与保留集合
     */
    public static PruneResult prune(DomTree tree, Collection<String> candidateIds, PruneBounds bounds) {
        tree.verify();
        Set<String> candidates = candidateIds == null ? Collections.emptySet() : new LinkedHashSet<>(candidateIds);

        List<DomNode> order = tree.preOrder();
        Map<String, DomNode> index = indexByBackendId(order);

        // 每个候选独立计算邻域，再取并集
        Set<DomNode> keep = identitySet();
        for (String candidateId : candidates) {
            keep.addAll(neighbourhood(tree, index, candidateId, bounds));
        }

        int n = order.size();
        boolean[] keepFlag = new boolean[n];
        boolean[] candidateFlag = new boolean[n];
        Set<String> keepIds = new LinkedHashSet<>();
        for (int i = 0; i < n; i++) {
            DomNode node = order.get(i);
            // text 节点跟随其父节点
            DomNode decider = node.isText() && node.getParent() != null ? node.getParent() : node;
            keepFlag[i] = keep.contains(decider);
            String deciderId = decider.getBackendId();
            candidateFlag[i] = deciderId != null && candidates.contains(deciderId);
            if (keep.contains(node) && node.hasBackendId()) keepIds.add(node.getBackendId());
        }

        DomTree copy = tree.copy();
        List<DomNode> copyOrder = copy.preOrder();
        int removed = 0;
        int collapsed = 0;
        // 先算好工作表，再按逆文档顺序修改
        for (int i = n - 1; i >= 0; i--) {
            DomNode node = copyOrder.get(i);
            if (!keepFlag[i] && node.getParent() != null) {
                node.detach();
                removed++;
                continue;
            }
            if (!candidateFlag[i] || node.isText()) {
                node.removeAttribute(DomNode.BACKEND_ID_ATTR);
            }
            if (isEmptyWrapper(node)) {
                node.unwrap();
                collapsed++;
            }
        }

        logger.info("[PRUNE] candidates={}, nodes {} -> {}, removed={}, collapsed={}, keepSet={}",
                candidates.size(), n, copy.size(), removed, collapsed, keepIds.size());
        return new PruneResult(copy, keepIds);
    }

    /**
     * 单个候选的保留集合（backend_node_id，按文档顺序）。
     * 调用方可借此逐个验证候选，跳过出错的那一个。
     */
    public static Set<String> keepSetFor(DomTree tree, String candidateId, PruneBounds bounds) {
        List<DomNode> order = tree.preOrder();
        Set<DomNode> nodes = neighbourhood(tree, indexByBackendId(order), candidateId, bounds);
        Set<String> ids = new LinkedHashSet<>();
        for (DomNode node : order) {
            if (nodes.contains(node) && node.hasBackendId()) ids.add(node.getBackendId());
        }
        return ids;
    }

    private static Set<DomNode> neighbourhood(DomTree tree, Map<String, DomNode> index, String candidateId, PruneBounds bounds) {
        DomNode candidate = candidateId == null ? null : index.get(candidateId);
        if (candidate == null) {
            throw new CandidateNotFoundException(candidateId);
        }
        Set<DomNode> out = identitySet();
        out.add(candidate);
        out.addAll(tree.ancestorsOf(candidate));
        out.addAll(descendants(candidate, bounds.getMaxDepth(), bounds.getMaxDescendants()));
        out.addAll(siblingWindow(candidate, bounds.getMaxSiblings()));
        return out;
    }

    /**
     * 先序遍历候选的子树，最多取 limit 个。
     * 子节点深度为 1，深度不超过 maxDepth 的节点继续展开其子节点，
     * 因此最深取到 maxDepth + 1 层；maxDepth 为 0 时只取直接子节点。
     */
    static List<DomNode> descendants(DomNode node, int maxDepth, int limit) {
        List<DomNode> out = new ArrayList<>();
        if (limit <= 0) return out;
        Deque<Frame> stack = new ArrayDeque<>();
        pushChildren(stack, node, 1);
        while (!stack.isEmpty() && out.size() < limit) {
            Frame frame = stack.pop();
            out.add(frame.node);
            if (frame.depth <= maxDepth) {
                pushChildren(stack, frame.node, frame.depth + 1);
            }
        }
        return out;
    }

    private static void pushChildren(Deque<Frame> stack, DomNode node, int depth) {
        List<DomNode> children = node.getChildren();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(new Frame(children.get(i), depth));
        }
    }

    private static final class Frame {
        final DomNode node;
        final int depth;

        Frame(DomNode node, int depth) {
            this.node = node;
            this.depth = depth;
        }
    }

    /**
     * 候选前后 radius 个元素兄弟（text 伪节点不参与编号），包含候选自身。
     */
    static List<DomNode> siblingWindow(DomNode node, int radius) {
        DomNode parent = node.getParent();
        if (parent == null) return Collections.singletonList(node);
        List<DomNode> siblings = new ArrayList<>();
        int idx = -1;
        for (DomNode child : parent.getChildren()) {
            if (child.isText()) continue;
            if (child == node) idx = siblings.size();
            siblings.add(child);
        }
        if (idx < 0) return Collections.singletonList(node);
        int from = Math.max(0, idx - radius);
        int to = Math.min(siblings.size(), idx + radius + 1);
        return new ArrayList<>(siblings.subList(from, to));
    }

    private static boolean isEmptyWrapper(DomNode node) {
        return !node.isText()
                && node.getAttributes().isEmpty()
                && !node.hasTextChild()
                && node.getParent() != null
                && node.childCount() <= 1;
    }

    private static Map<String, DomNode> indexByBackendId(List<DomNode> order) {
        Map<String, DomNode> index = new HashMap<>();
        for (DomNode node : order) {
            String id = node.getBackendId();
            if (id != null && !id.isEmpty()) index.putIfAbsent(id, node);
        }
        return index;
    }

    private static Set<DomNode> identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }
}
