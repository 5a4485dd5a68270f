package com.qiyi.domprune.prune;

import com.qiyi.domprune.model.DomTree;

import java.util.Collections;
import java.util.Set;

/**
 * 剪枝结果：剪枝后的新树，以及解析出的保留集合（按文档顺序的 backend_node_id）。
 * 不需要保留集合的调用方直接忽略即可。
 */
public class PruneResult {

    private final DomTree tree;
    private final Set<String> keepSet;

    public PruneResult(DomTree tree, Set<String> keepSet) {
        this.tree = tree;
        this.keepSet = Collections.unmodifiableSet(keepSet);
    }

    public DomTree getTree() {
        return tree;
    }

    public Set<String> getKeepSet() {
        return keepSet;
    }
}
