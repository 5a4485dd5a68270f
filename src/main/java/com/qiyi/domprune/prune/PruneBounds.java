package com.qiyi.domprune.prune;

import com.qiyi.domprune.config.PruneConfig;

/**
 * 候选邻域的范围限制。
 */
public class PruneBounds {

    private final int maxDepth;
    private final int maxDescendants;
    private final int maxSiblings;

    public PruneBounds(int maxDepth, int maxDescendants, int maxSiblings) {
        if (maxDepth < 0 || maxDescendants < 0 || maxSiblings < 0) {
            throw new IllegalArgumentException("bounds must be non-negative | maxDepth=" + maxDepth
                    + ", maxDescendants=" + maxDescendants + ", maxSiblings=" + maxSiblings);
        }
        this.maxDepth = maxDepth;
        this.maxDescendants = maxDescendants;
        this.maxSiblings = maxSiblings;
    }

    public static PruneBounds defaults() {
        return new PruneBounds(PruneConfig.DEFAULT_PRUNE_MAX_DEPTH,
                PruneConfig.DEFAULT_PRUNE_MAX_DESCENDANTS,
                PruneConfig.DEFAULT_PRUNE_MAX_SIBLINGS);
    }

    public static PruneBounds fromConfig(PruneConfig config) {
        return new PruneBounds(config.getPruneMaxDepth(), config.getPruneMaxDescendants(), config.getPruneMaxSiblings());
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getMaxDescendants() {
        return maxDescendants;
    }

    public int getMaxSiblings() {
        return maxSiblings;
    }

    public PruneBounds withMaxSiblings(int siblings) {
        return new PruneBounds(maxDepth, maxDescendants, siblings);
    }

    @Override
    public String toString() {
        return "PruneBounds{maxDepth=" + maxDepth + ", maxDescendants=" + maxDescendants + ", maxSiblings=" + maxSiblings + '}';
    }
}
