package com.qiyi.domprune;

import com.qiyi.domprune.choice.ChoiceFormatter;
import com.qiyi.domprune.choice.ChoiceSet;
import com.qiyi.domprune.config.PruneConfig;
import com.qiyi.domprune.ingest.SnapshotParser;
import com.qiyi.domprune.model.DomTree;
import com.qiyi.domprune.prune.CandidatePruner;
import com.qiyi.domprune.prune.PruneBounds;
import com.qiyi.domprune.prune.PruneResult;
import com.qiyi.domprune.sanitize.AttributeSanitizer;
import com.qiyi.domprune.serialize.CompactSerializer;
import com.qiyi.domprune.serialize.IdentifierMap;
import com.qiyi.domprune.serialize.SerializeOptions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Collections;

/**
 * 单个决策步骤的压缩流水线：
 * 快照 -> 解析 -> 清洗（候选不折叠）-> 剪枝 -> 紧凑序列化 -> 选项。
 *
 * 每次调用都新建 IdentifierMap，不跨步骤共享任何可变状态；
 * 候选不存在等错误直接抛出，由调用方决定中止、回退或跳过。
 */
public class DomCompactionPipeline {
    private static final Logger logger = LogManager.getLogger(DomCompactionPipeline.class);

    private final PruneBounds bounds;
    private final SerializeOptions options;
    private final int labelTokens;

    public DomCompactionPipeline() {
        this(PruneConfig.getInstance());
    }

    public DomCompactionPipeline(PruneConfig config) {
        this(PruneBounds.fromConfig(config), SerializeOptions.fromConfig(config), config.getChoiceLabelTokens());
    }

    public DomCompactionPipeline(PruneBounds bounds, SerializeOptions options, int labelTokens) {
        this.bounds = bounds;
        this.options = options;
        this.labelTokens = labelTokens;
    }

    public CompactionResult compact(String snapshot, Collection<String> candidateIds, String groundTruthId) {
        return compact(SnapshotParser.parse(snapshot), candidateIds, groundTruthId);
    }

    public CompactionResult compact(DomTree rawTree, Collection<String> candidateIds, String groundTruthId) {
        Collection<String> candidates = candidateIds == null ? Collections.emptyList() : candidateIds;
        long start = System.currentTimeMillis();

        DomTree sanitized = AttributeSanitizer.clean(rawTree, candidates);
        PruneResult pruned = CandidatePruner.prune(sanitized, candidates, bounds);

        IdentifierMap idMap = new IdentifierMap();
        String text = CompactSerializer.serialize(pruned.getTree(), idMap, options);
        ChoiceSet choices = ChoiceFormatter.format(pruned.getTree(), idMap, groundTruthId, options, labelTokens);

        logger.info("[COMPACT] candidates={}, choices={}, chars={}, groundTruth={}, cost={}ms",
                candidates.size(), choices.size(), text.length(), choices.getGroundTruthLetter(),
                System.currentTimeMillis() - start);
        return new CompactionResult(text, choices, idMap, pruned.getKeepSet(), pruned.getTree());
    }

    public PruneBounds getBounds() {
        return bounds;
    }

    public SerializeOptions getOptions() {
        return options;
    }
}
