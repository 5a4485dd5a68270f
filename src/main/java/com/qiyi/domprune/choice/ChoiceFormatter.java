package com.qiyi.domprune.choice;

import com.qiyi.domprune.config.PruneConfig;
import com.qiyi.domprune.model.DomNode;
import com.qiyi.domprune.model.DomTree;
import com.qiyi.domprune.serialize.CompactSerializer;
import com.qiyi.domprune.serialize.IdentifierMap;
import com.qiyi.domprune.serialize.SerializeOptions;
import com.qiyi.domprune.util.TextUtil;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * 把剪枝树中仍可寻址的节点（只有候选会保留 backend_node_id）整理成多选题选项。
 */
public class ChoiceFormatter {
    private static final Logger logger = LogManager.getLogger(ChoiceFormatter.class);

    public static ChoiceSet format(DomTree prunedTree, IdentifierMap idMap, String groundTruthId) {
        return format(prunedTree, idMap, groundTruthId, SerializeOptions.defaults(), PruneConfig.DEFAULT_CHOICE_LABEL_TOKENS);
    }

    /**
     * @param prunedTree 剪枝后的树
     * @param idMap 本步骤共享的标识映射，标签序列化时会复用并更新
     * @param groundTruthId 真值 backend_node_id，可为 null
     * @param options 序列化选项
     * @param labelTokens 标签保留的 token 数
     * @return 按文档顺序排列的选项集合
     */
    public static ChoiceSet format(DomTree prunedTree, IdentifierMap idMap, String groundTruthId,
                                   SerializeOptions options, int labelTokens) {
        List<Choice> choices = new ArrayList<>();
        for (DomNode node : prunedTree.preOrder()) {
            if (node.isText() || !node.hasBackendId()) continue;
            String repr = CompactSerializer.serialize(node, idMap, options);
            choices.add(new Choice(node.getBackendId(), TextUtil.firstTokens(repr, labelTokens)));
        }
        ChoiceSet set = new ChoiceSet(choices, groundTruthId);
        logger.debug("[CHOICE] choices={}, groundTruth={}", choices.size(), set.getGroundTruthLetter());
        return set;
    }
}
