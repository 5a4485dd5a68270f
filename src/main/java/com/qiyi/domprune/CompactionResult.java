package com.qiyi.domprune;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.qiyi.domprune.choice.ChoiceSet;
import com.qiyi.domprune.model.DomTree;
import com.qiyi.domprune.serialize.IdentifierMap;

import java.util.Collections;
import java.util.Set;

/**
 * 一次压缩的产物：紧凑文本、选项集合、本步骤的标识映射、保留集合与剪枝树。
 */
public class CompactionResult {

    private final String treeText;
    private final ChoiceSet choices;
    private final IdentifierMap idMap;
    private final Set<String> keepSet;
    private final DomTree prunedTree;

    CompactionResult(String treeText, ChoiceSet choices, IdentifierMap idMap, Set<String> keepSet, DomTree prunedTree) {
        this.treeText = treeText;
        this.choices = choices;
        this.idMap = idMap;
        this.keepSet = Collections.unmodifiableSet(keepSet);
        this.prunedTree = prunedTree;
    }

    public String getTreeText() {
        return treeText;
    }

    public ChoiceSet getChoices() {
        return choices;
    }

    public IdentifierMap getIdMap() {
        return idMap;
    }

    public Set<String> getKeepSet() {
        return keepSet;
    }

    public DomTree getPrunedTree() {
        return prunedTree;
    }

    /**
     * 导出给动作落地阶段使用的 JSON。
     */
    public String toJson() {
        JSONObject root = new JSONObject();
        root.put("tree", treeText);
        root.put("choices", JSON.parseObject(choices.toJson()));
        root.put("id_map", idMap.asMap());
        root.put("keep_set", keepSet);
        return root.toJSONString();
    }
}
