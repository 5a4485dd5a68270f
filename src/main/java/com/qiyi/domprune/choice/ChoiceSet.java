package com.qiyi.domprune.choice;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 多选题选项集合。
 * 字母 A 固定为 "None of the above"，第 i 个选项（从 0 开始）的字母为 nameOf(i + 1)。
 */
public class ChoiceSet {

    public static final String NONE_LETTER = "A";
    public static final String NONE_LABEL = "None of the above";

    private final List<Choice> choices;
    private final String groundTruthLetter;

    public ChoiceSet(List<Choice> choices, String groundTruthBackendId) {
        this.choices = Collections.unmodifiableList(new ArrayList<>(choices));
        int gt = indexOfBackendId(groundTruthBackendId);
        this.groundTruthLetter = gt < 0 ? NONE_LETTER : letterOf(gt);
    }

    public List<Choice> getChoices() {
        return choices;
    }

    public int size() {
        return choices.size();
    }

    /**
     * 真值对应的字母；真值缺失或不在选项中时为 A。
     */
    public String getGroundTruthLetter() {
        return groundTruthLetter;
    }

    public boolean isGroundTruthResolved() {
        return !NONE_LETTER.equals(groundTruthLetter);
    }

    public String letterOf(int choiceIndex) {
        if (choiceIndex < 0 || choiceIndex >= choices.size()) {
            throw new IndexOutOfBoundsException("choice index " + choiceIndex + " out of range [0, " + choices.size() + ")");
        }
        return OptionNames.nameOf(choiceIndex + 1);
    }

    public List<String> letters() {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < choices.size(); i++) {
            out.add(letterOf(i));
        }
        return out;
    }

    /**
     * 把模型选出的字母解析回选项。A 或超出范围的字母返回空；格式错误抛出 MalformedLetterCodeException。
     */
    public Optional<Choice> resolve(String letter) {
        int idx = OptionNames.indexOf(letter) - 1;
        if (idx < 0 || idx >= choices.size()) return Optional.empty();
        return Optional.of(choices.get(idx));
    }

    /**
     * 渲染 "字母. 标签" 列表，第一行是 A. None of the above。
     */
    public String enumeration() {
        StringBuilder sb = new StringBuilder();
        sb.append(NONE_LETTER).append(". ").append(NONE_LABEL).append("\n");
        for (int i = 0; i < choices.size(); i++) {
            sb.append(letterOf(i)).append(". ").append(choices.get(i).getLabel()).append("\n");
        }
        return sb.toString();
    }

    public String toJson() {
        JSONObject root = new JSONObject();
        JSONArray arr = new JSONArray();
        for (int i = 0; i < choices.size(); i++) {
            JSONObject item = new JSONObject();
            item.put("letter", letterOf(i));
            item.put("backend_node_id", choices.get(i).getBackendId());
            item.put("label", choices.get(i).getLabel());
            arr.add(item);
        }
        root.put("choices", arr);
        root.put("ground_truth", groundTruthLetter);
        return root.toJSONString();
    }

    private int indexOfBackendId(String backendId) {
        if (backendId == null) return -1;
        for (int i = 0; i < choices.size(); i++) {
            if (backendId.equals(choices.get(i).getBackendId())) return i;
        }
        return -1;
    }
}
