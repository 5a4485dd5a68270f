package com.qiyi.domprune.choice;

/**
 * 一个候选选项：原始 backend_node_id 与其紧凑文本的前若干 token。
 */
public class Choice {

    private final String backendId;
    private final String label;

    public Choice(String backendId, String label) {
        this.backendId = backendId;
        this.label = label == null ? "" : label;
    }

    public String getBackendId() {
        return backendId;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return "Choice{backendId='" + backendId + "', label='" + label + "'}";
    }
}
