package com.qiyi.domprune.choice;

import com.qiyi.domprune.config.PruneConfig;

import java.util.List;

/**
 * 多选题提问与参考答案。
 * 提问列出任务、最近 k 条历史动作与全部选项；答案是真值字母，必要时附带动作与取值。
 */
public class MultiChoiceQuery {

    public static final String CLICK = "CLICK";

    /**
     * 历史动作条数取自 choice.previous.actions。
     */
    public static String question(String task, List<String> previousActions, ChoiceSet choices) {
        return question(task, previousActions, choices, PruneConfig.getInstance().getChoicePreviousActions());
    }

    public static String question(String task, List<String> previousActions, ChoiceSet choices, int previousK) {
        StringBuilder sb = new StringBuilder();
        sb.append("Based on the HTML webpage above, try to complete the following task:\n");
        sb.append("Task: ").append(task == null ? "" : task).append("\n");
        sb.append("Previous actions:\n");
        if (previousActions != null && !previousActions.isEmpty() && previousK > 0) {
            int from = Math.max(0, previousActions.size() - previousK);
            for (String action : previousActions.subList(from, previousActions.size())) {
                sb.append(action).append("\n");
            }
        } else {
            sb.append("None\n");
        }
        sb.append("What should be the next action? Please select from the following choices ")
                .append("(If the correct action is not in the page above, please select A. 'None of the above'):\n\n");
        sb.append(choices.enumeration());
        return sb.toString();
    }

    /**
     * 参考答案。真值未解析时为 "A."；否则为字母、动作，非 CLICK 动作再附上取值。
     */
    public static String target(ChoiceSet choices, String operation, String value) {
        if (!choices.isGroundTruthResolved()) {
            return ChoiceSet.NONE_LETTER + ".";
        }
        String op = operation == null ? CLICK : operation;
        StringBuilder sb = new StringBuilder();
        sb.append(choices.getGroundTruthLetter()).append(".\n");
        sb.append("Action: ").append(op).append("\n");
        if (!CLICK.equals(op)) {
            sb.append("Value: ").append(value == null ? "" : value);
        }
        return sb.toString();
    }
}
