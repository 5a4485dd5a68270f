package com.qiyi.domprune.choice;

import java.util.List;

/**
 * 带导航选项的选项块。
 * 候选从 A 开始编号，其后依次追加：都不匹配、滚动、返回上一页、打开指定 URL、搜索引擎查询。
 *
 * 注意：n 个候选时五个导航选项依次占用 n..n+4，每项字母各不相同。
 * 旧版提示词里滚动与返回上一页共用 n+1，URL 与搜索为 n+2、n+3；
 * 按旧字母解析模型输出的调用方需改用 {@link #navigationOptionOf(String, int)}。
 */
public class OptionBlockFormatter {

    public enum NavigationOption {
        NONE_MATCH("None of the other options match the correct element"),
        SCROLL("Scroll (up or down)"),
        GO_BACK("Go back to the previous page (similar to clicking on the back button)"),
        GOTO_URL("Go to a specific URL (for example Wikipedia.com)"),
        SEARCH("Execute a query in a search engine (Google.com)");

        private final String description;

        NavigationOption(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    public static String letterOf(NavigationOption option, int choiceCount) {
        return OptionNames.nameOf(choiceCount + option.ordinal());
    }

    /**
     * 字母对应的导航选项；字母指向候选本身时返回 null。
     */
    public static NavigationOption navigationOptionOf(String letter, int choiceCount) {
        int offset = OptionNames.indexOf(letter) - choiceCount;
        NavigationOption[] all = NavigationOption.values();
        if (offset < 0 || offset >= all.length) return null;
        return all[offset];
    }

    public static String format(List<Choice> choices) {
        int n = choices.size();
        String none = letterOf(NavigationOption.NONE_MATCH, n);
        String scroll = letterOf(NavigationOption.SCROLL, n);
        String url = letterOf(NavigationOption.GOTO_URL, n);
        String search = letterOf(NavigationOption.SEARCH, n);

        StringBuilder multiChoice = new StringBuilder();
        for (int i = 0; i < n; i++) {
            multiChoice.append(OptionNames.nameOf(i)).append(". ").append(choices.get(i).getLabel()).append("\n");
        }
        NavigationOption[] all = NavigationOption.values();
        for (int i = 0; i < all.length; i++) {
            multiChoice.append(letterOf(all[i], n)).append(". ").append(all[i].getDescription());
            if (i < all.length - 1) multiChoice.append("\n");
        }

        StringBuilder sb = new StringBuilder();
        sb.append("If none of these elements match your target element, please select ")
                .append(none).append(". ").append(NavigationOption.NONE_MATCH.getDescription()).append(". ")
                .append("If you want to scroll up or down the page, select ")
                .append(scroll).append(". ").append(NavigationOption.SCROLL.getDescription()).append(". ")
                .append("If you want to go a different URL such as Google.com, please select ")
                .append(url).append(". Go to a different URL and pass the full URL as the value. ")
                .append("If you want to run a query in a search engine, please select ")
                .append(search).append(". Execute a query in a search engine and pass the query as the value.\n");
        sb.append(multiChoice).append("\n\n");
        return sb.toString();
    }
}
