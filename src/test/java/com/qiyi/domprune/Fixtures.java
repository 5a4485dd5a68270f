package com.qiyi.domprune;

/**
 * 测试用快照。
 */
public final class Fixtures {

    private Fixtures() {
    }

    /**
     * 搜索表单页：候选通常是 21（输入框）与 22（按钮）。
     */
    public static final String SEARCH_PAGE = String.join("",
            "<html backend_node_id=\"1\">",
            "<body backend_node_id=\"2\" style=\"margin:0\">",
            "<div backend_node_id=\"3\" role=\"main\" class=\"container\">",
            "<form backend_node_id=\"20\" aria_label=\"Search\" action=\"/s\">",
            "<input backend_node_id=\"21\" name=\"q\" placeholder=\"Search the site\" type=\"text\"/>",
            "<button backend_node_id=\"22\" type=\"submit\" onclick=\"go()\"><text backend_node_id=\"23\">Go</text></button>",
            "</form>",
            "</div>",
            "<footer backend_node_id=\"30\"><text>Copyright</text></footer>",
            "</body>",
            "</html>");

    /**
     * 一个 ul 下有 6 个 li（11..16），用于兄弟窗口。
     */
    public static final String LIST_PAGE = String.join("",
            "<html backend_node_id=\"1\">",
            "<body backend_node_id=\"2\">",
            "<ul backend_node_id=\"10\">",
            "<li backend_node_id=\"11\" aria_label=\"one\"><text>One</text></li>",
            "<li backend_node_id=\"12\" aria_label=\"two\"><text>Two</text></li>",
            "<li backend_node_id=\"13\" aria_label=\"three\"><text backend_node_id=\"99\">Three</text></li>",
            "<li backend_node_id=\"14\" aria_label=\"four\"><text>Four</text></li>",
            "<li backend_node_id=\"15\" aria_label=\"five\"><text>Five</text></li>",
            "<li backend_node_id=\"16\" aria_label=\"six\"><text>Six</text></li>",
            "</ul>",
            "<form backend_node_id=\"20\" aria_label=\"Search\">",
            "<input backend_node_id=\"21\" name=\"q\"/>",
            "</form>",
            "</body>",
            "</html>");
}
