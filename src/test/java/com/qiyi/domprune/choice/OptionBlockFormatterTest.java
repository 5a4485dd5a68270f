package com.qiyi.domprune.choice;

import com.qiyi.domprune.choice.OptionBlockFormatter.NavigationOption;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class OptionBlockFormatterTest {

    private static final List<Choice> CHOICES = List.of(
            new Choice("21", "(input id=0 q )"),
            new Choice("22", "(button id=1 submit>Go)"));

    @Test
    public void letterOf_shouldFollowChoices() {
        Assertions.assertEquals("C", OptionBlockFormatter.letterOf(NavigationOption.NONE_MATCH, 2));
        Assertions.assertEquals("D", OptionBlockFormatter.letterOf(NavigationOption.SCROLL, 2));
        Assertions.assertEquals("E", OptionBlockFormatter.letterOf(NavigationOption.GO_BACK, 2));
        Assertions.assertEquals("G", OptionBlockFormatter.letterOf(NavigationOption.SEARCH, 2));
        Assertions.assertEquals("AA", OptionBlockFormatter.letterOf(NavigationOption.SCROLL, 25));
    }

    @Test
    public void navigationOptionOf_shouldResolveLetters() {
        Assertions.assertNull(OptionBlockFormatter.navigationOptionOf("B", 2));
        Assertions.assertEquals(NavigationOption.GOTO_URL, OptionBlockFormatter.navigationOptionOf("F", 2));
        Assertions.assertNull(OptionBlockFormatter.navigationOptionOf("H", 2));
    }

    @Test
    public void format_shouldListChoicesThenNavigationOptions() {
        String block = OptionBlockFormatter.format(CHOICES);

        Assertions.assertTrue(block.startsWith("If none of these elements match your target element, please select C."));
        Assertions.assertTrue(block.contains("A. (input id=0 q )\nB. (button id=1 submit>Go)\nC. None of the other options"));
        Assertions.assertTrue(block.contains("\nD. Scroll (up or down)\nE. Go back"));
        Assertions.assertTrue(block.endsWith("G. Execute a query in a search engine (Google.com)\n\n"));
    }
}
