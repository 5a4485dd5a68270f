package com.qiyi.domprune.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class TextUtilTest {

    @Test
    public void cleanText_shouldCollapseUnicodeWhitespace() {
        Assertions.assertEquals("a b c", TextUtil.cleanText("  a  b\n\tc "));
        Assertions.assertEquals("", TextUtil.cleanText(null));
        Assertions.assertEquals("", TextUtil.cleanText("\u00a0 \u3000"));
    }

    @Test
    public void firstTokens_shouldTruncate() {
        Assertions.assertEquals("a b", TextUtil.firstTokens("a  b c", 2));
        Assertions.assertEquals("a b c", TextUtil.firstTokens("a b c", 10));
        Assertions.assertEquals("", TextUtil.firstTokens("a b c", 0));
        Assertions.assertEquals(List.of("x", "y"), TextUtil.tokens(" x  y "));
    }
}
