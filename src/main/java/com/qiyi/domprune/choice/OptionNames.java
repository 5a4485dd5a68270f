package com.qiyi.domprune.choice;

import com.qiyi.domprune.error.MalformedLetterCodeException;

/**
 * 选项字母编码：A…Z，之后 AA、AB … ZZ。
 * 两位编码 XY 对应 26 + 26 * X + Y，因此最多表示 702 个选项。
 */
public final class OptionNames {

    private static final int ALPHABET = 26;
    /**
     * 可编码的索引上界（不含）
     */
    public static final int MAX_INDEX = ALPHABET + ALPHABET * ALPHABET;

    private OptionNames() {
    }

    public static String nameOf(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("option index must be non-negative | index=" + index);
        }
        if (index < ALPHABET) {
            return String.valueOf((char) ('A' + index));
        }
        if (index >= MAX_INDEX) {
            throw new MalformedLetterCodeException("Option index needs more than two letters | index=" + index);
        }
        int first = (index - ALPHABET) / ALPHABET;
        int second = (index - ALPHABET) % ALPHABET;
        return String.valueOf((char) ('A' + first)) + (char) ('A' + second);
    }

    public static int indexOf(String name) {
        if (name == null || name.isEmpty() || name.length() > 2) {
            throw new MalformedLetterCodeException("The option name should be either 1 or 2 characters long | name=" + name);
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c < 'A' || c > 'Z') {
                throw new MalformedLetterCodeException("Option name must use upper-case A-Z | name=" + name);
            }
        }
        if (name.length() == 1) {
            return name.charAt(0) - 'A';
        }
        int first = name.charAt(0) - 'A';
        int second = name.charAt(1) - 'A';
        return ALPHABET + first * ALPHABET + second;
    }
}
