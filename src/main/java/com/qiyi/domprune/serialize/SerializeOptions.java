package com.qiyi.domprune.serialize;

import com.qiyi.domprune.config.PruneConfig;

public class SerializeOptions {

    private final int maxValueTokens;
    private final int maxMetaTokens;
    private final boolean keepHtmlBrackets;

    public SerializeOptions(int maxValueTokens, int maxMetaTokens, boolean keepHtmlBrackets) {
        if (maxValueTokens < 0 || maxMetaTokens < 0) {
            throw new IllegalArgumentException("token limits must be non-negative | maxValueTokens="
                    + maxValueTokens + ", maxMetaTokens=" + maxMetaTokens);
        }
        this.maxValueTokens = maxValueTokens;
        this.maxMetaTokens = maxMetaTokens;
        this.keepHtmlBrackets = keepHtmlBrackets;
    }

    public static SerializeOptions defaults() {
        return new SerializeOptions(PruneConfig.DEFAULT_SERIALIZE_MAX_VALUE_TOKENS,
                PruneConfig.DEFAULT_SERIALIZE_MAX_META_TOKENS, false);
    }

    public static SerializeOptions fromConfig(PruneConfig config) {
        return new SerializeOptions(config.getSerializeMaxValueTokens(),
                config.getSerializeMaxMetaTokens(), config.isKeepHtmlBrackets());
    }

    public int getMaxValueTokens() {
        return maxValueTokens;
    }

    public int getMaxMetaTokens() {
        return maxMetaTokens;
    }

    public boolean isKeepHtmlBrackets() {
        return keepHtmlBrackets;
    }

    public SerializeOptions withKeepHtmlBrackets(boolean keep) {
        return new SerializeOptions(maxValueTokens, maxMetaTokens, keep);
    }
}
