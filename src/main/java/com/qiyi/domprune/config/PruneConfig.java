package com.qiyi.domprune.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public class PruneConfig {
    private static final Logger logger = LogManager.getLogger(PruneConfig.class);

    public static final String RESOURCE_NAME = "domprune.cfg";
    private static final PruneConfig INSTANCE = new PruneConfig(RESOURCE_NAME);

    private final Properties properties = new Properties();

    // Configuration Keys
    public static final String KEY_PRUNE_MAX_DEPTH = "prune.max.depth";
    public static final String KEY_PRUNE_MAX_DESCENDANTS = "prune.max.descendants";
    public static final String KEY_PRUNE_MAX_SIBLINGS = "prune.max.siblings";
    public static final String KEY_SERIALIZE_MAX_VALUE_TOKENS = "serialize.max.value.tokens";
    public static final String KEY_SERIALIZE_MAX_META_TOKENS = "serialize.max.meta.tokens";
    public static final String KEY_SERIALIZE_KEEP_BRACKETS = "serialize.keep.html.brackets";
    public static final String KEY_CHOICE_LABEL_TOKENS = "choice.label.tokens";
    public static final String KEY_CHOICE_PREVIOUS_ACTIONS = "choice.previous.actions";
    public static final String KEY_CHOICE_BATCH_SIZE = "choice.batch.size";

    // Default Values
    public static final int DEFAULT_PRUNE_MAX_DEPTH = 5;
    public static final int DEFAULT_PRUNE_MAX_DESCENDANTS = 50;
    public static final int DEFAULT_PRUNE_MAX_SIBLINGS = 3;
    public static final int DEFAULT_SERIALIZE_MAX_VALUE_TOKENS = 5;
    public static final int DEFAULT_SERIALIZE_MAX_META_TOKENS = 20;
    public static final int DEFAULT_CHOICE_LABEL_TOKENS = 10;
    public static final int DEFAULT_CHOICE_PREVIOUS_ACTIONS = 5;
    public static final int DEFAULT_CHOICE_BATCH_SIZE = 17;

    private PruneConfig(String resourceName) {
        loadProperties(resourceName);
    }

    /**
     * 用给定属性构造（测试或调用方自行加载配置时使用）。
     */
    public PruneConfig(Properties source) {
        if (source != null) {
            properties.putAll(source);
        }
    }

    public static PruneConfig getInstance() {
        return INSTANCE;
    }

    private void loadProperties(String resourceName) {
        try (InputStream input = PruneConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (input == null) {
                logger.warn("[CONFIG] {} not found on classpath, using defaults", resourceName);
                return;
            }
            properties.load(input);
            logger.debug("[CONFIG] loaded {} | keys={}", resourceName, properties.size());
        } catch (IOException ex) {
            logger.error("[CONFIG] Error loading configuration | resource=" + resourceName, ex);
        }
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public int getPruneMaxDepth() {
        return getNonNegativeInt(KEY_PRUNE_MAX_DEPTH, DEFAULT_PRUNE_MAX_DEPTH);
    }

    public int getPruneMaxDescendants() {
        return getNonNegativeInt(KEY_PRUNE_MAX_DESCENDANTS, DEFAULT_PRUNE_MAX_DESCENDANTS);
    }

    public int getPruneMaxSiblings() {
        return getNonNegativeInt(KEY_PRUNE_MAX_SIBLINGS, DEFAULT_PRUNE_MAX_SIBLINGS);
    }

    public int getSerializeMaxValueTokens() {
        return getNonNegativeInt(KEY_SERIALIZE_MAX_VALUE_TOKENS, DEFAULT_SERIALIZE_MAX_VALUE_TOKENS);
    }

    public int getSerializeMaxMetaTokens() {
        return getNonNegativeInt(KEY_SERIALIZE_MAX_META_TOKENS, DEFAULT_SERIALIZE_MAX_META_TOKENS);
    }

    public boolean isKeepHtmlBrackets() {
        String v = getProperty(KEY_SERIALIZE_KEEP_BRACKETS);
        return v != null && Boolean.parseBoolean(v.trim());
    }

    public int getChoiceLabelTokens() {
        return getNonNegativeInt(KEY_CHOICE_LABEL_TOKENS, DEFAULT_CHOICE_LABEL_TOKENS);
    }

    public int getChoicePreviousActions() {
        return getNonNegativeInt(KEY_CHOICE_PREVIOUS_ACTIONS, DEFAULT_CHOICE_PREVIOUS_ACTIONS);
    }

    public int getChoiceBatchSize() {
        int size = getNonNegativeInt(KEY_CHOICE_BATCH_SIZE, DEFAULT_CHOICE_BATCH_SIZE);
        return size == 0 ? DEFAULT_CHOICE_BATCH_SIZE : size;
    }

    private int getNonNegativeInt(String key, int defaultValue) {
        String str = getProperty(key);
        if (str != null && !str.trim().isEmpty()) {
            try {
                int v = Integer.parseInt(str.trim());
                if (v >= 0) return v;
                logger.warn("[CONFIG] Negative value for {}, using default: {}", key, defaultValue);
            } catch (NumberFormatException e) {
                logger.warn("[CONFIG] Invalid number format for {}, using default: {}", key, defaultValue);
            }
        }
        return defaultValue;
    }
}
