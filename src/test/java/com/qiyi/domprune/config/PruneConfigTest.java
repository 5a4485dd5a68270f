package com.qiyi.domprune.config;

import com.qiyi.domprune.prune.PruneBounds;
import com.qiyi.domprune.serialize.SerializeOptions;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Properties;

public class PruneConfigTest {

    @Test
    public void getInstance_shouldLoadBundledConfig() {
        PruneConfig config = PruneConfig.getInstance();

        Assertions.assertEquals(5, config.getPruneMaxDepth());
        Assertions.assertEquals(50, config.getPruneMaxDescendants());
        Assertions.assertEquals(3, config.getPruneMaxSiblings());
        Assertions.assertEquals(17, config.getChoiceBatchSize());
        Assertions.assertFalse(config.isKeepHtmlBrackets());
    }

    @Test
    public void getters_shouldFallBackOnInvalidValues() {
        Properties props = new Properties();
        props.setProperty(PruneConfig.KEY_PRUNE_MAX_DEPTH, "abc");
        props.setProperty(PruneConfig.KEY_PRUNE_MAX_SIBLINGS, "-2");
        props.setProperty(PruneConfig.KEY_PRUNE_MAX_DESCENDANTS, " 7 ");
        props.setProperty(PruneConfig.KEY_CHOICE_BATCH_SIZE, "0");
        props.setProperty(PruneConfig.KEY_SERIALIZE_KEEP_BRACKETS, "true");

        PruneConfig config = new PruneConfig(props);

        Assertions.assertEquals(PruneConfig.DEFAULT_PRUNE_MAX_DEPTH, config.getPruneMaxDepth());
        Assertions.assertEquals(PruneConfig.DEFAULT_PRUNE_MAX_SIBLINGS, config.getPruneMaxSiblings());
        Assertions.assertEquals(7, config.getPruneMaxDescendants());
        Assertions.assertEquals(PruneConfig.DEFAULT_CHOICE_BATCH_SIZE, config.getChoiceBatchSize());
        Assertions.assertTrue(config.isKeepHtmlBrackets());
    }

    @Test
    public void fromConfig_shouldBuildBoundsAndOptions() {
        Properties props = new Properties();
        props.setProperty(PruneConfig.KEY_PRUNE_MAX_SIBLINGS, "1");
        props.setProperty(PruneConfig.KEY_SERIALIZE_MAX_META_TOKENS, "8");
        PruneConfig config = new PruneConfig(props);

        PruneBounds bounds = PruneBounds.fromConfig(config);
        SerializeOptions options = SerializeOptions.fromConfig(config);

        Assertions.assertEquals(1, bounds.getMaxSiblings());
        Assertions.assertEquals(PruneConfig.DEFAULT_PRUNE_MAX_DEPTH, bounds.getMaxDepth());
        Assertions.assertEquals(8, options.getMaxMetaTokens());
        Assertions.assertEquals(PruneConfig.DEFAULT_SERIALIZE_MAX_VALUE_TOKENS, options.getMaxValueTokens());
    }
}
