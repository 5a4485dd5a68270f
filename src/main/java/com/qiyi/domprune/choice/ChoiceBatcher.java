package com.qiyi.domprune.choice;

import com.qiyi.domprune.config.PruneConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 候选分批：候选过多时按批次出题。
 */
public class ChoiceBatcher {

    /**
     * 批大小取自 choice.batch.size。
     */
    public static int fixedBatchSize(int numChoices) {
        return fixedBatchSize(numChoices, PruneConfig.getInstance().getChoiceBatchSize());
    }

    public static int fixedBatchSize(int numChoices, int batchSize) {
        return Math.min(numChoices, batchSize);
    }

    /**
     * 按页面高度动态决定批大小：页面越长，批次越多。
     *
     * @param numChoices 候选总数
     * @param pageHeight 页面总高度
     * @param heightPerBatch 每批覆盖的高度，必须为正
     */
    public static int dynamicBatchSize(int numChoices, double pageHeight, double heightPerBatch) {
        if (heightPerBatch <= 0) {
            throw new IllegalArgumentException("heightPerBatch must be positive | heightPerBatch=" + heightPerBatch);
        }
        long pages = Math.max((long) Math.rint(pageHeight / heightPerBatch), 1L);
        return (int) Math.min(numChoices, numChoices / pages + 1);
    }

    public static <T> List<List<T>> batches(List<T> items) {
        return batches(items, PruneConfig.getInstance().getChoiceBatchSize());
    }

    public static <T> List<List<T>> batches(List<T> items, int batchSize) {
        if (items == null || items.isEmpty()) return Collections.emptyList();
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive | batchSize=" + batchSize);
        }
        List<List<T>> out = new ArrayList<>();
        for (int i = 0; i < items.size(); i += batchSize) {
            out.add(new ArrayList<>(items.subList(i, Math.min(items.size(), i + batchSize))));
        }
        return out;
    }
}
