package ru.tigran.feedbacksync.pipeline;

import ru.tigran.feedbacksync.model.FeedbackItem;

import java.util.List;
import java.util.Set;

/**
 * @param finalItems merged fresh items followed by baseline items that were not re-fetched
 * @param freshItems the merged fresh items only
 * @param newItemIds ids of fresh items unknown to the baseline
 * @param needsAnalysis items of the final set that still need classification
 */
public record MergeResult(
        List<FeedbackItem> finalItems,
        List<FeedbackItem> freshItems,
        Set<String> newItemIds,
        List<FeedbackItem> needsAnalysis
) {
}
