package ru.tigran.feedbacksync.dto;

import ru.tigran.feedbacksync.model.FeedbackCategory;
import ru.tigran.feedbacksync.model.Sentiment;

import java.util.List;

/**
 * Consolidation output: one theme that covers one or more batch-local groups.
 * itemIds may be incomplete, the reconciler unions them with the source groups' members.
 */
public record MergedGroupProposal(
        String theme,
        String summary,
        Sentiment sentiment,
        FeedbackCategory category,
        List<String> originalGroupIds,
        List<String> itemIds
) {
}
