package ru.tigran.feedbacksync.dto;

import ru.tigran.feedbacksync.model.FeedbackCategory;
import ru.tigran.feedbacksync.model.Sentiment;

import java.util.List;

/**
 * Cluster proposed by the AI service for one grouping batch.
 */
public record GroupProposal(
        String theme,
        String summary,
        Sentiment sentiment,
        FeedbackCategory category,
        List<String> itemIds
) {
}
