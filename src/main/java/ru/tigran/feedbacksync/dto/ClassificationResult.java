package ru.tigran.feedbacksync.dto;

import ru.tigran.feedbacksync.model.FeedbackCategory;
import ru.tigran.feedbacksync.model.Sentiment;

/**
 * Classification of a single item as returned by the AI service.
 * Confidences are clamped to [0, 1].
 */
public record ClassificationResult(
        Sentiment sentiment,
        double sentimentConfidence,
        FeedbackCategory category,
        double categoryConfidence,
        String summary
) {
}
