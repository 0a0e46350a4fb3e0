package ru.tigran.feedbacksync.service;

import ru.tigran.feedbacksync.dto.ClassificationResult;
import ru.tigran.feedbacksync.dto.GroupProposal;
import ru.tigran.feedbacksync.dto.MergedGroupProposal;
import ru.tigran.feedbacksync.dto.TranslationResult;
import ru.tigran.feedbacksync.model.FeedbackGroup;
import ru.tigran.feedbacksync.model.FeedbackItem;

import java.util.List;
import java.util.Map;

/**
 * AI operations used by the sync pipeline. Every method may throw
 * {@link ru.tigran.feedbacksync.exception.AIGatewayException}; callers treat that as a failed batch.
 */
public interface AIService {

    /**
     * @return results keyed by item id; items the model skipped are absent
     */
    Map<String, ClassificationResult> classify(List<FeedbackItem> batch);

    /**
     * Clusters one batch. Returned item ids are restricted to the batch.
     */
    List<GroupProposal> group(List<FeedbackItem> batch);

    /**
     * Merges batch-local groups that describe the same theme.
     */
    List<MergedGroupProposal> consolidate(List<FeedbackGroup> batchGroups);

    /**
     * @return translations keyed by item id
     */
    Map<String, TranslationResult> translate(List<FeedbackItem> batch, List<String> targetLanguages);
}
