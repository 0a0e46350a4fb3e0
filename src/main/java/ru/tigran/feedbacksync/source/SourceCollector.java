package ru.tigran.feedbacksync.source;

import ru.tigran.feedbacksync.model.FeedbackItem;
import ru.tigran.feedbacksync.model.SourceType;

import java.time.Instant;
import java.util.List;

/**
 * Pulls feedback items from one external source.
 *
 * Implementations must produce stable ids (see {@link ru.tigran.feedbacksync.util.FeedbackIds})
 * and signal failures by throwing; the orchestrator retries transient errors and otherwise
 * treats the source as empty for the cycle.
 */
public interface SourceCollector {

    SourceType sourceType();

    default String name() {
        return sourceType().getDisplayName();
    }

    /**
     * @param since lower bound on publishedAt, or null for an unbounded fetch
     */
    List<FeedbackItem> fetch(Instant since);
}
