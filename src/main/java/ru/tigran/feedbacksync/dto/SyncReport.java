package ru.tigran.feedbacksync.dto;

import ru.tigran.feedbacksync.model.SourceType;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Result of one sync cycle, including partial-failure counts.
 */
public record SyncReport(
        Instant startedAt,
        Instant finishedAt,
        int fetchedItems,
        int newItems,
        int totalItems,
        List<SourceType> failedSources,
        StageReport classification,
        StageReport translation,
        GroupingReport grouping
) {

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public boolean hasPartialFailures() {
        return !failedSources.isEmpty()
                || classification.failedBatches() > 0
                || translation.failedBatches() > 0
                || grouping.failedBatches() > 0
                || grouping.consolidationFailed();
    }
}
