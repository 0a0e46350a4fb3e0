package ru.tigran.feedbacksync.dto;

/**
 * Outcome of clustering.
 *
 * @param executed false when the analyzed set was below the grouping threshold
 * @param analyzedItems items submitted to phase 1
 * @param batchGroups batch-local groups produced by phase 1
 * @param canonicalGroups groups written after consolidation
 * @param failedBatches phase 1 batches that failed
 * @param consolidationFailed true when the consolidation call failed and singletons were used
 * @param supersededGroups previous groups deleted by this run
 */
public record GroupingReport(
        boolean executed,
        int analyzedItems,
        int batchGroups,
        int canonicalGroups,
        int failedBatches,
        boolean consolidationFailed,
        int supersededGroups
) {

    public static GroupingReport skipped(int analyzedItems) {
        return new GroupingReport(false, analyzedItems, 0, 0, 0, false, 0);
    }
}
