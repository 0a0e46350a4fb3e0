package ru.tigran.feedbacksync.dto;

/**
 * Outcome of a batched AI stage.
 *
 * @param candidates items handed to the stage
 * @param succeeded items that received a result
 * @param totalBatches batches submitted
 * @param failedBatches batches whose AI call failed
 */
public record StageReport(int candidates, int succeeded, int totalBatches, int failedBatches) {

    public static final StageReport SKIPPED = new StageReport(0, 0, 0, 0);
}
