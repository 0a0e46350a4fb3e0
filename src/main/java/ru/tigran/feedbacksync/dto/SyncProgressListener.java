package ru.tigran.feedbacksync.dto;

/**
 * Receives cumulative progress. Always invoked on the thread running the sync cycle.
 */
@FunctionalInterface
public interface SyncProgressListener {

    SyncProgressListener NO_OP = (stage, processed, total) -> { };

    void onProgress(SyncStage stage, int processed, int total);
}
