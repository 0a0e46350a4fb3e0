package ru.tigran.feedbacksync.exception;

import java.util.List;

/**
 * Base class for per-batch AI failures. Never fatal for a sync cycle:
 * the batch is counted as failed and its items keep their previous state.
 */
public abstract class BatchProcessingException extends ApplicationException {
    private final int batchIndex;
    private final List<String> itemIds;

    protected BatchProcessingException(String message, ErrorCode errorCode, int batchIndex,
                                       List<String> itemIds, Throwable cause) {
        super(message, errorCode, false, cause);
        this.batchIndex = batchIndex;
        this.itemIds = List.copyOf(itemIds);
    }

    public int getBatchIndex() {
        return batchIndex;
    }

    public List<String> getItemIds() {
        return itemIds;
    }
}
