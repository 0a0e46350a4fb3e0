package ru.tigran.feedbacksync.exception;

import java.util.List;

public class ClassificationBatchException extends BatchProcessingException {
    public ClassificationBatchException(int batchIndex, List<String> itemIds, Throwable cause) {
        super(String.format("Classification batch %d failed (%d items): %s", batchIndex, itemIds.size(), cause.getMessage()),
                ErrorCode.CLASSIFICATION_BATCH_FAILED, batchIndex, itemIds, cause);
    }
}
