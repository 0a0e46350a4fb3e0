package ru.tigran.feedbacksync.exception;

import java.util.List;

public class GroupingBatchException extends BatchProcessingException {
    public GroupingBatchException(int batchIndex, List<String> itemIds, Throwable cause) {
        super(String.format("Grouping batch %d failed (%d items): %s", batchIndex, itemIds.size(), cause.getMessage()),
                ErrorCode.GROUPING_BATCH_FAILED, batchIndex, itemIds, cause);
    }
}
