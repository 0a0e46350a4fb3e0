package ru.tigran.feedbacksync.exception;

import java.util.List;

public class TranslationBatchException extends BatchProcessingException {
    public TranslationBatchException(int batchIndex, List<String> itemIds, Throwable cause) {
        super(String.format("Translation batch %d failed (%d items): %s", batchIndex, itemIds.size(), cause.getMessage()),
                ErrorCode.TRANSLATION_BATCH_FAILED, batchIndex, itemIds, cause);
    }
}
