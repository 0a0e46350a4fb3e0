package ru.tigran.feedbacksync.exception;

/**
 * Thrown when sync() is invoked while another cycle is still running.
 */
public class SyncInProgressException extends ApplicationException {
    public SyncInProgressException() {
        super(ErrorCode.SYNC_IN_PROGRESS.getDefaultMessage(), ErrorCode.SYNC_IN_PROGRESS);
    }
}
