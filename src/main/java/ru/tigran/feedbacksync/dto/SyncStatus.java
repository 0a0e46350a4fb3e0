package ru.tigran.feedbacksync.dto;

/**
 * Состояния цикла синхронизации: IDLE -> SYNCING -> COMPLETED | FAILED.
 * Из COMPLETED и FAILED можно снова запустить синхронизацию.
 */
public enum SyncStatus {
    IDLE,
    SYNCING,
    COMPLETED,
    FAILED
}
