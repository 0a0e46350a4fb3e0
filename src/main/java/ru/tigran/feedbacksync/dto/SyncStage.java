package ru.tigran.feedbacksync.dto;

public enum SyncStage {
    FETCH,
    CLASSIFICATION,
    TRANSLATION,
    GROUPING,
    CONSOLIDATION
}
