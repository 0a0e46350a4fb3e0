package ru.tigran.feedbacksync.dto;

import ru.tigran.feedbacksync.model.SourceType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-invocation sync parameters.
 *
 * @param enabledSources source types whose collectors run in this cycle
 * @param progressListener progress sink, never null
 */
public record SyncOptions(Set<SourceType> enabledSources, SyncProgressListener progressListener) {

    public SyncOptions {
        enabledSources = enabledSources == null || enabledSources.isEmpty()
                ? EnumSet.noneOf(SourceType.class)
                : EnumSet.copyOf(enabledSources);
        progressListener = progressListener == null ? SyncProgressListener.NO_OP : progressListener;
    }

    public static SyncOptions of(Set<SourceType> enabledSources) {
        return new SyncOptions(enabledSources, SyncProgressListener.NO_OP);
    }

    public SyncOptions withProgressListener(SyncProgressListener listener) {
        return new SyncOptions(enabledSources, listener);
    }
}
