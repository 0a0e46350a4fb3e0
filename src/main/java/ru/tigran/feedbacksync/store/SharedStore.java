package ru.tigran.feedbacksync.store;

import ru.tigran.feedbacksync.model.FeedbackGroup;
import ru.tigran.feedbacksync.model.FeedbackItem;
import ru.tigran.feedbacksync.model.SyncState;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable store shared by all clients.
 *
 * Writes are upserts keyed by id (whole-record, last write wins). Large writes are split
 * into chunks, each chunk committed on its own. Every failure surfaces as
 * {@link ru.tigran.feedbacksync.exception.SharedStoreException}.
 */
public interface SharedStore {

    void saveItems(Collection<FeedbackItem> items);

    /**
     * @param limit maximum number of items, newest publishedAt first
     */
    List<FeedbackItem> loadItems(int limit);

    /**
     * Point lookup for items outside the newest-first window. Unknown ids are skipped.
     */
    List<FeedbackItem> loadItemsByIds(Collection<String> ids);

    void deleteItems(Collection<String> ids);

    void saveGroups(Collection<FeedbackGroup> groups);

    List<FeedbackGroup> loadGroups();

    void deleteGroups(Collection<String> ids);

    Optional<SyncState> loadSyncState();

    void saveSyncState(SyncState state);

    /**
     * Removes every item, group and the sync state. The next sync runs unbounded.
     */
    void clearAll();
}
