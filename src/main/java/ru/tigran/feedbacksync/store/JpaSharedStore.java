package ru.tigran.feedbacksync.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;
import ru.tigran.feedbacksync.exception.ErrorCode;
import ru.tigran.feedbacksync.exception.SharedStoreException;
import ru.tigran.feedbacksync.model.FeedbackGroup;
import ru.tigran.feedbacksync.model.FeedbackItem;
import ru.tigran.feedbacksync.model.SyncState;
import ru.tigran.feedbacksync.repository.FeedbackGroupRepository;
import ru.tigran.feedbacksync.repository.FeedbackItemRepository;
import ru.tigran.feedbacksync.repository.SyncStateRepository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * SharedStore на базе Spring Data JPA.
 * Запись разбивается на чанки (по умолчанию 500), каждый чанк - отдельная транзакция.
 * Выборка по id режется на чанки того же размера.
 */
@Slf4j
@Component
public class JpaSharedStore implements SharedStore {

    private final FeedbackItemRepository itemRepository;
    private final FeedbackGroupRepository groupRepository;
    private final SyncStateRepository syncStateRepository;
    private final TransactionTemplate transactionTemplate;
    private final int writeChunkSize;

    public JpaSharedStore(
            FeedbackItemRepository itemRepository,
            FeedbackGroupRepository groupRepository,
            SyncStateRepository syncStateRepository,
            TransactionTemplate transactionTemplate,
            @Value("${app.store.write-chunk-size:500}") int writeChunkSize
    ) {
        if (writeChunkSize <= 0) {
            throw new IllegalArgumentException("app.store.write-chunk-size must be positive: " + writeChunkSize);
        }
        this.itemRepository = itemRepository;
        this.groupRepository = groupRepository;
        this.syncStateRepository = syncStateRepository;
        this.transactionTemplate = transactionTemplate;
        this.writeChunkSize = writeChunkSize;
    }

    @Override
    public void saveItems(Collection<FeedbackItem> items) {
        writeInChunks("items", items, itemRepository::saveAll);
    }

    @Override
    public List<FeedbackItem> loadItems(int limit) {
        return read("items", () -> itemRepository
                .findAll(PageRequest.of(0, limit, Sort.by(Sort.Direction.DESC, "publishedAt")))
                .getContent());
    }

    @Override
    public List<FeedbackItem> loadItemsByIds(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<String> all = new ArrayList<>(ids);
        List<FeedbackItem> found = new ArrayList<>();
        for (int from = 0; from < all.size(); from += writeChunkSize) {
            List<String> chunk = all.subList(from, Math.min(from + writeChunkSize, all.size()));
            found.addAll(read("items by id", () -> itemRepository.findAllById(chunk)));
        }
        return found;
    }

    @Override
    public void deleteItems(Collection<String> ids) {
        writeInChunks("item deletions", ids, itemRepository::deleteAllById);
    }

    @Override
    public void saveGroups(Collection<FeedbackGroup> groups) {
        writeInChunks("groups", groups, groupRepository::saveAll);
    }

    @Override
    public List<FeedbackGroup> loadGroups() {
        return read("groups", groupRepository::findAllByOrderByItemCountDesc);
    }

    @Override
    public void deleteGroups(Collection<String> ids) {
        writeInChunks("group deletions", ids, groupRepository::deleteAllById);
    }

    @Override
    public Optional<SyncState> loadSyncState() {
        return read("sync state", () -> syncStateRepository.findById(SyncState.SINGLETON_ID));
    }

    @Override
    public void saveSyncState(SyncState state) {
        state.setId(SyncState.SINGLETON_ID);
        write("sync state", () -> syncStateRepository.save(state));
    }

    @Override
    public void clearAll() {
        log.warn("Clearing shared store: all items, groups and sync state");
        write("clear all", () -> {
            groupRepository.deleteAllInBatch();
            itemRepository.deleteAllInBatch();
            syncStateRepository.deleteAllInBatch();
        });
    }

    private <T> void writeInChunks(String what, Collection<T> values, Consumer<List<T>> writer) {
        if (values == null || values.isEmpty()) {
            return;
        }
        List<T> all = new ArrayList<>(values);
        int chunks = 0;
        for (int from = 0; from < all.size(); from += writeChunkSize) {
            List<T> chunk = all.subList(from, Math.min(from + writeChunkSize, all.size()));
            write(what, () -> writer.accept(chunk));
            chunks++;
        }
        log.debug("Wrote {} {} in {} chunk(s)", all.size(), what, chunks);
    }

    private void write(String what, Runnable action) {
        try {
            transactionTemplate.executeWithoutResult(status -> action.run());
        } catch (DataAccessException e) {
            log.error("Shared store write failed: {}", what, e);
            throw new SharedStoreException("Failed to write " + what + ": " + e.getMessage(),
                    ErrorCode.STORE_WRITE_FAILED, e);
        }
    }

    private <T> T read(String what, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            log.error("Shared store read failed: {}", what, e);
            throw new SharedStoreException("Failed to read " + what + ": " + e.getMessage(),
                    ErrorCode.STORE_READ_FAILED, e);
        }
    }
}
