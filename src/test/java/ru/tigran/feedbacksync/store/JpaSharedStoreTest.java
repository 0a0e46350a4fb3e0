package ru.tigran.feedbacksync.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import ru.tigran.feedbacksync.model.FeedbackCategory;
import ru.tigran.feedbacksync.model.FeedbackGroup;
import ru.tigran.feedbacksync.model.FeedbackItem;
import ru.tigran.feedbacksync.model.Sentiment;
import ru.tigran.feedbacksync.model.SourceType;
import ru.tigran.feedbacksync.model.SyncState;
import ru.tigran.feedbacksync.repository.FeedbackItemRepository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static ru.tigran.feedbacksync.support.TestItems.item;

/**
 * Тесты JpaSharedStore на H2: upsert, порядок загрузки, JSON колонки, очистка.
 */
@DataJpaTest(properties = "app.store.write-chunk-size=2")
@Import(JpaSharedStore.class)
@DisplayName("JpaSharedStore тесты")
class JpaSharedStoreTest {

    @Autowired
    private JpaSharedStore store;

    @Autowired
    private FeedbackItemRepository itemRepository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    @DisplayName("Элементы загружаются от новых к старым с ограничением, JSON поля сохраняются")
    void loadsNewestItemsFirst() {
        FeedbackItem oldest = item("a", SourceType.DISCOURSE, Instant.parse("2024-01-01T00:00:00Z"));
        FeedbackItem middle = item("b", SourceType.GITHUB_ISSUE, Instant.parse("2024-02-01T00:00:00Z"));
        middle.setLabels(List.of("bug", "sdk"));
        middle.setTranslations(new LinkedHashMap<>(Map.of("en", "Hello", "pt", "Olá")));
        middle.setSentiment(Sentiment.NEGATIVE);
        middle.setCategory(FeedbackCategory.BUG_REPORT);
        middle.setAnalyzed(true);
        FeedbackItem newest = item("c", SourceType.TWITTER_SEARCH, Instant.parse("2024-03-01T00:00:00Z"));

        store.saveItems(List.of(oldest, middle, newest));
        entityManager.flush();
        entityManager.clear();

        List<FeedbackItem> loaded = store.loadItems(2);

        assertEquals(List.of("c", "b"), loaded.stream().map(FeedbackItem::getId).toList());
        FeedbackItem reloaded = loaded.get(1);
        assertEquals(List.of("bug", "sdk"), reloaded.getLabels());
        assertEquals(Map.of("en", "Hello", "pt", "Olá"), reloaded.getTranslations());
        assertEquals(Sentiment.NEGATIVE, reloaded.getSentiment());
        assertEquals(FeedbackCategory.BUG_REPORT, reloaded.getCategory());
        assertTrue(reloaded.isAnalyzed());
        assertNotNull(reloaded.getUpdatedAt());
    }

    @Test
    @DisplayName("Выборка по id находит элементы за пределами окна и пропускает неизвестные id")
    void loadsItemsByIdAcrossChunks() {
        FeedbackItem old = item("old", SourceType.GITHUB_ISSUE, Instant.parse("2023-01-01T00:00:00Z"));
        old.setAnalyzed(true);
        old.setGroupId("group-1");
        store.saveItems(List.of(old, item("b"), item("c")));
        entityManager.flush();
        entityManager.clear();

        List<FeedbackItem> loaded = store.loadItemsByIds(List.of("old", "missing", "c"));

        assertEquals(Set.of("old", "c"), Set.copyOf(loaded.stream().map(FeedbackItem::getId).toList()));
        FeedbackItem reloaded = loaded.stream().filter(i -> i.getId().equals("old")).findFirst().orElseThrow();
        assertTrue(reloaded.isAnalyzed());
        assertEquals("group-1", reloaded.getGroupId());
        assertTrue(store.loadItemsByIds(List.of()).isEmpty());
    }

    @Test
    @DisplayName("Повторная запись по id заменяет элемент целиком")
    void upsertReplacesRecord() {
        store.saveItems(List.of(item("a")));
        FeedbackItem updated = item("a");
        updated.setTitle("Edited");
        updated.setGroupId("group-1");

        store.saveItems(List.of(updated));
        entityManager.flush();
        entityManager.clear();

        assertEquals(1, itemRepository.count());
        FeedbackItem reloaded = itemRepository.findById("a").orElseThrow();
        assertEquals("Edited", reloaded.getTitle());
        assertEquals("group-1", reloaded.getGroupId());
    }

    @Test
    @DisplayName("Группы: сортировка по размеру, удаление по id")
    void savesAndDeletesGroups() {
        store.saveGroups(List.of(group("g-small", "a"), group("g-large", "b", "c", "d"), group("g-mid", "e", "f")));
        entityManager.flush();
        entityManager.clear();

        List<FeedbackGroup> loaded = store.loadGroups();
        assertEquals(List.of("g-large", "g-mid", "g-small"), loaded.stream().map(FeedbackGroup::getId).toList());
        assertEquals(Set.of("b", "c", "d"), loaded.get(0).getItemIds());
        assertEquals(Map.of("github-issue", 3), loaded.get(0).getSourceCounts());

        store.deleteGroups(List.of("g-mid", "missing"));
        entityManager.flush();
        entityManager.clear();

        assertEquals(List.of("g-large", "g-small"), store.loadGroups().stream().map(FeedbackGroup::getId).toList());
    }

    @Test
    @DisplayName("Состояние синхронизации: одна строка, watermark по типу источника")
    void syncStateRoundTrip() {
        assertTrue(store.loadSyncState().isEmpty());

        SyncState state = new SyncState();
        state.setWatermark(SourceType.GITHUB_ISSUE, Instant.parse("2024-05-01T10:00:00Z"));
        state.setLastSync(Instant.parse("2024-05-02T00:00:00Z"));
        store.saveSyncState(state);
        entityManager.flush();
        entityManager.clear();

        SyncState loaded = store.loadSyncState().orElseThrow();
        assertEquals(SyncState.SINGLETON_ID, loaded.getId());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), loaded.getWatermark(SourceType.GITHUB_ISSUE));
        assertNull(loaded.getWatermark(SourceType.DISCOURSE));
        assertEquals(Instant.parse("2024-05-02T00:00:00Z"), loaded.getLastSync());
    }

    @Test
    @DisplayName("clearAll удаляет элементы, группы и состояние")
    void clearAllRemovesEverything() {
        store.saveItems(List.of(item("a"), item("b"), item("c")));
        store.saveGroups(List.of(group("g", "a")));
        store.saveSyncState(new SyncState());
        entityManager.flush();

        store.clearAll();
        entityManager.clear();

        assertTrue(store.loadItems(10).isEmpty());
        assertTrue(store.loadGroups().isEmpty());
        assertTrue(store.loadSyncState().isEmpty());
    }

    private static FeedbackGroup group(String id, String... itemIds) {
        FeedbackGroup group = new FeedbackGroup();
        group.setId(id);
        group.setTheme("Theme " + id);
        group.setSentiment(Sentiment.NEUTRAL);
        group.setCategory(FeedbackCategory.OTHER);
        group.setItemIds(List.of(itemIds));
        group.refreshStats(List.of(itemIds).stream().map(itemId -> item(itemId)).toList());
        group.setCreatedAt(Instant.parse("2024-05-01T00:00:00Z"));
        return group;
    }
}
