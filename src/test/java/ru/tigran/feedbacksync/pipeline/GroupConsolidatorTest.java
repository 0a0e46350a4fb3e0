package ru.tigran.feedbacksync.pipeline;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.feedbacksync.dto.MergedGroupProposal;
import ru.tigran.feedbacksync.model.FeedbackCategory;
import ru.tigran.feedbacksync.model.FeedbackGroup;
import ru.tigran.feedbacksync.model.FeedbackItem;
import ru.tigran.feedbacksync.model.Sentiment;
import ru.tigran.feedbacksync.model.SourceType;
import ru.tigran.feedbacksync.util.FeedbackIds;

import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static ru.tigran.feedbacksync.support.TestItems.analyzed;

@DisplayName("GroupConsolidator unit тесты")
class GroupConsolidatorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private final GroupConsolidator consolidator = new GroupConsolidator();
    private Map<String, FeedbackItem> analyzedItems;

    @BeforeEach
    void setUp() {
        analyzedItems = new LinkedHashMap<>();
        for (String id : List.of("a", "b", "c", "d")) {
            analyzedItems.put(id, analyzed(id));
        }
        analyzedItems.get("c").setSourceType(SourceType.DISCOURSE);
        analyzedItems.get("a").setLanguage("en");
    }

    @Test
    @DisplayName("Объединённые группы забирают элементы исходных, неупомянутые остаются как есть")
    void mergesReferencedGroupsAndKeepsUnreferenced() {
        List<FeedbackGroup> batchGroups = List.of(
                batchGroup("batch-0-0", "Slow streaming", "a", "b"),
                batchGroup("batch-1-0", "Streaming latency", "c"),
                batchGroup("batch-1-1", "Docs missing", "d"));
        List<MergedGroupProposal> merged = List.of(new MergedGroupProposal(
                "Streaming performance", "Streaming is slow", Sentiment.NEGATIVE, FeedbackCategory.PERFORMANCE_ISSUE,
                List.of("batch-0-0", "batch-1-0"), List.of("a", "c", "unknown")));

        List<FeedbackGroup> canonical = consolidator.reconcile(batchGroups, merged, analyzedItems, Map.of(), NOW);

        assertEquals(2, canonical.size());
        FeedbackGroup streaming = canonical.get(0);
        assertEquals(FeedbackIds.groupId("Streaming performance"), streaming.getId());
        assertEquals(Set.of("a", "b", "c"), streaming.getItemIds());
        assertEquals(3, streaming.getItemCount());
        assertEquals(Map.of("github-issue", 2, "discourse", 1), streaming.getSourceCounts());
        assertEquals(Set.of("en"), streaming.getLanguages());
        assertEquals(Sentiment.NEGATIVE, streaming.getSentiment());
        assertEquals(NOW, streaming.getCreatedAt());

        FeedbackGroup docs = canonical.get(1);
        assertEquals(FeedbackIds.groupId("Docs missing"), docs.getId());
        assertEquals(Set.of("d"), docs.getItemIds());
    }

    @Test
    @DisplayName("Каждый элемент попадает ровно в одну группу, ни один не теряется")
    void everyItemLandsInExactlyOneGroup() {
        List<FeedbackGroup> batchGroups = List.of(
                batchGroup("batch-0-0", "Auth errors", "a", "b"),
                batchGroup("batch-1-0", "Login failures", "c", "d"));
        List<MergedGroupProposal> merged = List.of(
                new MergedGroupProposal("Authentication", null, Sentiment.NEGATIVE, FeedbackCategory.BUG_REPORT,
                        List.of("batch-0-0"), List.of("c")),
                new MergedGroupProposal("Login", null, Sentiment.NEGATIVE, FeedbackCategory.BUG_REPORT,
                        List.of("batch-0-0", "batch-1-0"), List.of("a")));

        List<FeedbackGroup> canonical = consolidator.reconcile(batchGroups, merged, analyzedItems, Map.of(), NOW);

        Set<String> seen = new HashSet<>();
        for (FeedbackGroup group : canonical) {
            for (String itemId : group.getItemIds()) {
                assertTrue(seen.add(itemId), itemId + " is in more than one group");
            }
        }
        assertEquals(Set.of("a", "b", "c", "d"), seen);
        assertEquals(Set.of("a", "b", "c"), canonical.get(0).getItemIds());
        assertEquals(Set.of("d"), canonical.get(1).getItemIds());
    }

    @Test
    @DisplayName("Пустой ответ консолидации: batch группы становятся каноническими")
    void emptyConsolidationKeepsBatchGroups() {
        List<FeedbackGroup> batchGroups = List.of(
                batchGroup("batch-0-0", "Pricing", "a"),
                batchGroup("batch-0-1", "Quota", "b"));

        List<FeedbackGroup> canonical = consolidator.reconcile(batchGroups, List.of(), analyzedItems, Map.of(), NOW);

        assertEquals(List.of(FeedbackIds.groupId("Pricing"), FeedbackIds.groupId("Quota")),
                canonical.stream().map(FeedbackGroup::getId).toList());
    }

    @Test
    @DisplayName("Одинаковая тема сливается в одну группу, createdAt существующей группы сохраняется")
    void sameThemeFoldsAndKeepsCreatedAt() {
        Instant created = Instant.parse("2024-01-01T00:00:00Z");
        FeedbackGroup previous = batchGroup(FeedbackIds.groupId("Rate limits"), "Rate limits", "a");
        previous.setCreatedAt(created);
        List<FeedbackGroup> batchGroups = List.of(
                batchGroup("batch-0-0", "Rate limits", "a"),
                batchGroup("batch-1-0", "  rate   LIMITS ", "b"));

        List<FeedbackGroup> canonical = consolidator.reconcile(batchGroups, List.of(), analyzedItems,
                Map.of(previous.getId(), previous), NOW);

        assertEquals(1, canonical.size());
        assertEquals(Set.of("a", "b"), canonical.get(0).getItemIds());
        assertEquals(2, canonical.get(0).getItemCount());
        assertEquals(created, canonical.get(0).getCreatedAt());
        assertEquals(NOW, canonical.get(0).getUpdatedAt());
    }

    private static FeedbackGroup batchGroup(String id, String theme, String... itemIds) {
        FeedbackGroup group = new FeedbackGroup();
        group.setId(id);
        group.setTheme(theme);
        group.setSentiment(Sentiment.NEUTRAL);
        group.setCategory(FeedbackCategory.OTHER);
        group.setItemIds(List.of(itemIds));
        return group;
    }
}
