package ru.tigran.feedbacksync.pipeline;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.tigran.feedbacksync.dto.GroupProposal;
import ru.tigran.feedbacksync.dto.GroupingReport;
import ru.tigran.feedbacksync.dto.MergedGroupProposal;
import ru.tigran.feedbacksync.exception.AIGatewayException;
import ru.tigran.feedbacksync.exception.ErrorCode;
import ru.tigran.feedbacksync.model.FeedbackCategory;
import ru.tigran.feedbacksync.model.FeedbackGroup;
import ru.tigran.feedbacksync.model.FeedbackItem;
import ru.tigran.feedbacksync.model.Sentiment;
import ru.tigran.feedbacksync.service.AIService;
import ru.tigran.feedbacksync.support.InMemorySharedStore;
import ru.tigran.feedbacksync.util.FeedbackIds;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;
import static ru.tigran.feedbacksync.support.TestItems.analyzed;
import static ru.tigran.feedbacksync.support.TestItems.item;

/**
 * Unit-тесты для FeedbackGrouper.
 * Тестирует политику supersede, сбой консолидации и сохранение групп упавших батчей.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("FeedbackGrouper unit тесты")
class FeedbackGrouperTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private AIService aiService;

    private InMemorySharedStore store;
    private FeedbackGrouper grouper;

    private FeedbackItem a;
    private FeedbackItem b;
    private FeedbackItem c;
    private FeedbackItem d;

    @BeforeEach
    void setUp() {
        store = new InMemorySharedStore();
        grouper = new FeedbackGrouper(aiService, store, new WaveExecutor(Runnable::run), new GroupConsolidator(),
                Clock.fixed(NOW, ZoneOffset.UTC), 2, 2);
        a = analyzed("a");
        b = analyzed("b");
        c = analyzed("c");
        d = analyzed("d");
    }

    // ===== Supersede =====

    @Test
    @DisplayName("Старые группы заменяются каноническими, элементы получают новые groupId")
    void supersedesPreviousGroups() {
        FeedbackGroup old = group("group-old", "Old theme", "a");
        store.groups.put(old.getId(), old);
        a.setGroupId("group-old");
        stubBatchGroups();
        when(aiService.consolidate(anyList())).thenReturn(List.of());

        GroupingReport report = grouper.group(List.of(a, b, c, d), List.of(old), (stage, processed, total) -> { });

        String streaming = FeedbackIds.groupId("Slow streaming");
        String docs = FeedbackIds.groupId("Docs missing");
        assertEquals(new GroupingReport(true, 4, 2, 2, 0, false, 1), report);
        assertEquals(Set.of(streaming, docs), store.groups.keySet());
        assertEquals(streaming, a.getGroupId());
        assertEquals(streaming, b.getGroupId());
        assertEquals(docs, c.getGroupId());
        assertEquals(docs, d.getGroupId());
        assertSame(a, store.items.get("a"));
        assertEquals(Set.of("a", "b"), store.groups.get(streaming).getItemIds());
    }

    @Test
    @DisplayName("Неразмеченные элементы не кластеризуются и теряют устаревший groupId")
    void unanalyzedItemsAreNotGrouped() {
        FeedbackItem pending = item("pending");
        pending.setGroupId("group-old");
        FeedbackGroup old = group("group-old", "Old theme", "pending");
        store.groups.put(old.getId(), old);
        stubBatchGroups();
        when(aiService.consolidate(anyList())).thenReturn(List.of());

        grouper.group(List.of(a, b, c, d, pending), List.of(old), (stage, processed, total) -> { });

        assertNull(pending.getGroupId());
        assertFalse(store.groups.containsKey("group-old"));
        verify(aiService, times(2)).group(anyList());
    }

    // ===== Consolidation =====

    @Test
    @DisplayName("Консолидация объединяет темы разных батчей")
    void consolidationMergesAcrossBatches() {
        stubBatchGroups();
        when(aiService.consolidate(anyList())).thenReturn(List.of(new MergedGroupProposal(
                "Developer experience", null, Sentiment.NEGATIVE, FeedbackCategory.OTHER,
                List.of("batch-0-0", "batch-1-0"), List.of())));

        GroupingReport report = grouper.group(List.of(a, b, c, d), List.of(), (stage, processed, total) -> { });

        String merged = FeedbackIds.groupId("Developer experience");
        assertEquals(1, report.canonicalGroups());
        assertEquals(Set.of(merged), store.groups.keySet());
        assertEquals(4, store.groups.get(merged).getItemCount());
        List.of(a, b, c, d).forEach(item -> assertEquals(merged, item.getGroupId()));
    }

    @Test
    @DisplayName("Сбой консолидации: batch группы сохраняются как канонические")
    void consolidationFailureUsesBatchGroups() {
        stubBatchGroups();
        when(aiService.consolidate(anyList()))
                .thenThrow(new AIGatewayException("timeout", ErrorCode.AI_SERVICE_ERROR, true));

        GroupingReport report = grouper.group(List.of(a, b, c, d), List.of(), (stage, processed, total) -> { });

        assertTrue(report.consolidationFailed());
        assertEquals(2, report.canonicalGroups());
        assertEquals(2, store.groups.size());
        assertNotNull(a.getGroupId());
        assertNotNull(d.getGroupId());
    }

    // ===== Failed batches =====

    @Test
    @DisplayName("Элементы упавшего батча сохраняют прежнюю группу")
    void failedBatchKeepsPreviousAssignment() {
        FeedbackGroup old = group("group-old", "Old docs theme", "c", "gone");
        old.setCreatedAt(Instant.parse("2024-01-01T00:00:00Z"));
        store.groups.put(old.getId(), old);
        c.setGroupId("group-old");
        when(aiService.group(anyList())).thenAnswer(invocation -> {
            List<FeedbackItem> batch = invocation.getArgument(0);
            if (BatchAnalyzer.idsOf(batch).contains("c")) {
                throw new AIGatewayException("boom", ErrorCode.AI_SERVICE_ERROR, false);
            }
            return List.of(proposal("Slow streaming", "a", "b"));
        });

        GroupingReport report = grouper.group(List.of(a, b, c, d), List.of(old), (stage, processed, total) -> { });

        assertEquals(1, report.failedBatches());
        assertEquals(0, report.supersededGroups());
        assertEquals("group-old", c.getGroupId());
        assertNull(d.getGroupId());
        assertEquals(Set.of("c"), store.groups.get("group-old").getItemIds());
        assertEquals(1, store.groups.get("group-old").getItemCount());
        assertTrue(store.groups.containsKey(FeedbackIds.groupId("Slow streaming")));
        verify(aiService, never()).consolidate(anyList());
    }

    @Test
    @DisplayName("Если не получено ни одной группы, существующие группы не трогаются")
    void noGroupsKeepsExistingGroups() {
        FeedbackGroup old = group("group-old", "Old theme", "a");
        store.groups.put(old.getId(), old);
        a.setGroupId("group-old");
        when(aiService.group(anyList())).thenThrow(new IllegalStateException("provider down"));

        GroupingReport report = grouper.group(List.of(a, b, c, d), List.of(old), (stage, processed, total) -> { });

        assertEquals(2, report.failedBatches());
        assertEquals(0, report.canonicalGroups());
        assertTrue(store.groups.containsKey("group-old"));
        assertEquals("group-old", a.getGroupId());
    }

    private void stubBatchGroups() {
        when(aiService.group(anyList())).thenAnswer(invocation -> {
            List<FeedbackItem> batch = invocation.getArgument(0);
            return BatchAnalyzer.idsOf(batch).contains("a")
                    ? List.of(proposal("Slow streaming", "a", "b"))
                    : List.of(proposal("Docs missing", "c", "d"));
        });
    }

    private static GroupProposal proposal(String theme, String... itemIds) {
        return new GroupProposal(theme, theme + " summary", Sentiment.NEGATIVE, FeedbackCategory.BUG_REPORT,
                List.of(itemIds));
    }

    private static FeedbackGroup group(String id, String theme, String... itemIds) {
        FeedbackGroup group = new FeedbackGroup();
        group.setId(id);
        group.setTheme(theme);
        group.setItemIds(List.of(itemIds));
        return group;
    }
}
