package ru.tigran.feedbacksync.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.feedbacksync.model.FeedbackCategory;
import ru.tigran.feedbacksync.model.FeedbackItem;
import ru.tigran.feedbacksync.model.Sentiment;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static ru.tigran.feedbacksync.support.TestItems.analyzed;
import static ru.tigran.feedbacksync.support.TestItems.item;

@DisplayName("FeedbackMerger unit тесты")
class FeedbackMergerTest {

    private final FeedbackMerger merger = new FeedbackMerger();

    @Test
    @DisplayName("Контент берётся из свежей версии, анализ - из базы")
    void freshContentKeepsStoredAnalysis() {
        FeedbackItem stored = analyzed("1");
        stored.setGroupId("group-abc");
        stored.setDismissed(true);
        stored.setTranslations(Map.of("en", "Translated"));
        stored.setContent("old content");

        FeedbackItem fresh = item("1");
        fresh.setContent("edited content");
        fresh.setReplyCount(5);

        MergeResult result = merger.merge(List.of(fresh), List.of(stored));

        FeedbackItem merged = result.finalItems().get(0);
        assertSame(fresh, merged);
        assertEquals("edited content", merged.getContent());
        assertEquals(5, merged.getReplyCount());
        assertEquals(Sentiment.NEGATIVE, merged.getSentiment());
        assertEquals(FeedbackCategory.BUG_REPORT, merged.getCategory());
        assertEquals("Summary of 1", merged.getSummary());
        assertEquals("group-abc", merged.getGroupId());
        assertTrue(merged.isAnalyzed());
        assertTrue(merged.isDismissed());
        assertEquals(Map.of("en", "Translated"), merged.getTranslations());
        assertTrue(result.newItemIds().isEmpty());
        assertTrue(result.needsAnalysis().isEmpty());
    }

    @Test
    @DisplayName("Финальный набор: свежие элементы, затем не перезагруженные из базы")
    void finalSetIsFreshThenBaselineOnly() {
        FeedbackItem freshNew = item("new");
        FeedbackItem freshKnown = item("known");
        FeedbackItem storedKnown = analyzed("known");
        FeedbackItem storedOnly = analyzed("old");

        MergeResult result = merger.merge(List.of(freshNew, freshKnown), List.of(storedOnly, storedKnown));

        assertEquals(List.of("new", "known", "old"), BatchAnalyzer.idsOf(result.finalItems()));
        assertEquals(List.of("new", "known"), BatchAnalyzer.idsOf(result.freshItems()));
        assertEquals(Set.of("new"), result.newItemIds());
        assertEquals(List.of("new"), BatchAnalyzer.idsOf(result.needsAnalysis()));
    }

    @Test
    @DisplayName("Неразмеченные элементы базы тоже требуют анализа")
    void unanalyzedBaselineItemsNeedAnalysis() {
        FeedbackItem pending = item("pending");

        MergeResult result = merger.merge(List.of(), List.of(pending, analyzed("done")));

        assertEquals(List.of("pending"), BatchAnalyzer.idsOf(result.needsAnalysis()));
        assertEquals(2, result.finalItems().size());
    }
}
