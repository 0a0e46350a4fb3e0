package ru.tigran.feedbacksync.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.feedbacksync.model.FeedbackItem;
import ru.tigran.feedbacksync.model.SourceType;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static ru.tigran.feedbacksync.support.TestItems.item;

@DisplayName("ItemDeduplicator unit тесты")
class ItemDeduplicatorTest {

    private final ItemDeduplicator deduplicator = new ItemDeduplicator();

    @Test
    @DisplayName("Первое вхождение id побеждает, порядок сохраняется")
    void firstOccurrenceWins() {
        FeedbackItem first = item("1", SourceType.TWITTER_SEARCH, Instant.parse("2024-01-01T00:00:00Z"));
        FeedbackItem duplicate = item("1", SourceType.GITHUB_DISCUSSION, Instant.parse("2024-02-01T00:00:00Z"));
        FeedbackItem other = item("2", SourceType.DISCOURSE, Instant.parse("2024-03-01T00:00:00Z"));

        List<FeedbackItem> unique = deduplicator.deduplicate(List.of(first, duplicate, other));

        assertEquals(2, unique.size());
        assertSame(first, unique.get(0));
        assertSame(other, unique.get(1));
    }

    @Test
    @DisplayName("Элементы без id отбрасываются")
    void dropsItemsWithoutId() {
        FeedbackItem noId = item("x");
        noId.setId(null);
        FeedbackItem blankId = item("y");
        blankId.setId(" ");

        List<FeedbackItem> unique = deduplicator.deduplicate(List.of(noId, item("1"), blankId));

        assertEquals(1, unique.size());
        assertEquals("1", unique.get(0).getId());
    }

    @Test
    @DisplayName("Пустой вход - пустой результат")
    void emptyInput() {
        assertTrue(deduplicator.deduplicate(List.of()).isEmpty());
    }
}
