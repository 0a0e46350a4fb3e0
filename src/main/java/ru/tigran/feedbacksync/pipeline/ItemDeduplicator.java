package ru.tigran.feedbacksync.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.tigran.feedbacksync.model.FeedbackItem;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Collapses a fetched batch to one item per id. The first occurrence in input order wins.
 */
@Slf4j
@Component
public class ItemDeduplicator {

    public List<FeedbackItem> deduplicate(List<FeedbackItem> items) {
        Set<String> seen = new HashSet<>();
        List<FeedbackItem> unique = new ArrayList<>(items.size());
        int withoutId = 0;
        for (FeedbackItem item : items) {
            if (item.getId() == null || item.getId().isBlank()) {
                withoutId++;
                continue;
            }
            if (seen.add(item.getId())) {
                unique.add(item);
            }
        }
        if (withoutId > 0) {
            log.warn("Dropped {} fetched items without id", withoutId);
        }
        if (unique.size() < items.size() - withoutId) {
            log.debug("Deduplicated {} fetched items to {}", items.size() - withoutId, unique.size());
        }
        return unique;
    }
}
