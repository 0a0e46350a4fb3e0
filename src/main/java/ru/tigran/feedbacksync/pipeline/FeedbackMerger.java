package ru.tigran.feedbacksync.pipeline;

import org.springframework.stereotype.Component;
import ru.tigran.feedbacksync.model.FeedbackItem;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Сливает свежие элементы с сохранённой базой.
 *
 * Контент берётся из свежей версии, результаты анализа (sentiment, category, summary, groupId,
 * analyzed, dismissed, translations) - из базы. Свежие элементы мутируются на месте.
 */
@Component
public class FeedbackMerger {

    public MergeResult merge(List<FeedbackItem> fresh, List<FeedbackItem> baseline) {
        Map<String, FeedbackItem> baselineById = new LinkedHashMap<>();
        Set<String> analyzedInBaseline = new HashSet<>();
        for (FeedbackItem item : baseline) {
            baselineById.putIfAbsent(item.getId(), item);
            if (item.isAnalyzed()) {
                analyzedInBaseline.add(item.getId());
            }
        }

        List<FeedbackItem> finalItems = new ArrayList<>(fresh.size() + baseline.size());
        Set<String> newItemIds = new LinkedHashSet<>();
        Set<String> freshIds = new HashSet<>();
        for (FeedbackItem item : fresh) {
            FeedbackItem previous = baselineById.get(item.getId());
            if (previous != null) {
                carryAnalysis(previous, item);
            } else {
                newItemIds.add(item.getId());
            }
            freshIds.add(item.getId());
            finalItems.add(item);
        }
        List<FeedbackItem> freshItems = List.copyOf(finalItems);

        for (FeedbackItem item : baselineById.values()) {
            if (!freshIds.contains(item.getId())) {
                finalItems.add(item);
            }
        }

        List<FeedbackItem> needsAnalysis = finalItems.stream()
                .filter(item -> !item.isAnalyzed() && !analyzedInBaseline.contains(item.getId()))
                .toList();

        return new MergeResult(finalItems, freshItems, newItemIds, needsAnalysis);
    }

    private static void carryAnalysis(FeedbackItem from, FeedbackItem to) {
        to.setSentiment(from.getSentiment());
        to.setSentimentConfidence(from.getSentimentConfidence());
        to.setCategory(from.getCategory());
        to.setCategoryConfidence(from.getCategoryConfidence());
        to.setSummary(from.getSummary());
        to.setGroupId(from.getGroupId());
        to.setAnalyzed(from.isAnalyzed());
        to.setDismissed(from.isDismissed());
        to.setTranslations(from.getTranslations() == null
                ? new LinkedHashMap<>() : new LinkedHashMap<>(from.getTranslations()));
        to.setTranslatedTitles(from.getTranslatedTitles() == null
                ? new LinkedHashMap<>() : new LinkedHashMap<>(from.getTranslatedTitles()));
    }
}
