package ru.tigran.feedbacksync.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import ru.tigran.feedbacksync.dto.StageReport;
import ru.tigran.feedbacksync.dto.SyncProgressListener;
import ru.tigran.feedbacksync.dto.SyncStage;
import ru.tigran.feedbacksync.dto.TranslationResult;
import ru.tigran.feedbacksync.exception.TranslationBatchException;
import ru.tigran.feedbacksync.model.FeedbackItem;
import ru.tigran.feedbacksync.service.AIService;
import ru.tigran.feedbacksync.store.SharedStore;
import ru.tigran.feedbacksync.util.FeedbackIds;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Перевод элементов с известным языком и без переводов.
 * Перевод выполняется один раз: элемент с непустой картой translations больше не попадает в батчи.
 */
@Slf4j
@Component
public class FeedbackTranslator {

    private final AIService aiService;
    private final SharedStore sharedStore;
    private final WaveExecutor waveExecutor;
    private final List<String> targetLanguages;
    private final int batchSize;
    private final int waveWidth;

    public FeedbackTranslator(
            AIService aiService,
            SharedStore sharedStore,
            WaveExecutor waveExecutor,
            @Value("${app.translation.target-languages:en,pt,es,fr,de,ja,zh}") String targetLanguages,
            @Value("${app.translation.batch-size:5}") int batchSize,
            @Value("${app.translation.wave-width:10}") int waveWidth
    ) {
        this.aiService = aiService;
        this.sharedStore = sharedStore;
        this.waveExecutor = waveExecutor;
        this.targetLanguages = Arrays.stream(targetLanguages.split(","))
                .map(FeedbackIds::normalizeLanguage)
                .filter(language -> language != null)
                .distinct()
                .toList();
        this.batchSize = batchSize;
        this.waveWidth = waveWidth;
    }

    public static boolean needsTranslation(FeedbackItem item) {
        return item.getLanguage() != null && !item.getLanguage().isBlank() && !item.hasTranslations();
    }

    public StageReport translate(List<FeedbackItem> items, SyncProgressListener listener) {
        List<FeedbackItem> candidates = items.stream()
                .filter(FeedbackTranslator::needsTranslation)
                .filter(this::hasOtherTargetLanguage)
                .toList();
        if (candidates.isEmpty() || targetLanguages.isEmpty()) {
            return StageReport.SKIPPED;
        }
        List<List<FeedbackItem>> batches = WaveExecutor.partition(candidates, batchSize);
        log.info("Translating {} items in {} batches into {}", candidates.size(), batches.size(), targetLanguages);

        AtomicInteger processed = new AtomicInteger();
        AtomicInteger translated = new AtomicInteger();
        WaveExecutor.WaveSummary summary = waveExecutor.execute(
                "translation",
                batches,
                waveWidth,
                batch -> aiService.translate(batch, targetLanguages),
                (index, batch, cause) -> new TranslationBatchException(index, BatchAnalyzer.idsOf(batch), cause),
                outcome -> {
                    if (outcome.succeeded()) {
                        List<FeedbackItem> updated = apply(outcome.batch(), outcome.result());
                        sharedStore.saveItems(updated);
                        translated.addAndGet(updated.size());
                    }
                    listener.onProgress(SyncStage.TRANSLATION, processed.addAndGet(outcome.batch().size()), candidates.size());
                });

        log.info("Translation finished: {}/{} items translated, {}/{} batches failed",
                translated.get(), candidates.size(), summary.failedBatches(), summary.totalBatches());
        return new StageReport(candidates.size(), translated.get(), summary.totalBatches(), summary.failedBatches());
    }

    /**
     * An item whose language is the only target can never receive a translation.
     */
    private boolean hasOtherTargetLanguage(FeedbackItem item) {
        String ownLanguage = FeedbackIds.normalizeLanguage(item.getLanguage());
        return targetLanguages.stream().anyMatch(language -> !language.equals(ownLanguage));
    }

    private List<FeedbackItem> apply(List<FeedbackItem> batch, Map<String, TranslationResult> results) {
        List<FeedbackItem> updated = new ArrayList<>();
        for (FeedbackItem item : batch) {
            TranslationResult result = results.get(item.getId());
            if (result == null) {
                continue;
            }
            String ownLanguage = FeedbackIds.normalizeLanguage(item.getLanguage());
            Map<String, String> translations = forTargets(result.translations(), ownLanguage);
            if (translations.isEmpty()) {
                continue;
            }
            item.setTranslations(translations);
            item.setTranslatedTitles(forTargets(result.titles(), ownLanguage));
            updated.add(item);
        }
        return updated;
    }

    /**
     * Keeps configured target languages only and never the item's own language.
     */
    private Map<String, String> forTargets(Map<String, String> values, String ownLanguage) {
        Map<String, String> filtered = new LinkedHashMap<>();
        if (values == null) {
            return filtered;
        }
        values.forEach((language, text) -> {
            String normalized = FeedbackIds.normalizeLanguage(language);
            if (normalized != null && targetLanguages.contains(normalized)
                    && !normalized.equals(ownLanguage) && text != null && !text.isBlank()) {
                filtered.putIfAbsent(normalized, text);
            }
        });
        return filtered;
    }
}
