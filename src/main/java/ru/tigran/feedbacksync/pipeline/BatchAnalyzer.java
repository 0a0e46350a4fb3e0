package ru.tigran.feedbacksync.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import ru.tigran.feedbacksync.dto.ClassificationResult;
import ru.tigran.feedbacksync.dto.StageReport;
import ru.tigran.feedbacksync.dto.SyncProgressListener;
import ru.tigran.feedbacksync.dto.SyncStage;
import ru.tigran.feedbacksync.exception.ClassificationBatchException;
import ru.tigran.feedbacksync.model.FeedbackItem;
import ru.tigran.feedbacksync.service.AIService;
import ru.tigran.feedbacksync.store.SharedStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Классификация элементов (sentiment/category/summary) батчами по волнам.
 *
 * Упавший батч не прерывает синхронизацию: его элементы остаются analyzed=false и попадут
 * в needsAnalysis в следующем цикле. После каждого батча результаты применяются к живым
 * элементам, сразу сохраняются и публикуется прогресс.
 */
@Slf4j
@Component
public class BatchAnalyzer {

    private final AIService aiService;
    private final SharedStore sharedStore;
    private final WaveExecutor waveExecutor;
    private final int batchSize;
    private final int waveWidth;

    public BatchAnalyzer(
            AIService aiService,
            SharedStore sharedStore,
            WaveExecutor waveExecutor,
            @Value("${app.classification.batch-size:100}") int batchSize,
            @Value("${app.classification.wave-width:10}") int waveWidth
    ) {
        this.aiService = aiService;
        this.sharedStore = sharedStore;
        this.waveExecutor = waveExecutor;
        this.batchSize = batchSize;
        this.waveWidth = waveWidth;
    }

    public StageReport analyze(List<FeedbackItem> items, SyncProgressListener listener) {
        if (items.isEmpty()) {
            return StageReport.SKIPPED;
        }
        List<List<FeedbackItem>> batches = WaveExecutor.partition(items, batchSize);
        log.info("Classifying {} items in {} batches (wave width {})", items.size(), batches.size(), waveWidth);

        AtomicInteger processed = new AtomicInteger();
        AtomicInteger analyzed = new AtomicInteger();
        WaveExecutor.WaveSummary summary = waveExecutor.execute(
                "classification",
                batches,
                waveWidth,
                aiService::classify,
                (index, batch, cause) -> new ClassificationBatchException(index, idsOf(batch), cause),
                outcome -> {
                    if (outcome.succeeded()) {
                        List<FeedbackItem> updated = apply(outcome.batch(), outcome.result());
                        sharedStore.saveItems(updated);
                        analyzed.addAndGet(updated.size());
                        if (updated.size() < outcome.batch().size()) {
                            log.debug("Classification batch {} left {} items unanalyzed",
                                    outcome.index(), outcome.batch().size() - updated.size());
                        }
                    }
                    listener.onProgress(SyncStage.CLASSIFICATION, processed.addAndGet(outcome.batch().size()), items.size());
                });

        log.info("Classification finished: {}/{} items analyzed, {}/{} batches failed",
                analyzed.get(), items.size(), summary.failedBatches(), summary.totalBatches());
        return new StageReport(items.size(), analyzed.get(), summary.totalBatches(), summary.failedBatches());
    }

    private static List<FeedbackItem> apply(List<FeedbackItem> batch, Map<String, ClassificationResult> results) {
        List<FeedbackItem> updated = new ArrayList<>();
        for (FeedbackItem item : batch) {
            ClassificationResult result = results.get(item.getId());
            if (result == null) {
                continue;
            }
            item.setSentiment(result.sentiment());
            item.setSentimentConfidence(result.sentimentConfidence());
            item.setCategory(result.category());
            item.setCategoryConfidence(result.categoryConfidence());
            if (result.summary() != null) {
                item.setSummary(result.summary());
            }
            item.setAnalyzed(true);
            updated.add(item);
        }
        return updated;
    }

    static List<String> idsOf(List<FeedbackItem> batch) {
        return batch.stream().map(FeedbackItem::getId).toList();
    }
}
