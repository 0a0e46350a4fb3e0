package ru.tigran.feedbacksync.pipeline;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import ru.tigran.feedbacksync.config.ApiKeyValidator;
import ru.tigran.feedbacksync.dto.GroupingReport;
import ru.tigran.feedbacksync.dto.StageReport;
import ru.tigran.feedbacksync.dto.SyncOptions;
import ru.tigran.feedbacksync.dto.SyncProgressListener;
import ru.tigran.feedbacksync.dto.SyncReport;
import ru.tigran.feedbacksync.dto.SyncStage;
import ru.tigran.feedbacksync.dto.SyncStatus;
import ru.tigran.feedbacksync.exception.SyncInProgressException;
import ru.tigran.feedbacksync.model.FeedbackGroup;
import ru.tigran.feedbacksync.model.FeedbackItem;
import ru.tigran.feedbacksync.model.SourceType;
import ru.tigran.feedbacksync.model.SyncState;
import ru.tigran.feedbacksync.service.ResilientCallExecutor;
import ru.tigran.feedbacksync.source.SourceCollector;
import ru.tigran.feedbacksync.store.SharedStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Один цикл синхронизации: загрузка базы, параллельный fetch источников, дедупликация и слияние,
 * классификация, перевод, кластеризация, сохранение watermark.
 *
 * Single-flight: IDLE -> SYNCING -> COMPLETED | FAILED. Вызов во время SYNCING отклоняется
 * SyncInProgressException (без очереди). Фатальны только ошибки хранилища и конфигурации,
 * сбои источников и батчей учитываются в отчёте.
 */
@Slf4j
@Service
public class SyncOrchestrator {

    private final SharedStore sharedStore;
    private final List<SourceCollector> collectors;
    private final ItemDeduplicator deduplicator;
    private final FeedbackMerger merger;
    private final BatchAnalyzer batchAnalyzer;
    private final FeedbackTranslator translator;
    private final FeedbackGrouper grouper;
    private final ResilientCallExecutor resilientCalls;
    private final ApiKeyValidator apiKeyValidator;
    private final Executor sourceFetchExecutor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final int baselineLimit;
    private final int minAnalyzedForGrouping;
    private final Set<SourceType> defaultEnabledSources;

    private final AtomicReference<SyncStatus> status = new AtomicReference<>(SyncStatus.IDLE);

    private final Timer syncTimer;
    private final Counter syncCompletedCounter;
    private final Counter syncFailedCounter;
    private final Counter syncRejectedCounter;
    private final Counter newItemsCounter;

    public SyncOrchestrator(
            SharedStore sharedStore,
            List<SourceCollector> collectors,
            ItemDeduplicator deduplicator,
            FeedbackMerger merger,
            BatchAnalyzer batchAnalyzer,
            FeedbackTranslator translator,
            FeedbackGrouper grouper,
            ResilientCallExecutor resilientCalls,
            ApiKeyValidator apiKeyValidator,
            @Qualifier("sourceFetchExecutor") Executor sourceFetchExecutor,
            Clock clock,
            MeterRegistry meterRegistry,
            @Value("${app.sync.baseline-limit:5000}") int baselineLimit,
            @Value("${app.sync.min-analyzed-for-grouping:10}") int minAnalyzedForGrouping,
            @Value("${app.sync.enabled-sources:}") String defaultEnabledSources
    ) {
        this.sharedStore = sharedStore;
        this.collectors = List.copyOf(collectors);
        this.deduplicator = deduplicator;
        this.merger = merger;
        this.batchAnalyzer = batchAnalyzer;
        this.translator = translator;
        this.grouper = grouper;
        this.resilientCalls = resilientCalls;
        this.apiKeyValidator = apiKeyValidator;
        this.sourceFetchExecutor = sourceFetchExecutor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.baselineLimit = baselineLimit;
        this.minAnalyzedForGrouping = minAnalyzedForGrouping;
        this.defaultEnabledSources = parseSourceTypes(defaultEnabledSources);

        this.syncTimer = Timer.builder("feedback.sync.time")
                .description("Duration of sync cycles")
                .register(meterRegistry);
        this.syncCompletedCounter = Counter.builder("feedback.sync.completed")
                .description("Sync cycles that completed, possibly with partial failures")
                .register(meterRegistry);
        this.syncFailedCounter = Counter.builder("feedback.sync.failed")
                .description("Sync cycles aborted by a store or configuration error")
                .register(meterRegistry);
        this.syncRejectedCounter = Counter.builder("feedback.sync.rejected")
                .description("Sync calls rejected because a cycle was running")
                .register(meterRegistry);
        this.newItemsCounter = Counter.builder("feedback.sync.items.new")
                .description("Fetched items unknown to the store")
                .register(meterRegistry);
    }

    public SyncStatus getStatus() {
        return status.get();
    }

    public Set<SourceType> getDefaultEnabledSources() {
        return EnumSet.copyOf(defaultEnabledSources);
    }

    /**
     * Runs a cycle for the sources enabled in configuration.
     */
    public SyncReport sync() {
        return sync(SyncOptions.of(defaultEnabledSources));
    }

    /**
     * @throws SyncInProgressException if a cycle is already running
     * @throws ru.tigran.feedbacksync.exception.ConfigurationException before any fetch if AI credentials are missing
     * @throws ru.tigran.feedbacksync.exception.SharedStoreException on any store read/write failure
     */
    public SyncReport sync(SyncOptions options) {
        SyncStatus current = status.get();
        if (current == SyncStatus.SYNCING || !status.compareAndSet(current, SyncStatus.SYNCING)) {
            syncRejectedCounter.increment();
            log.warn("Sync rejected: a cycle is already running");
            throw new SyncInProgressException();
        }

        try {
            SyncReport report = syncTimer.record(() -> runCycle(options));
            status.set(SyncStatus.COMPLETED);
            syncCompletedCounter.increment();
            return report;
        } catch (RuntimeException e) {
            status.set(SyncStatus.FAILED);
            syncFailedCounter.increment();
            log.error("Sync failed: {}", e.getMessage(), e);
            throw e;
        }
    }

    private SyncReport runCycle(SyncOptions options) {
        Instant startedAt = clock.instant();
        SyncProgressListener listener = options.progressListener();

        apiKeyValidator.validate();

        List<FeedbackItem> baseline = sharedStore.loadItems(baselineLimit);
        List<FeedbackGroup> groups = sharedStore.loadGroups();
        Optional<SyncState> previousState = sharedStore.loadSyncState();
        log.info("Sync started: sources={}, baseline={} items, {} groups, {}",
                options.enabledSources(), baseline.size(), groups.size(),
                previousState.isPresent() ? "incremental" : "full fetch");

        // ===== Fetch =====
        List<SourceType> failedSources = new ArrayList<>();
        List<FeedbackItem> fetched = fetchAll(options.enabledSources(), previousState.orElse(null),
                failedSources, listener);

        // ===== Dedup + merge =====
        List<FeedbackItem> unique = deduplicator.deduplicate(fetched);
        MergeResult merge = merger.merge(unique, withStoredOutsideWindow(unique, baseline));
        sharedStore.saveItems(merge.freshItems());
        newItemsCounter.increment(merge.newItemIds().size());
        log.info("Merged {} fetched ({} unique, {} new) with baseline: {} items total, {} need analysis",
                fetched.size(), unique.size(), merge.newItemIds().size(),
                merge.finalItems().size(), merge.needsAnalysis().size());

        // ===== Classification =====
        StageReport classification = merge.needsAnalysis().isEmpty()
                ? StageReport.SKIPPED
                : batchAnalyzer.analyze(merge.needsAnalysis(), listener);
        recordBatchFailures(SyncStage.CLASSIFICATION, classification.failedBatches());

        // ===== Translation =====
        StageReport translation = translator.translate(merge.finalItems(), listener);
        recordBatchFailures(SyncStage.TRANSLATION, translation.failedBatches());

        // ===== Grouping =====
        int analyzedCount = (int) merge.finalItems().stream().filter(FeedbackItem::isAnalyzed).count();
        GroupingReport grouping;
        if (analyzedCount >= minAnalyzedForGrouping) {
            grouping = grouper.group(merge.finalItems(), groups, listener);
            recordBatchFailures(SyncStage.GROUPING, grouping.failedBatches());
        } else {
            log.info("Skipping grouping: {} analyzed items, need at least {}", analyzedCount, minAnalyzedForGrouping);
            grouping = GroupingReport.skipped(analyzedCount);
        }

        // ===== Sync state =====
        SyncState newState = computeSyncState(merge.finalItems(), previousState.orElse(null));
        sharedStore.saveSyncState(newState);

        SyncReport report = new SyncReport(startedAt, clock.instant(), fetched.size(), merge.newItemIds().size(),
                merge.finalItems().size(), List.copyOf(failedSources), classification, translation, grouping);
        log.info("Sync completed in {} ms: {} new items, failed sources={}, partial failures={}",
                report.duration().toMillis(), report.newItems(), failedSources, report.hasPartialFailures());
        return report;
    }

    /**
     * Runs enabled collectors concurrently. A failed collector contributes no items.
     */
    private List<FeedbackItem> fetchAll(Set<SourceType> enabledSources, SyncState previousState,
                                        List<SourceType> failedSources, SyncProgressListener listener) {
        List<SourceCollector> active = collectors.stream()
                .filter(collector -> enabledSources.contains(collector.sourceType()))
                .toList();
        if (active.isEmpty()) {
            log.warn("No enabled source collectors for {}", enabledSources);
            return List.of();
        }

        Map<SourceCollector, CompletableFuture<List<FeedbackItem>>> futures = new LinkedHashMap<>();
        for (SourceCollector collector : active) {
            Instant since = previousState == null ? null : previousState.getWatermark(collector.sourceType());
            futures.put(collector, CompletableFuture.supplyAsync(
                    () -> resilientCalls.fetchFromSource(collector.sourceType(), collector.name(),
                            () -> collector.fetch(since)),
                    sourceFetchExecutor));
        }

        List<FeedbackItem> fetched = new ArrayList<>();
        int done = 0;
        for (Map.Entry<SourceCollector, CompletableFuture<List<FeedbackItem>>> entry : futures.entrySet()) {
            SourceCollector collector = entry.getKey();
            try {
                List<FeedbackItem> items = entry.getValue().join();
                List<FeedbackItem> accepted = accept(collector, items);
                log.info("Source '{}' returned {} items", collector.name(), accepted.size());
                fetched.addAll(accepted);
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Source '{}' failed, contributing no items: {}", collector.name(), cause.getMessage());
                if (!failedSources.contains(collector.sourceType())) {
                    failedSources.add(collector.sourceType());
                }
                Counter.builder("feedback.sync.source.failures")
                        .tag("source", collector.sourceType().getValue())
                        .register(meterRegistry)
                        .increment();
            }
            listener.onProgress(SyncStage.FETCH, ++done, active.size());
        }
        return fetched;
    }

    private static List<FeedbackItem> accept(SourceCollector collector, List<FeedbackItem> items) {
        if (items == null) {
            return List.of();
        }
        List<FeedbackItem> accepted = new ArrayList<>(items.size());
        for (FeedbackItem item : items) {
            if (item == null) {
                log.warn("Source '{}' returned a null item, skipping", collector.name());
                continue;
            }
            if (item.getPublishedAt() == null) {
                log.warn("Source '{}' returned item {} without publishedAt, skipping", collector.name(), item.getId());
                continue;
            }
            if (item.getSourceType() == null) {
                item.setSourceType(collector.sourceType());
            }
            accepted.add(item);
        }
        return accepted;
    }

    /**
     * Re-fetched items older than the baseline window still have a stored record with analysis.
     * They are looked up by id so the merge does not treat them as new.
     */
    private List<FeedbackItem> withStoredOutsideWindow(List<FeedbackItem> fresh, List<FeedbackItem> baseline) {
        Set<String> known = baseline.stream().map(FeedbackItem::getId).collect(Collectors.toSet());
        List<String> missing = fresh.stream()
                .map(FeedbackItem::getId)
                .filter(id -> !known.contains(id))
                .toList();
        if (missing.isEmpty()) {
            return baseline;
        }
        List<FeedbackItem> stored = sharedStore.loadItemsByIds(missing);
        if (stored.isEmpty()) {
            return baseline;
        }
        log.info("{} re-fetched items are outside the baseline window, loaded by id", stored.size());
        List<FeedbackItem> extended = new ArrayList<>(baseline);
        extended.addAll(stored);
        return extended;
    }

    /**
     * Watermark per source type = max publishedAt among its items in the final set.
     * A type without surviving items keeps its previous watermark.
     */
    SyncState computeSyncState(List<FeedbackItem> finalItems, SyncState previousState) {
        Map<SourceType, Instant> newest = finalItems.stream()
                .filter(item -> item.getSourceType() != null && item.getPublishedAt() != null)
                .collect(Collectors.toMap(FeedbackItem::getSourceType, FeedbackItem::getPublishedAt,
                        (left, right) -> left.isAfter(right) ? left : right));

        SyncState state = new SyncState();
        for (SourceType type : SourceType.values()) {
            Instant watermark = newest.get(type);
            if (watermark == null && previousState != null) {
                watermark = previousState.getWatermark(type);
            }
            state.setWatermark(type, watermark);
        }
        state.setLastSync(clock.instant());
        return state;
    }

    private void recordBatchFailures(SyncStage stage, int failedBatches) {
        if (failedBatches > 0) {
            Counter.builder("feedback.sync.batch.failures")
                    .tag("stage", stage.name().toLowerCase())
                    .register(meterRegistry)
                    .increment(failedBatches);
        }
    }

    private static Set<SourceType> parseSourceTypes(String value) {
        Set<SourceType> types = Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(token -> !token.isEmpty())
                .map(SourceType::fromValue)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(SourceType.class)));
        return types.isEmpty() ? EnumSet.allOf(SourceType.class) : types;
    }
}
