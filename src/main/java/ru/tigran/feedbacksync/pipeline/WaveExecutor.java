package ru.tigran.feedbacksync.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import ru.tigran.feedbacksync.exception.BatchProcessingException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.function.Function;

/**
 * Выполнение батчей волнами ограниченной ширины.
 *
 * В волне запускается до waveWidth вызовов параллельно; результаты забираются в порядке
 * завершения и передаются обработчику в вызывающем потоке. Следующая волна стартует только
 * после того, как все батчи текущей завершены и обработаны.
 */
@Slf4j
@Component
public class WaveExecutor {

    /**
     * Invoked on the calling thread for every batch as soon as it completes.
     */
    @FunctionalInterface
    public interface BatchCompletionHandler<B, R> {
        void onBatchComplete(BatchOutcome<B, R> outcome);
    }

    /**
     * Wraps a batch call failure into the stage's exception type.
     */
    @FunctionalInterface
    public interface BatchFailureMapper<B> {
        BatchProcessingException toFailure(int batchIndex, B batch, RuntimeException cause);
    }

    public record WaveSummary(int totalBatches, int failedBatches, int waves) {
    }

    private final Executor executor;

    public WaveExecutor(@Qualifier("aiBatchExecutor") Executor executor) {
        this.executor = executor;
    }

    public static <T> List<List<T>> partition(List<T> items, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        List<List<T>> batches = new ArrayList<>();
        for (int from = 0; from < items.size(); from += batchSize) {
            batches.add(List.copyOf(items.subList(from, Math.min(from + batchSize, items.size()))));
        }
        return batches;
    }

    public <B, R> WaveSummary execute(
            String stage,
            List<B> batches,
            int waveWidth,
            Function<B, R> call,
            BatchFailureMapper<B> failureMapper,
            BatchCompletionHandler<B, R> handler
    ) {
        if (waveWidth <= 0) {
            throw new IllegalArgumentException("Wave width must be positive: " + waveWidth);
        }
        int failed = 0;
        int waves = 0;
        for (int waveStart = 0; waveStart < batches.size(); waveStart += waveWidth) {
            int waveEnd = Math.min(waveStart + waveWidth, batches.size());
            waves++;
            log.debug("{}: wave {} with batches {}..{} of {}", stage, waves, waveStart + 1, waveEnd, batches.size());

            CompletionService<BatchOutcome<B, R>> completionService = new ExecutorCompletionService<>(executor);
            for (int index = waveStart; index < waveEnd; index++) {
                int batchIndex = index;
                B batch = batches.get(index);
                completionService.submit(() -> runBatch(batchIndex, batch, call, failureMapper));
            }

            for (int completed = waveStart; completed < waveEnd; completed++) {
                BatchOutcome<B, R> outcome = takeNext(completionService, stage);
                if (!outcome.succeeded()) {
                    failed++;
                    log.warn("{} - continuing with remaining batches", outcome.failure().getMessage());
                }
                handler.onBatchComplete(outcome);
            }
        }
        return new WaveSummary(batches.size(), failed, waves);
    }

    private static <B, R> BatchOutcome<B, R> runBatch(int index, B batch, Function<B, R> call,
                                                      BatchFailureMapper<B> failureMapper) {
        try {
            return new BatchOutcome<>(index, batch, call.apply(batch), null);
        } catch (RuntimeException e) {
            return new BatchOutcome<>(index, batch, null, failureMapper.toFailure(index, batch, e));
        }
    }

    private static <B, R> BatchOutcome<B, R> takeNext(CompletionService<BatchOutcome<B, R>> completionService,
                                                      String stage) {
        try {
            return completionService.take().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + stage + " batch", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException(stage + " batch task failed unexpectedly", e.getCause());
        }
    }
}
