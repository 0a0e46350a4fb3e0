package ru.tigran.feedbacksync.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import ru.tigran.feedbacksync.dto.SyncReport;
import ru.tigran.feedbacksync.exception.ApplicationException;
import ru.tigran.feedbacksync.exception.SyncInProgressException;
import ru.tigran.feedbacksync.pipeline.SyncOrchestrator;

/**
 * Периодический запуск синхронизации (app.sync.schedule.enabled=true).
 * Если цикл уже идёт (ручной запуск или предыдущий тик), тик пропускается.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.sync.schedule", name = "enabled", havingValue = "true")
public class ScheduledSyncRunner {

    private final SyncOrchestrator syncOrchestrator;

    public ScheduledSyncRunner(SyncOrchestrator syncOrchestrator) {
        this.syncOrchestrator = syncOrchestrator;
    }

    @Scheduled(
            initialDelayString = "${app.sync.schedule.initial-delay-ms:60000}",
            fixedDelayString = "${app.sync.schedule.interval-ms:1800000}"
    )
    public void runScheduledSync() {
        try {
            SyncReport report = syncOrchestrator.sync();
            log.info("Scheduled sync done: {} new of {} fetched, {} total",
                    report.newItems(), report.fetchedItems(), report.totalItems());
        } catch (SyncInProgressException e) {
            log.info("Scheduled sync skipped: {}", e.getMessage());
        } catch (ApplicationException e) {
            log.error("Scheduled sync failed [{}]: {}", e.getErrorCode(), e.getMessage());
        }
    }
}
