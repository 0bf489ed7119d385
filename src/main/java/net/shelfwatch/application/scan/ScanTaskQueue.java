package net.shelfwatch.application.scan;

import io.github.resilience4j.retry.Retry;
import jakarta.annotation.Nullable;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import net.shelfwatch.application.rescan.RescanRequester;
import net.shelfwatch.config.ScanProperties;
import net.shelfwatch.domain.scan.ScanDepth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * In-memory job queue for page scans.
 *
 * <p>A page is queued at most once at a time; a second trigger while it waits or runs is
 * answered with a skip. Each job retries engine failures through {@code scanJobRetry} and
 * drops jobs for missing pages without retrying.</p>
 */
@Service
public class ScanTaskQueue implements RescanRequester {

    private static final Logger log = LoggerFactory.getLogger(ScanTaskQueue.class);

    private final ScanOrchestrator orchestrator;
    private final PageScanGuard guard;
    private final Retry scanJobRetry;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final ExecutorService executorService;
    private final Set<UUID> pending = ConcurrentHashMap.newKeySet();

    @Autowired
    public ScanTaskQueue(ScanOrchestrator orchestrator,
                         PageScanGuard guard,
                         Retry scanJobRetry,
                         TaskScheduler taskScheduler,
                         Clock clock,
                         ScanProperties properties) {
        this(orchestrator, guard, scanJobRetry, taskScheduler, clock, newWorkerPool(properties.getWorkerThreads()));
    }

    ScanTaskQueue(ScanOrchestrator orchestrator,
                  PageScanGuard guard,
                  Retry scanJobRetry,
                  TaskScheduler taskScheduler,
                  Clock clock,
                  ExecutorService executorService) {
        this.orchestrator = orchestrator;
        this.guard = guard;
        this.scanJobRetry = scanJobRetry;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.executorService = executorService;
    }

    /**
     * Enqueues a scan job for the page.
     */
    public TriggerResult submit(UUID pageId, @Nullable ScanDepth forcedDepth) {
        if (guard.isRunning(pageId)) {
            return TriggerResult.skipped(pageId, SkipReason.ALREADY_RUNNING);
        }
        if (!pending.add(pageId)) {
            return TriggerResult.skipped(pageId, SkipReason.ALREADY_QUEUED);
        }
        try {
            executorService.execute(() -> runJob(pageId, forcedDepth));
        } catch (RejectedExecutionException rejected) {
            pending.remove(pageId);
            throw rejected;
        }
        log.debug("Scan job enqueued for pageId={} (forcedDepth={})", pageId, forcedDepth);
        return TriggerResult.enqueued(pageId);
    }

    @Override
    public void scheduleRescan(UUID pageId, Duration delay) {
        taskScheduler.schedule(() -> {
            TriggerResult result = submit(pageId, null);
            if (!result.enqueued()) {
                log.info("Confirmation rescan of pageId={} skipped: {}", pageId, result.skipReason());
            }
        }, clock.instant().plus(delay));
    }

    public boolean isPending(UUID pageId) {
        return pending.contains(pageId);
    }

    public int pendingCount() {
        return pending.size();
    }

    void runJob(UUID pageId, @Nullable ScanDepth forcedDepth) {
        try {
            ScanExecution execution = scanJobRetry.executeSupplier(() -> orchestrator.execute(pageId, forcedDepth));
            if (execution.isSkipped()) {
                log.debug("Scan job for pageId={} finished without scanning: {}", pageId, execution.skipReason());
            }
        } catch (PageNotFoundException notFound) {
            log.info("Discarding scan job: {}", notFound.getMessage());
        } catch (ScanEngineException engineFailure) {
            log.error("Scan job for pageId={} gave up after retries: {}", pageId, engineFailure.getMessage());
        } catch (RuntimeException unexpected) {
            log.error("Scan job for pageId={} failed", pageId, unexpected);
        } finally {
            pending.remove(pageId);
        }
    }

    @PreDestroy
    void shutdown() {
        executorService.shutdownNow();
    }

    private static ExecutorService newWorkerPool(int workerThreads) {
        AtomicInteger sequence = new AtomicInteger();
        return Executors.newFixedThreadPool(workerThreads, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("scan-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
