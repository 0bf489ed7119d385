package net.shelfwatch.application.scan;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.Nullable;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import net.shelfwatch.domain.scan.MonitoredPage;
import net.shelfwatch.domain.scan.MonitoredPageStore;
import net.shelfwatch.domain.scan.PageHealth;
import net.shelfwatch.domain.scan.PageVisibility;
import net.shelfwatch.domain.scan.ScanDepth;
import net.shelfwatch.domain.scan.ScanEngine;
import net.shelfwatch.domain.scan.ScanEngineResult;
import net.shelfwatch.domain.scan.ScanRequest;
import net.shelfwatch.domain.scan.ScanRun;
import net.shelfwatch.domain.scan.ScanRunStore;
import net.shelfwatch.domain.tenant.MonitoringEntitlement;
import net.shelfwatch.domain.tenant.Tenant;
import net.shelfwatch.domain.tenant.TenantDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one scan of one page end to end.
 *
 * <p>Ineligible pages are skipped silently. The page is held in {@link PageScanGuard} for the
 * whole run, so concurrent triggers for the same page produce a single scan run.</p>
 */
@Service
public class ScanOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ScanOrchestrator.class);

    private final MonitoredPageStore pageStore;
    private final TenantDirectory tenantDirectory;
    private final MonitoringEntitlement entitlement;
    private final ScanRunStore scanRunStore;
    private final ScanEngine scanEngine;
    private final ScanDepthPolicy depthPolicy;
    private final ScanPipeline pipeline;
    private final PageScanGuard guard;
    private final Clock clock;
    private final Counter scansCompleted;
    private final Counter scansFailed;
    private final Counter scansSkipped;

    public ScanOrchestrator(MonitoredPageStore pageStore,
                            TenantDirectory tenantDirectory,
                            MonitoringEntitlement entitlement,
                            ScanRunStore scanRunStore,
                            ScanEngine scanEngine,
                            ScanDepthPolicy depthPolicy,
                            ScanPipeline pipeline,
                            PageScanGuard guard,
                            Clock clock,
                            MeterRegistry meterRegistry) {
        this.pageStore = pageStore;
        this.tenantDirectory = tenantDirectory;
        this.entitlement = entitlement;
        this.scanRunStore = scanRunStore;
        this.scanEngine = scanEngine;
        this.depthPolicy = depthPolicy;
        this.pipeline = pipeline;
        this.guard = guard;
        this.clock = clock;
        this.scansCompleted = Counter.builder("shelfwatch.scan.completed")
            .description("Scan runs that completed and were processed")
            .register(meterRegistry);
        this.scansFailed = Counter.builder("shelfwatch.scan.failed")
            .description("Scan runs the engine could not complete")
            .register(meterRegistry);
        this.scansSkipped = Counter.builder("shelfwatch.scan.skipped")
            .description("Scan executions skipped for eligibility or concurrency")
            .register(meterRegistry);
    }

    /**
     * Scans a page.
     *
     * @param forcedDepth depth override, or {@code null} to let {@link ScanDepthPolicy} decide
     * @throws PageNotFoundException when the page is missing or soft-deleted
     * @throws ScanEngineException when the engine fails; the run is recorded as failed first
     */
    public ScanExecution execute(UUID pageId, @Nullable ScanDepth forcedDepth) {
        MonitoredPage page = loadPage(pageId);
        Tenant tenant = tenantDirectory.findById(page.tenantId())
            .orElseThrow(() -> new PageNotFoundException(pageId));

        Optional<SkipReason> ineligible = checkEligibility(page);
        if (ineligible.isPresent()) {
            log.info("Skipping scan of pageId={}: {}", pageId, ineligible.get());
            scansSkipped.increment();
            return ScanExecution.skipped(ineligible.get());
        }

        if (!guard.tryAcquire(pageId)) {
            log.info("Skipping scan of pageId={}: another scan is in flight", pageId);
            scansSkipped.increment();
            return ScanExecution.skipped(SkipReason.ALREADY_RUNNING);
        }
        try {
            return runScan(tenant, page, forcedDepth);
        } finally {
            guard.release(pageId);
        }
    }

    /**
     * Loads a scannable page.
     *
     * @throws PageNotFoundException when the page is missing or soft-deleted
     */
    public MonitoredPage loadPage(UUID pageId) {
        return pageStore.findById(pageId, PageVisibility.ACTIVE)
            .orElseThrow(() -> new PageNotFoundException(pageId));
    }

    /**
     * Reason the page may not be scanned right now, if any.
     */
    public Optional<SkipReason> checkEligibility(MonitoredPage page) {
        if (!entitlement.isMonitoringAllowed(page.tenantId())) {
            return Optional.of(SkipReason.TENANT_NOT_ENTITLED);
        }
        if (!page.monitoringEnabled()) {
            return Optional.of(SkipReason.MONITORING_DISABLED);
        }
        return Optional.empty();
    }

    private ScanExecution runScan(Tenant tenant, MonitoredPage page, @Nullable ScanDepth forcedDepth) {
        ScanDepth depth = depthPolicy.decide(page, forcedDepth);
        ScanRun scanRun = scanRunStore.create(page.id(), depth);
        scanRun = scanRunStore.save(scanRun.running(clock.instant()));
        log.info("Scan run {} started for pageId={} (depth={})", scanRun.id(), page.id(), depth);

        ScanEngineResult result;
        Throwable engineCause = null;
        try {
            result = scanEngine.run(new ScanRequest(page.id(), page.resolveUrl(tenant.storefrontBaseUrl()), depth));
        } catch (RuntimeException ex) {
            engineCause = ex;
            result = ScanEngineResult.failure(ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
        }

        if (!result.success()) {
            String message = result.error() == null ? "Scan engine reported failure" : result.error();
            scanRunStore.save(scanRun.failed(message, clock.instant()));
            pageStore.markScanned(page.id(), clock.instant());
            pageStore.updateHealth(page.id(), PageHealth.ERROR);
            scansFailed.increment();
            log.warn("Scan run {} failed for pageId={}: {}", scanRun.id(), page.id(), message);
            throw new ScanEngineException(page.id(), message, engineCause);
        }

        scanRun = scanRunStore.save(scanRun.completed(result, clock.instant()));
        pageStore.markScanned(page.id(), clock.instant());

        ScanReport report = pipeline.process(tenant, page, scanRun);
        scansCompleted.increment();
        log.info("Scan run {} completed for pageId={}: {} issue(s), {} resolved, {} alert(s), rescan={}, health={}",
            scanRun.id(), page.id(), report.issues().size(), report.resolved().size(), report.alertsSent(),
            report.rescanScheduled(), report.health());
        return ScanExecution.completed(report);
    }
}
