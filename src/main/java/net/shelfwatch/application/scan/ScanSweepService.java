package net.shelfwatch.application.scan;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import net.shelfwatch.config.ScanProperties;
import net.shelfwatch.domain.scan.MonitoredPage;
import net.shelfwatch.domain.scan.MonitoredPageStore;
import net.shelfwatch.domain.scan.PageVisibility;
import net.shelfwatch.domain.tenant.MonitoringEntitlement;
import net.shelfwatch.domain.tenant.Tenant;
import net.shelfwatch.domain.tenant.TenantDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Enqueues every due page of every entitled tenant.
 */
@Service
public class ScanSweepService {

    private static final Logger log = LoggerFactory.getLogger(ScanSweepService.class);

    private final TenantDirectory tenantDirectory;
    private final MonitoringEntitlement entitlement;
    private final MonitoredPageStore pageStore;
    private final ScanTaskQueue queue;
    private final Clock clock;
    private final Duration refreshInterval;

    public ScanSweepService(TenantDirectory tenantDirectory,
                            MonitoringEntitlement entitlement,
                            MonitoredPageStore pageStore,
                            ScanTaskQueue queue,
                            Clock clock,
                            ScanProperties properties) {
        this.tenantDirectory = tenantDirectory;
        this.entitlement = entitlement;
        this.pageStore = pageStore;
        this.queue = queue;
        this.clock = clock;
        this.refreshInterval = properties.getRefreshInterval();
    }

    public SweepSummary triggerScheduledSweep() {
        Instant now = clock.instant();
        Instant dueBefore = now.minus(refreshInterval);
        int tenantsChecked = 0;
        int tenantsSkipped = 0;
        int enqueued = 0;
        int skipped = 0;

        for (Tenant tenant : tenantDirectory.findAll()) {
            tenantsChecked++;
            if (!entitlement.isMonitoringAllowed(tenant.id())) {
                tenantsSkipped++;
                continue;
            }
            List<MonitoredPage> duePages = pageStore.findDueForScan(tenant.id(), dueBefore, PageVisibility.ACTIVE);
            for (MonitoredPage page : duePages) {
                if (!page.monitoringEnabled() || !page.isDue(now, refreshInterval)) {
                    skipped++;
                    continue;
                }
                TriggerResult result = queue.submit(page.id(), null);
                if (result.enqueued()) {
                    enqueued++;
                } else {
                    skipped++;
                }
            }
        }

        log.info("Scheduled sweep checked {} tenant(s) ({} not entitled), enqueued {} page(s), skipped {}",
            tenantsChecked, tenantsSkipped, enqueued, skipped);
        return new SweepSummary(tenantsChecked, tenantsSkipped, enqueued, skipped);
    }
}
