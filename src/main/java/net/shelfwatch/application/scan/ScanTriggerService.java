package net.shelfwatch.application.scan;

import jakarta.annotation.Nullable;
import java.util.Optional;
import java.util.UUID;
import net.shelfwatch.domain.scan.MonitoredPage;
import net.shelfwatch.domain.scan.ScanDepth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for on-demand scans.
 */
@Service
public class ScanTriggerService {

    private static final Logger log = LoggerFactory.getLogger(ScanTriggerService.class);

    private final ScanOrchestrator orchestrator;
    private final ScanTaskQueue queue;

    public ScanTriggerService(ScanOrchestrator orchestrator, ScanTaskQueue queue) {
        this.orchestrator = orchestrator;
        this.queue = queue;
    }

    /**
     * Enqueues a scan unless the page is ineligible, queued or in flight.
     *
     * @throws PageNotFoundException when the page is missing or soft-deleted
     */
    public TriggerResult triggerScan(UUID pageId, @Nullable ScanDepth forcedDepth) {
        MonitoredPage page = orchestrator.loadPage(pageId);
        Optional<SkipReason> ineligible = orchestrator.checkEligibility(page);
        if (ineligible.isPresent()) {
            log.info("Scan trigger for pageId={} skipped: {}", pageId, ineligible.get());
            return TriggerResult.skipped(pageId, ineligible.get());
        }
        return queue.submit(pageId, forcedDepth);
    }
}
