package net.shelfwatch.application.scan;

import java.util.ArrayList;
import java.util.List;
import net.shelfwatch.application.ai.AiEnrichmentService;
import net.shelfwatch.application.alert.AlertGatekeeper;
import net.shelfwatch.application.detection.ClassificationResult;
import net.shelfwatch.application.detection.DetectionClassifier;
import net.shelfwatch.application.detection.RawSignalInspector;
import net.shelfwatch.application.ledger.IssueLedger;
import net.shelfwatch.application.ledger.LedgerPass;
import net.shelfwatch.application.rescan.RescanScheduler;
import net.shelfwatch.domain.issue.Issue;
import net.shelfwatch.domain.issue.IssueStepOutcome;
import net.shelfwatch.domain.issue.IssueStore;
import net.shelfwatch.domain.scan.MonitoredPage;
import net.shelfwatch.domain.scan.MonitoredPageStore;
import net.shelfwatch.domain.scan.PageHealth;
import net.shelfwatch.domain.scan.RawFinding;
import net.shelfwatch.domain.scan.ScanRun;
import net.shelfwatch.domain.tenant.Tenant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Post-scan processing: classify, merge into the ledger, AI review, alert, rescan.
 *
 * <p>AI and alert steps are fail-open per issue; their results land in {@link ScanReport#outcomes()}.</p>
 */
@Service
public class ScanPipeline {

    private static final Logger log = LoggerFactory.getLogger(ScanPipeline.class);

    private final RawSignalInspector rawSignalInspector;
    private final DetectionClassifier classifier;
    private final IssueLedger ledger;
    private final AiEnrichmentService aiEnrichmentService;
    private final AlertGatekeeper alertGatekeeper;
    private final RescanScheduler rescanScheduler;
    private final IssueStore issueStore;
    private final MonitoredPageStore pageStore;

    public ScanPipeline(RawSignalInspector rawSignalInspector,
                        DetectionClassifier classifier,
                        IssueLedger ledger,
                        AiEnrichmentService aiEnrichmentService,
                        AlertGatekeeper alertGatekeeper,
                        RescanScheduler rescanScheduler,
                        IssueStore issueStore,
                        MonitoredPageStore pageStore) {
        this.rawSignalInspector = rawSignalInspector;
        this.classifier = classifier;
        this.ledger = ledger;
        this.aiEnrichmentService = aiEnrichmentService;
        this.alertGatekeeper = alertGatekeeper;
        this.rescanScheduler = rescanScheduler;
        this.issueStore = issueStore;
        this.pageStore = pageStore;
    }

    /**
     * Processes a completed scan run. Callers check tenant entitlement before the run starts.
     */
    public ScanReport process(Tenant tenant, MonitoredPage page, ScanRun scanRun) {
        List<RawFinding> findings = new ArrayList<>(scanRun.findings());
        findings.addAll(rawSignalInspector.inspect(scanRun.signals(), scanRun.findings()));

        ClassificationResult classification = classifier.classify(scanRun.id(), findings);
        LedgerPass pass = ledger.merge(page.id(), scanRun.id(), classification);
        log.info("Scan run {} produced {} candidate(s); ledger touched {} and resolved {} issue(s) (pageId={})",
            scanRun.id(), classification.candidates().size(), pass.touched().size(), pass.resolved().size(), page.id());

        AiEnrichmentService.Enrichment enrichment =
            aiEnrichmentService.enrich(tenant, page, scanRun, pass.touched());
        List<IssueStepOutcome> outcomes = new ArrayList<>(enrichment.outcomes());

        List<Issue> finalIssues = new ArrayList<>();
        for (Issue enriched : enrichment.issues()) {
            Issue current = issueStore.findById(enriched.id()).orElse(enriched);
            finalIssues.add(current);
            try {
                outcomes.addAll(alertGatekeeper.evaluate(tenant, page, current));
            } catch (RuntimeException ex) {
                log.error("Alert evaluation failed for issueId={} (pageId={}): {}", current.id(), page.id(), ex.getMessage(), ex);
                outcomes.add(IssueStepOutcome.failed(current.id(), IssueStepOutcome.Step.ALERT_EMAIL,
                    ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage()));
            }
        }

        boolean rescanScheduled = rescanScheduler.scheduleIfNeeded(page.id(), finalIssues);

        PageHealth health = ledger.healthOf(page.id());
        pageStore.updateHealth(page.id(), health);

        return new ScanReport(scanRun.id(), page.id(), finalIssues, pass.resolved(), outcomes, rescanScheduled, health);
    }
}
