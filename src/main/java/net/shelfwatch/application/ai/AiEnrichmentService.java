package net.shelfwatch.application.ai;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import net.shelfwatch.domain.issue.AiAnnotation;
import net.shelfwatch.domain.issue.Issue;
import net.shelfwatch.domain.issue.IssueCandidate;
import net.shelfwatch.domain.issue.IssueSeverity;
import net.shelfwatch.domain.issue.IssueStepOutcome;
import net.shelfwatch.domain.issue.IssueStore;
import net.shelfwatch.domain.issue.IssueType;
import net.shelfwatch.domain.scan.CheckVerdict;
import net.shelfwatch.domain.scan.MonitoredPage;
import net.shelfwatch.domain.scan.PageAnalysisSummary;
import net.shelfwatch.domain.scan.ScanRun;
import net.shelfwatch.domain.scan.ScanRunStore;
import net.shelfwatch.domain.scan.ScreenshotStore;
import net.shelfwatch.domain.tenant.Tenant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Applies AI review to the issues of one scan pass.
 *
 * <p>Fail-open: analyzer errors are logged and recorded as failed outcomes, and detector-driven
 * issues keep flowing to alerting.</p>
 */
@Service
public class AiEnrichmentService {

    private static final Logger log = LoggerFactory.getLogger(AiEnrichmentService.class);

    private final AiIssueAnalyzer analyzer;
    private final ScreenshotStore screenshotStore;
    private final IssueStore issueStore;
    private final ScanRunStore scanRunStore;
    private final Clock clock;

    public AiEnrichmentService(AiIssueAnalyzer analyzer,
                               ScreenshotStore screenshotStore,
                               IssueStore issueStore,
                               ScanRunStore scanRunStore,
                               Clock clock) {
        this.analyzer = analyzer;
        this.screenshotStore = screenshotStore;
        this.issueStore = issueStore;
        this.scanRunStore = scanRunStore;
        this.clock = clock;
    }

    /**
     * Runs the page-level review, then the per-issue review.
     *
     * @param touched issues the ledger created or updated during this pass
     * @return touched issues in their enriched state plus any AI-created issues
     */
    public Enrichment enrich(Tenant tenant, MonitoredPage page, ScanRun scanRun, List<Issue> touched) {
        List<IssueStepOutcome> outcomes = new ArrayList<>();
        byte[] screenshot = loadScreenshot(scanRun).orElse(null);

        Map<UUID, Issue> issues = new LinkedHashMap<>();
        touched.forEach(issue -> issues.put(issue.id(), issue));

        PageAnalysisSummary summary = null;
        if (analyzer.isAvailable() && screenshot != null) {
            summary = reviewPage(tenant, page, scanRun, screenshot, issues, outcomes);
        }

        for (Issue issue : List.copyOf(issues.values())) {
            if (issue.ai().isVerified()) {
                continue;
            }
            Issue reviewed = reviewIssue(tenant, page, issue, screenshot, outcomes);
            issues.put(reviewed.id(), reviewed);
        }

        return new Enrichment(List.copyOf(issues.values()), List.copyOf(outcomes), summary);
    }

    private PageAnalysisSummary reviewPage(Tenant tenant,
                                           MonitoredPage page,
                                           ScanRun scanRun,
                                           byte[] screenshot,
                                           Map<UUID, Issue> issues,
                                           List<IssueStepOutcome> outcomes) {
        PageAnalysis analysis;
        try {
            analysis = analyzer.analyzePage(new PageAnalysisRequest(page, tenant.shopDomain(), screenshot, scanRun.findings()));
        } catch (RuntimeException ex) {
            log.error("AI page review failed for pageId={} scanRunId={}: {}", page.id(), scanRun.id(), ex.getMessage(), ex);
            return null;
        }

        PageAnalysisSummary summary = null;
        if (StringUtils.hasText(analysis.summary())) {
            summary = new PageAnalysisSummary(analysis.summary(),
                Boolean.TRUE.equals(analysis.pageHealthy()), analysis.findings().size());
            scanRunStore.save(scanRun.withAiSummary(summary));
        }

        Instant now = clock.instant();
        for (PageFinding finding : analysis.findings()) {
            Optional<Issue> matching = issues.values().stream()
                .filter(issue -> issue.type() == finding.type() && issue.isActive())
                .findFirst();
            if (matching.isPresent()) {
                Issue confirmed = issueStore.save(matching.get().withAi(new AiAnnotation(
                    true, finding.confidence(), finding.description(), finding.explanation(),
                    finding.suggestedFix(), now)));
                issues.put(confirmed.id(), confirmed);
                outcomes.add(IssueStepOutcome.succeeded(confirmed.id(), IssueStepOutcome.Step.AI_PAGE_REVIEW,
                    "confirmed by page review"));
                log.info("AI page review confirmed {} issue {} (pageId={})", finding.type(), confirmed.id(), page.id());
            } else if (finding.newFinding()) {
                createDetectedIssue(page, scanRun, finding, now).ifPresent(created -> {
                    issues.put(created.id(), created);
                    outcomes.add(IssueStepOutcome.succeeded(created.id(), IssueStepOutcome.Step.AI_PAGE_REVIEW,
                        "created from page review"));
                });
            }
        }
        return summary;
    }

    private Optional<Issue> createDetectedIssue(MonitoredPage page, ScanRun scanRun, PageFinding finding, Instant now) {
        IssueType type = finding.type();
        if (issueStore.findActive(page.id(), type).isPresent()) {
            log.info("AI page review reported {} but an active issue already tracks it (pageId={})", type, page.id());
            return Optional.empty();
        }
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("ai_detected", true);
        evidence.put("ai_confidence", finding.confidence());
        evidence.put("scan_id", scanRun.id().toString());
        IssueCandidate candidate = new IssueCandidate(type, finding.severity(), finding.confidence(),
            type.defaultTitle(), finding.description(), evidence, CheckVerdict.FAIL);
        Issue issue = Issue.open(UUID.randomUUID(), page.id(), scanRun.id(), candidate, now)
            .withAi(new AiAnnotation(true, finding.confidence(), finding.description(), finding.explanation(),
                finding.suggestedFix(), now));
        Issue saved = issueStore.save(issue);
        log.info("AI page review created {} issue {} (severity={}, pageId={})", type, saved.id(), saved.severity(), page.id());
        return Optional.of(saved);
    }

    private Issue reviewIssue(Tenant tenant,
                              MonitoredPage page,
                              Issue issue,
                              byte[] screenshot,
                              List<IssueStepOutcome> outcomes) {
        boolean high = issue.severity() == IssueSeverity.HIGH;
        IssueAnalysis analysis = IssueAnalysis.none();
        if (analyzer.isAvailable()) {
            try {
                analysis = analyzer.analyzeIssue(
                    new IssueAnalysisRequest(page, tenant.shopDomain(), issue, high ? screenshot : null));
                outcomes.add(IssueStepOutcome.succeeded(issue.id(), IssueStepOutcome.Step.AI_ISSUE_REVIEW,
                    analysis.hasVerdict() ? "verdict=" + analysis.confirmed() : "explained"));
            } catch (RuntimeException ex) {
                log.error("AI review failed for issueId={} (pageId={}): {}", issue.id(), page.id(), ex.getMessage(), ex);
                outcomes.add(IssueStepOutcome.failed(issue.id(), IssueStepOutcome.Step.AI_ISSUE_REVIEW,
                    ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage()));
            }
        }

        AiAnnotation current = issue.ai();
        boolean changed = false;
        String explanation = current.explanation();
        String suggestedFix = current.suggestedFix();
        if (StringUtils.hasText(analysis.explanation())) {
            explanation = analysis.explanation();
            changed = true;
        }
        if (StringUtils.hasText(analysis.suggestedFix())) {
            suggestedFix = analysis.suggestedFix();
            changed = true;
        }

        Boolean confirmed = current.confirmed();
        Double confidence = current.confidence();
        String reasoning = current.reasoning();
        if (high && analysis.hasVerdict()) {
            confirmed = analysis.confirmed();
            confidence = analysis.confidence();
            reasoning = analysis.reasoning();
            changed = true;
        }

        if (!changed) {
            return issue;
        }
        return issueStore.save(issue.withAi(
            new AiAnnotation(confirmed, confidence, reasoning, explanation, suggestedFix, clock.instant())));
    }

    private Optional<byte[]> loadScreenshot(ScanRun scanRun) {
        String reference = scanRun.signals().screenshotRef();
        if (!StringUtils.hasText(reference)) {
            return Optional.empty();
        }
        try {
            return screenshotStore.load(reference);
        } catch (RuntimeException ex) {
            log.warn("Screenshot download failed for scanRunId={}: {}", scanRun.id(), ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Issues after enrichment, per-issue step outcomes and the stored page summary.
     */
    public record Enrichment(List<Issue> issues, List<IssueStepOutcome> outcomes, PageAnalysisSummary pageSummary) {
    }
}
