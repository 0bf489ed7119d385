package net.shelfwatch.application.ledger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import net.shelfwatch.application.detection.ClassificationResult;
import net.shelfwatch.domain.issue.Issue;
import net.shelfwatch.domain.issue.IssueCandidate;
import net.shelfwatch.domain.issue.IssueSeverity;
import net.shelfwatch.domain.issue.IssueStatus;
import net.shelfwatch.domain.issue.IssueStore;
import net.shelfwatch.domain.issue.IssueType;
import net.shelfwatch.domain.scan.PageHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Merges classified findings into the durable per-page issue ledger.
 *
 * <p>Keeps at most one active issue per (page, type). Merging is not idempotent:
 * every observation increments the occurrence count.</p>
 */
@Service
public class IssueLedger {

    private static final Logger log = LoggerFactory.getLogger(IssueLedger.class);

    private final IssueStore issueStore;
    private final Clock clock;

    public IssueLedger(IssueStore issueStore, Clock clock) {
        this.issueStore = issueStore;
        this.clock = clock;
    }

    /**
     * Applies one pass of candidates and resolve signals to a page's issues.
     */
    @Transactional
    public LedgerPass merge(UUID pageId, UUID scanRunId, ClassificationResult classification) {
        Instant now = clock.instant();
        List<Issue> touched = new ArrayList<>();
        List<Issue> resolved = new ArrayList<>();
        Map<UUID, MergeAction> actions = new LinkedHashMap<>();

        for (IssueCandidate candidate : classification.candidates()) {
            Optional<Issue> active = issueStore.findActive(pageId, candidate.type());
            if (active.isEmpty()) {
                Issue created = issueStore.save(Issue.open(UUID.randomUUID(), pageId, scanRunId, candidate, now));
                record(touched, actions, created, MergeAction.CREATED);
                continue;
            }

            Issue existing = active.get();
            if (candidate.severity().outranks(existing.severity())) {
                Issue escalated = issueStore.save(existing.observedAgain(scanRunId, candidate, now, true));
                log.info("Escalated issue {} ({}) from {} to {} (pageId={})",
                    existing.id(), existing.type(), existing.severity(), candidate.severity(), pageId);
                record(touched, actions, escalated, MergeAction.ESCALATED);
            } else if (existing.severity().outranks(candidate.severity())) {
                Issue retired = issueStore.save(existing.resolved(scanRunId));
                resolved.add(retired);
                actions.put(retired.id(), MergeAction.DE_ESCALATED);
                Issue replacement = issueStore.save(Issue.open(UUID.randomUUID(), pageId, scanRunId, candidate, now));
                log.info("De-escalated issue {} ({}) from {} to {}; replaced by {} (pageId={})",
                    existing.id(), existing.type(), existing.severity(), candidate.severity(), replacement.id(), pageId);
                record(touched, actions, replacement, MergeAction.CREATED);
            } else {
                Issue refreshed = issueStore.save(existing.observedAgain(scanRunId, candidate, now, false));
                record(touched, actions, refreshed, MergeAction.REFRESHED);
            }
        }

        for (IssueType passedType : classification.passedTypes()) {
            issueStore.findActive(pageId, passedType).ifPresent(existing -> {
                Issue closed = issueStore.save(existing.resolved(scanRunId));
                resolved.add(closed);
                actions.put(closed.id(), MergeAction.RESOLVED);
                log.info("Resolved issue {} ({}) after passing check (pageId={})", closed.id(), passedType, pageId);
            });
        }

        return new LedgerPass(touched, resolved, actions);
    }

    /**
     * Marks an open issue as seen by the merchant. It keeps receiving merge updates.
     */
    @Transactional
    public Issue acknowledge(UUID issueId, String acknowledgedBy) {
        Issue issue = issueStore.findById(issueId).orElseThrow(() -> new IssueNotFoundException(issueId));
        if (issue.status() != IssueStatus.OPEN) {
            throw new IssueStateException(issueId,
                "Only open issues can be acknowledged; issue %s is %s".formatted(issueId, issue.status()));
        }
        String by = acknowledgedBy == null || acknowledgedBy.isBlank() ? "merchant" : acknowledgedBy.trim();
        return issueStore.save(issue.acknowledged(by, clock.instant()));
    }

    /**
     * Returns a resolved or acknowledged issue to OPEN.
     */
    @Transactional
    public Issue reopen(UUID issueId) {
        Issue issue = issueStore.findById(issueId).orElseThrow(() -> new IssueNotFoundException(issueId));
        if (issue.status() == IssueStatus.OPEN) {
            throw new IssueStateException(issueId, "Issue %s is already open".formatted(issueId));
        }
        if (issue.status() == IssueStatus.RESOLVED) {
            Optional<Issue> active = issueStore.findActive(issue.pageId(), issue.type());
            if (active.isPresent()) {
                throw new IssueStateException(issueId,
                    "Issue %s cannot reopen: issue %s of type %s is already active on the page"
                        .formatted(issueId, active.get().id(), issue.type()));
            }
        }
        return issueStore.save(issue.reopened());
    }

    /**
     * Health derived from the page's open issues. Acknowledged issues no longer count against the page.
     */
    public PageHealth healthOf(UUID pageId) {
        List<Issue> open = issueStore.findActiveByPage(pageId).stream().filter(Issue::isOpen).toList();
        if (open.isEmpty()) {
            return PageHealth.HEALTHY;
        }
        boolean anyHigh = open.stream()
            .anyMatch(issue -> issue.severity() == IssueSeverity.HIGH);
        return anyHigh ? PageHealth.CRITICAL : PageHealth.WARNING;
    }

    private static void record(List<Issue> touched, Map<UUID, MergeAction> actions, Issue issue, MergeAction action) {
        touched.add(issue);
        actions.put(issue.id(), action);
    }
}
