package net.shelfwatch.controller;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import net.shelfwatch.application.ledger.IssueLedger;
import net.shelfwatch.application.ledger.IssueNotFoundException;
import net.shelfwatch.application.ledger.IssueStateException;
import net.shelfwatch.application.scan.PageNotFoundException;
import net.shelfwatch.application.scan.ScanTriggerService;
import net.shelfwatch.application.scan.SweepSummary;
import net.shelfwatch.application.scan.TriggerResult;
import net.shelfwatch.domain.issue.Issue;
import net.shelfwatch.domain.scan.ScanDepth;
import net.shelfwatch.scheduler.ScanSweepScheduler;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Operator endpoints for triggering scans and managing issue state.
 */
@RestController
@RequestMapping(value = "/admin", produces = MediaType.APPLICATION_JSON_VALUE)
@Slf4j
public class ScanAdminController {

    private final ScanTriggerService scanTriggerService;
    private final ScanSweepScheduler scanSweepScheduler;
    private final IssueLedger issueLedger;

    public ScanAdminController(ScanTriggerService scanTriggerService,
                               ScanSweepScheduler scanSweepScheduler,
                               IssueLedger issueLedger) {
        this.scanTriggerService = scanTriggerService;
        this.scanSweepScheduler = scanSweepScheduler;
        this.issueLedger = issueLedger;
    }

    /**
     * Enqueues a scan of one page. Returns 202 when enqueued and 200 with the skip reason otherwise.
     */
    @PostMapping("/pages/{pageId}/scans")
    public ResponseEntity<TriggerResponse> triggerScan(@PathVariable("pageId") UUID pageId,
                                                       @RequestParam(name = "depth", required = false) String depth) {
        ScanDepth forcedDepth = parseDepth(depth);
        try {
            TriggerResult result = scanTriggerService.triggerScan(pageId, forcedDepth);
            TriggerResponse body = new TriggerResponse(pageId, result.enqueued(),
                result.skipReason() == null ? null : result.skipReason().name());
            return ResponseEntity.status(result.enqueued() ? HttpStatus.ACCEPTED : HttpStatus.OK).body(body);
        } catch (PageNotFoundException notFound) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, notFound.getMessage(), notFound);
        }
    }

    @PostMapping("/scans/sweep")
    public ResponseEntity<SweepSummary> triggerSweep() {
        SweepSummary summary = scanSweepScheduler.forceRunSweep();
        log.info("Manual sweep enqueued {} page(s)", summary.pagesEnqueued());
        return ResponseEntity.ok(summary);
    }

    @PostMapping("/issues/{issueId}/acknowledge")
    public ResponseEntity<IssueResponse> acknowledge(@PathVariable("issueId") UUID issueId,
                                                     @RequestParam(name = "by", required = false) String acknowledgedBy) {
        try {
            return ResponseEntity.ok(IssueResponse.from(issueLedger.acknowledge(issueId, acknowledgedBy)));
        } catch (IssueNotFoundException notFound) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, notFound.getMessage(), notFound);
        } catch (IssueStateException conflict) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, conflict.getMessage(), conflict);
        }
    }

    @PostMapping("/issues/{issueId}/reopen")
    public ResponseEntity<IssueResponse> reopen(@PathVariable("issueId") UUID issueId) {
        try {
            return ResponseEntity.ok(IssueResponse.from(issueLedger.reopen(issueId)));
        } catch (IssueNotFoundException notFound) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, notFound.getMessage(), notFound);
        } catch (IssueStateException conflict) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, conflict.getMessage(), conflict);
        }
    }

    private static ScanDepth parseDepth(String depth) {
        if (!StringUtils.hasText(depth)) {
            return null;
        }
        try {
            return ScanDepth.fromParameter(depth);
        } catch (IllegalArgumentException invalid) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown scan depth: " + depth, invalid);
        }
    }

    public record TriggerResponse(UUID pageId, boolean enqueued, @Nullable String skipReason) {}

    public record IssueResponse(UUID id,
                                UUID pageId,
                                String type,
                                String severity,
                                String status,
                                int occurrenceCount,
                                @Nullable Instant acknowledgedAt,
                                @Nullable String acknowledgedBy) {

        static IssueResponse from(Issue issue) {
            return new IssueResponse(issue.id(), issue.pageId(), issue.type().code(), issue.severity().name(),
                issue.status().name(), issue.occurrenceCount(), issue.acknowledgedAt(), issue.acknowledgedBy());
        }
    }
}
