package net.shelfwatch.domain.scan;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One execution of the scan engine against a page.
 *
 * <p>Moves PENDING to RUNNING to COMPLETED or FAILED, then stays fixed apart from
 * the AI summary attached after the page-level analysis.</p>
 */
public record ScanRun(
    UUID id,
    UUID pageId,
    ScanDepth depth,
    ScanRunStatus status,
    @Nullable Instant startedAt,
    @Nullable Instant completedAt,
    ScanSignals signals,
    List<RawFinding> findings,
    @Nullable String errorMessage,
    @Nullable PageAnalysisSummary aiSummary
) {

    public ScanRun {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(pageId, "pageId must not be null");
        depth = depth == null ? ScanDepth.QUICK : depth;
        status = status == null ? ScanRunStatus.PENDING : status;
        signals = signals == null ? ScanSignals.empty() : signals;
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static ScanRun pending(UUID id, UUID pageId, ScanDepth depth) {
        return new ScanRun(id, pageId, depth, ScanRunStatus.PENDING, null, null, null, null, null, null);
    }

    public ScanRun running(Instant at) {
        requireStatus(ScanRunStatus.PENDING);
        return new ScanRun(id, pageId, depth, ScanRunStatus.RUNNING, at, null, signals, findings, null, aiSummary);
    }

    public ScanRun completed(ScanEngineResult result, Instant at) {
        requireStatus(ScanRunStatus.RUNNING);
        return new ScanRun(id, pageId, depth, ScanRunStatus.COMPLETED, startedAt, at,
            result.signals(), result.findings(), null, aiSummary);
    }

    public ScanRun failed(String message, Instant at) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Scan run " + id + " already finished with status " + status);
        }
        return new ScanRun(id, pageId, depth, ScanRunStatus.FAILED, startedAt, at, signals, findings, message, aiSummary);
    }

    public ScanRun withAiSummary(PageAnalysisSummary summary) {
        return new ScanRun(id, pageId, depth, status, startedAt, completedAt, signals, findings, errorMessage, summary);
    }

    @Nullable
    public Long durationMs() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }

    private void requireStatus(ScanRunStatus expected) {
        if (status != expected) {
            throw new IllegalStateException(
                "Scan run %s expected status %s but was %s".formatted(id, expected, status));
        }
    }
}
