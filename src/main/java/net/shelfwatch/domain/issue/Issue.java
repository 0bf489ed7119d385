package net.shelfwatch.domain.issue;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Durable record of a defect on a monitored page.
 *
 * <p>At most one active (open or acknowledged) issue exists per page and type.</p>
 */
public record Issue(
    UUID id,
    UUID pageId,
    UUID scanRunId,
    IssueType type,
    IssueSeverity severity,
    IssueStatus status,
    String title,
    String description,
    Map<String, Object> evidence,
    int occurrenceCount,
    Instant firstDetectedAt,
    Instant lastDetectedAt,
    @Nullable Instant acknowledgedAt,
    @Nullable String acknowledgedBy,
    AiAnnotation ai
) {

    public Issue {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(pageId, "pageId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        status = status == null ? IssueStatus.OPEN : status;
        if (occurrenceCount < 1) {
            throw new IllegalArgumentException("occurrenceCount must be at least 1 but was " + occurrenceCount);
        }
        evidence = evidence == null ? Map.of() : Map.copyOf(evidence);
        ai = ai == null ? AiAnnotation.empty() : ai;
    }

    /**
     * Opens a new issue from a first observation.
     */
    public static Issue open(UUID id, UUID pageId, UUID scanRunId, IssueCandidate candidate, Instant now) {
        return new Issue(id, pageId, scanRunId, candidate.type(), candidate.severity(), IssueStatus.OPEN,
            candidate.title(), candidate.description(), candidate.evidence(), 1, now, now, null, null,
            AiAnnotation.empty());
    }

    public boolean isActive() {
        return status.isActive();
    }

    public boolean isOpen() {
        return status == IssueStatus.OPEN;
    }

    public boolean isAiConfirmed() {
        return ai.isConfirmed();
    }

    /**
     * Same severity or higher: new observation replaces copy and evidence and bumps the counter.
     * Escalations also drop the AI annotation since it described the weaker finding.
     */
    public Issue observedAgain(UUID byScanRunId, IssueCandidate candidate, Instant now, boolean clearAi) {
        return new Issue(id, pageId, byScanRunId, type, candidate.severity(), status, candidate.title(),
            candidate.description(), candidate.evidence(), occurrenceCount + 1, firstDetectedAt, now,
            acknowledgedAt, acknowledgedBy, clearAi ? AiAnnotation.empty() : ai);
    }

    public Issue resolved(UUID byScanRunId) {
        return new Issue(id, pageId, byScanRunId, type, severity, IssueStatus.RESOLVED, title, description,
            evidence, occurrenceCount, firstDetectedAt, lastDetectedAt, acknowledgedAt, acknowledgedBy, ai);
    }

    public Issue acknowledged(String by, Instant at) {
        return new Issue(id, pageId, scanRunId, type, severity, IssueStatus.ACKNOWLEDGED, title, description,
            evidence, occurrenceCount, firstDetectedAt, lastDetectedAt, at, by, ai);
    }

    public Issue reopened() {
        return new Issue(id, pageId, scanRunId, type, severity, IssueStatus.OPEN, title, description,
            evidence, occurrenceCount, firstDetectedAt, lastDetectedAt, null, null, ai);
    }

    public Issue withAi(AiAnnotation annotation) {
        return new Issue(id, pageId, scanRunId, type, severity, status, title, description, evidence,
            occurrenceCount, firstDetectedAt, lastDetectedAt, acknowledgedAt, acknowledgedBy, annotation);
    }
}
