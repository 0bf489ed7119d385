package net.shelfwatch.domain.issue;

import java.util.Map;
import java.util.Objects;
import net.shelfwatch.domain.scan.CheckVerdict;

/**
 * Classified finding that the ledger may turn into or merge with an issue. Never persisted.
 */
public record IssueCandidate(
    IssueType type,
    IssueSeverity severity,
    double confidence,
    String title,
    String description,
    Map<String, Object> evidence,
    CheckVerdict verdict
) {

    public IssueCandidate {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        title = title == null || title.isBlank() ? type.defaultTitle() : title;
        description = description == null || description.isBlank() ? type.defaultDescription() : description;
        evidence = evidence == null ? Map.of() : Map.copyOf(evidence);
    }
}
