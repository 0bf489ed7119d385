package net.shelfwatch.application.ai;

import jakarta.annotation.Nullable;
import net.shelfwatch.domain.issue.IssueSeverity;
import net.shelfwatch.domain.issue.IssueType;

/**
 * One defect the AI reported from a page screenshot.
 *
 * @param newFinding true when no failing detector check produced this type
 */
public record PageFinding(
    IssueType type,
    IssueSeverity severity,
    double confidence,
    @Nullable String description,
    @Nullable String explanation,
    @Nullable String suggestedFix,
    boolean newFinding
) {
}
