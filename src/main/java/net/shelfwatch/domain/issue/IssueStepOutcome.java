package net.shelfwatch.domain.issue;

import java.util.UUID;

/**
 * Result of one fail-open pipeline step applied to one issue.
 */
public record IssueStepOutcome(UUID issueId, Step step, boolean success, String detail) {

    public enum Step {
        AI_PAGE_REVIEW,
        AI_ISSUE_REVIEW,
        ALERT_EMAIL,
        ALERT_ADMIN
    }

    public static IssueStepOutcome succeeded(UUID issueId, Step step, String detail) {
        return new IssueStepOutcome(issueId, step, true, detail);
    }

    public static IssueStepOutcome failed(UUID issueId, Step step, String detail) {
        return new IssueStepOutcome(issueId, step, false, detail);
    }
}
