package net.shelfwatch.application.alert;

import net.shelfwatch.domain.issue.Issue;
import net.shelfwatch.domain.issue.IssueSeverity;
import net.shelfwatch.domain.issue.IssueStatus;

/**
 * Alert-worthiness rule.
 */
public final class AlertPolicy {

    static final int CONFIRMING_OCCURRENCES = 2;

    private AlertPolicy() {
    }

    /**
     * Open, high severity, not yet alerted, and either AI-confirmed or seen at least twice.
     */
    public static boolean shouldAlert(IssueStatus status,
                                      IssueSeverity severity,
                                      boolean alreadyAlerted,
                                      boolean aiConfirmed,
                                      int occurrenceCount) {
        return status == IssueStatus.OPEN
            && severity == IssueSeverity.HIGH
            && !alreadyAlerted
            && (aiConfirmed || occurrenceCount >= CONFIRMING_OCCURRENCES);
    }

    public static boolean shouldAlert(Issue issue, boolean alreadyAlerted) {
        return shouldAlert(issue.status(), issue.severity(), alreadyAlerted, issue.isAiConfirmed(),
            issue.occurrenceCount());
    }
}
