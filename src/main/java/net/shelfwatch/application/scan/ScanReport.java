package net.shelfwatch.application.scan;

import java.util.List;
import java.util.UUID;
import net.shelfwatch.domain.issue.Issue;
import net.shelfwatch.domain.issue.IssueStepOutcome;
import net.shelfwatch.domain.scan.PageHealth;

/**
 * Summary of one completed scan pass.
 *
 * @param issues issues created or updated during the pass, in their final state
 * @param resolved issues resolved during the pass
 * @param outcomes per-issue results of the fail-open AI and alert steps
 * @param rescanScheduled whether a confirmation rescan was requested
 * @param health page health after the pass
 */
public record ScanReport(
    UUID scanRunId,
    UUID pageId,
    List<Issue> issues,
    List<Issue> resolved,
    List<IssueStepOutcome> outcomes,
    boolean rescanScheduled,
    PageHealth health
) {

    public ScanReport {
        issues = issues == null ? List.of() : List.copyOf(issues);
        resolved = resolved == null ? List.of() : List.copyOf(resolved);
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public long alertsSent() {
        return outcomes.stream()
            .filter(outcome -> outcome.success()
                && (outcome.step() == IssueStepOutcome.Step.ALERT_EMAIL
                    || outcome.step() == IssueStepOutcome.Step.ALERT_ADMIN))
            .count();
    }

    public List<IssueStepOutcome> failures() {
        return outcomes.stream().filter(outcome -> !outcome.success()).toList();
    }
}
