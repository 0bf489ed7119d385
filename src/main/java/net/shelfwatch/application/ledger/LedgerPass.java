package net.shelfwatch.application.ledger;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import net.shelfwatch.domain.issue.Issue;

/**
 * Result of merging one scan pass into the ledger.
 *
 * @param touched issues created or updated from a candidate, in their saved state
 * @param resolved issues resolved during the pass
 * @param actions action taken per issue id
 */
public record LedgerPass(List<Issue> touched, List<Issue> resolved, Map<UUID, MergeAction> actions) {

    public LedgerPass {
        touched = touched == null ? List.of() : List.copyOf(touched);
        resolved = resolved == null ? List.of() : List.copyOf(resolved);
        actions = actions == null ? Map.of() : Map.copyOf(actions);
    }

    public MergeAction actionFor(UUID issueId) {
        return actions.get(issueId);
    }
}
