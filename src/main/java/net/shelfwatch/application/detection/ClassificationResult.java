package net.shelfwatch.application.detection;

import java.util.List;
import java.util.Set;
import net.shelfwatch.domain.issue.IssueCandidate;
import net.shelfwatch.domain.issue.IssueType;

/**
 * Classifier output for one scan pass.
 *
 * @param candidates at most one candidate per issue type
 * @param passedTypes issue types whose checks passed; active issues of these types resolve
 */
public record ClassificationResult(List<IssueCandidate> candidates, Set<IssueType> passedTypes) {

    public ClassificationResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        passedTypes = passedTypes == null ? Set.of() : Set.copyOf(passedTypes);
    }

    public static ClassificationResult empty() {
        return new ClassificationResult(List.of(), Set.of());
    }

    public boolean isEmpty() {
        return candidates.isEmpty() && passedTypes.isEmpty();
    }
}
