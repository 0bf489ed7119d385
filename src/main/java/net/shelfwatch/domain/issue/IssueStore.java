package net.shelfwatch.domain.issue;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port for the issue ledger.
 */
public interface IssueStore {

    Optional<Issue> findById(UUID issueId);

    /**
     * The open or acknowledged issue of this type on the page, if any.
     */
    Optional<Issue> findActive(UUID pageId, IssueType type);

    List<Issue> findActiveByPage(UUID pageId);

    /**
     * Inserts or updates by id.
     */
    Issue save(Issue issue);
}
