package net.shelfwatch.application.ledger;

import java.util.UUID;

/**
 * Thrown when a manual issue transition is not allowed from the issue's current state.
 */
public class IssueStateException extends RuntimeException {

    private final UUID issueId;

    public IssueStateException(UUID issueId, String message) {
        super(message);
        this.issueId = issueId;
    }

    public UUID issueId() {
        return issueId;
    }
}
