package net.shelfwatch.domain.issue;

public enum IssueStatus {
    OPEN,
    ACKNOWLEDGED,
    RESOLVED;

    /**
     * Open and acknowledged issues are both still tracked by the ledger.
     */
    public boolean isActive() {
        return this != RESOLVED;
    }
}
