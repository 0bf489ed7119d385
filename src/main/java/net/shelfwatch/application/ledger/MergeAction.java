package net.shelfwatch.application.ledger;

/**
 * What the ledger did with an issue during one pass.
 */
public enum MergeAction {
    CREATED,
    ESCALATED,
    REFRESHED,
    /** Old issue resolved because a lower-severity finding replaced it. */
    DE_ESCALATED,
    RESOLVED
}
