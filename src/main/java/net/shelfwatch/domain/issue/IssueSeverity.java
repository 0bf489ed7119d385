package net.shelfwatch.domain.issue;

/**
 * Ordered issue severity. Compare with {@link #weight()}, never by name.
 */
public enum IssueSeverity {
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private final int weight;

    IssueSeverity(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    public boolean outranks(IssueSeverity other) {
        return weight > other.weight;
    }
}
