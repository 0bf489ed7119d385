package net.shelfwatch.domain.scan;

/**
 * Which soft-deleted pages a query may return. Every page lookup states this explicitly.
 */
public enum PageVisibility {
    /** Only pages that have not been soft-deleted. */
    ACTIVE,
    /** Soft-deleted pages as well, for audit and admin views. */
    INCLUDING_DELETED;

    public boolean admits(MonitoredPage page) {
        return this == INCLUDING_DELETED || !page.isDeleted();
    }
}
