package net.shelfwatch.domain.scan;

/**
 * Aggregate health shown for a monitored page.
 */
public enum PageHealth {
    PENDING,
    HEALTHY,
    WARNING,
    CRITICAL,
    ERROR
}
