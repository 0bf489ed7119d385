package net.shelfwatch.application.scan;

/**
 * Why a scan trigger or execution did nothing.
 */
public enum SkipReason {
    TENANT_NOT_ENTITLED,
    MONITORING_DISABLED,
    ALREADY_QUEUED,
    ALREADY_RUNNING
}
