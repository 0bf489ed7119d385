package net.shelfwatch.application.scan;

/**
 * Counts from one scheduled sweep.
 *
 * @param tenantsChecked tenants considered
 * @param tenantsSkipped tenants without monitoring entitlement
 * @param pagesEnqueued due pages enqueued
 * @param pagesSkipped due pages not enqueued (disabled, queued or running)
 */
public record SweepSummary(int tenantsChecked, int tenantsSkipped, int pagesEnqueued, int pagesSkipped) {
}
