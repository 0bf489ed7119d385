package net.shelfwatch.domain.tenant;

/**
 * Subscription lifecycle states tracked for a storefront tenant.
 */
public enum BillingStatus {
    TRIAL,
    ACTIVE,
    CANCELLED,
    FROZEN
}
