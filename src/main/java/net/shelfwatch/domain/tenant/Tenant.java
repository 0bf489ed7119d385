package net.shelfwatch.domain.tenant;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Storefront account whose product pages are monitored.
 *
 * @param id tenant identifier
 * @param shopDomain storefront domain, e.g. {@code acme.myshopify.com}
 * @param billingStatus current subscription state
 * @param trialEndsAt end of the free trial, when one was granted
 * @param billingExempt whether billing checks are bypassed for this tenant
 * @param alertEmail explicit alert recipient; falls back to the shop domain
 * @param emailAlertsEnabled whether the email channel is active
 * @param adminAlertsEnabled whether the admin channel is active
 */
public record Tenant(
    UUID id,
    String shopDomain,
    BillingStatus billingStatus,
    @Nullable Instant trialEndsAt,
    boolean billingExempt,
    @Nullable String alertEmail,
    boolean emailAlertsEnabled,
    boolean adminAlertsEnabled
) {

    public Tenant {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(shopDomain, "shopDomain must not be null");
        billingStatus = billingStatus == null ? BillingStatus.TRIAL : billingStatus;
    }

    /**
     * A tenant may scan while exempt, inside an unexpired trial, or with an active subscription.
     */
    public boolean billingActive(Instant now) {
        if (billingExempt) {
            return true;
        }
        if (billingStatus == BillingStatus.TRIAL) {
            return trialEndsAt != null && trialEndsAt.isAfter(now);
        }
        return billingStatus == BillingStatus.ACTIVE;
    }

    public String alertRecipient() {
        return alertEmail != null && !alertEmail.isBlank() ? alertEmail.trim() : shopDomain;
    }

    public String storefrontBaseUrl() {
        return shopDomain.startsWith("http") ? shopDomain : "https://" + shopDomain;
    }
}
