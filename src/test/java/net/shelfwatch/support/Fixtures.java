package net.shelfwatch.support;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import net.shelfwatch.domain.issue.Issue;
import net.shelfwatch.domain.issue.IssueCandidate;
import net.shelfwatch.domain.issue.IssueSeverity;
import net.shelfwatch.domain.issue.IssueType;
import net.shelfwatch.domain.scan.CheckVerdict;
import net.shelfwatch.domain.scan.MonitoredPage;
import net.shelfwatch.domain.scan.PageHealth;
import net.shelfwatch.domain.tenant.BillingStatus;
import net.shelfwatch.domain.tenant.Tenant;

/**
 * Shared builders for domain test data.
 */
public final class Fixtures {

    public static final Instant NOW = Instant.parse("2026-03-04T10:00:00Z");

    private Fixtures() {
    }

    public static Tenant activeTenant() {
        return new Tenant(UUID.randomUUID(), "demo-store.myshopify.com", BillingStatus.ACTIVE, null, false,
            "owner@demo-store.test", true, false);
    }

    public static Tenant tenant(BillingStatus status, Instant trialEndsAt, boolean exempt) {
        return new Tenant(UUID.randomUUID(), "shop-" + status.name().toLowerCase(java.util.Locale.ROOT) + ".myshopify.com", status,
            trialEndsAt, exempt, null, true, false);
    }

    public static MonitoredPage page(Tenant tenant) {
        return new MonitoredPage(UUID.randomUUID(), tenant.id(), "Trail Runner", "/products/trail-runner", true,
            null, PageHealth.PENDING, null);
    }

    public static IssueCandidate candidate(IssueType type, IssueSeverity severity, double confidence) {
        return new IssueCandidate(type, severity, confidence, null, null, Map.of("confidence", confidence),
            CheckVerdict.FAIL);
    }

    public static Issue openIssue(UUID pageId, IssueType type, IssueSeverity severity, double confidence) {
        return Issue.open(UUID.randomUUID(), pageId, UUID.randomUUID(), candidate(type, severity, confidence), NOW);
    }
}
