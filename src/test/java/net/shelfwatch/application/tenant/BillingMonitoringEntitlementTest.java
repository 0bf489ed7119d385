package net.shelfwatch.application.tenant;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.UUID;
import net.shelfwatch.domain.tenant.BillingStatus;
import net.shelfwatch.domain.tenant.Tenant;
import net.shelfwatch.support.Fixtures;
import net.shelfwatch.support.InMemoryTenantDirectory;
import net.shelfwatch.support.MutableClock;
import org.junit.jupiter.api.Test;

class BillingMonitoringEntitlementTest {

    private final InMemoryTenantDirectory directory = new InMemoryTenantDirectory();
    private final BillingMonitoringEntitlement entitlement =
        new BillingMonitoringEntitlement(directory, new MutableClock(Fixtures.NOW));

    @Test
    void should_AllowActiveExemptAndUnexpiredTrialTenants() {
        Tenant active = directory.add(Fixtures.tenant(BillingStatus.ACTIVE, null, false));
        Tenant exempt = directory.add(Fixtures.tenant(BillingStatus.CANCELLED, null, true));
        Tenant trial = directory.add(Fixtures.tenant(BillingStatus.TRIAL, Fixtures.NOW.plus(Duration.ofDays(3)), false));

        assertThat(entitlement.isMonitoringAllowed(active.id())).isTrue();
        assertThat(entitlement.isMonitoringAllowed(exempt.id())).isTrue();
        assertThat(entitlement.isMonitoringAllowed(trial.id())).isTrue();
    }

    @Test
    void should_DenyExpiredTrialsFrozenCancelledAndUnknownTenants() {
        Tenant expired = directory.add(Fixtures.tenant(BillingStatus.TRIAL, Fixtures.NOW.minus(Duration.ofDays(1)), false));
        Tenant frozen = directory.add(Fixtures.tenant(BillingStatus.FROZEN, null, false));
        Tenant cancelled = directory.add(Fixtures.tenant(BillingStatus.CANCELLED, null, false));

        assertThat(entitlement.isMonitoringAllowed(expired.id())).isFalse();
        assertThat(entitlement.isMonitoringAllowed(frozen.id())).isFalse();
        assertThat(entitlement.isMonitoringAllowed(cancelled.id())).isFalse();
        assertThat(entitlement.isMonitoringAllowed(UUID.randomUUID())).isFalse();
    }
}
