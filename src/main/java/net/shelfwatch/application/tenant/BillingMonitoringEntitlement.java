package net.shelfwatch.application.tenant;

import java.time.Clock;
import java.util.UUID;
import net.shelfwatch.domain.tenant.MonitoringEntitlement;
import net.shelfwatch.domain.tenant.TenantDirectory;
import org.springframework.stereotype.Service;

/**
 * Entitlement backed by the tenant's billing state: exempt, trialing, or actively subscribed.
 */
@Service
public class BillingMonitoringEntitlement implements MonitoringEntitlement {

    private final TenantDirectory tenantDirectory;
    private final Clock clock;

    public BillingMonitoringEntitlement(TenantDirectory tenantDirectory, Clock clock) {
        this.tenantDirectory = tenantDirectory;
        this.clock = clock;
    }

    @Override
    public boolean isMonitoringAllowed(UUID tenantId) {
        return tenantDirectory.findById(tenantId)
            .map(tenant -> tenant.billingActive(clock.instant()))
            .orElse(false);
    }
}
