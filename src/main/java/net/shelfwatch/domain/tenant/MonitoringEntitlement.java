package net.shelfwatch.domain.tenant;

import java.util.UUID;

/**
 * Answers whether a tenant's plan currently allows page scanning.
 */
@FunctionalInterface
public interface MonitoringEntitlement {

    boolean isMonitoringAllowed(UUID tenantId);
}
