package net.shelfwatch.domain.tenant;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read access to tenant accounts.
 */
public interface TenantDirectory {

    Optional<Tenant> findById(UUID tenantId);

    List<Tenant> findAll();
}
