package net.shelfwatch.adapters.persistence;

import static net.shelfwatch.adapters.persistence.JdbcTimestamps.instant;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.shelfwatch.domain.tenant.BillingStatus;
import net.shelfwatch.domain.tenant.Tenant;
import net.shelfwatch.domain.tenant.TenantDirectory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Postgres adapter for the {@code tenants} table. Tenants are written by the onboarding and billing flows.
 */
@Repository
public class TenantRepository implements TenantDirectory {

    private static final String SELECT_COLUMNS = """
        SELECT id, shop_domain, billing_status, trial_ends_at, billing_exempt,
               alert_email, email_alerts_enabled, admin_alerts_enabled
        FROM tenants
        """;

    private final JdbcTemplate jdbcTemplate;

    public TenantRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Tenant> findById(UUID tenantId) {
        if (tenantId == null) {
            return Optional.empty();
        }
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?", this::mapRow, tenantId)
            .stream()
            .findFirst();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Tenant> findAll() {
        return jdbcTemplate.query(SELECT_COLUMNS + "ORDER BY created_at, id", this::mapRow);
    }

    private Tenant mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new Tenant(
            rs.getObject("id", UUID.class),
            rs.getString("shop_domain"),
            BillingStatus.valueOf(rs.getString("billing_status")),
            instant(rs, "trial_ends_at"),
            rs.getBoolean("billing_exempt"),
            rs.getString("alert_email"),
            rs.getBoolean("email_alerts_enabled"),
            rs.getBoolean("admin_alerts_enabled")
        );
    }
}
