package net.shelfwatch.adapters.persistence;

import static net.shelfwatch.adapters.persistence.JdbcTimestamps.instant;
import static net.shelfwatch.adapters.persistence.JdbcTimestamps.toTimestamp;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.shelfwatch.domain.scan.MonitoredPage;
import net.shelfwatch.domain.scan.MonitoredPageStore;
import net.shelfwatch.domain.scan.PageHealth;
import net.shelfwatch.domain.scan.PageVisibility;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Postgres adapter for {@code monitored_pages}. Soft-deleted rows are filtered unless
 * the caller explicitly asks for {@link PageVisibility#INCLUDING_DELETED}.
 */
@Repository
public class MonitoredPageRepository implements MonitoredPageStore {

    private static final String SELECT_COLUMNS = """
        SELECT id, tenant_id, title, url, monitoring_enabled, last_scanned_at, health, deleted_at
        FROM monitored_pages
        """;

    private final JdbcTemplate jdbcTemplate;

    public MonitoredPageRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MonitoredPage> findById(UUID pageId, PageVisibility visibility) {
        if (pageId == null) {
            return Optional.empty();
        }
        String sql = SELECT_COLUMNS + "WHERE id = ?" + visibilityClause(visibility);
        return jdbcTemplate.query(sql, this::mapRow, pageId).stream().findFirst();
    }

    @Override
    @Transactional(readOnly = true)
    public List<MonitoredPage> findDueForScan(UUID tenantId, Instant dueBefore, PageVisibility visibility) {
        String sql = SELECT_COLUMNS + """
            WHERE tenant_id = ?
              AND monitoring_enabled = true
              AND (last_scanned_at IS NULL OR last_scanned_at < ?)
            """ + visibilityClause(visibility) + " ORDER BY last_scanned_at NULLS FIRST, id";
        return jdbcTemplate.query(sql, this::mapRow, tenantId, toTimestamp(dueBefore));
    }

    @Override
    @Transactional
    public void updateHealth(UUID pageId, PageHealth health) {
        jdbcTemplate.update(
            "UPDATE monitored_pages SET health = ?, updated_at = NOW() WHERE id = ?",
            health.name(),
            pageId
        );
    }

    @Override
    @Transactional
    public void markScanned(UUID pageId, Instant scannedAt) {
        jdbcTemplate.update(
            "UPDATE monitored_pages SET last_scanned_at = ?, updated_at = NOW() WHERE id = ?",
            toTimestamp(scannedAt),
            pageId
        );
    }

    private static String visibilityClause(PageVisibility visibility) {
        return visibility == PageVisibility.INCLUDING_DELETED ? "" : " AND deleted_at IS NULL";
    }

    private MonitoredPage mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new MonitoredPage(
            rs.getObject("id", UUID.class),
            rs.getObject("tenant_id", UUID.class),
            rs.getString("title"),
            rs.getString("url"),
            rs.getBoolean("monitoring_enabled"),
            instant(rs, "last_scanned_at"),
            PageHealth.valueOf(rs.getString("health")),
            instant(rs, "deleted_at")
        );
    }
}
