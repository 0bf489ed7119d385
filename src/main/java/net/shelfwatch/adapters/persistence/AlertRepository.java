package net.shelfwatch.adapters.persistence;

import static net.shelfwatch.adapters.persistence.JdbcTimestamps.instant;
import static net.shelfwatch.adapters.persistence.JdbcTimestamps.toTimestamp;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.shelfwatch.domain.alert.Alert;
import net.shelfwatch.domain.alert.AlertChannel;
import net.shelfwatch.domain.alert.AlertDeliveryStatus;
import net.shelfwatch.domain.alert.AlertStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Postgres adapter for {@code alerts}. The unique {@code (issue_id, channel)} constraint makes
 * {@link #claim} the single point that decides which scan pass delivers an alert.
 */
@Repository
public class AlertRepository implements AlertStore {

    private static final String RETURNING_COLUMNS = " RETURNING id, issue_id, tenant_id, channel, status, sent_at, created_at";

    private final JdbcTemplate jdbcTemplate;

    public AlertRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasSent(UUID issueId, AlertChannel channel) {
        Boolean sent = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM alerts WHERE issue_id = ? AND channel = ? AND status = 'SENT')",
            Boolean.class,
            issueId,
            channel.name()
        );
        return Boolean.TRUE.equals(sent);
    }

    @Override
    @Transactional
    public Optional<Alert> claim(UUID issueId, UUID tenantId, AlertChannel channel, Instant claimedAt, Instant staleBefore) {
        // Conflicting rows are taken over when the previous delivery failed or its claim went stale
        String sql = """
            INSERT INTO alerts (id, issue_id, tenant_id, channel, status, claimed_at, created_at)
            VALUES (?, ?, ?, ?, 'PENDING', ?, NOW())
            ON CONFLICT (issue_id, channel) DO UPDATE
               SET status = 'PENDING',
                   claimed_at = EXCLUDED.claimed_at
             WHERE alerts.status = 'FAILED'
                OR (alerts.status = 'PENDING' AND COALESCE(alerts.claimed_at, alerts.created_at) < ?)
            """ + RETURNING_COLUMNS;
        return jdbcTemplate.query(sql, this::mapRow, UUID.randomUUID(), issueId, tenantId, channel.name(),
                toTimestamp(claimedAt), toTimestamp(staleBefore))
            .stream()
            .findFirst();
    }

    @Override
    @Transactional
    public void markSent(UUID alertId, Instant sentAt) {
        jdbcTemplate.update(
            "UPDATE alerts SET status = 'SENT', sent_at = ? WHERE id = ?",
            toTimestamp(sentAt),
            alertId
        );
    }

    @Override
    @Transactional
    public void markFailed(UUID alertId) {
        jdbcTemplate.update("UPDATE alerts SET status = 'FAILED' WHERE id = ? AND status = 'PENDING'", alertId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Alert> findByIssue(UUID issueId) {
        return jdbcTemplate.query(
            "SELECT id, issue_id, tenant_id, channel, status, sent_at, created_at FROM alerts WHERE issue_id = ? ORDER BY created_at, id",
            this::mapRow,
            issueId
        );
    }

    private Alert mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new Alert(
            rs.getObject("id", UUID.class),
            rs.getObject("issue_id", UUID.class),
            rs.getObject("tenant_id", UUID.class),
            AlertChannel.valueOf(rs.getString("channel")),
            AlertDeliveryStatus.valueOf(rs.getString("status")),
            instant(rs, "sent_at"),
            instant(rs, "created_at")
        );
    }
}
