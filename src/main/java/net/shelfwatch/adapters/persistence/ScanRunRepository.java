package net.shelfwatch.adapters.persistence;

import static net.shelfwatch.adapters.persistence.JdbcTimestamps.instant;
import static net.shelfwatch.adapters.persistence.JdbcTimestamps.toTimestamp;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.shelfwatch.domain.scan.NetworkFailure;
import net.shelfwatch.domain.scan.PageAnalysisSummary;
import net.shelfwatch.domain.scan.RawFinding;
import net.shelfwatch.domain.scan.ScanDepth;
import net.shelfwatch.domain.scan.ScanRun;
import net.shelfwatch.domain.scan.ScanRunStatus;
import net.shelfwatch.domain.scan.ScanRunStore;
import net.shelfwatch.domain.scan.ScanSignals;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.core.type.TypeReference;

/**
 * Postgres adapter for {@code scan_runs}.
 *
 * <p>Captured signals and detector findings are stored as {@code jsonb}; the AI page summary
 * is flattened into its own columns so dashboards can query it.</p>
 */
@Repository
public class ScanRunRepository implements ScanRunStore {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<List<NetworkFailure>> NETWORK_FAILURE_LIST = new TypeReference<>() {};
    private static final TypeReference<List<RawFinding>> FINDING_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumnCodec json;

    public ScanRunRepository(JdbcTemplate jdbcTemplate, JsonColumnCodec json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
    }

    @Override
    @Transactional
    public ScanRun create(UUID pageId, ScanDepth depth) {
        ScanRun scanRun = ScanRun.pending(UUID.randomUUID(), pageId, depth);
        jdbcTemplate.update(
            "INSERT INTO scan_runs (id, page_id, depth, status, created_at) VALUES (?, ?, ?, ?, NOW())",
            scanRun.id(),
            scanRun.pageId(),
            scanRun.depth().name(),
            scanRun.status().name()
        );
        return scanRun;
    }

    @Override
    @Transactional
    public ScanRun save(ScanRun scanRun) {
        ScanSignals signals = scanRun.signals();
        PageAnalysisSummary summary = scanRun.aiSummary();
        String sql = """
            UPDATE scan_runs
               SET status = ?, started_at = ?, completed_at = ?, load_time_ms = ?,
                   js_errors = CAST(? AS jsonb), network_errors = CAST(? AS jsonb),
                   console_logs = CAST(? AS jsonb), html_snapshot = ?, screenshot_ref = ?,
                   findings = CAST(? AS jsonb), error_message = ?,
                   ai_summary = ?, ai_page_healthy = ?, ai_findings_count = ?
             WHERE id = ?
            """;
        int updated = jdbcTemplate.update(
            sql,
            scanRun.status().name(),
            toTimestamp(scanRun.startedAt()),
            toTimestamp(scanRun.completedAt()),
            signals.loadTimeMs(),
            json.write(signals.jsErrors()),
            json.write(signals.networkErrors()),
            json.write(signals.consoleLogs()),
            signals.htmlSnapshot(),
            signals.screenshotRef(),
            json.write(scanRun.findings()),
            scanRun.errorMessage(),
            summary == null ? null : summary.summary(),
            summary == null ? null : summary.pageHealthy(),
            summary == null ? null : summary.findingsCount(),
            scanRun.id()
        );
        if (updated == 0) {
            throw new IllegalStateException("Scan run " + scanRun.id() + " does not exist");
        }
        return scanRun;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ScanRun> findById(UUID scanRunId) {
        String sql = """
            SELECT id, page_id, depth, status, started_at, completed_at, load_time_ms, js_errors,
                   network_errors, console_logs, html_snapshot, screenshot_ref, findings,
                   error_message, ai_summary, ai_page_healthy, ai_findings_count
            FROM scan_runs
            WHERE id = ?
            """;
        return jdbcTemplate.query(sql, this::mapRow, scanRunId).stream().findFirst();
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsForPage(UUID pageId) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM scan_runs WHERE page_id = ?)",
            Boolean.class,
            pageId
        );
        return Boolean.TRUE.equals(exists);
    }

    @Override
    @Transactional(readOnly = true)
    public long countForPage(UUID pageId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM scan_runs WHERE page_id = ?",
            Long.class,
            pageId
        );
        return count == null ? 0L : count;
    }

    private ScanRun mapRow(ResultSet rs, int rowNum) throws SQLException {
        int loadTime = rs.getInt("load_time_ms");
        ScanSignals signals = new ScanSignals(
            rs.wasNull() ? null : loadTime,
            json.readList(rs.getString("js_errors"), STRING_LIST),
            json.readList(rs.getString("network_errors"), NETWORK_FAILURE_LIST),
            json.readList(rs.getString("console_logs"), STRING_LIST),
            rs.getString("html_snapshot"),
            rs.getString("screenshot_ref")
        );
        String summaryText = rs.getString("ai_summary");
        PageAnalysisSummary summary = summaryText == null
            ? null
            : new PageAnalysisSummary(summaryText, rs.getBoolean("ai_page_healthy"), rs.getInt("ai_findings_count"));
        return new ScanRun(
            rs.getObject("id", UUID.class),
            rs.getObject("page_id", UUID.class),
            ScanDepth.valueOf(rs.getString("depth")),
            ScanRunStatus.valueOf(rs.getString("status")),
            instant(rs, "started_at"),
            instant(rs, "completed_at"),
            signals,
            json.readList(rs.getString("findings"), FINDING_LIST),
            rs.getString("error_message"),
            summary
        );
    }
}
