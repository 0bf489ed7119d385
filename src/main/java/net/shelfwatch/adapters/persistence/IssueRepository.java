package net.shelfwatch.adapters.persistence;

import static net.shelfwatch.adapters.persistence.JdbcTimestamps.instant;
import static net.shelfwatch.adapters.persistence.JdbcTimestamps.toTimestamp;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.shelfwatch.domain.issue.AiAnnotation;
import net.shelfwatch.domain.issue.Issue;
import net.shelfwatch.domain.issue.IssueSeverity;
import net.shelfwatch.domain.issue.IssueStatus;
import net.shelfwatch.domain.issue.IssueStore;
import net.shelfwatch.domain.issue.IssueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Postgres adapter for {@code issues}.
 *
 * <p>A partial unique index on {@code (page_id, type)} for OPEN and ACKNOWLEDGED rows backs the
 * one-active-issue-per-type rule.</p>
 */
@Repository
public class IssueRepository implements IssueStore {

    private static final Logger log = LoggerFactory.getLogger(IssueRepository.class);

    private static final String SELECT_COLUMNS = """
        SELECT id, page_id, scan_run_id, type, severity, status, title, description, evidence,
               occurrence_count, first_detected_at, last_detected_at, acknowledged_at, acknowledged_by,
               ai_confirmed, ai_confidence, ai_reasoning, ai_explanation, ai_suggested_fix, ai_verified_at
        FROM issues
        """;
    private static final String ACTIVE_CLAUSE = " AND status IN ('OPEN', 'ACKNOWLEDGED')";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumnCodec json;

    public IssueRepository(JdbcTemplate jdbcTemplate, JsonColumnCodec json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Issue> findById(UUID issueId) {
        if (issueId == null) {
            return Optional.empty();
        }
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?", this::mapRow, issueId).stream().findFirst();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Issue> findActive(UUID pageId, IssueType type) {
        String sql = SELECT_COLUMNS + "WHERE page_id = ? AND type = ?" + ACTIVE_CLAUSE;
        return jdbcTemplate.query(sql, this::mapRow, pageId, type.name()).stream().findFirst();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Issue> findActiveByPage(UUID pageId) {
        String sql = SELECT_COLUMNS + "WHERE page_id = ?" + ACTIVE_CLAUSE + " ORDER BY first_detected_at, id";
        return jdbcTemplate.query(sql, this::mapRow, pageId);
    }

    @Override
    @Transactional
    public Issue save(Issue issue) {
        AiAnnotation ai = issue.ai();
        String sql = """
            INSERT INTO issues
              (id, page_id, scan_run_id, type, severity, status, title, description, evidence,
               occurrence_count, first_detected_at, last_detected_at, acknowledged_at, acknowledged_by,
               ai_confirmed, ai_confidence, ai_reasoning, ai_explanation, ai_suggested_fix, ai_verified_at,
               created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, NOW(), NOW())
            ON CONFLICT (id) DO UPDATE SET
              scan_run_id = EXCLUDED.scan_run_id,
              severity = EXCLUDED.severity,
              status = EXCLUDED.status,
              title = EXCLUDED.title,
              description = EXCLUDED.description,
              evidence = EXCLUDED.evidence,
              occurrence_count = EXCLUDED.occurrence_count,
              last_detected_at = EXCLUDED.last_detected_at,
              acknowledged_at = EXCLUDED.acknowledged_at,
              acknowledged_by = EXCLUDED.acknowledged_by,
              ai_confirmed = EXCLUDED.ai_confirmed,
              ai_confidence = EXCLUDED.ai_confidence,
              ai_reasoning = EXCLUDED.ai_reasoning,
              ai_explanation = EXCLUDED.ai_explanation,
              ai_suggested_fix = EXCLUDED.ai_suggested_fix,
              ai_verified_at = EXCLUDED.ai_verified_at,
              updated_at = NOW()
            """;
        jdbcTemplate.update(
            sql,
            issue.id(),
            issue.pageId(),
            issue.scanRunId(),
            issue.type().name(),
            issue.severity().name(),
            issue.status().name(),
            issue.title(),
            issue.description(),
            json.write(issue.evidence()),
            issue.occurrenceCount(),
            toTimestamp(issue.firstDetectedAt()),
            toTimestamp(issue.lastDetectedAt()),
            toTimestamp(issue.acknowledgedAt()),
            issue.acknowledgedBy(),
            ai.confirmed(),
            ai.confidence(),
            ai.reasoning(),
            ai.explanation(),
            ai.suggestedFix(),
            toTimestamp(ai.verifiedAt())
        );
        log.debug("Saved issue {} ({} {} x{})", issue.id(), issue.type().code(), issue.status(), issue.occurrenceCount());
        return issue;
    }

    private Issue mapRow(ResultSet rs, int rowNum) throws SQLException {
        Boolean confirmed = rs.getObject("ai_confirmed", Boolean.class);
        Double confidence = rs.getObject("ai_confidence", Double.class);
        AiAnnotation ai = new AiAnnotation(
            confirmed,
            confidence,
            rs.getString("ai_reasoning"),
            rs.getString("ai_explanation"),
            rs.getString("ai_suggested_fix"),
            instant(rs, "ai_verified_at")
        );
        return new Issue(
            rs.getObject("id", UUID.class),
            rs.getObject("page_id", UUID.class),
            rs.getObject("scan_run_id", UUID.class),
            IssueType.valueOf(rs.getString("type")),
            IssueSeverity.valueOf(rs.getString("severity")),
            IssueStatus.valueOf(rs.getString("status")),
            rs.getString("title"),
            rs.getString("description"),
            json.readMap(rs.getString("evidence")),
            rs.getInt("occurrence_count"),
            instant(rs, "first_detected_at"),
            instant(rs, "last_detected_at"),
            instant(rs, "acknowledged_at"),
            rs.getString("acknowledged_by"),
            ai
        );
    }
}
