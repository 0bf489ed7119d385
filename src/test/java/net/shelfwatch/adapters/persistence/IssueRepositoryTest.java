package net.shelfwatch.adapters.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import net.shelfwatch.domain.issue.AiAnnotation;
import net.shelfwatch.domain.issue.Issue;
import net.shelfwatch.domain.issue.IssueCandidate;
import net.shelfwatch.domain.issue.IssueSeverity;
import net.shelfwatch.domain.issue.IssueStatus;
import net.shelfwatch.domain.issue.IssueType;
import net.shelfwatch.domain.scan.CheckVerdict;
import net.shelfwatch.domain.scan.ScanDepth;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

class IssueRepositoryTest extends PostgresRepositoryTestSupport {

    private static final Instant NOW = Instant.parse("2026-03-04T10:00:00Z");

    private IssueRepository repository;
    private UUID pageId;
    private UUID scanRunId;

    @BeforeEach
    void setUp() {
        repository = new IssueRepository(jdbcTemplate, json);
        pageId = insertPage(insertTenant("demo-store.myshopify.com"), null, null);
        scanRunId = new ScanRunRepository(jdbcTemplate, json).create(pageId, ScanDepth.QUICK).id();
    }

    @Test
    void should_UpdateInPlace_When_IssueObservedAgain() {
        Issue opened = repository.save(open(IssueType.MISSING_PURCHASE_CONTROL, 0.8));

        Issue again = repository.save(opened.observedAgain(scanRunId, candidate(IssueType.MISSING_PURCHASE_CONTROL, 0.9),
            NOW.plus(Duration.ofMinutes(30)), false));

        Issue stored = repository.findById(again.id()).orElseThrow();
        assertThat(stored.occurrenceCount()).isEqualTo(2);
        assertThat(stored.lastDetectedAt()).isEqualTo(NOW.plus(Duration.ofMinutes(30)));
        assertThat(stored.firstDetectedAt()).isEqualTo(NOW);
        assertThat(stored.evidence()).containsEntry("confidence", 0.9);
    }

    @Test
    void should_PersistAiAnnotation() {
        Issue issue = repository.save(open(IssueType.MISSING_PURCHASE_CONTROL, 0.8)
            .withAi(new AiAnnotation(true, 0.97, "Button hidden behind overlay", "Customers cannot buy",
                "Remove the overlay", NOW)));

        Issue stored = repository.findById(issue.id()).orElseThrow();

        assertThat(stored.isAiConfirmed()).isTrue();
        assertThat(stored.ai().confidence()).isEqualTo(0.97);
        assertThat(stored.ai().suggestedFix()).isEqualTo("Remove the overlay");
    }

    @Test
    void should_ListOnlyActiveIssues() {
        Issue purchase = repository.save(open(IssueType.MISSING_PURCHASE_CONTROL, 0.8));
        repository.save(open(IssueType.SLOW_LOAD, 1.0).resolved(scanRunId));
        repository.save(open(IssueType.MISSING_IMAGES, 1.0).acknowledged("merchant", NOW));

        assertThat(repository.findActiveByPage(pageId))
            .extracting(Issue::type)
            .containsExactlyInAnyOrder(IssueType.MISSING_PURCHASE_CONTROL, IssueType.MISSING_IMAGES);
        assertThat(repository.findActive(pageId, IssueType.MISSING_PURCHASE_CONTROL)).map(Issue::id).contains(purchase.id());
        assertThat(repository.findActive(pageId, IssueType.SLOW_LOAD)).isEmpty();
    }

    @Test
    void should_RejectSecondActiveIssueOfSameType() {
        repository.save(open(IssueType.MISSING_PURCHASE_CONTROL, 0.8));

        assertThatThrownBy(() -> repository.save(open(IssueType.MISSING_PURCHASE_CONTROL, 0.9)))
            .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void should_AllowNewIssue_When_PreviousOfSameTypeResolved() {
        Issue first = repository.save(open(IssueType.SLOW_LOAD, 1.0));
        repository.save(first.resolved(scanRunId));

        Issue second = repository.save(open(IssueType.SLOW_LOAD, 1.0));

        assertThat(repository.findActive(pageId, IssueType.SLOW_LOAD)).map(Issue::id).contains(second.id());
        assertThat(repository.findById(first.id())).map(Issue::status).contains(IssueStatus.RESOLVED);
    }

    private Issue open(IssueType type, double confidence) {
        return Issue.open(UUID.randomUUID(), pageId, scanRunId, candidate(type, confidence), NOW);
    }

    private static IssueCandidate candidate(IssueType type, double confidence) {
        return new IssueCandidate(type, IssueSeverity.HIGH, confidence, type.defaultTitle(), "Detected on the page",
            Map.of("confidence", confidence), CheckVerdict.FAIL);
    }
}
