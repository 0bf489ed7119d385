package net.shelfwatch.application.ledger;

import static net.shelfwatch.support.Fixtures.NOW;
import static net.shelfwatch.support.Fixtures.candidate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import net.shelfwatch.application.detection.ClassificationResult;
import net.shelfwatch.domain.issue.AiAnnotation;
import net.shelfwatch.domain.issue.Issue;
import net.shelfwatch.domain.issue.IssueSeverity;
import net.shelfwatch.domain.issue.IssueStatus;
import net.shelfwatch.domain.issue.IssueType;
import net.shelfwatch.domain.scan.PageHealth;
import net.shelfwatch.support.InMemoryIssueStore;
import net.shelfwatch.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IssueLedgerTest {

    private final UUID pageId = UUID.randomUUID();
    private InMemoryIssueStore issueStore;
    private MutableClock clock;
    private IssueLedger ledger;

    @BeforeEach
    void setUp() {
        issueStore = new InMemoryIssueStore();
        clock = new MutableClock(NOW);
        ledger = new IssueLedger(issueStore, clock);
    }

    @Test
    void should_OpenIssue_When_NoActiveIssueOfTypeExists() {
        LedgerPass pass = ledger.merge(pageId, UUID.randomUUID(), found(IssueType.MISSING_PRICE, IssueSeverity.HIGH));

        assertThat(pass.touched()).singleElement().satisfies(issue -> {
            assertThat(issue.status()).isEqualTo(IssueStatus.OPEN);
            assertThat(issue.occurrenceCount()).isEqualTo(1);
            assertThat(issue.firstDetectedAt()).isEqualTo(NOW);
            assertThat(pass.actionFor(issue.id())).isEqualTo(MergeAction.CREATED);
        });
        assertThat(pass.resolved()).isEmpty();
    }

    @Test
    void should_RefreshAndCountOccurrence_When_SameSeverityObservedAgain() {
        Issue first = ledger.merge(pageId, UUID.randomUUID(), found(IssueType.SCRIPT_ERROR, IssueSeverity.HIGH))
            .touched().get(0);
        issueStore.save(first.withAi(new AiAnnotation(true, 0.9, "seen", null, null, NOW)));
        clock.advance(Duration.ofMinutes(30));

        LedgerPass second = ledger.merge(pageId, UUID.randomUUID(), found(IssueType.SCRIPT_ERROR, IssueSeverity.HIGH));

        Issue refreshed = second.touched().get(0);
        assertThat(refreshed.id()).isEqualTo(first.id());
        assertThat(refreshed.occurrenceCount()).isEqualTo(2);
        assertThat(refreshed.lastDetectedAt()).isEqualTo(NOW.plus(Duration.ofMinutes(30)));
        assertThat(refreshed.firstDetectedAt()).isEqualTo(NOW);
        assertThat(refreshed.isAiConfirmed()).isTrue();
        assertThat(second.actionFor(refreshed.id())).isEqualTo(MergeAction.REFRESHED);
    }

    @Test
    void should_EscalateInPlaceAndClearAiVerdict_When_SeverityRises() {
        Issue low = ledger.merge(pageId, UUID.randomUUID(), found(IssueType.SCRIPT_ERROR, IssueSeverity.LOW))
            .touched().get(0);
        issueStore.save(low.withAi(new AiAnnotation(false, 0.4, "cosmetic", null, null, NOW)));

        LedgerPass pass = ledger.merge(pageId, UUID.randomUUID(), found(IssueType.SCRIPT_ERROR, IssueSeverity.HIGH));

        Issue escalated = pass.touched().get(0);
        assertThat(escalated.id()).isEqualTo(low.id());
        assertThat(escalated.severity()).isEqualTo(IssueSeverity.HIGH);
        assertThat(escalated.occurrenceCount()).isEqualTo(2);
        assertThat(escalated.ai().isVerified()).isFalse();
        assertThat(pass.actionFor(escalated.id())).isEqualTo(MergeAction.ESCALATED);
    }

    @Test
    void should_ResolveAndReplaceIssue_When_SeverityDrops() {
        Issue high = ledger.merge(pageId, UUID.randomUUID(), found(IssueType.SCRIPT_ERROR, IssueSeverity.HIGH))
            .touched().get(0);

        LedgerPass pass = ledger.merge(pageId, UUID.randomUUID(), found(IssueType.SCRIPT_ERROR, IssueSeverity.LOW));

        assertThat(pass.resolved()).extracting(Issue::id).containsExactly(high.id());
        assertThat(pass.actionFor(high.id())).isEqualTo(MergeAction.DE_ESCALATED);
        Issue replacement = pass.touched().get(0);
        assertThat(replacement.id()).isNotEqualTo(high.id());
        assertThat(replacement.severity()).isEqualTo(IssueSeverity.LOW);
        assertThat(replacement.occurrenceCount()).isEqualTo(1);
        assertThat(issueStore.findActiveByPage(pageId)).extracting(Issue::id).containsExactly(replacement.id());
    }

    @Test
    void should_ResolveActiveIssue_When_CheckPasses() {
        Issue issue = ledger.merge(pageId, UUID.randomUUID(), found(IssueType.MISSING_IMAGES, IssueSeverity.MEDIUM))
            .touched().get(0);

        LedgerPass pass = ledger.merge(pageId, UUID.randomUUID(),
            new ClassificationResult(List.of(), Set.of(IssueType.MISSING_IMAGES, IssueType.MISSING_PRICE)));

        assertThat(pass.resolved()).extracting(Issue::id).containsExactly(issue.id());
        assertThat(issueStore.findById(issue.id())).get().extracting(Issue::status).isEqualTo(IssueStatus.RESOLVED);
        assertThat(ledger.healthOf(pageId)).isEqualTo(PageHealth.HEALTHY);
    }

    @Test
    void should_KeepAcknowledgedIssueActiveAndUpdated_When_ObservedAgain() {
        Issue issue = ledger.merge(pageId, UUID.randomUUID(), found(IssueType.MISSING_PRICE, IssueSeverity.HIGH))
            .touched().get(0);
        ledger.acknowledge(issue.id(), "  ");

        Issue refreshed = ledger.merge(pageId, UUID.randomUUID(), found(IssueType.MISSING_PRICE, IssueSeverity.HIGH))
            .touched().get(0);

        assertThat(refreshed.status()).isEqualTo(IssueStatus.ACKNOWLEDGED);
        assertThat(refreshed.acknowledgedBy()).isEqualTo("merchant");
        assertThat(refreshed.occurrenceCount()).isEqualTo(2);
        assertThat(ledger.healthOf(pageId)).isEqualTo(PageHealth.HEALTHY);
    }

    @Test
    void should_RejectAcknowledge_When_IssueNotOpen() {
        Issue issue = ledger.merge(pageId, UUID.randomUUID(), found(IssueType.MISSING_PRICE, IssueSeverity.HIGH))
            .touched().get(0);
        ledger.acknowledge(issue.id(), "ops@shop.test");

        assertThatThrownBy(() -> ledger.acknowledge(issue.id(), "ops@shop.test"))
            .isInstanceOf(IssueStateException.class);
        assertThatThrownBy(() -> ledger.acknowledge(UUID.randomUUID(), null))
            .isInstanceOf(IssueNotFoundException.class);
    }

    @Test
    void should_ReopenResolvedIssue_When_NoOtherActiveIssueOfType() {
        Issue issue = ledger.merge(pageId, UUID.randomUUID(), found(IssueType.MISSING_PRICE, IssueSeverity.HIGH))
            .touched().get(0);
        ledger.merge(pageId, UUID.randomUUID(), new ClassificationResult(List.of(), Set.of(IssueType.MISSING_PRICE)));

        Issue reopened = ledger.reopen(issue.id());

        assertThat(reopened.status()).isEqualTo(IssueStatus.OPEN);
        assertThat(reopened.acknowledgedAt()).isNull();
        assertThat(ledger.healthOf(pageId)).isEqualTo(PageHealth.CRITICAL);
    }

    @Test
    void should_RefuseReopen_When_AnotherIssueOfTypeIsActiveOrIssueAlreadyOpen() {
        Issue high = ledger.merge(pageId, UUID.randomUUID(), found(IssueType.SCRIPT_ERROR, IssueSeverity.HIGH))
            .touched().get(0);
        ledger.merge(pageId, UUID.randomUUID(), found(IssueType.SCRIPT_ERROR, IssueSeverity.LOW));
        Issue replacement = issueStore.findActive(pageId, IssueType.SCRIPT_ERROR).orElseThrow();

        assertThatThrownBy(() -> ledger.reopen(high.id())).isInstanceOf(IssueStateException.class);
        assertThatThrownBy(() -> ledger.reopen(replacement.id())).isInstanceOf(IssueStateException.class);
    }

    @Test
    void should_DeriveHealthFromOpenIssues() {
        assertThat(ledger.healthOf(pageId)).isEqualTo(PageHealth.HEALTHY);

        ledger.merge(pageId, UUID.randomUUID(), found(IssueType.TEMPLATE_ERROR, IssueSeverity.MEDIUM));
        assertThat(ledger.healthOf(pageId)).isEqualTo(PageHealth.WARNING);

        ledger.merge(pageId, UUID.randomUUID(), found(IssueType.MISSING_PURCHASE_CONTROL, IssueSeverity.HIGH));
        assertThat(ledger.healthOf(pageId)).isEqualTo(PageHealth.CRITICAL);
    }

    private static ClassificationResult found(IssueType type, IssueSeverity severity) {
        return new ClassificationResult(List.of(candidate(type, severity, 0.9)), Set.of());
    }
}
