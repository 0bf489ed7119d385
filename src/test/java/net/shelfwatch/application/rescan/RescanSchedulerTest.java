package net.shelfwatch.application.rescan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import net.shelfwatch.config.ScanProperties;
import net.shelfwatch.domain.issue.AiAnnotation;
import net.shelfwatch.domain.issue.Issue;
import net.shelfwatch.domain.issue.IssueSeverity;
import net.shelfwatch.domain.issue.IssueType;
import net.shelfwatch.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RescanSchedulerTest {

    @Mock
    private RescanRequester rescanRequester;

    private final UUID pageId = UUID.randomUUID();
    private RescanScheduler scheduler;

    @BeforeEach
    void setUp() {
        ScanProperties properties = new ScanProperties();
        properties.setRescanDelay(Duration.ofMinutes(45));
        scheduler = new RescanScheduler(rescanRequester, properties);
    }

    @Test
    void should_RequestDelayedRescan_When_HighSeverityIssueSeenOnceWithoutAiConfirmation() {
        Issue unconfirmed = Fixtures.openIssue(pageId, IssueType.MISSING_PURCHASE_CONTROL, IssueSeverity.HIGH, 0.8);

        boolean scheduled = scheduler.scheduleIfNeeded(pageId, List.of(unconfirmed));

        assertThat(scheduled).isTrue();
        verify(rescanRequester).scheduleRescan(pageId, Duration.ofMinutes(45));
    }

    @Test
    void should_NotRescan_When_IssuesAreConfirmedRecurringOrMinor() {
        Issue aiConfirmed = Fixtures.openIssue(pageId, IssueType.MISSING_PRICE, IssueSeverity.HIGH, 0.8)
            .withAi(new AiAnnotation(true, 0.9, "visible", null, null, Fixtures.NOW));
        Issue recurring = Fixtures.openIssue(pageId, IssueType.SCRIPT_ERROR, IssueSeverity.HIGH, 0.8)
            .observedAgain(UUID.randomUUID(),
                Fixtures.candidate(IssueType.SCRIPT_ERROR, IssueSeverity.HIGH, 0.8), Fixtures.NOW, false);
        Issue medium = Fixtures.openIssue(pageId, IssueType.TEMPLATE_ERROR, IssueSeverity.MEDIUM, 0.9);
        Issue acknowledged = Fixtures.openIssue(pageId, IssueType.BROKEN_CHECKOUT, IssueSeverity.HIGH, 0.9)
            .acknowledged("merchant", Fixtures.NOW);

        boolean scheduled = scheduler.scheduleIfNeeded(pageId, List.of(aiConfirmed, recurring, medium, acknowledged));

        assertThat(scheduled).isFalse();
        verify(rescanRequester, never()).scheduleRescan(any(), any());
    }
}
