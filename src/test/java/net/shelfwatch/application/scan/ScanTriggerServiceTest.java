package net.shelfwatch.application.scan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.UUID;
import net.shelfwatch.domain.scan.MonitoredPage;
import net.shelfwatch.domain.scan.ScanDepth;
import net.shelfwatch.support.Fixtures;
import org.junit.jupiter.api.Test;

class ScanTriggerServiceTest {

    private final ScanOrchestrator orchestrator = mock(ScanOrchestrator.class);
    private final ScanTaskQueue queue = mock(ScanTaskQueue.class);
    private final ScanTriggerService triggerService = new ScanTriggerService(orchestrator, queue);
    private final MonitoredPage page = Fixtures.page(Fixtures.activeTenant());

    @Test
    void should_EnqueueWithForcedDepth_When_PageEligible() {
        when(orchestrator.loadPage(page.id())).thenReturn(page);
        when(orchestrator.checkEligibility(page)).thenReturn(Optional.empty());
        when(queue.submit(page.id(), ScanDepth.DEEP)).thenReturn(TriggerResult.enqueued(page.id()));

        TriggerResult result = triggerService.triggerScan(page.id(), ScanDepth.DEEP);

        assertThat(result.enqueued()).isTrue();
        verify(queue).submit(page.id(), ScanDepth.DEEP);
    }

    @Test
    void should_SkipWithoutEnqueue_When_TenantNotEntitled() {
        when(orchestrator.loadPage(page.id())).thenReturn(page);
        when(orchestrator.checkEligibility(page)).thenReturn(Optional.of(SkipReason.TENANT_NOT_ENTITLED));

        TriggerResult result = triggerService.triggerScan(page.id(), null);

        assertThat(result.enqueued()).isFalse();
        assertThat(result.skipReason()).isEqualTo(SkipReason.TENANT_NOT_ENTITLED);
        verify(queue, never()).submit(any(), any());
    }

    @Test
    void should_PropagateNotFound_When_PageMissing() {
        UUID missing = UUID.randomUUID();
        when(orchestrator.loadPage(missing)).thenThrow(new PageNotFoundException(missing));

        assertThatThrownBy(() -> triggerService.triggerScan(missing, null)).isInstanceOf(PageNotFoundException.class);
        verify(queue, never()).submit(any(), any());
    }
}
