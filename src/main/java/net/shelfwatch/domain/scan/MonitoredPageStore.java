package net.shelfwatch.domain.scan;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port for monitored pages. Callers always pass the visibility they expect.
 */
public interface MonitoredPageStore {

    Optional<MonitoredPage> findById(UUID pageId, PageVisibility visibility);

    /**
     * Pages of a tenant with monitoring enabled that were never scanned or last scanned before {@code dueBefore}.
     */
    List<MonitoredPage> findDueForScan(UUID tenantId, Instant dueBefore, PageVisibility visibility);

    void updateHealth(UUID pageId, PageHealth health);

    void markScanned(UUID pageId, Instant scannedAt);
}
