package net.shelfwatch.domain.scan;

import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port for scan runs.
 */
public interface ScanRunStore {

    /**
     * Inserts a new run in PENDING state.
     */
    ScanRun create(UUID pageId, ScanDepth depth);

    /**
     * Persists a status transition produced by {@link ScanRun}.
     */
    ScanRun save(ScanRun scanRun);

    Optional<ScanRun> findById(UUID scanRunId);

    boolean existsForPage(UUID pageId);

    long countForPage(UUID pageId);
}
