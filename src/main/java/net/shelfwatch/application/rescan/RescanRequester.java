package net.shelfwatch.application.rescan;

import java.time.Duration;
import java.util.UUID;

/**
 * Accepts a delayed scan request for a page.
 */
public interface RescanRequester {

    void scheduleRescan(UUID pageId, Duration delay);
}
