package net.shelfwatch.application.scan;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Single-flight marker per page: at most one scan may hold a page at a time.
 */
@Component
public class PageScanGuard {

    private final Map<UUID, Instant> inFlight = new ConcurrentHashMap<>();

    /**
     * @return true when the caller now holds the page and must call {@link #release(UUID)}
     */
    public boolean tryAcquire(UUID pageId) {
        return inFlight.putIfAbsent(pageId, Instant.now()) == null;
    }

    public void release(UUID pageId) {
        inFlight.remove(pageId);
    }

    public boolean isRunning(UUID pageId) {
        return inFlight.containsKey(pageId);
    }

    public int inFlightCount() {
        return inFlight.size();
    }
}
