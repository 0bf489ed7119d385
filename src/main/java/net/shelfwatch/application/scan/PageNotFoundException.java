package net.shelfwatch.application.scan;

import java.util.UUID;

/**
 * The page is missing or soft-deleted. Never retried.
 */
public class PageNotFoundException extends RuntimeException {

    private final UUID pageId;

    public PageNotFoundException(UUID pageId) {
        super("Monitored page not found: " + pageId);
        this.pageId = pageId;
    }

    public UUID pageId() {
        return pageId;
    }
}
