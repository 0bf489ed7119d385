package net.shelfwatch.application.scan;

import java.util.UUID;

/**
 * The scan engine could not render the page. Retried with backoff by {@link ScanTaskQueue}.
 */
public class ScanEngineException extends RuntimeException {

    private final UUID pageId;

    public ScanEngineException(UUID pageId, String message) {
        this(pageId, message, null);
    }

    public ScanEngineException(UUID pageId, String message, Throwable cause) {
        super(message, cause);
        this.pageId = pageId;
    }

    public UUID pageId() {
        return pageId;
    }
}
