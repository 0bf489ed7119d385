package net.shelfwatch.application.scan;

import jakarta.annotation.Nullable;
import java.util.UUID;

/**
 * Answer to a scan trigger: the job was enqueued, or skipped with a reason.
 */
public record TriggerResult(UUID pageId, boolean enqueued, @Nullable SkipReason skipReason) {

    public static TriggerResult enqueued(UUID pageId) {
        return new TriggerResult(pageId, true, null);
    }

    public static TriggerResult skipped(UUID pageId, SkipReason reason) {
        return new TriggerResult(pageId, false, reason);
    }
}
