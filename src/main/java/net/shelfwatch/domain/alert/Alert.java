package net.shelfwatch.domain.alert;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.UUID;

/**
 * Notification record for one issue on one channel. Unique per (issue, channel).
 */
public record Alert(
    UUID id,
    UUID issueId,
    UUID tenantId,
    AlertChannel channel,
    AlertDeliveryStatus status,
    @Nullable Instant sentAt,
    Instant createdAt
) {

    public boolean isSent() {
        return status == AlertDeliveryStatus.SENT;
    }
}
