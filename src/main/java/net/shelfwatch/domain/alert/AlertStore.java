package net.shelfwatch.domain.alert;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port for alerts.
 */
public interface AlertStore {

    boolean hasSent(UUID issueId, AlertChannel channel);

    /**
     * Atomically reserves the (issue, channel) slot for delivery.
     *
     * <p>Inserts a PENDING alert, or flips an existing FAILED alert back to PENDING. A PENDING alert
     * claimed before {@code staleBefore} is treated as abandoned and claimed again. Returns empty when
     * another pass holds a live claim or the alert was delivered.</p>
     *
     * @param claimedAt time recorded on the claim
     * @param staleBefore PENDING claims older than this are taken over
     */
    Optional<Alert> claim(UUID issueId, UUID tenantId, AlertChannel channel, Instant claimedAt, Instant staleBefore);

    void markSent(UUID alertId, Instant sentAt);

    void markFailed(UUID alertId);

    List<Alert> findByIssue(UUID issueId);
}
