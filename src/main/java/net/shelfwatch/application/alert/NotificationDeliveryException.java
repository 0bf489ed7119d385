package net.shelfwatch.application.alert;

import net.shelfwatch.domain.alert.AlertChannel;

/**
 * Thrown by notification senders when a message could not be delivered.
 */
public class NotificationDeliveryException extends RuntimeException {

    private final AlertChannel channel;

    public NotificationDeliveryException(AlertChannel channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }

    public AlertChannel channel() {
        return channel;
    }
}
