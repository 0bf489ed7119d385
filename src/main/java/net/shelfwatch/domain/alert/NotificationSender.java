package net.shelfwatch.domain.alert;

/**
 * Port for delivering a notification on one channel.
 */
public interface NotificationSender {

    AlertChannel channel();

    /**
     * Delivers the notification.
     *
     * @throws RuntimeException when delivery fails; the alert is then marked failed
     */
    void send(Notification notification);
}
