package net.shelfwatch.adapters.notification;

import lombok.extern.slf4j.Slf4j;
import net.shelfwatch.domain.alert.AlertChannel;
import net.shelfwatch.domain.alert.Notification;
import net.shelfwatch.domain.alert.NotificationSender;
import org.springframework.stereotype.Component;

/**
 * Admin-surface notification. Delivery is recorded in the application log, which the
 * admin console tails.
 */
@Slf4j
@Component
public class AdminNotificationSender implements NotificationSender {

    @Override
    public AlertChannel channel() {
        return AlertChannel.ADMIN;
    }

    @Override
    public void send(Notification notification) {
        log.info("Admin notification: tenant={} page={} issueId={} type={} severity={} occurrences={} aiConfirmed={}",
            notification.tenant().shopDomain(),
            notification.page().id(),
            notification.issue().id(),
            notification.issue().type().code(),
            notification.issue().severity(),
            notification.issue().occurrenceCount(),
            notification.issue().isAiConfirmed());
    }
}
