package net.shelfwatch.domain.alert;

import net.shelfwatch.domain.issue.Issue;
import net.shelfwatch.domain.scan.MonitoredPage;
import net.shelfwatch.domain.tenant.Tenant;

/**
 * Payload handed to a {@link NotificationSender}.
 */
public record Notification(Tenant tenant, MonitoredPage page, Issue issue, AlertChannel channel) {
}
