package net.shelfwatch.application.alert;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.shelfwatch.domain.alert.Alert;
import net.shelfwatch.domain.alert.AlertChannel;
import net.shelfwatch.domain.alert.AlertStore;
import net.shelfwatch.domain.alert.Notification;
import net.shelfwatch.domain.alert.NotificationSender;
import net.shelfwatch.domain.issue.Issue;
import net.shelfwatch.domain.issue.IssueStepOutcome;
import net.shelfwatch.domain.scan.MonitoredPage;
import net.shelfwatch.domain.tenant.Tenant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Decides whether an issue warrants a notification and delivers it at most once per channel.
 *
 * <p>Each (issue, channel) slot is claimed in the alert store before delivery, so overlapping
 * passes cannot both send. A failed delivery leaves the slot FAILED and a later qualifying pass
 * claims it again. A claim that is never resolved, for example because the process died mid-delivery,
 * expires after the claim lease.</p>
 */
@Service
public class AlertGatekeeper {

    private static final Logger log = LoggerFactory.getLogger(AlertGatekeeper.class);

    private final AlertStore alertStore;
    private final Map<AlertChannel, NotificationSender> senders = new EnumMap<>(AlertChannel.class);
    private final Clock clock;
    private final Duration claimLease;
    private final Counter alertsSent;
    private final Counter alertsFailed;

    public AlertGatekeeper(AlertStore alertStore,
                           List<NotificationSender> notificationSenders,
                           Clock clock,
                           MeterRegistry meterRegistry,
                           @Value("${shelfwatch.alerts.claim-lease:PT10M}") Duration claimLease) {
        if (claimLease.isNegative() || claimLease.isZero()) {
            throw new IllegalArgumentException("shelfwatch.alerts.claim-lease must be positive");
        }
        this.alertStore = alertStore;
        this.clock = clock;
        this.claimLease = claimLease;
        for (NotificationSender sender : notificationSenders) {
            NotificationSender previous = senders.putIfAbsent(sender.channel(), sender);
            if (previous != null) {
                throw new IllegalStateException("Duplicate notification sender for channel " + sender.channel());
            }
        }
        this.alertsSent = Counter.builder("shelfwatch.alert.sent")
            .description("Notifications delivered")
            .register(meterRegistry);
        this.alertsFailed = Counter.builder("shelfwatch.alert.failed")
            .description("Notification deliveries that failed")
            .register(meterRegistry);
    }

    /**
     * Evaluates one issue and dispatches on every channel the tenant has enabled.
     *
     * @return one outcome per attempted channel; empty when the issue is not alert-worthy
     */
    public List<IssueStepOutcome> evaluate(Tenant tenant, MonitoredPage page, Issue issue) {
        boolean emailAlerted = alertStore.hasSent(issue.id(), AlertChannel.EMAIL);
        if (!AlertPolicy.shouldAlert(issue, emailAlerted)) {
            return List.of();
        }

        List<IssueStepOutcome> outcomes = new ArrayList<>();
        for (AlertChannel channel : enabledChannels(tenant)) {
            dispatch(tenant, page, issue, channel).ifPresent(outcomes::add);
        }
        return outcomes;
    }

    private Optional<IssueStepOutcome> dispatch(Tenant tenant, MonitoredPage page, Issue issue, AlertChannel channel) {
        NotificationSender sender = senders.get(channel);
        IssueStepOutcome.Step step = channel == AlertChannel.EMAIL
            ? IssueStepOutcome.Step.ALERT_EMAIL
            : IssueStepOutcome.Step.ALERT_ADMIN;
        if (sender == null) {
            log.warn("No notification sender registered for channel {}; issueId={} not alerted", channel, issue.id());
            return Optional.of(IssueStepOutcome.failed(issue.id(), step, "no sender for " + channel));
        }
        if (alertStore.hasSent(issue.id(), channel)) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        Optional<Alert> claimed = alertStore.claim(issue.id(), tenant.id(), channel, now, now.minus(claimLease));
        if (claimed.isEmpty()) {
            log.debug("Alert slot for issueId={} channel={} is held by another pass", issue.id(), channel);
            return Optional.empty();
        }

        Alert alert = claimed.get();
        try {
            sender.send(new Notification(tenant, page, issue, channel));
        } catch (RuntimeException ex) {
            alertStore.markFailed(alert.id());
            alertsFailed.increment();
            log.error("{} alert failed for issueId={} (tenant {}): {}", channel, issue.id(), tenant.id(), ex.getMessage(), ex);
            return Optional.of(IssueStepOutcome.failed(issue.id(), step, describe(ex)));
        }

        alertsSent.increment();
        try {
            alertStore.markSent(alert.id(), clock.instant());
        } catch (RuntimeException ex) {
            // Delivered; the PENDING claim blocks other passes until the lease expires
            log.error("{} alert delivered for issueId={} but alertId={} could not be marked sent: {}",
                channel, issue.id(), alert.id(), ex.getMessage(), ex);
            return Optional.of(IssueStepOutcome.succeeded(issue.id(), step, "sent; delivery record not saved"));
        }
        log.info("{} alert sent for issueId={} to tenant {}", channel, issue.id(), tenant.id());
        return Optional.of(IssueStepOutcome.succeeded(issue.id(), step, "sent"));
    }

    private static String describe(RuntimeException ex) {
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }

    private static List<AlertChannel> enabledChannels(Tenant tenant) {
        List<AlertChannel> channels = new ArrayList<>(2);
        if (tenant.emailAlertsEnabled()) {
            channels.add(AlertChannel.EMAIL);
        }
        if (tenant.adminAlertsEnabled()) {
            channels.add(AlertChannel.ADMIN);
        }
        return channels;
    }
}
