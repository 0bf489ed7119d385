package net.shelfwatch.adapters.notification;

import net.shelfwatch.application.alert.NotificationDeliveryException;
import net.shelfwatch.domain.alert.AlertChannel;
import net.shelfwatch.domain.alert.Notification;
import net.shelfwatch.domain.alert.NotificationSender;
import net.shelfwatch.domain.issue.Issue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

/**
 * Emails the merchant about a confirmed issue.
 */
@Component
public class EmailNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(EmailNotificationSender.class);

    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final String fromAddress;
    private final String appBaseUrl;

    public EmailNotificationSender(ObjectProvider<JavaMailSender> mailSenderProvider,
                                   @Value("${shelfwatch.alerts.from:alerts@shelfwatch.net}") String fromAddress,
                                   @Value("${shelfwatch.alerts.app-base-url:http://localhost:8080}") String appBaseUrl) {
        this.mailSenderProvider = mailSenderProvider;
        this.fromAddress = fromAddress;
        this.appBaseUrl = appBaseUrl.endsWith("/") ? appBaseUrl.substring(0, appBaseUrl.length() - 1) : appBaseUrl;
    }

    @Override
    public AlertChannel channel() {
        return AlertChannel.EMAIL;
    }

    @Override
    public void send(Notification notification) {
        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (mailSender == null) {
            throw new NotificationDeliveryException(AlertChannel.EMAIL,
                "No mail sender configured (set spring.mail.host)", null);
        }
        SimpleMailMessage message = compose(notification);
        try {
            mailSender.send(message);
            log.debug("Alert email for issueId={} handed to mail server", notification.issue().id());
        } catch (MailException ex) {
            throw new NotificationDeliveryException(AlertChannel.EMAIL,
                "Email delivery to " + notification.tenant().alertRecipient() + " failed", ex);
        }
    }

    SimpleMailMessage compose(Notification notification) {
        Issue issue = notification.issue();
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(fromAddress);
        message.setTo(notification.tenant().alertRecipient());
        message.setSubject("Shelfwatch: Issue detected on " + notification.page().displayName());

        StringBuilder body = new StringBuilder()
            .append(issue.title()).append("\n\n")
            .append(issue.ai().explanation() != null ? issue.ai().explanation() : issue.description()).append("\n");
        if (issue.ai().suggestedFix() != null) {
            body.append("\nHow to fix it:\n").append(issue.ai().suggestedFix()).append("\n");
        }
        body.append("\nPage: ").append(notification.page().url())
            .append("\nDetails: ").append(appBaseUrl).append("/issues/").append(issue.id()).append("\n");
        message.setText(body.toString());
        return message;
    }
}
