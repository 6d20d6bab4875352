package com.autoping.monitor.ping.notify;

import com.autoping.monitor.config.MonitorProperties;
import com.autoping.monitor.ping.model.FailureHistoryEntry;
import com.autoping.monitor.ping.model.PingJob;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.mail.MailProperties;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;

/**
 * Best-effort alert delivery. Every failure mode (mail disabled, no transport, no recipient,
 * transport error) is reported as {@code false}; nothing is thrown to the caller.
 */
@Service
public class EmailAlertService {
    private static final Logger log = LoggerFactory.getLogger(EmailAlertService.class);

    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final ObjectProvider<MailProperties> mailPropertiesProvider;
    private final AlertMessageFormatter formatter;
    private final MonitorProperties properties;
    private final Clock clock;

    public EmailAlertService(
        ObjectProvider<JavaMailSender> mailSenderProvider,
        ObjectProvider<MailProperties> mailPropertiesProvider,
        AlertMessageFormatter formatter,
        MonitorProperties properties,
        Clock clock
    ) {
        this.mailSenderProvider = mailSenderProvider;
        this.mailPropertiesProvider = mailPropertiesProvider;
        this.formatter = formatter;
        this.properties = properties;
        this.clock = clock;
    }

    public boolean sendFailure(PingJob job, List<FailureHistoryEntry> history) {
        if (!readyToSend(job, "failure")) {
            return false;
        }
        AlertMessage message = formatter.failure(
            job,
            history,
            properties.getEscalation().getPauseDurationMinutes(),
            clock.instant()
        );
        return deliver(job, message, "failure");
    }

    public boolean sendRecovery(PingJob job, String downtime) {
        if (!readyToSend(job, "recovery")) {
            return false;
        }
        AlertMessage message = formatter.recovery(job, downtime, clock.instant());
        return deliver(job, message, "recovery");
    }

    private boolean readyToSend(PingJob job, String kind) {
        if (!properties.getMail().isEnabled()) {
            log.debug("Mail disabled; skipping {} alert for job {}", kind, job.id());
            return false;
        }
        if (!job.hasAlertEmail()) {
            log.warn("No alert email configured for job {}; skipping {} alert", job.id(), kind);
            return false;
        }
        return true;
    }

    private boolean deliver(PingJob job, AlertMessage message, String kind) {
        JavaMailSender sender = mailSenderProvider.getIfAvailable();
        if (sender == null) {
            log.warn("No mail transport configured; skipping {} alert for job {}", kind, job.id());
            return false;
        }
        try {
            MimeMessage mime = sender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mime, true, StandardCharsets.UTF_8.name());
            String from = resolveFrom();
            if (from != null) {
                helper.setFrom(from);
            }
            helper.setTo(job.alertEmail().trim());
            helper.setSubject(message.subject());
            helper.setText(message.text(), message.html());
            sender.send(mime);
            log.info("Sent {} alert for job {} to {}", kind, job.id(), job.alertEmail());
            return true;
        } catch (MailException | MessagingException e) {
            log.warn("Failed to send {} alert for job {} to {}: {}", kind, job.id(), job.alertEmail(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.warn("Unexpected error sending {} alert for job {}", kind, job.id(), e);
            return false;
        }
    }

    private String resolveFrom() {
        String configured = properties.getMail().getFrom();
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        MailProperties mailProperties = mailPropertiesProvider.getIfAvailable();
        if (mailProperties != null && mailProperties.getUsername() != null && !mailProperties.getUsername().isBlank()) {
            return mailProperties.getUsername().trim();
        }
        return null;
    }
}
