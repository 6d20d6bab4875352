package com.autoping.monitor.ping.notify;

import com.autoping.monitor.ping.model.FailureHistoryEntry;
import com.autoping.monitor.ping.model.PingJob;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/** Renders the plain-text and HTML bodies of failure and recovery alerts. */
@Component
public class AlertMessageFormatter {
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneId.systemDefault());
    private static final String NO_HISTORY = "No detailed failure history available";

    public AlertMessage failure(PingJob job, List<FailureHistoryEntry> history, int pauseMinutes, Instant generatedAt) {
        String failureList = failureList(history);
        String lastResult = job.lastResult() == null ? "N/A" : job.lastResult();
        String subject = "AutoPing Alert: " + job.url() + " is DOWN";

        String text = """
            AutoPing Alert - Domain Unreachable
            ====================================

            Your monitored domain has failed to respond after %d consecutive ping attempts.

            Domain: %s
            Status: OFFLINE
            Check Interval: %s
            Failure Count: %d consecutive failures
            Last Checked: %s
            Last Result: %s

            Failure History:
            %s

            Next Steps:
            - AutoPing will pause monitoring for %d minutes
            - After %d minutes, normal ping interval will resume
            - You will be notified again only if the issue persists

            ---
            This is an automated notification from AutoPing.
            Monitoring Job ID: %d | Generated at %s
            """.formatted(
            job.failureCount(),
            job.url(),
            job.checkInterval().label(),
            job.failureCount(),
            formatTime(job.lastRun()),
            lastResult,
            failureList,
            pauseMinutes,
            pauseMinutes,
            job.id(),
            formatTime(generatedAt)
        );

        String html = """
            <!DOCTYPE html>
            <html>
            <body style="font-family: Arial, sans-serif; color: #333; max-width: 600px; margin: 0 auto;">
              <h1 style="background: #764ba2; color: white; padding: 20px; margin: 0;">AutoPing Alert</h1>
              <p><strong>Alert:</strong> Your monitored domain has failed to respond after %d consecutive ping attempts.</p>
              <table cellpadding="6">
                <tr><td><strong>Domain:</strong></td><td>%s</td></tr>
                <tr><td><strong>Status:</strong></td><td style="color: #dc3545;"><strong>OFFLINE</strong></td></tr>
                <tr><td><strong>Check Interval:</strong></td><td>%s</td></tr>
                <tr><td><strong>Failure Count:</strong></td><td>%d consecutive failures</td></tr>
                <tr><td><strong>Last Checked:</strong></td><td>%s</td></tr>
                <tr><td><strong>Last Result:</strong></td><td>%s</td></tr>
              </table>
              <h3>Failure History:</h3>
              <pre style="background: #f8f9fa; padding: 12px;">%s</pre>
              <p><strong>Next Steps:</strong></p>
              <ul>
                <li>AutoPing will pause monitoring for %d minutes</li>
                <li>After %d minutes, normal ping interval will resume</li>
                <li>You will be notified again only if the issue persists</li>
              </ul>
              <p style="font-size: 12px; color: #666;">This is an automated notification from AutoPing.<br>
              Monitoring Job ID: %d | Generated at %s</p>
            </body>
            </html>
            """.formatted(
            job.failureCount(),
            escape(job.url()),
            escape(job.checkInterval().label()),
            job.failureCount(),
            escape(formatTime(job.lastRun())),
            escape(lastResult),
            escape(failureList),
            pauseMinutes,
            pauseMinutes,
            job.id(),
            escape(formatTime(generatedAt))
        );
        return new AlertMessage(subject, text, html);
    }

    public AlertMessage recovery(PingJob job, String downtime, Instant recoveredAt) {
        String lastResult = job.lastResult() == null ? "Success" : job.lastResult();
        String interval = job.restorableInterval().label();
        String subject = "AutoPing Recovery: " + job.url() + " is BACK ONLINE";

        String text = """
            AutoPing Recovery - Domain Back Online
            ======================================

            Good News! Your monitored domain is now responding successfully!

            Domain: %s
            Status: ONLINE
            Downtime Duration: %s
            Recovery Time: %s
            Check Interval: %s
            Last Result: %s

            Status:
            - Domain is responding normally
            - AutoPing has resumed normal monitoring at %s intervals
            - You will be notified if the issue occurs again

            ---
            This is an automated notification from AutoPing.
            Monitoring Job ID: %d | Generated at %s
            """.formatted(
            job.url(),
            downtime,
            formatTime(recoveredAt),
            interval,
            lastResult,
            interval,
            job.id(),
            formatTime(recoveredAt)
        );

        String html = """
            <!DOCTYPE html>
            <html>
            <body style="font-family: Arial, sans-serif; color: #333; max-width: 600px; margin: 0 auto;">
              <h1 style="background: #16a34a; color: white; padding: 20px; margin: 0;">AutoPing Recovery</h1>
              <p><strong>Good News:</strong> Your monitored domain is now responding successfully!</p>
              <table cellpadding="6">
                <tr><td><strong>Domain:</strong></td><td>%s</td></tr>
                <tr><td><strong>Status:</strong></td><td style="color: #22c55e;"><strong>ONLINE</strong></td></tr>
                <tr><td><strong>Downtime Duration:</strong></td><td>%s</td></tr>
                <tr><td><strong>Recovery Time:</strong></td><td>%s</td></tr>
                <tr><td><strong>Check Interval:</strong></td><td>%s</td></tr>
                <tr><td><strong>Last Result:</strong></td><td>%s</td></tr>
              </table>
              <ul>
                <li>Domain is responding normally</li>
                <li>AutoPing has resumed normal monitoring at %s intervals</li>
                <li>You will be notified if the issue occurs again</li>
              </ul>
              <p style="font-size: 12px; color: #666;">This is an automated notification from AutoPing.<br>
              Monitoring Job ID: %d | Generated at %s</p>
            </body>
            </html>
            """.formatted(
            escape(job.url()),
            escape(downtime),
            escape(formatTime(recoveredAt)),
            escape(interval),
            escape(lastResult),
            escape(interval),
            job.id(),
            escape(formatTime(recoveredAt))
        );
        return new AlertMessage(subject, text, html);
    }

    String failureList(List<FailureHistoryEntry> history) {
        if (history == null || history.isEmpty()) {
            return NO_HISTORY;
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < history.size(); i++) {
            FailureHistoryEntry entry = history.get(i);
            if (i > 0) {
                builder.append('\n');
            }
            builder.append("  ")
                .append(i + 1)
                .append(". ")
                .append(formatTime(entry.time()))
                .append(" - ")
                .append(entry.result());
        }
        return builder.toString();
    }

    private String formatTime(Instant instant) {
        return instant == null ? "N/A" : TIMESTAMP_FORMAT.format(instant);
    }

    private String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
