package jump.email.watcher.service;

import jump.email.watcher.config.AlertsProperties;
import jump.email.watcher.config.HooksProperties;
import jump.email.watcher.model.AlertPayload;
import jump.email.watcher.model.AlertsConfigUpdate;
import jump.email.watcher.model.LogLevel;
import jump.email.watcher.model.NotificationTestResult;
import jump.email.watcher.model.PlatformSupport;
import jump.email.watcher.model.Priority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Routes alerts to the protocol log, desktop notifications and a webhook, depending on
 * priority and the current alerts configuration.
 */
@Slf4j
@Service
public class NotifierService {
    static final int MAX_DESKTOP_PER_MINUTE = 5;
    private static final String COMPONENT = "notifier";

    private final DesktopNotificationService desktopNotifications;
    private final WebhookService webhookService;
    private final ProtocolLogService protocolLog;
    private final AtomicInteger desktopCount = new AtomicInteger();

    private volatile AlertsProperties config;

    public NotifierService(HooksProperties hooksProperties,
                           DesktopNotificationService desktopNotifications,
                           WebhookService webhookService,
                           ProtocolLogService protocolLog) {
        this.config = hooksProperties.getAlerts().copy();
        this.desktopNotifications = desktopNotifications;
        this.webhookService = webhookService;
        this.protocolLog = protocolLog;
    }

    /**
     * Dispatches one alert. The protocol log entry is always written; the desktop and webhook
     * channels are best-effort and never throw.
     *
     * @param forceDesktop show a desktop notification even below the urgency threshold
     */
    public void alert(AlertPayload payload, boolean forceDesktop) {
        AlertsProperties current = config;
        boolean meetsThreshold = payload.getPriority().meets(current.getUrgencyThreshold());

        protocolLog.log(LogLevel.forPriority(payload.getPriority()), COMPONENT, formatLogLine(payload));

        if (current.isDesktop() && (meetsThreshold || forceDesktop)) {
            sendDesktopNotification(payload, current);
        }

        if (current.hasWebhook() && current.getWebhookEvents().contains(payload.getPriority())) {
            webhookService.dispatch(current.getWebhookUrl(), payload);
        }
    }

    public void alert(AlertPayload payload) {
        alert(payload, false);
    }

    /**
     * Merges the non-null fields of the update into the runtime configuration.
     * The bound application properties are left alone.
     */
    public AlertsProperties updateConfig(AlertsConfigUpdate update) {
        synchronized (this) {
            AlertsProperties next = config.copy();
            if (update.getDesktop() != null) {
                next.setDesktop(update.getDesktop());
            }
            if (update.getSound() != null) {
                next.setSound(update.getSound());
            }
            if (update.getUrgencyThreshold() != null) {
                next.setUrgencyThreshold(update.getUrgencyThreshold());
            }
            if (update.getWebhookUrl() != null) {
                next.setWebhookUrl(update.getWebhookUrl());
            }
            if (update.getWebhookEvents() != null) {
                next.setWebhookEvents(new ArrayList<>(update.getWebhookEvents()));
            }
            config = next;
        }
        log.info("Alerts configuration updated: desktop={}, sound={}, threshold={}, webhook={}",
                config.isDesktop(), config.isSound(), config.getUrgencyThreshold().value(), config.hasWebhook());
        return getConfig();
    }

    public AlertsProperties getConfig() {
        return config.copy();
    }

    /**
     * Sends a notification regardless of threshold, enablement and the per-minute cap.
     */
    public NotificationTestResult sendTestNotification(boolean sound) {
        try {
            desktopNotifications.notify("Email Watcher - Test",
                    "Desktop notifications are working" + (sound ? " (with sound)" : ""), sound);
            return new NotificationTestResult(true,
                    "Test notification sent on " + desktopNotifications.getPlatform().name().toLowerCase());
        } catch (IOException e) {
            log.warn("Test notification failed: {}", e.getMessage());
            return new NotificationTestResult(false, "Test notification failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new NotificationTestResult(false, "Test notification interrupted");
        }
    }

    public PlatformSupport checkPlatformSupport() {
        return desktopNotifications.checkPlatformSupport();
    }

    @Scheduled(fixedRate = 60_000)
    public void resetDesktopCounter() {
        desktopCount.set(0);
    }

    static String formatLogLine(AlertPayload payload) {
        StringBuilder line = new StringBuilder()
                .append('[').append(payload.getPriority().name()).append("] ")
                .append(payload.getSender().displayName())
                .append(": \"").append(payload.getSubject()).append('"');
        if (payload.hasLabels()) {
            line.append(" [").append(String.join(", ", payload.getLabels())).append(']');
        }
        if (payload.getRuleName() != null) {
            line.append(" (rule: ").append(payload.getRuleName()).append(')');
        }
        return line.toString();
    }

    private void sendDesktopNotification(AlertPayload payload, AlertsProperties current) {
        if (desktopCount.incrementAndGet() > MAX_DESKTOP_PER_MINUTE) {
            log.debug("Desktop notification limit reached, skipping \"{}\"", payload.getSubject());
            return;
        }
        String title = "Email Watcher - " + (payload.getPriority() == Priority.URGENT ? "Urgent" : "Important");
        String body = "From: " + DesktopNotificationService.sanitizeForShell(payload.getSender().displayName())
                + "\n" + DesktopNotificationService.sanitizeForShell(payload.getSubject());
        boolean playSound = current.isSound() && payload.getPriority() == Priority.URGENT;
        try {
            desktopNotifications.notify(title, body, playSound);
        } catch (IOException e) {
            log.debug("Desktop notification failed: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
