package jump.email.watcher.service;

import jump.email.watcher.config.AlertsProperties;
import jump.email.watcher.config.HooksProperties;
import jump.email.watcher.model.AlertPayload;
import jump.email.watcher.model.AlertsConfigUpdate;
import jump.email.watcher.model.EmailAddress;
import jump.email.watcher.model.LogLevel;
import jump.email.watcher.model.NotificationTestResult;
import jump.email.watcher.model.Priority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotifierServiceTest {

    @Mock
    private DesktopNotificationService desktopNotifications;

    @Mock
    private WebhookService webhookService;

    @Mock
    private ProtocolLogService protocolLog;

    private HooksProperties hooksProperties;
    private NotifierService notifierService;

    @BeforeEach
    void setUp() {
        hooksProperties = new HooksProperties();
        hooksProperties.getAlerts().setDesktop(true);
        notifierService = new NotifierService(hooksProperties, desktopNotifications, webhookService, protocolLog);
    }

    private static AlertPayload payload(Priority priority) {
        return AlertPayload.builder()
                .account("work")
                .sender(new EmailAddress("Alice", "alice@example.com"))
                .subject("Contract")
                .priority(priority)
                .labels(List.of())
                .build();
    }

    @Test
    void alert_AtThreshold_ShouldShowDesktopNotification() throws Exception {
        notifierService.alert(payload(Priority.HIGH), false);

        verify(desktopNotifications).notify("Email Watcher - Important", "From: Alice\nContract", false);
    }

    @Test
    void alert_ShouldSanitizeSenderAndSubjectSeparatelyAndJoinWithLineBreak() throws Exception {
        // Given
        AlertPayload payload = AlertPayload.builder()
                .account("work")
                .sender(new EmailAddress("Eve \"$(id)\"", "eve@example.com"))
                .subject("Part one\npart two")
                .priority(Priority.URGENT)
                .build();

        // When
        notifierService.alert(payload, false);

        // Then
        verify(desktopNotifications).notify("Email Watcher - Urgent", "From: Eve (id)\nPart one part two", false);
    }

    @Test
    void alert_BelowThreshold_ShouldOnlyLog() {
        // When
        notifierService.alert(payload(Priority.NORMAL), false);

        // Then
        verify(protocolLog).log(LogLevel.INFO, "notifier", "[NORMAL] Alice: \"Contract\"");
        verifyNoInteractions(desktopNotifications, webhookService);
    }

    @Test
    void alert_BelowThresholdButForced_ShouldShowDesktopNotification() throws Exception {
        notifierService.alert(payload(Priority.NORMAL), true);

        verify(desktopNotifications).notify(anyString(), anyString(), eq(false));
    }

    @Test
    void alert_WhenDesktopDisabled_ShouldNotNotifyEvenIfForced() {
        hooksProperties.getAlerts().setDesktop(false);
        notifierService = new NotifierService(hooksProperties, desktopNotifications, webhookService, protocolLog);

        notifierService.alert(payload(Priority.URGENT), true);

        verifyNoInteractions(desktopNotifications);
    }

    @Test
    void alert_ShouldLogAtLevelMatchingPriority() {
        notifierService.alert(AlertPayload.builder()
                .account("work")
                .sender(new EmailAddress(null, "ops@example.com"))
                .subject("Outage")
                .priority(Priority.URGENT)
                .labels(List.of("Ops", "Incident"))
                .ruleName("ops-rule")
                .build(), false);
        notifierService.alert(payload(Priority.LOW), false);

        verify(protocolLog).log(LogLevel.ALERT, "notifier",
                "[URGENT] ops@example.com: \"Outage\" [Ops, Incident] (rule: ops-rule)");
        verify(protocolLog).log(LogLevel.DEBUG, "notifier", "[LOW] Alice: \"Contract\"");
    }

    @Test
    void alert_UrgentWithSoundEnabled_ShouldPlaySound() throws Exception {
        notifierService.updateConfig(update(u -> u.setSound(true)));

        notifierService.alert(payload(Priority.URGENT), false);
        notifierService.alert(payload(Priority.HIGH), false);

        verify(desktopNotifications).notify("Email Watcher - Urgent", "From: Alice\nContract", true);
        verify(desktopNotifications).notify("Email Watcher - Important", "From: Alice\nContract", false);
    }

    @Test
    void alert_ShouldCapDesktopNotificationsPerMinute() throws Exception {
        // When
        for (int i = 0; i < 8; i++) {
            notifierService.alert(payload(Priority.HIGH), false);
        }

        // Then
        verify(desktopNotifications, times(NotifierService.MAX_DESKTOP_PER_MINUTE))
                .notify(anyString(), anyString(), anyBoolean());
        verify(protocolLog, times(8)).log(eq(LogLevel.WARNING), eq("notifier"), anyString());

        // When the window resets
        notifierService.resetDesktopCounter();
        notifierService.alert(payload(Priority.HIGH), false);

        // Then
        verify(desktopNotifications, times(NotifierService.MAX_DESKTOP_PER_MINUTE + 1))
                .notify(anyString(), anyString(), anyBoolean());
    }

    @Test
    void alert_WhenDesktopFails_ShouldDegradeSilently() throws Exception {
        doThrow(new IOException("notify-send missing")).when(desktopNotifications)
                .notify(anyString(), anyString(), anyBoolean());

        assertDoesNotThrow(() -> notifierService.alert(payload(Priority.URGENT), false));
        verify(protocolLog).log(eq(LogLevel.ALERT), eq("notifier"), anyString());
    }

    @Test
    void alert_ShouldDispatchWebhookOnlyForConfiguredEvents() {
        // Given
        notifierService.updateConfig(update(u -> {
            u.setDesktop(false);
            u.setWebhookUrl("https://hooks.example.com/mail");
        }));
        AlertPayload urgent = payload(Priority.URGENT);

        // When
        notifierService.alert(urgent, false);
        notifierService.alert(payload(Priority.NORMAL), false);

        // Then
        verify(webhookService).dispatch("https://hooks.example.com/mail", urgent);
        verifyNoMoreInteractions(webhookService);
    }

    @Test
    void updateConfig_ShouldMergeOnlyGivenFields() {
        // When
        AlertsProperties updated = notifierService.updateConfig(update(u -> {
            u.setUrgencyThreshold(Priority.URGENT);
            u.setWebhookEvents(List.of(Priority.URGENT));
        }));

        // Then
        assertTrue(updated.isDesktop());
        assertFalse(updated.isSound());
        assertEquals(Priority.URGENT, updated.getUrgencyThreshold());
        assertEquals(List.of(Priority.URGENT), updated.getWebhookEvents());
        assertEquals(Priority.HIGH, hooksProperties.getAlerts().getUrgencyThreshold());
    }

    @Test
    void updateConfig_RaisedThreshold_ShouldSuppressHighDesktopAlerts() {
        notifierService.updateConfig(update(u -> u.setUrgencyThreshold(Priority.URGENT)));

        notifierService.alert(payload(Priority.HIGH), false);

        verifyNoInteractions(desktopNotifications);
    }

    @Test
    void getConfig_ShouldReturnDetachedCopy() {
        notifierService.getConfig().setDesktop(false);

        assertTrue(notifierService.getConfig().isDesktop());
    }

    @Test
    void sendTestNotification_ShouldBypassThresholdAndReportSuccess() throws Exception {
        when(desktopNotifications.getPlatform()).thenReturn(DesktopNotificationService.Platform.LINUX);

        NotificationTestResult result = notifierService.sendTestNotification(true);

        assertTrue(result.isSuccess());
        assertEquals("Test notification sent on linux", result.getMessage());
        verify(desktopNotifications).notify("Email Watcher - Test", "Desktop notifications are working (with sound)", true);
    }

    @Test
    void sendTestNotification_WhenToolFails_ShouldReportFailure() throws Exception {
        doThrow(new IOException("notify-send exited with status 1")).when(desktopNotifications)
                .notify(anyString(), anyString(), anyBoolean());

        NotificationTestResult result = notifierService.sendTestNotification(false);

        assertFalse(result.isSuccess());
        assertEquals("Test notification failed: notify-send exited with status 1", result.getMessage());
    }

    private static AlertsConfigUpdate update(Consumer<AlertsConfigUpdate> changes) {
        AlertsConfigUpdate update = new AlertsConfigUpdate();
        changes.accept(update);
        return update;
    }
}
