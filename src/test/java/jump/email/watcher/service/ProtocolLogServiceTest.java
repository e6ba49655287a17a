package jump.email.watcher.service;

import jump.email.watcher.model.LogLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProtocolLogServiceTest {

    @Mock
    private ClientNotificationService clientNotificationService;

    @InjectMocks
    private ProtocolLogService protocolLogService;

    @Test
    void log_ShouldForwardEveryLevelToClients() {
        for (LogLevel level : LogLevel.values()) {
            protocolLogService.log(level, "hooks", "message at " + level.value());
            verify(clientNotificationService).sendLog(level, "hooks", "message at " + level.value());
        }
    }

    @Test
    void infoAndWarning_ShouldUseMatchingLevels() {
        protocolLogService.info("watcher", "IDLE started");
        protocolLogService.warning("watcher", "IDLE connect failed");

        verify(clientNotificationService).sendLog(LogLevel.INFO, "watcher", "IDLE started");
        verify(clientNotificationService).sendLog(LogLevel.WARNING, "watcher", "IDLE connect failed");
    }

    @Test
    void clientNotifications_WithoutClients_ShouldNotFail() {
        ClientNotificationService service = new ClientNotificationService();

        assertDoesNotThrow(() -> {
            service.sendResourceUpdated("email://work/unread");
            service.sendLog(LogLevel.INFO, "hooks", "nothing listening");
        });
        assertEquals(0, service.activeClients());
        service.register();
        assertEquals(1, service.activeClients());
    }
}
