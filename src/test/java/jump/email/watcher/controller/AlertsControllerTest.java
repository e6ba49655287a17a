package jump.email.watcher.controller;

import jump.email.watcher.config.AlertsProperties;
import jump.email.watcher.model.AlertsConfigUpdate;
import jump.email.watcher.model.NotificationTestResult;
import jump.email.watcher.model.PlatformSupport;
import jump.email.watcher.model.Priority;
import jump.email.watcher.service.NotifierService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class AlertsControllerTest {

    @Mock
    private NotifierService notifierService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AlertsController(notifierService)).build();
    }

    @Test
    void diagnostics_ShouldReturnPlatformAndConfig() throws Exception {
        // Given
        when(notifierService.checkPlatformSupport()).thenReturn(PlatformSupport.builder()
                .platform("linux")
                .desktopTool(new PlatformSupport.Tool("notify-send", true))
                .soundTool(new PlatformSupport.Tool("paplay", false))
                .supported(true)
                .issue("paplay was not found on PATH; sound alerts will be silent")
                .build());
        when(notifierService.getConfig()).thenReturn(new AlertsProperties());

        // When / Then
        mockMvc.perform(get("/api/alerts/diagnostics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.platform.platform").value("linux"))
                .andExpect(jsonPath("$.platform.desktopTool.available").value(true))
                .andExpect(jsonPath("$.config.urgencyThreshold").value("high"))
                .andExpect(jsonPath("$.config.webhookEvents[0]").value("urgent"));
    }

    @Test
    void sendTest_ShouldPassSoundFlag() throws Exception {
        when(notifierService.sendTestNotification(true)).thenReturn(new NotificationTestResult(true, "sent"));

        mockMvc.perform(post("/api/alerts/test").param("sound", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    void sendTest_WhenItFails_ShouldReturnBadGateway() throws Exception {
        when(notifierService.sendTestNotification(false)).thenReturn(new NotificationTestResult(false, "no tool"));

        mockMvc.perform(post("/api/alerts/test"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.message").value("no tool"));
    }

    @Test
    void updateConfig_ShouldBindPartialUpdate() throws Exception {
        // Given
        AlertsProperties updated = new AlertsProperties();
        updated.setUrgencyThreshold(Priority.URGENT);
        when(notifierService.updateConfig(any())).thenReturn(updated);

        // When
        mockMvc.perform(patch("/api/alerts/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"urgencyThreshold\":\"urgent\",\"desktop\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.urgencyThreshold").value("urgent"));

        // Then
        ArgumentCaptor<AlertsConfigUpdate> captor = ArgumentCaptor.forClass(AlertsConfigUpdate.class);
        verify(notifierService).updateConfig(captor.capture());
        assertEquals(Priority.URGENT, captor.getValue().getUrgencyThreshold());
        assertEquals(Boolean.TRUE, captor.getValue().getDesktop());
        assertNull(captor.getValue().getSound());
    }

    @Test
    void updateConfig_WithNoFields_ShouldBeRejected() throws Exception {
        mockMvc.perform(patch("/api/alerts/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verify(notifierService, never()).updateConfig(any());
    }
}
