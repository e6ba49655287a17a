package jump.email.watcher.controller;

import jump.email.watcher.service.ClientNotificationService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Server-Sent Events stream of resource updates and protocol log entries.
 */
@RestController
public class ClientEventsController {
    private final ClientNotificationService clientNotificationService;

    public ClientEventsController(ClientNotificationService clientNotificationService) {
        this.clientNotificationService = clientNotificationService;
    }

    @GetMapping(path = "/api/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        return clientNotificationService.register();
    }
}
