package jump.email.watcher.controller;

import jump.email.watcher.config.AlertsProperties;
import jump.email.watcher.model.AlertsConfigUpdate;
import jump.email.watcher.model.NotificationTestResult;
import jump.email.watcher.service.NotifierService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Alert diagnostics, test notifications and runtime alert settings.
 */
@RestController
@RequestMapping("/api/alerts")
public class AlertsController {
    private final NotifierService notifierService;

    public AlertsController(NotifierService notifierService) {
        this.notifierService = notifierService;
    }

    @GetMapping("/diagnostics")
    public Map<String, Object> diagnostics() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("platform", notifierService.checkPlatformSupport());
        body.put("config", notifierService.getConfig());
        return body;
    }

    @PostMapping("/test")
    public ResponseEntity<NotificationTestResult> sendTestNotification(
            @RequestParam(defaultValue = "false") boolean sound) {
        NotificationTestResult result = notifierService.sendTestNotification(sound);
        return result.isSuccess() ? ResponseEntity.ok(result) : ResponseEntity.status(502).body(result);
    }

    /**
     * Changes alert settings until the next restart; omitted fields keep their value.
     */
    @PatchMapping("/config")
    public ResponseEntity<AlertsProperties> updateConfig(@RequestBody AlertsConfigUpdate update) {
        if (update.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(notifierService.updateConfig(update));
    }
}
