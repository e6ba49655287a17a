package jump.email.watcher.service;

import jump.email.watcher.config.AsyncConfig;
import jump.email.watcher.model.AlertPayload;
import jump.email.watcher.model.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts alerts as JSON to a user-supplied URL. Delivery runs on the alert executor and is
 * never retried; failures only show up in the protocol log.
 */
@Slf4j
@Service
public class WebhookService {
    private static final String COMPONENT = "notifier";

    private final RestTemplate restTemplate;
    private final TaskExecutor executor;
    private final ProtocolLogService protocolLog;

    public WebhookService(@Qualifier(AsyncConfig.WEBHOOK_REST_TEMPLATE) RestTemplate restTemplate,
                          @Qualifier(AsyncConfig.ALERT_EXECUTOR) TaskExecutor executor,
                          ProtocolLogService protocolLog) {
        this.restTemplate = restTemplate;
        this.executor = executor;
        this.protocolLog = protocolLog;
    }

    public void dispatch(String url, AlertPayload payload) {
        Map<String, Object> body = buildBody(payload, Instant.now());
        try {
            executor.execute(() -> post(url, body));
        } catch (TaskRejectedException e) {
            log.debug("Webhook dispatch rejected: {}", e.getMessage());
            protocolLog.log(LogLevel.DEBUG, COMPONENT, "Webhook dispatch failed (non-fatal)");
        }
    }

    static Map<String, Object> buildBody(AlertPayload payload, Instant timestamp) {
        Map<String, Object> sender = new LinkedHashMap<>();
        sender.put("name", payload.getSender().getName());
        sender.put("address", payload.getSender().getAddress());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event", "email." + payload.getPriority().value());
        body.put("account", payload.getAccount());
        body.put("sender", sender);
        body.put("subject", payload.getSubject());
        body.put("priority", payload.getPriority().value());
        body.put("labels", payload.hasLabels() ? payload.getLabels() : List.of());
        body.put("rule", payload.getRuleName());
        body.put("timestamp", timestamp.toString());
        return body;
    }

    private void post(String url, Map<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                protocolLog.log(LogLevel.WARNING, COMPONENT, "Webhook returned " + response.getStatusCode().value());
            }
        } catch (HttpStatusCodeException e) {
            protocolLog.log(LogLevel.WARNING, COMPONENT, "Webhook returned " + e.getStatusCode().value());
        } catch (RuntimeException e) {
            // transport errors, and IllegalArgumentException for a URL that is not absolute
            log.debug("Webhook POST to {} failed: {}", url, e.getMessage());
            protocolLog.log(LogLevel.DEBUG, COMPONENT, "Webhook dispatch failed (non-fatal)");
        }
    }
}
