package jump.email.watcher.service;

import jump.email.watcher.model.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Pushes resource-updated and log messages to clients connected over Server-Sent Events.
 * Delivery is best-effort: an emitter that fails is dropped.
 */
@Slf4j
@Service
public class ClientNotificationService {
    private static final long EMITTER_TIMEOUT_MS = 0L;

    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    public SseEmitter register() {
        SseEmitter emitter = new SseEmitter(EMITTER_TIMEOUT_MS);
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(e -> emitters.remove(emitter));
        emitters.add(emitter);
        log.debug("Client event stream registered ({} active)", emitters.size());
        return emitter;
    }

    /**
     * Tells clients that the resource behind the URI has changed and should be re-read.
     */
    public void sendResourceUpdated(String uri) {
        send("resource-updated", Map.of("uri", uri));
    }

    public void sendLog(LogLevel level, String component, String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("level", level.value());
        data.put("logger", component);
        data.put("data", message);
        data.put("timestamp", Instant.now().toString());
        send("log", data);
    }

    public int activeClients() {
        return emitters.size();
    }

    private void send(String eventName, Object data) {
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name(eventName).data(data));
            } catch (IOException | IllegalStateException e) {
                emitters.remove(emitter);
                log.debug("Dropped client event stream: {}", e.getMessage());
            }
        }
    }
}
