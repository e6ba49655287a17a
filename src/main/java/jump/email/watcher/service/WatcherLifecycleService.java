package jump.email.watcher.service;

import jakarta.annotation.PreDestroy;
import jump.email.watcher.model.ClientCapabilities;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Starts the hooks and the watcher once the application is ready and stops them on shutdown.
 * Hooks subscribe first so the first arrivals are not missed.
 */
@Slf4j
@Service
public class WatcherLifecycleService {
    private final WatcherService watcherService;
    private final HooksService hooksService;
    private final SamplingClient samplingClient;

    public WatcherLifecycleService(WatcherService watcherService, HooksService hooksService,
                                   SamplingClient samplingClient) {
        this.watcherService = watcherService;
        this.hooksService = hooksService;
        this.samplingClient = samplingClient;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        ClientCapabilities capabilities = new ClientCapabilities(samplingClient.isAvailable());
        log.info("Sampling {}", capabilities.isSampling() ? "available" : "not available, triage will fall back to notify");
        hooksService.start(capabilities);
        watcherService.start();
    }

    @PreDestroy
    public void shutdown() {
        watcherService.stop();
        hooksService.stop();
    }
}
