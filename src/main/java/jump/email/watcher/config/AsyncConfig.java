package jump.email.watcher.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Timers and thread pools: a scheduler for batch, reconnect and rate-limit timers,
 * and a small executor for fire-and-forget alert delivery.
 */
@Configuration
@EnableScheduling
public class AsyncConfig {
    public static final String ALERT_EXECUTOR = "alertDispatchExecutor";
    public static final String WEBHOOK_REST_TEMPLATE = "webhookRestTemplate";
    private static final Duration WEBHOOK_TIMEOUT = Duration.ofSeconds(5);

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("watcher-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Bean(name = ALERT_EXECUTOR)
    public ThreadPoolTaskExecutor alertDispatchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2); // Core threads
        executor.setMaxPoolSize(4); // Maximum threads
        executor.setQueueCapacity(100); // Queue capacity
        executor.setThreadNamePrefix("alert-dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Bean(name = WEBHOOK_REST_TEMPLATE)
    public RestTemplate webhookRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(WEBHOOK_TIMEOUT)
                .setReadTimeout(WEBHOOK_TIMEOUT)
                .build();
    }
}
