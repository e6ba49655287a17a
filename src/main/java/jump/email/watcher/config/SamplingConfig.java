package jump.email.watcher.config;

import com.theokanning.openai.service.OpenAiService;
import jump.email.watcher.service.GeminiSamplingService;
import jump.email.watcher.service.OpenAiSamplingService;
import jump.email.watcher.service.SamplingClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration to switch between AI providers.
 * Set ai.provider=openai, ai.provider=gemini or ai.provider=none in application.properties
 */
@Configuration
public class SamplingConfig {
    private static final Duration AI_TIMEOUT = Duration.ofSeconds(30);

    @Bean
    @ConditionalOnProperty(name = "ai.provider", havingValue = "openai", matchIfMissing = true)
    public SamplingClient openAiSamplingClient(@Value("${openai.api.key:}") String apiKey,
                                               @Value("${openai.model:gpt-3.5-turbo}") String model) {
        boolean configured = apiKey != null && !apiKey.isBlank() && !apiKey.startsWith("${");
        return new OpenAiSamplingService(new OpenAiService(apiKey, AI_TIMEOUT), model, configured);
    }

    @Bean
    @ConditionalOnProperty(name = "ai.provider", havingValue = "gemini")
    public SamplingClient geminiSamplingClient(RestTemplateBuilder restTemplateBuilder,
                                               @Value("${gemini.api.key:}") String apiKey,
                                               @Value("${gemini.model:gemini-1.5-flash}") String model) {
        return new GeminiSamplingService(restTemplateBuilder
                .setConnectTimeout(AI_TIMEOUT)
                .setReadTimeout(AI_TIMEOUT)
                .build(), apiKey, model);
    }

    @Bean
    @ConditionalOnProperty(name = "ai.provider", havingValue = "none")
    public SamplingClient disabledSamplingClient() {
        return SamplingClient.unavailable();
    }
}
