package jump.email.watcher.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jump.email.watcher.model.SamplingMessage;
import jump.email.watcher.model.SamplingRequest;
import jump.email.watcher.model.SamplingResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini implementation of {@link SamplingClient}, called over REST.
 * Free tier allows 15 requests/minute, comfortably above the triage call budget.
 */
@Slf4j
public class GeminiSamplingService implements SamplingClient {
    private static final String GEMINI_API_URL =
            "https://generativelanguage.googleapis.com/v1beta/models/%s:generateContent";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;

    public GeminiSamplingService(RestTemplate restTemplate, String apiKey, String model) {
        this.restTemplate = restTemplate;
        this.objectMapper = new ObjectMapper();
        this.apiKey = apiKey;
        this.model = model;

        if (!isAvailable()) {
            log.warn("Gemini API key not configured. Set gemini.api.key in application.properties or environment variable.");
        }
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isEmpty() && !apiKey.startsWith("${");
    }

    @Override
    public SamplingResult createMessage(SamplingRequest request) {
        if (!isAvailable()) {
            throw new SamplingException("Gemini API key not configured", null);
        }

        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            List<Map<String, Object>> contents = new ArrayList<>();
            for (SamplingMessage message : request.getMessages()) {
                Map<String, Object> content = new HashMap<>();
                content.put("role", "assistant".equals(message.getRole()) ? "model" : "user");
                content.put("parts", List.of(Map.of("text", message.getText())));
                contents.add(content);
            }

            Map<String, Object> generationConfig = new HashMap<>();
            generationConfig.put("maxOutputTokens", request.getMaxTokens());
            generationConfig.put("temperature", 0.3f);

            Map<String, Object> requestBody = new HashMap<>();
            requestBody.put("contents", contents);
            requestBody.put("generationConfig", generationConfig);

            HttpEntity<Map<String, Object>> entity = new HttpEntity<>(requestBody, headers);
            String url = String.format(GEMINI_API_URL, model) + "?key=" + apiKey;
            ResponseEntity<String> response = restTemplate.postForEntity(url, entity, String.class);

            if (response.getStatusCode().is2xxSuccessful() && response.getBody() != null) {
                JsonNode jsonResponse = objectMapper.readTree(response.getBody());
                JsonNode text = jsonResponse.path("candidates").path(0).path("content").path("parts").path(0).path("text");
                if (text.isTextual()) {
                    return new SamplingResult(model, text.asText());
                }
                throw new SamplingException("Unexpected Gemini API response format: " + response.getBody(), null);
            }
            throw new SamplingException("Gemini API error: " + response.getStatusCode() + " - " + response.getBody(), null);
        } catch (SamplingException e) {
            throw e;
        } catch (Exception e) {
            throw translate(e);
        }
    }

    private static SamplingException translate(Exception e) {
        String errorMessage = e.getMessage() != null ? e.getMessage().toLowerCase() : "";

        // Quota errors come back as 429, or 403 with a quota message
        if (errorMessage.contains("quota")
                || errorMessage.contains("exceeded")
                || errorMessage.contains("rate limit")
                || errorMessage.contains("429")
                || errorMessage.contains("resource exhausted")) {
            return new SamplingException("Gemini quota/rate limit exceeded: " + e.getMessage(), e, true);
        }
        return new SamplingException("Gemini API error: " + e.getMessage(), e);
    }
}
