package jump.email.watcher.service;

import com.theokanning.openai.OpenAiHttpException;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatCompletionResult;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.service.OpenAiService;
import jump.email.watcher.model.SamplingRequest;
import jump.email.watcher.model.SamplingResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * OpenAI chat-completions implementation of {@link SamplingClient}.
 */
@Slf4j
public class OpenAiSamplingService implements SamplingClient {
    private final OpenAiService openAiService;
    private final String defaultModel;
    private final boolean configured;

    public OpenAiSamplingService(OpenAiService openAiService, String defaultModel, boolean configured) {
        this.openAiService = openAiService;
        this.defaultModel = defaultModel;
        this.configured = configured;
        if (!configured) {
            log.warn("OpenAI API key not configured. Set openai.api.key to enable AI triage.");
        }
    }

    @Override
    public boolean isAvailable() {
        return configured;
    }

    @Override
    public SamplingResult createMessage(SamplingRequest request) {
        if (!configured) {
            throw new SamplingException("OpenAI API key not configured", null);
        }
        try {
            List<ChatMessage> messages = request.getMessages().stream()
                    .map(m -> new ChatMessage(m.getRole(), m.getText()))
                    .collect(Collectors.toList());
            String model = chooseModel(request);
            ChatCompletionRequest completionRequest = ChatCompletionRequest.builder()
                    .model(model)
                    .messages(messages)
                    .maxTokens(request.getMaxTokens())
                    .temperature(0.3)
                    .build();

            ChatCompletionResult result = openAiService.createChatCompletion(completionRequest);
            if (result.getChoices() == null || result.getChoices().isEmpty()) {
                throw new SamplingException("OpenAI returned no choices", null);
            }
            String text = result.getChoices().get(0).getMessage().getContent();
            return new SamplingResult(result.getModel() != null ? result.getModel() : model,
                    text != null ? text.trim() : "");
        } catch (SamplingException e) {
            throw e;
        } catch (Exception e) {
            throw translate(e, "triage sampling");
        }
    }

    /**
     * A hint naming an OpenAI model wins; anything else ("fast") keeps the configured default.
     */
    private String chooseModel(SamplingRequest request) {
        return request.getModelHints().stream()
                .filter(hint -> hint.startsWith("gpt-") || hint.startsWith("o1") || hint.startsWith("o3"))
                .findFirst()
                .orElse(defaultModel);
    }

    static SamplingException translate(Exception e, String operation) {
        String errorMessage = e.getMessage() != null ? e.getMessage().toLowerCase() : "";

        boolean quota = e instanceof OpenAiHttpException && ((OpenAiHttpException) e).statusCode == 429
                || errorMessage.contains("quota")
                || errorMessage.contains("rate limit")
                || (e.getCause() != null && e.getCause().getMessage() != null
                && e.getCause().getMessage().toLowerCase().contains("429"));
        if (quota) {
            return new SamplingException("OpenAI quota/rate limit exceeded during " + operation + ": " + e.getMessage(), e, true);
        }
        return new SamplingException("OpenAI API error during " + operation + ": " + e.getMessage(), e);
    }
}
