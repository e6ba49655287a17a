package jump.email.watcher.service.triage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jump.email.watcher.model.Priority;
import jump.email.watcher.model.TriageResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns free-form model output into exactly one {@link TriageResult} per message.
 * Never throws: anything unusable becomes an empty result.
 */
@Slf4j
public final class TriageResponseParser {
    static final int MAX_LABELS = 5;
    static final int MAX_ACTION_LENGTH = 200;

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\n?");

    private TriageResponseParser() {
    }

    public static List<TriageResult> parseTriageResponse(String text, int expectedCount) {
        List<TriageResult> results = new ArrayList<>(expectedCount);
        if (text != null && expectedCount > 0) {
            String cleaned = CODE_FENCE.matcher(text).replaceAll("").trim();
            try {
                JsonNode parsed = OBJECT_MAPPER.readTree(cleaned);
                if (parsed != null && parsed.isArray()) {
                    for (int i = 0; i < parsed.size() && i < expectedCount; i++) {
                        results.add(sanitize(parsed.get(i)));
                    }
                } else if (parsed != null && parsed.isObject()) {
                    results.add(sanitize(parsed));
                }
            } catch (JsonProcessingException e) {
                log.debug("Unparseable triage response: {}", e.getOriginalMessage());
            }
        }
        while (results.size() < expectedCount) {
            results.add(TriageResult.empty());
        }
        return results;
    }

    /**
     * Keeps only well-typed fields: a known priority, at most five string labels,
     * a boolean flag and an action of at most 200 characters.
     */
    public static TriageResult sanitize(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            return TriageResult.empty();
        }
        JsonNode priority = raw.get("priority");
        JsonNode labels = raw.get("labels");
        JsonNode flag = raw.get("flag");
        JsonNode action = raw.get("action");

        TriageResult.TriageResultBuilder builder = TriageResult.builder();
        if (priority != null && priority.isTextual()) {
            builder.priority(Priority.fromValue(priority.asText()).orElse(null));
        }
        if (labels != null && labels.isArray()) {
            List<String> kept = new ArrayList<>();
            for (JsonNode label : labels) {
                if (kept.size() == MAX_LABELS) {
                    break;
                }
                if (label.isTextual()) {
                    kept.add(label.asText());
                }
            }
            builder.labels(List.copyOf(kept));
        }
        if (flag != null && flag.isBoolean()) {
            builder.flag(flag.asBoolean());
        }
        if (action != null && action.isTextual()) {
            String value = action.asText();
            builder.action(value.length() > MAX_ACTION_LENGTH ? value.substring(0, MAX_ACTION_LENGTH) : value);
        }
        return builder.build();
    }
}
