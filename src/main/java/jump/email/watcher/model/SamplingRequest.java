package jump.email.watcher.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One request to the reasoning provider. Hints and priorities are advisory; providers map
 * them onto whatever model choice they support.
 */
@Value
@Builder
public class SamplingRequest {
    @Singular
    List<SamplingMessage> messages;
    @Singular
    List<String> modelHints;
    double speedPriority;
    double intelligencePriority;
    int maxTokens;
}
