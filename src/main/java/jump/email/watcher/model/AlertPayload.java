package jump.email.watcher.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AlertPayload {
    String account;
    EmailAddress sender;
    String subject;
    Priority priority;
    List<String> labels;
    String ruleName;

    public boolean hasLabels() {
        return labels != null && !labels.isEmpty();
    }
}
