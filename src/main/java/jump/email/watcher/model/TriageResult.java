package jump.email.watcher.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Classification of one message. A null field means the classifier had no opinion on it.
 */
@Value
@Builder
public class TriageResult {
    private static final TriageResult EMPTY = TriageResult.builder().build();

    Priority priority;
    List<String> labels;
    Boolean flag;
    String action;

    public static TriageResult empty() {
        return EMPTY;
    }

    public Optional<Priority> priority() {
        return Optional.ofNullable(priority);
    }

    public boolean hasLabels() {
        return labels != null && !labels.isEmpty();
    }

    public boolean requestsFlag() {
        return Boolean.TRUE.equals(flag);
    }

    public boolean hasAction() {
        return action != null && !action.isEmpty();
    }
}
