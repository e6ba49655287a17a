package jump.email.watcher.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Urgency levels, declared in ascending order so that ordinal comparison
 * gives the threshold order low &lt; normal &lt; high &lt; urgent.
 */
public enum Priority {
    LOW,
    NORMAL,
    HIGH,
    URGENT;

    /**
     * @return true if this priority is at or above the given minimum
     */
    public boolean meets(Priority threshold) {
        return compareTo(threshold) >= 0;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup used when reading AI output: unknown or non-text values yield empty.
     */
    public static Optional<Priority> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Priority priority : values()) {
            if (priority.value().equals(value)) {
                return Optional.of(priority);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Priority fromJson(String value) {
        return fromValue(value == null ? null : value.toLowerCase(Locale.ROOT))
                .orElseThrow(() -> new IllegalArgumentException("Unknown priority: " + value));
    }
}
