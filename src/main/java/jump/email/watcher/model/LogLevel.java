package jump.email.watcher.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a protocol log entry pushed to connected clients.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    NOTICE,
    WARNING,
    ERROR,
    ALERT;

    public static LogLevel forPriority(Priority priority) {
        switch (priority) {
            case URGENT:
                return ALERT;
            case HIGH:
                return WARNING;
            case LOW:
                return DEBUG;
            default:
                return INFO;
        }
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
