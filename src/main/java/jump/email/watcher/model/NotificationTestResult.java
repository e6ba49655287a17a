package jump.email.watcher.model;

import lombok.Value;

@Value
public class NotificationTestResult {
    boolean success;
    String message;
}
