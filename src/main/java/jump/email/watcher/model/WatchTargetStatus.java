package jump.email.watcher.model;

import lombok.Value;

@Value
public class WatchTargetStatus {
    String account;
    String folder;
    boolean connected;
    long lastSeenId;
}
