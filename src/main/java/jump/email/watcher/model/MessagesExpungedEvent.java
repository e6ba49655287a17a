package jump.email.watcher.model;

import lombok.Value;

@Value
public class MessagesExpungedEvent {
    String account;
    String folder;
    int count;
}
