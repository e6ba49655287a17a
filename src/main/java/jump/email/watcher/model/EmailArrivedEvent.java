package jump.email.watcher.model;

import lombok.Value;

import java.util.List;

@Value
public class EmailArrivedEvent {
    String account;
    String folder;
    List<MessageSummary> emails;

    public EmailArrivedEvent(String account, String folder, List<MessageSummary> emails) {
        this.account = account;
        this.folder = folder;
        this.emails = List.copyOf(emails);
    }
}
