package jump.email.watcher.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Envelope-level view of a newly arrived message. The id is the store's UID in the folder.
 */
@Value
@Builder
public class MessageSummary {
    String id;
    String subject;
    EmailAddress from;
    @Singular("recipient")
    List<EmailAddress> to;
    Instant date;
    boolean seen;
    boolean flagged;
    boolean answered;
    boolean hasAttachments;
    @Singular
    List<String> labels;
}
