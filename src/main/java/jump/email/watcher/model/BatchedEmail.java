package jump.email.watcher.model;

import lombok.Value;

/**
 * A pending arrival tagged with the account and folder it came from.
 */
@Value
public class BatchedEmail {
    String account;
    String folder;
    MessageSummary meta;
}
