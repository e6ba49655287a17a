package jump.email.watcher.model;

import lombok.Value;

/**
 * Result of the one-time capability handshake with the reasoning provider.
 */
@Value
public class ClientCapabilities {
    boolean sampling;

    public static ClientCapabilities none() {
        return new ClientCapabilities(false);
    }
}
