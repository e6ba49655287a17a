package jump.email.watcher.model;

import lombok.Value;

@Value
public class EmailAddress {
    String name;
    String address;

    /**
     * Display form used in logs and alerts: the name when present, otherwise the address.
     */
    public String displayName() {
        return name != null && !name.isBlank() ? name : address;
    }
}
