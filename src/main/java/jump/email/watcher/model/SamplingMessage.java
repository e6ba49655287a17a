package jump.email.watcher.model;

import lombok.Value;

@Value
public class SamplingMessage {
    String role;
    String text;

    public static SamplingMessage user(String text) {
        return new SamplingMessage("user", text);
    }
}
