package jump.email.watcher.model;

import lombok.Value;

@Value
public class SamplingResult {
    String model;
    String text;
}
