package jump.email.watcher.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What this machine offers for desktop and sound notifications, with hints to fix what is missing.
 */
@Value
@Builder
public class PlatformSupport {
    String platform;
    Tool desktopTool;
    Tool soundTool;
    boolean supported;
    @Singular
    List<String> issues;
    @Singular
    List<String> setupInstructions;

    @Value
    public static class Tool {
        String name;
        boolean available;
    }
}
