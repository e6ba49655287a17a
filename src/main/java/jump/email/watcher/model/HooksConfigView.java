package jump.email.watcher.model;

import jump.email.watcher.config.AlertsProperties;
import jump.email.watcher.config.HooksProperties;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Read-only snapshot of the active hooks settings, with the alerts section reflecting runtime updates.
 */
@Value
@Builder
public class HooksConfigView {
    TriageMode onNewEmail;
    TriagePreset preset;
    boolean autoLabel;
    boolean autoFlag;
    int batchDelay;
    int maxSamplingPerMinute;
    String customInstructions;
    List<HooksProperties.Rule> rules;
    AlertsProperties alerts;
    boolean samplingSupported;
    boolean active;
}
