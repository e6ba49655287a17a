package jump.email.watcher.config;

import jump.email.watcher.model.TriageMode;
import jump.email.watcher.model.TriagePreset;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for new-mail hooks, bound from {@code hooks.*} in application.properties.
 */
@Data
@ConfigurationProperties(prefix = "hooks")
public class HooksProperties {
    private TriageMode onNewEmail = TriageMode.NOTIFY;
    private String preset = TriagePreset.DEFAULT.getId();
    private boolean autoLabel = false;
    private boolean autoFlag = false;
    /** Seconds between the first arrival of a burst and the flush. */
    private int batchDelay = 5;
    private int maxSamplingPerMinute = 10;
    private String customInstructions = "";
    private List<Rule> rules = new ArrayList<>();
    private AlertsProperties alerts = new AlertsProperties();

    public TriagePreset resolvePreset() {
        return TriagePreset.fromId(preset).orElse(TriagePreset.DEFAULT);
    }

    @Data
    public static class Rule {
        private String name;
        private Match match = new Match();
        private Actions actions = new Actions();
    }

    @Data
    public static class Match {
        private String from;
        private String to;
        private String subject;
    }

    @Data
    public static class Actions {
        private List<String> labels = new ArrayList<>();
        private boolean flag;
        private boolean markRead;
        private boolean alert;
    }
}
