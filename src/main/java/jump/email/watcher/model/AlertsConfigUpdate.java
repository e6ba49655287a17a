package jump.email.watcher.model;

import lombok.Data;

import java.util.List;

/**
 * Partial alerts configuration; null fields are left unchanged.
 */
@Data
public class AlertsConfigUpdate {
    private Boolean desktop;
    private Boolean sound;
    private Priority urgencyThreshold;
    private String webhookUrl;
    private List<Priority> webhookEvents;

    public boolean isEmpty() {
        return desktop == null && sound == null && urgencyThreshold == null
                && webhookUrl == null && webhookEvents == null;
    }
}
