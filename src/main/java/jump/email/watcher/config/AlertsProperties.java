package jump.email.watcher.config;

import jump.email.watcher.model.Priority;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Alert channel settings, bound from {@code hooks.alerts.*}. The notifier keeps its own copy
 * so runtime updates never touch the bound bean.
 */
@Data
public class AlertsProperties {
    private boolean desktop = false;
    private boolean sound = false;
    private Priority urgencyThreshold = Priority.HIGH;
    private String webhookUrl = "";
    private List<Priority> webhookEvents = new ArrayList<>(List.of(Priority.URGENT, Priority.HIGH));

    public AlertsProperties copy() {
        AlertsProperties copy = new AlertsProperties();
        copy.setDesktop(desktop);
        copy.setSound(sound);
        copy.setUrgencyThreshold(urgencyThreshold);
        copy.setWebhookUrl(webhookUrl);
        copy.setWebhookEvents(new ArrayList<>(webhookEvents));
        return copy;
    }

    public boolean hasWebhook() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }
}
