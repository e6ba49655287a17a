package jump.email.watcher.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.util.List;
import java.util.Optional;

/**
 * Built-in triage styles. Each preset contributes extra instructions to the triage prompt
 * and a set of labels the AI is encouraged to use.
 */
@JsonFormat(shape = JsonFormat.Shape.OBJECT)
public enum TriagePreset {
    DEFAULT("default", "Default",
            "Balanced triage: priority, a few topical labels and a short suggested action.",
            List.of(),
            ""),
    INBOX_ZERO("inbox-zero", "Inbox Zero",
            "Aggressively sorts mail into action buckets so the inbox can be emptied.",
            List.of("Action", "Waiting", "Reference", "Archive"),
            "Assign exactly one of the labels Action, Waiting, Reference or Archive to every email."),
    GTD("gtd", "Getting Things Done",
            "Classifies mail by next action following the GTD method.",
            List.of("Next-Action", "Project", "Someday", "Delegated"),
            "Think in GTD terms: label emails as Next-Action, Project, Someday or Delegated "
                    + "and describe the concrete next physical action."),
    PRIORITY_FOCUS("priority-focus", "Priority Focus",
            "Only cares about urgency; flags anything that needs attention today.",
            List.of(),
            "Be strict with priorities: use urgent only for same-day deadlines, flag anything urgent or high, "
                    + "and leave labels empty."),
    NEWSLETTER_FILTER("newsletter-filter", "Newsletter Filter",
            "Separates newsletters, promotions and notifications from personal mail.",
            List.of("Newsletter", "Promotion", "Notification", "Personal"),
            "Detect bulk mail: label newsletters, promotions and automated notifications as such and give "
                    + "them low priority; personal mail gets the Personal label.");

    private final String id;
    private final String displayName;
    private final String description;
    private final List<String> suggestedLabels;
    private final String promptInstructions;

    TriagePreset(String id, String displayName, String description, List<String> suggestedLabels,
                 String promptInstructions) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
        this.suggestedLabels = suggestedLabels;
        this.promptInstructions = promptInstructions;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getSuggestedLabels() {
        return suggestedLabels;
    }

    public String getPromptInstructions() {
        return promptInstructions;
    }

    public static Optional<TriagePreset> fromId(String id) {
        for (TriagePreset preset : values()) {
            if (preset.id.equalsIgnoreCase(id)) {
                return Optional.of(preset);
            }
        }
        return Optional.empty();
    }
}
