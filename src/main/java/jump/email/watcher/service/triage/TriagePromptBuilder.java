package jump.email.watcher.service.triage;

import jump.email.watcher.model.BatchedEmail;
import jump.email.watcher.model.MessageSummary;
import jump.email.watcher.model.TriagePreset;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Builds the single prompt sent for a batch: one numbered block per message,
 * followed by preset and user instructions.
 */
public final class TriagePromptBuilder {
    private static final String FLAGGED = "⭐";
    private static final String SEEN = "👁️";
    private static final String UNSEEN = "🆕";
    private static final String ATTACHMENT = "📎";

    private TriagePromptBuilder() {
    }

    public static String buildPrompt(List<BatchedEmail> emails, TriagePreset preset, String customInstructions) {
        String summaries = IntStream.range(0, emails.size())
                .mapToObj(i -> formatSummary(emails.get(i).getMeta(), i))
                .collect(Collectors.joining("\n\n"));

        StringBuilder prompt = new StringBuilder()
                .append("You are an email triage assistant. Analyze these ").append(emails.size())
                .append(" new email(s) and respond with a JSON array (one object per email, in order). ")
                .append("Each object should have:\n")
                .append("- \"priority\": \"urgent\" | \"high\" | \"normal\" | \"low\"\n")
                .append("- \"labels\": string[] (suggested labels, e.g. ");
        if (preset.getSuggestedLabels().isEmpty()) {
            prompt.append("[\"Meeting\", \"Finance\"]");
        } else {
            prompt.append(preset.getSuggestedLabels().stream()
                    .map(label -> "\"" + label + "\"")
                    .collect(Collectors.joining(", ", "[", "]")));
        }
        prompt.append(")\n")
                .append("- \"flag\": boolean (true if urgent/important)\n")
                .append("- \"action\": string (brief description of suggested action)\n");

        if (!preset.getPromptInstructions().isBlank()) {
            prompt.append('\n').append(preset.getPromptInstructions()).append('\n');
        }
        if (customInstructions != null && !customInstructions.isBlank()) {
            prompt.append('\n').append(customInstructions.trim()).append('\n');
        }

        return prompt.append("\nEmails:\n").append(summaries).append("\n\n")
                .append("Respond ONLY with the JSON array, no markdown or extra text.")
                .toString();
    }

    static String formatSummary(MessageSummary meta, int index) {
        String flags = (meta.isFlagged() ? FLAGGED : "")
                + (meta.isSeen() ? SEEN : UNSEEN)
                + (meta.isHasAttachments() ? ATTACHMENT : "");
        return "[" + (index + 1) + "] From: " + meta.getFrom().displayName() + "\n"
                + "    Subject: " + meta.getSubject() + "\n"
                + "    Date: " + (meta.getDate() != null ? meta.getDate() : "unknown") + "\n"
                + "    Flags: " + flags;
    }
}
