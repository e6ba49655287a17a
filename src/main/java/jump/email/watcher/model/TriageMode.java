package jump.email.watcher.model;

/**
 * What the hooks do with new mail: nothing, log a notification, or ask the AI to triage it.
 */
public enum TriageMode {
    NONE,
    NOTIFY,
    TRIAGE
}
