package jump.email.watcher.mail;

import lombok.Value;

/**
 * A single change to a message: add a label, set the flagged marker or mark it read.
 */
@Value
public class MailMutation {
    public enum Kind {
        ADD_LABEL,
        SET_FLAG,
        MARK_READ
    }

    Kind kind;
    String label;

    public static MailMutation addLabel(String label) {
        return new MailMutation(Kind.ADD_LABEL, label);
    }

    public static MailMutation setFlag() {
        return new MailMutation(Kind.SET_FLAG, null);
    }

    public static MailMutation markRead() {
        return new MailMutation(Kind.MARK_READ, null);
    }
}
