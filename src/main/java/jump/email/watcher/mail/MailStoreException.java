package jump.email.watcher.mail;

/**
 * Any failure talking to the mail store: connect, authenticate, open, fetch or mutate.
 */
public class MailStoreException extends Exception {
    public MailStoreException(String message) {
        super(message);
    }

    public MailStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
