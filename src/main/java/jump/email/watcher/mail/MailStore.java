package jump.email.watcher.mail;

/**
 * Entry point to a mail store; each call opens a fresh connection.
 */
public interface MailStore {
    MailConnection connect(MailEndpoint endpoint, MailCredentials credentials) throws MailStoreException;
}
