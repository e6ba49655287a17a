package jump.email.watcher.mail;

import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jump.email.watcher.config.WatcherProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Properties;

/**
 * Jakarta Mail (Angus) implementation of {@link MailStore} speaking IMAP.
 */
@Slf4j
@Component
public class ImapMailStore implements MailStore {
    private static final int CONNECT_TIMEOUT_MS = 15_000;
    private static final int READ_TIMEOUT_MS = 60_000;

    private final TaskScheduler taskScheduler;
    private final Duration idleTimeout;

    public ImapMailStore(TaskScheduler taskScheduler, WatcherProperties watcherProperties) {
        this.taskScheduler = taskScheduler;
        this.idleTimeout = Duration.ofSeconds(Math.max(60, watcherProperties.getIdleTimeout()));
    }

    @Override
    public MailConnection connect(MailEndpoint endpoint, MailCredentials credentials) throws MailStoreException {
        if (endpoint.getHost() == null || endpoint.getHost().isBlank()) {
            throw new MailStoreException("IMAP host is not configured for " + credentials.getUsername());
        }
        String protocol = endpoint.isTls() ? "imaps" : "imap";
        Session session = Session.getInstance(sessionProperties(protocol, endpoint, credentials));
        try {
            Store store = session.getStore(protocol);
            store.connect(endpoint.getHost(), endpoint.getPort(), credentials.getUsername(), credentials.getSecret());
            log.debug("Connected to {}:{} as {}", endpoint.getHost(), endpoint.getPort(), credentials.getUsername());
            return new ImapMailConnection(store, taskScheduler, idleTimeout);
        } catch (MessagingException e) {
            throw new MailStoreException("Could not connect to " + endpoint.getHost() + ": " + e.getMessage(), e);
        }
    }

    static Properties sessionProperties(String protocol, MailEndpoint endpoint, MailCredentials credentials) {
        String prefix = "mail." + protocol + ".";
        Properties props = new Properties();
        props.setProperty(prefix + "host", endpoint.getHost());
        props.setProperty(prefix + "port", String.valueOf(endpoint.getPort()));
        props.setProperty(prefix + "connectiontimeout", String.valueOf(CONNECT_TIMEOUT_MS));
        props.setProperty(prefix + "timeout", String.valueOf(READ_TIMEOUT_MS));
        if (endpoint.isTls()) {
            props.setProperty(prefix + "ssl.enable", "true");
            if (!endpoint.isVerifySsl()) {
                props.setProperty(prefix + "ssl.trust", "*");
                props.setProperty(prefix + "ssl.checkserveridentity", "false");
            }
        } else {
            props.setProperty(prefix + "starttls.enable", "true");
        }
        if (credentials.isBearer()) {
            props.setProperty(prefix + "auth.mechanisms", "XOAUTH2");
        }
        return props;
    }
}
