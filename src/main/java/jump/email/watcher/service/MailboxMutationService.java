package jump.email.watcher.service;

import jump.email.watcher.config.WatcherProperties;
import jump.email.watcher.mail.MailConnection;
import jump.email.watcher.mail.MailMutation;
import jump.email.watcher.mail.MailStore;
import jump.email.watcher.mail.MailStoreException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Applies labels and flags to messages. Keeps one connection per account, separate from the
 * watcher's IDLE connections, and reopens it when the server has dropped it.
 */
@Slf4j
@Service
public class MailboxMutationService {
    private final WatcherProperties properties;
    private final MailStore mailStore;
    private final Map<String, MailConnection> connections = new HashMap<>();

    public MailboxMutationService(WatcherProperties properties, MailStore mailStore) {
        this.properties = properties;
        this.mailStore = mailStore;
    }

    public void addLabel(String account, String folder, String messageId, String label) throws MailStoreException {
        mutate(account, folder, messageId, MailMutation.addLabel(label));
    }

    public void setFlag(String account, String folder, String messageId) throws MailStoreException {
        mutate(account, folder, messageId, MailMutation.setFlag());
    }

    public void markRead(String account, String folder, String messageId) throws MailStoreException {
        mutate(account, folder, messageId, MailMutation.markRead());
    }

    public synchronized void mutate(String account, String folder, String messageId, MailMutation mutation)
            throws MailStoreException {
        MailConnection connection = connectionFor(account);
        try {
            connection.mutate(folder, messageId, mutation);
        } catch (MailStoreException e) {
            if (!connection.isUsable()) {
                connections.remove(account);
                connection.close();
            }
            throw e;
        }
    }

    @PreDestroy
    public synchronized void closeAll() {
        connections.values().forEach(MailConnection::close);
        connections.clear();
    }

    private MailConnection connectionFor(String account) throws MailStoreException {
        MailConnection existing = connections.get(account);
        if (existing != null && existing.isUsable()) {
            return existing;
        }
        if (existing != null) {
            existing.close();
            connections.remove(account);
        }
        WatcherProperties.Account config = properties.getAccounts().stream()
                .filter(a -> account.equals(a.getName()))
                .findFirst()
                .orElseThrow(() -> new MailStoreException("Unknown account: " + account));
        log.debug("Opening mutation connection for {}", account);
        MailConnection connection = mailStore.connect(config.toEndpoint(), config.toCredentials());
        connections.put(account, connection);
        return connection;
    }
}
