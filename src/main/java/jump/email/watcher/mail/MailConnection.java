package jump.email.watcher.mail;

import jump.email.watcher.model.MessageSummary;

import java.util.List;
import java.util.function.Consumer;

/**
 * An authenticated connection to a mail store.
 */
public interface MailConnection extends AutoCloseable {

    /**
     * Opens the folder for exclusive use and starts delivering push signals to the listener.
     * Signals may arrive on any thread.
     */
    FolderSubscription subscribe(String folder, Consumer<StoreSignal> listener) throws MailStoreException;

    /**
     * Summaries of every message in the subscribed folder with id &gt;= {@code fromId}, in id order.
     * Stores may include the last message even when its id is lower, so callers must filter.
     */
    List<MessageSummary> fetchSummaries(String folder, long fromId) throws MailStoreException;

    void mutate(String folder, String messageId, MailMutation mutation) throws MailStoreException;

    boolean isUsable();

    @Override
    void close();
}
