package jump.email.watcher.mail;

/**
 * An exclusive, push-subscribed hold on one folder of an open connection.
 */
public interface FolderSubscription {

    /**
     * The id the store will assign to the next message delivered to this folder.
     */
    long nextId();

    /**
     * Drops the hold and stops push delivery. Safe to call more than once.
     */
    void release();
}
