package jump.email.watcher.service.watch;

import jump.email.watcher.mail.FolderSubscription;
import jump.email.watcher.mail.MailConnection;
import jump.email.watcher.mail.MailCredentials;
import jump.email.watcher.mail.MailEndpoint;
import jump.email.watcher.mail.MailStore;
import jump.email.watcher.mail.MailStoreException;
import jump.email.watcher.mail.StoreSignal;
import jump.email.watcher.model.EmailArrivedEvent;
import jump.email.watcher.model.LogLevel;
import jump.email.watcher.model.MessageSummary;
import jump.email.watcher.model.MessagesExpungedEvent;
import jump.email.watcher.model.WatchTargetStatus;
import jump.email.watcher.service.EmailEventBus;
import jump.email.watcher.service.ProtocolLogService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the IDLE connection for one (account, folder) pair.
 *
 * <p>Store callbacks, reconnect timers and stop requests are all posted to this worker's inbox
 * and handled one at a time on the worker thread, so a target never has more than one
 * connection attempt or fetch in flight.
 */
@Slf4j
public class TargetWorker implements Runnable {
    private static final String COMPONENT = "watcher";

    private final WatchKey key;
    private final MailEndpoint endpoint;
    private final MailCredentials credentials;
    private final MailStore mailStore;
    private final EmailEventBus eventBus;
    private final ProtocolLogService protocolLog;
    private final TaskScheduler taskScheduler;
    private final BackoffPolicy policy;
    private final BlockingQueue<WatchEvent> inbox = new LinkedBlockingQueue<>();

    private volatile WatchState state;
    private volatile MailConnection connection;
    private volatile ScheduledFuture<?> reconnectTimer;
    private FolderSubscription subscription;
    private int generation;

    public TargetWorker(WatchKey key, MailEndpoint endpoint, MailCredentials credentials, MailStore mailStore,
                        EmailEventBus eventBus, ProtocolLogService protocolLog, TaskScheduler taskScheduler,
                        BackoffPolicy policy) {
        this.key = key;
        this.endpoint = endpoint;
        this.credentials = credentials;
        this.mailStore = mailStore;
        this.eventBus = eventBus;
        this.protocolLog = protocolLog;
        this.taskScheduler = taskScheduler;
        this.policy = policy;
        this.state = WatchState.initial(key, policy);
    }

    public void start() {
        post(WatchEvent.connectDue());
    }

    /**
     * Requests a stop. The reconnect timer is cancelled right away; the connection is
     * released on the worker thread once the stop is handled.
     */
    public void shutdown() {
        cancelReconnect();
        post(WatchEvent.stop());
    }

    public void post(WatchEvent event) {
        inbox.offer(event);
    }

    @Override
    public void run() {
        try {
            while (!state.isStopped()) {
                handle(inbox.take());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Watcher thread for {} interrupted", key);
        } finally {
            cancelReconnect();
            releaseConnection();
        }
    }

    /**
     * Handles everything currently queued without blocking.
     */
    void drainInbox() {
        WatchEvent event;
        while ((event = inbox.poll()) != null) {
            handle(event);
        }
    }

    void handle(WatchEvent event) {
        if (event.isStoreSignal() && event.getGeneration() != generation) {
            log.debug("Ignoring {} from a previous connection of {}", event.getType(), key);
            return;
        }
        WatchState before = state;
        if (before.isStopped()) {
            return;
        }
        WatchState after = WatchTransitions.apply(before, event, policy);
        state = after;

        switch (event.getType()) {
            case CONNECT_DUE:
                if (after.getPhase() == WatchPhase.CONNECTING) {
                    connect();
                }
                break;
            case CONNECT_FAILED:
                if (after.getPhase() == WatchPhase.RECONNECTING) {
                    scheduleReconnect(after.getBackoffMs());
                } else if (after.isStopped()) {
                    protocolLog.log(LogLevel.ERROR, COMPONENT, String.format(
                            "Giving up on %s/%s after %d consecutive failures",
                            key.getAccount(), key.getFolder(), after.getConsecutiveFailures()));
                }
                break;
            case ITEMS_ARRIVED:
                if (after.getPhase() == WatchPhase.NOTIFYING) {
                    fetchNewEmails();
                }
                break;
            case ITEMS_EXPUNGED:
                if (after.isConnected()) {
                    eventBus.emit(new MessagesExpungedEvent(key.getAccount(), key.getFolder(), (int) event.getValue()));
                }
                break;
            case CLOSED:
                if (after.getPhase() == WatchPhase.RECONNECTING) {
                    releaseConnection();
                    scheduleReconnect(after.getBackoffMs());
                }
                break;
            case STOP:
                cancelReconnect();
                releaseConnection();
                break;
            default:
                break;
        }
    }

    public WatchState getState() {
        return state;
    }

    public WatchTargetStatus status() {
        WatchState current = state;
        MailConnection openConnection = connection;
        boolean connected = current.isConnected() && openConnection != null && openConnection.isUsable();
        return new WatchTargetStatus(key.getAccount(), key.getFolder(), connected, current.getLastSeenId());
    }

    private void connect() {
        generation++;
        int connectionGeneration = generation;
        long nextId;
        try {
            MailConnection opened = mailStore.connect(endpoint, credentials);
            connection = opened;
            subscription = opened.subscribe(key.getFolder(), signal -> relay(signal, connectionGeneration));
            nextId = subscription.nextId();
        } catch (MailStoreException | RuntimeException e) {
            protocolLog.warning(COMPONENT, String.format("IDLE connect failed for %s/%s: %s",
                    key.getAccount(), key.getFolder(), e.getMessage()));
            releaseConnection();
            handle(WatchEvent.connectFailed());
            return;
        }
        handle(WatchEvent.connected(nextId));
        protocolLog.info(COMPONENT, String.format("IDLE started: %s/%s (uid > %d)",
                key.getAccount(), key.getFolder(), nextId - 1));
    }

    private void relay(StoreSignal signal, int connectionGeneration) {
        switch (signal.getKind()) {
            case ITEM_COUNT_INCREASED:
                post(WatchEvent.itemsArrived(connectionGeneration));
                break;
            case ITEMS_EXPUNGED:
                post(WatchEvent.itemsExpunged(signal.getCount(), connectionGeneration));
                break;
            case CLOSED:
                post(WatchEvent.closed(connectionGeneration));
                break;
            default:
                break;
        }
    }

    private void fetchNewEmails() {
        long lastSeen = state.getLastSeenId();
        MailConnection current = connection;
        try {
            if (current == null) {
                throw new MailStoreException("not connected");
            }
            List<MessageSummary> fresh = new ArrayList<>();
            long maxId = lastSeen;
            for (MessageSummary summary : current.fetchSummaries(key.getFolder(), lastSeen + 1)) {
                long id = Long.parseLong(summary.getId());
                if (id > lastSeen) {
                    fresh.add(summary);
                    maxId = Math.max(maxId, id);
                }
            }
            handle(WatchEvent.fetched(maxId));

            if (!fresh.isEmpty()) {
                eventBus.emit(new EmailArrivedEvent(key.getAccount(), key.getFolder(), fresh));
                protocolLog.info(COMPONENT, String.format("%d new email(s) in %s/%s",
                        fresh.size(), key.getAccount(), key.getFolder()));
            }
        } catch (MailStoreException | RuntimeException e) {
            protocolLog.warning(COMPONENT, "Failed to fetch new emails: " + e.getMessage());
            handle(WatchEvent.fetchFailed());
        }
    }

    private void scheduleReconnect(long delayMs) {
        protocolLog.info(COMPONENT, String.format("Reconnecting %s/%s in %dms",
                key.getAccount(), key.getFolder(), delayMs));
        reconnectTimer = taskScheduler.schedule(() -> post(WatchEvent.connectDue()),
                Instant.now().plusMillis(delayMs));
    }

    private void cancelReconnect() {
        ScheduledFuture<?> timer = reconnectTimer;
        if (timer != null) {
            timer.cancel(false);
            reconnectTimer = null;
        }
    }

    private void releaseConnection() {
        FolderSubscription currentSubscription = subscription;
        MailConnection currentConnection = connection;
        subscription = null;
        connection = null;
        try {
            if (currentSubscription != null) {
                currentSubscription.release();
            }
            if (currentConnection != null) {
                currentConnection.close();
            }
        } catch (RuntimeException e) {
            log.debug("Error releasing {}: {}", key, e.getMessage());
        }
    }
}
