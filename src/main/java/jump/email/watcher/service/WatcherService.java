package jump.email.watcher.service;

import jump.email.watcher.config.WatcherProperties;
import jump.email.watcher.mail.MailStore;
import jump.email.watcher.model.WatchTargetStatus;
import jump.email.watcher.service.watch.BackoffPolicy;
import jump.email.watcher.service.watch.TargetWorker;
import jump.email.watcher.service.watch.WatchKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * IMAP IDLE watcher: one independent {@link TargetWorker} per configured (account, folder) pair.
 * New arrivals are published on the {@link EmailEventBus}.
 */
@Slf4j
@Service
public class WatcherService {
    private static final long STOP_JOIN_MS = 5_000;

    private final WatcherProperties properties;
    private final MailStore mailStore;
    private final EmailEventBus eventBus;
    private final ProtocolLogService protocolLog;
    private final TaskScheduler taskScheduler;

    private final Map<WatchKey, TargetWorker> workers = new LinkedHashMap<>();
    private final Map<WatchKey, Thread> threads = new LinkedHashMap<>();

    public WatcherService(WatcherProperties properties, MailStore mailStore, EmailEventBus eventBus,
                          ProtocolLogService protocolLog, TaskScheduler taskScheduler) {
        this.properties = properties;
        this.mailStore = mailStore;
        this.eventBus = eventBus;
        this.protocolLog = protocolLog;
        this.taskScheduler = taskScheduler;
    }

    /**
     * Starts a worker for every configured pair. Workers connect on their own threads,
     * so a slow or failing account never holds up the others.
     */
    public synchronized void start() {
        if (!properties.isEnabled()) {
            log.info("Watcher disabled, not starting");
            return;
        }
        if (!workers.isEmpty()) {
            log.debug("Watcher already running");
            return;
        }
        BackoffPolicy policy = new BackoffPolicy(
                properties.getInitialBackoffMs(),
                properties.getMaxBackoffMs(),
                properties.getMaxConsecutiveFailures());

        for (WatcherProperties.Account account : properties.getAccounts()) {
            if (account.getName() == null || account.getName().isBlank()) {
                log.warn("Skipping watcher account without a name (user {})", account.getUsername());
                continue;
            }
            for (String folder : properties.getFolders()) {
                WatchKey key = new WatchKey(account.getName(), folder);
                if (workers.containsKey(key)) {
                    continue;
                }
                TargetWorker worker = new TargetWorker(key, account.toEndpoint(), account.toCredentials(),
                        mailStore, eventBus, protocolLog, taskScheduler, policy);
                Thread thread = new Thread(worker, "watch-" + key);
                thread.setDaemon(true);
                workers.put(key, worker);
                threads.put(key, thread);
                worker.start();
                thread.start();
            }
        }
        log.info("Watcher started for {} target(s)", workers.size());
    }

    /**
     * Stops every worker, cancelling reconnect timers and releasing connections best-effort.
     * Calling it again, or before {@link #start()}, does nothing.
     */
    public void stop() {
        List<TargetWorker> stopping;
        List<Thread> running;
        synchronized (this) {
            if (workers.isEmpty()) {
                return;
            }
            stopping = new ArrayList<>(workers.values());
            running = new ArrayList<>(threads.values());
            workers.clear();
            threads.clear();
        }
        stopping.forEach(TargetWorker::shutdown);
        for (Thread thread : running) {
            try {
                thread.join(STOP_JOIN_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while stopping watcher threads");
                break;
            }
        }
        log.info("Watcher stopped ({} target(s))", stopping.size());
    }

    public synchronized List<WatchTargetStatus> getStatus() {
        List<WatchTargetStatus> status = new ArrayList<>();
        for (TargetWorker worker : workers.values()) {
            status.add(worker.status());
        }
        return status;
    }
}
