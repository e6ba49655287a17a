package jump.email.watcher.service;

import jump.email.watcher.config.HooksProperties;
import jump.email.watcher.mail.MailStoreException;
import jump.email.watcher.model.AlertPayload;
import jump.email.watcher.model.BatchedEmail;
import jump.email.watcher.model.ClientCapabilities;
import jump.email.watcher.model.EmailArrivedEvent;
import jump.email.watcher.model.HooksConfigView;
import jump.email.watcher.model.MessageSummary;
import jump.email.watcher.model.MessagesExpungedEvent;
import jump.email.watcher.model.Priority;
import jump.email.watcher.model.SamplingMessage;
import jump.email.watcher.model.SamplingRequest;
import jump.email.watcher.model.SamplingResult;
import jump.email.watcher.model.TriageMode;
import jump.email.watcher.model.TriagePreset;
import jump.email.watcher.model.TriageResult;
import jump.email.watcher.service.triage.RuleMatcher;
import jump.email.watcher.service.triage.TriagePromptBuilder;
import jump.email.watcher.service.triage.TriageResponseParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Reacts to new mail: batches arrivals for a short window, applies user rules, then either
 * asks the AI to triage the batch or logs a plain notification per message.
 */
@Slf4j
@Service
public class HooksService {
    private static final String COMPONENT = "hooks";
    private static final Duration SAMPLING_WINDOW = Duration.ofSeconds(60);

    private final HooksProperties properties;
    private final EmailEventBus eventBus;
    private final MailboxMutationService mutations;
    private final NotifierService notifier;
    private final ProtocolLogService protocolLog;
    private final ClientNotificationService clientNotifications;
    private final SamplingClient samplingClient;
    private final TaskScheduler taskScheduler;

    private final Consumer<EmailArrivedEvent> arrivalListener = this::onNewEmail;
    private final Consumer<MessagesExpungedEvent> expungeListener = this::onMessagesExpunged;
    private final AtomicInteger samplingCalls = new AtomicInteger();

    private final Object batchLock = new Object();
    private List<BatchedEmail> pendingEmails = new ArrayList<>();
    private boolean flushScheduled;
    private ScheduledFuture<?> batchTimer;

    private ScheduledFuture<?> samplingResetTimer;
    private volatile boolean running;
    private volatile boolean samplingSupported;

    public HooksService(HooksProperties properties,
                        EmailEventBus eventBus,
                        MailboxMutationService mutations,
                        NotifierService notifier,
                        ProtocolLogService protocolLog,
                        ClientNotificationService clientNotifications,
                        SamplingClient samplingClient,
                        TaskScheduler taskScheduler) {
        this.properties = properties;
        this.eventBus = eventBus;
        this.mutations = mutations;
        this.notifier = notifier;
        this.protocolLog = protocolLog;
        this.clientNotifications = clientNotifications;
        this.samplingClient = samplingClient;
        this.taskScheduler = taskScheduler;
    }

    /**
     * Subscribes to mailbox events. Call once the client's capabilities are known.
     */
    public synchronized void start(ClientCapabilities capabilities) {
        if (running) {
            return;
        }
        samplingSupported = capabilities.isSampling();
        if (properties.getOnNewEmail() == TriageMode.NONE) {
            log.info("Hooks disabled (mode=none)");
            return;
        }
        running = true;
        eventBus.on(EmailArrivedEvent.class, arrivalListener);
        eventBus.on(MessagesExpungedEvent.class, expungeListener);
        samplingResetTimer = taskScheduler.scheduleAtFixedRate(() -> samplingCalls.set(0),
                Instant.now().plus(SAMPLING_WINDOW), SAMPLING_WINDOW);

        protocolLog.info(COMPONENT, "Hooks active: mode=" + properties.getOnNewEmail().name().toLowerCase()
                + ", preset=" + properties.resolvePreset().getId()
                + ", sampling=" + (samplingSupported ? "yes" : "no"));
    }

    /**
     * Unsubscribes, cancels timers and discards anything still waiting to be flushed.
     */
    public synchronized void stop() {
        eventBus.off(EmailArrivedEvent.class, arrivalListener);
        eventBus.off(MessagesExpungedEvent.class, expungeListener);
        synchronized (batchLock) {
            running = false;
            if (batchTimer != null) {
                batchTimer.cancel(false);
                batchTimer = null;
            }
            flushScheduled = false;
            pendingEmails = new ArrayList<>();
        }
        if (samplingResetTimer != null) {
            samplingResetTimer.cancel(false);
            samplingResetTimer = null;
        }
    }

    public HooksConfigView getHooksConfig() {
        return HooksConfigView.builder()
                .onNewEmail(properties.getOnNewEmail())
                .preset(properties.resolvePreset())
                .autoLabel(properties.isAutoLabel())
                .autoFlag(properties.isAutoFlag())
                .batchDelay(properties.getBatchDelay())
                .maxSamplingPerMinute(properties.getMaxSamplingPerMinute())
                .customInstructions(properties.getCustomInstructions())
                .rules(List.copyOf(properties.getRules()))
                .alerts(notifier.getConfig())
                .samplingSupported(samplingSupported)
                .active(running)
                .build();
    }

    public NotifierService getNotifier() {
        return notifier;
    }

    void onNewEmail(EmailArrivedEvent event) {
        List<BatchedEmail> arrived = new ArrayList<>();
        for (MessageSummary meta : event.getEmails()) {
            arrived.add(new BatchedEmail(event.getAccount(), event.getFolder(), meta));
        }
        synchronized (batchLock) {
            // stop() clears running under this lock
            if (!running) {
                return;
            }
            pendingEmails.addAll(arrived);
            // the window starts at the first arrival and is never extended
            if (!flushScheduled) {
                flushScheduled = true;
                batchTimer = taskScheduler.schedule(this::runScheduledFlush,
                        Instant.now().plusSeconds(properties.getBatchDelay()));
            }
        }
    }

    void onMessagesExpunged(MessagesExpungedEvent event) {
        if (running) {
            sendResourceUpdates(Set.of(event.getAccount()));
        }
    }

    /**
     * Takes the pending batch and processes it. Arrivals during processing go into the next batch.
     */
    void flushBatch() {
        List<BatchedEmail> batch;
        synchronized (batchLock) {
            batch = pendingEmails;
            pendingEmails = new ArrayList<>();
            flushScheduled = false;
            batchTimer = null;
        }
        if (batch.isEmpty()) {
            return;
        }

        Set<String> accounts = new LinkedHashSet<>();
        batch.forEach(email -> accounts.add(email.getAccount()));
        sendResourceUpdates(accounts);

        List<BatchedEmail> remaining = applyRules(batch);
        if (remaining.isEmpty()) {
            return;
        }
        if (properties.getOnNewEmail() == TriageMode.TRIAGE && samplingSupported) {
            triageBatch(remaining);
        } else {
            notifyBatch(remaining);
        }
    }

    private void runScheduledFlush() {
        try {
            flushBatch();
        } catch (RuntimeException e) {
            log.error("Batch flush failed: {}", e.getMessage(), e);
        }
    }

    private void sendResourceUpdates(Set<String> accounts) {
        for (String account : accounts) {
            for (String uri : List.of("email://" + account + "/unread", "email://" + account + "/mailboxes")) {
                try {
                    clientNotifications.sendResourceUpdated(uri);
                } catch (RuntimeException e) {
                    log.debug("Resource update for {} failed: {}", uri, e.getMessage());
                }
            }
        }
    }

    private List<BatchedEmail> applyRules(List<BatchedEmail> batch) {
        if (properties.getRules().isEmpty()) {
            return batch;
        }
        List<BatchedEmail> remaining = new ArrayList<>();
        for (BatchedEmail email : batch) {
            Optional<HooksProperties.Rule> rule = RuleMatcher.firstMatch(properties.getRules(), email.getMeta());
            if (rule.isPresent()) {
                applyRule(email, rule.get());
            } else {
                remaining.add(email);
            }
        }
        return remaining;
    }

    private void applyRule(BatchedEmail email, HooksProperties.Rule rule) {
        MessageSummary meta = email.getMeta();
        HooksProperties.Actions actions = rule.getActions();
        for (String label : actions.getLabels()) {
            try {
                mutations.addLabel(email.getAccount(), email.getFolder(), meta.getId(), label);
            } catch (MailStoreException e) {
                protocolLog.warning(COMPONENT, "Could not add label \"" + label + "\" to email " + meta.getId()
                        + ": " + e.getMessage());
            }
        }
        if (actions.isFlag()) {
            try {
                mutations.setFlag(email.getAccount(), email.getFolder(), meta.getId());
            } catch (MailStoreException e) {
                protocolLog.warning(COMPONENT, "Could not flag email " + meta.getId() + ": " + e.getMessage());
            }
        }
        if (actions.isMarkRead()) {
            try {
                mutations.markRead(email.getAccount(), email.getFolder(), meta.getId());
            } catch (MailStoreException e) {
                protocolLog.warning(COMPONENT, "Could not mark email " + meta.getId() + " as read: " + e.getMessage());
            }
        }
        protocolLog.info(COMPONENT, "Rule \"" + rule.getName() + "\" matched \"" + meta.getSubject()
                + "\" from " + meta.getFrom().getAddress());

        notifier.alert(AlertPayload.builder()
                .account(email.getAccount())
                .sender(meta.getFrom())
                .subject(meta.getSubject())
                .priority(actions.isAlert() ? Priority.HIGH : Priority.NORMAL)
                .labels(actions.getLabels())
                .ruleName(rule.getName())
                .build(), actions.isAlert());
    }

    private void notifyBatch(List<BatchedEmail> emails) {
        for (BatchedEmail email : emails) {
            protocolLog.info(COMPONENT, "New email in " + email.getAccount() + "/" + email.getFolder() + ": \""
                    + email.getMeta().getSubject() + "\" from " + email.getMeta().getFrom().getAddress());
        }
    }

    private void triageBatch(List<BatchedEmail> emails) {
        int limit = properties.getMaxSamplingPerMinute();
        if (samplingCalls.getAndUpdate(n -> n < limit ? n + 1 : n) >= limit) {
            protocolLog.warning(COMPONENT, "Sampling rate limit reached, falling back to notify");
            notifyBatch(emails);
            return;
        }

        TriagePreset preset = properties.resolvePreset();
        SamplingRequest request = SamplingRequest.builder()
                .message(SamplingMessage.user(
                        TriagePromptBuilder.buildPrompt(emails, preset, properties.getCustomInstructions())))
                .modelHint("fast")
                .speedPriority(0.8)
                .intelligencePriority(0.5)
                .maxTokens(1000)
                .build();

        SamplingResult result;
        try {
            result = samplingClient.createMessage(request);
        } catch (RuntimeException e) {
            protocolLog.warning(COMPONENT, "Sampling failed: " + e.getMessage() + ", falling back to notify");
            notifyBatch(emails);
            return;
        }

        List<TriageResult> results = TriageResponseParser.parseTriageResponse(result.getText(), emails.size());
        for (int i = 0; i < emails.size(); i++) {
            applyTriage(emails.get(i), results.get(i), preset);
        }
    }

    private void applyTriage(BatchedEmail email, TriageResult triage, TriagePreset preset) {
        MessageSummary meta = email.getMeta();
        if (properties.isAutoLabel() && triage.hasLabels()) {
            for (String label : triage.getLabels()) {
                try {
                    mutations.addLabel(email.getAccount(), email.getFolder(), meta.getId(), label);
                } catch (MailStoreException e) {
                    protocolLog.warning(COMPONENT, "Could not add label \"" + label + "\" to email " + meta.getId());
                }
            }
        }
        if (properties.isAutoFlag() && triage.requestsFlag()) {
            try {
                mutations.setFlag(email.getAccount(), email.getFolder(), meta.getId());
            } catch (MailStoreException e) {
                protocolLog.warning(COMPONENT, "Could not flag email " + meta.getId());
            }
        }

        Priority priority = triage.priority().orElse(Priority.NORMAL);
        StringBuilder summary = new StringBuilder()
                .append('[').append(priority.value()).append("] \"").append(meta.getSubject())
                .append("\" from ").append(meta.getFrom().getAddress());
        if (triage.requestsFlag()) {
            summary.append(" (flagged)");
        }
        if (triage.hasLabels()) {
            summary.append(" -> labels: ").append(String.join(", ", triage.getLabels()));
        }
        protocolLog.info(COMPONENT, summary.toString());
        if (triage.hasAction()) {
            protocolLog.info(COMPONENT, "   Action: " + triage.getAction());
        }

        notifier.alert(AlertPayload.builder()
                .account(email.getAccount())
                .sender(meta.getFrom())
                .subject(meta.getSubject())
                .priority(priority)
                .labels(triage.hasLabels() ? triage.getLabels() : List.of())
                .ruleName(preset.getId())
                .build(), false);
    }
}
