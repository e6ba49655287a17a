package jump.email.watcher.mail;

import jakarta.mail.Address;
import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Store;
import jakarta.mail.UIDFolder;
import jakarta.mail.event.ConnectionAdapter;
import jakarta.mail.event.ConnectionEvent;
import jakarta.mail.event.MessageCountAdapter;
import jakarta.mail.event.MessageCountEvent;
import jakarta.mail.internet.InternetAddress;
import jump.email.watcher.model.EmailAddress;
import jump.email.watcher.model.MessageSummary;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.angus.mail.imap.IMAPFolder;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

@Slf4j
class ImapMailConnection implements MailConnection {
    private final Store store;
    private final TaskScheduler taskScheduler;
    private final Duration idleTimeout;
    private final Map<String, ImapSubscription> subscriptions = new ConcurrentHashMap<>();

    ImapMailConnection(Store store, TaskScheduler taskScheduler, Duration idleTimeout) {
        this.store = store;
        this.taskScheduler = taskScheduler;
        this.idleTimeout = idleTimeout;
    }

    @Override
    public FolderSubscription subscribe(String folderName, Consumer<StoreSignal> listener) throws MailStoreException {
        try {
            Folder folder = store.getFolder(folderName);
            if (!(folder instanceof IMAPFolder)) {
                throw new MailStoreException("Store does not support IDLE on " + folderName);
            }
            IMAPFolder imapFolder = (IMAPFolder) folder;
            imapFolder.open(Folder.READ_WRITE);
            long nextId = imapFolder.getUIDNext();
            if (nextId < 1) {
                nextId = 1;
            }
            ImapSubscription subscription = new ImapSubscription(folderName, imapFolder, nextId, listener);
            subscriptions.put(folderName, subscription);
            subscription.start();
            return subscription;
        } catch (MessagingException e) {
            throw new MailStoreException("Could not open " + folderName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<MessageSummary> fetchSummaries(String folderName, long fromId) throws MailStoreException {
        ImapSubscription subscription = subscriptions.get(folderName);
        if (subscription == null) {
            throw new MailStoreException("Folder " + folderName + " is not subscribed");
        }
        IMAPFolder folder = subscription.folder;
        try {
            Message[] messages = folder.getMessagesByUID(fromId, UIDFolder.MAXUID);
            FetchProfile profile = new FetchProfile();
            profile.add(FetchProfile.Item.ENVELOPE);
            profile.add(FetchProfile.Item.FLAGS);
            profile.add(FetchProfile.Item.CONTENT_INFO);
            profile.add(UIDFolder.FetchProfileItem.UID);
            folder.fetch(messages, profile);

            List<MessageSummary> summaries = new ArrayList<>();
            for (Message message : messages) {
                if (message != null) {
                    summaries.add(toSummary(folder.getUID(message), message));
                }
            }
            return summaries;
        } catch (MessagingException e) {
            throw new MailStoreException("Fetch failed in " + folderName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void mutate(String folderName, String messageId, MailMutation mutation) throws MailStoreException {
        ImapSubscription subscription = subscriptions.get(folderName);
        IMAPFolder folder = null;
        boolean temporary = subscription == null;
        try {
            if (temporary) {
                folder = (IMAPFolder) store.getFolder(folderName);
                folder.open(Folder.READ_WRITE);
            } else {
                folder = subscription.folder;
            }
            Message message = folder.getMessageByUID(Long.parseLong(messageId));
            if (message == null) {
                throw new MailStoreException("Message " + messageId + " not found in " + folderName);
            }
            switch (mutation.getKind()) {
                case ADD_LABEL:
                    message.setFlags(new Flags(mutation.getLabel()), true);
                    break;
                case SET_FLAG:
                    message.setFlag(Flags.Flag.FLAGGED, true);
                    break;
                case MARK_READ:
                    message.setFlag(Flags.Flag.SEEN, true);
                    break;
                default:
                    break;
            }
        } catch (MessagingException | NumberFormatException e) {
            throw new MailStoreException("Could not update message " + messageId + ": " + e.getMessage(), e);
        } finally {
            if (temporary && folder != null && folder.isOpen()) {
                try {
                    folder.close(false);
                } catch (MessagingException e) {
                    log.debug("Error closing {}: {}", folderName, e.getMessage());
                }
            }
        }
    }

    @Override
    public boolean isUsable() {
        return store.isConnected();
    }

    @Override
    public void close() {
        subscriptions.values().forEach(ImapSubscription::release);
        subscriptions.clear();
        try {
            store.close();
        } catch (MessagingException e) {
            log.debug("Error closing store: {}", e.getMessage());
        }
    }

    static MessageSummary toSummary(long uid, Message message) throws MessagingException {
        Flags flags = message.getFlags();
        MessageSummary.MessageSummaryBuilder builder = MessageSummary.builder()
                .id(String.valueOf(uid))
                .subject(message.getSubject() != null ? message.getSubject() : "(no subject)")
                .from(firstAddress(message.getFrom()))
                .date(toInstant(message.getSentDate() != null ? message.getSentDate() : message.getReceivedDate()))
                .seen(flags.contains(Flags.Flag.SEEN))
                .flagged(flags.contains(Flags.Flag.FLAGGED))
                .answered(flags.contains(Flags.Flag.ANSWERED))
                .hasAttachments(hasAttachments(message));

        Address[] to = message.getRecipients(Message.RecipientType.TO);
        if (to != null) {
            for (Address address : to) {
                builder.recipient(toEmailAddress(address));
            }
        }
        for (String userFlag : flags.getUserFlags()) {
            builder.label(userFlag);
        }
        return builder.build();
    }

    private static EmailAddress firstAddress(Address[] addresses) {
        if (addresses == null || addresses.length == 0) {
            return new EmailAddress(null, "");
        }
        return toEmailAddress(addresses[0]);
    }

    private static EmailAddress toEmailAddress(Address address) {
        if (address instanceof InternetAddress) {
            InternetAddress internet = (InternetAddress) address;
            return new EmailAddress(internet.getPersonal(), internet.getAddress() != null ? internet.getAddress() : "");
        }
        return new EmailAddress(null, address.toString());
    }

    private static Instant toInstant(Date date) {
        return date != null ? date.toInstant() : Instant.now();
    }

    private static boolean hasAttachments(Part part) {
        try {
            if (Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition())) {
                return true;
            }
            if (part.isMimeType("multipart/*")) {
                Multipart multipart = (Multipart) part.getContent();
                for (int i = 0; i < multipart.getCount(); i++) {
                    if (hasAttachments(multipart.getBodyPart(i))) {
                        return true;
                    }
                }
            }
            return false;
        } catch (MessagingException | IOException e) {
            log.debug("Could not inspect body structure: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Runs the IDLE loop for one folder on its own thread and turns folder events into signals.
     */
    private class ImapSubscription implements FolderSubscription {
        private final String folderName;
        private final IMAPFolder folder;
        private final long nextId;
        private final Consumer<StoreSignal> listener;
        private volatile boolean released;
        private ScheduledFuture<?> keepAlive;
        private Thread idleThread;

        ImapSubscription(String folderName, IMAPFolder folder, long nextId, Consumer<StoreSignal> listener) {
            this.folderName = folderName;
            this.folder = folder;
            this.nextId = nextId;
            this.listener = listener;
        }

        void start() {
            folder.addMessageCountListener(new MessageCountAdapter() {
                @Override
                public void messagesAdded(MessageCountEvent e) {
                    listener.accept(StoreSignal.itemCountIncreased(e.getMessages().length));
                }

                @Override
                public void messagesRemoved(MessageCountEvent e) {
                    listener.accept(StoreSignal.itemsExpunged(e.getMessages().length));
                }
            });
            folder.addConnectionListener(new ConnectionAdapter() {
                @Override
                public void closed(ConnectionEvent e) {
                    signalClosed();
                }
            });

            // Interrupting IDLE with a NOOP keeps the session below the server's idle cutoff.
            keepAlive = taskScheduler.scheduleWithFixedDelay(this::noop, idleTimeout);

            idleThread = new Thread(this::idleLoop, "imap-idle-" + folderName);
            idleThread.setDaemon(true);
            idleThread.start();
        }

        private void idleLoop() {
            try {
                while (!released && folder.isOpen()) {
                    folder.idle();
                }
            } catch (MessagingException | IllegalStateException e) {
                if (!released) {
                    log.debug("IDLE ended on {}: {}", folderName, e.getMessage());
                }
            }
            signalClosed();
        }

        private void noop() {
            if (released || !folder.isOpen()) {
                return;
            }
            try {
                folder.doCommand(protocol -> {
                    protocol.noop();
                    return null;
                });
            } catch (MessagingException e) {
                log.debug("Keepalive failed on {}: {}", folderName, e.getMessage());
            }
        }

        private synchronized void signalClosed() {
            if (keepAlive != null) {
                keepAlive.cancel(false);
                keepAlive = null;
            }
            if (!released) {
                released = true;
                listener.accept(StoreSignal.closed());
            }
        }

        @Override
        public long nextId() {
            return nextId;
        }

        @Override
        public synchronized void release() {
            released = true;
            if (keepAlive != null) {
                keepAlive.cancel(false);
                keepAlive = null;
            }
            subscriptions.remove(folderName, this);
            try {
                if (folder.isOpen()) {
                    folder.close(false);
                }
            } catch (MessagingException e) {
                log.debug("Error releasing {}: {}", folderName, e.getMessage());
            }
        }
    }
}
