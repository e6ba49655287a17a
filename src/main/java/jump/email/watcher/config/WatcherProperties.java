package jump.email.watcher.config;

import jump.email.watcher.mail.MailCredentials;
import jump.email.watcher.mail.MailEndpoint;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the IDLE watcher, bound from {@code watcher.*} in application.properties.
 */
@Data
@ConfigurationProperties(prefix = "watcher")
public class WatcherProperties {
    private boolean enabled = true;

    private List<String> folders = new ArrayList<>(List.of("INBOX"));

    /** Seconds before an IDLE command is re-issued; servers drop idle clients after 30 minutes. */
    private int idleTimeout = 1740;

    private long initialBackoffMs = 1_000;

    private long maxBackoffMs = 60_000;

    /** 0 keeps retrying forever. */
    private int maxConsecutiveFailures = 0;

    private List<Account> accounts = new ArrayList<>();

    @Data
    public static class Account {
        private String name;
        private String username;
        @ToString.Exclude
        private String password;
        /** When true the password is an OAuth2 access token sent with XOAUTH2. */
        private boolean oauth2;
        private Imap imap = new Imap();

        public MailEndpoint toEndpoint() {
            return new MailEndpoint(imap.getHost(), imap.getPort(), imap.isTls(), imap.isVerifySsl());
        }

        public MailCredentials toCredentials() {
            return new MailCredentials(username, password, oauth2);
        }
    }

    @Data
    public static class Imap {
        private String host;
        private int port = 993;
        private boolean tls = true;
        private boolean verifySsl = true;
    }
}
