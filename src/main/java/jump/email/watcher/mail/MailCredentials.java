package jump.email.watcher.mail;

import lombok.ToString;
import lombok.Value;

/**
 * Login for a mail store. When {@code bearer} is set the secret is an OAuth2 access token.
 */
@Value
public class MailCredentials {
    String username;
    @ToString.Exclude
    String secret;
    boolean bearer;
}
