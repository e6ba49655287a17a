package jump.email.watcher.mail;

import lombok.Value;

@Value
public class MailEndpoint {
    String host;
    int port;
    boolean tls;
    boolean verifySsl;
}
