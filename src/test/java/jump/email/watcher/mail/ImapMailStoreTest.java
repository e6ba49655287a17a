package jump.email.watcher.mail;

import jakarta.mail.Flags;
import jakarta.mail.Message;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jump.email.watcher.model.MessageSummary;
import org.junit.jupiter.api.Test;

import java.util.Date;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ImapMailStoreTest {

    @Test
    void sessionProperties_WithTlsAndPassword_ShouldEnableSsl() {
        // When
        Properties props = ImapMailStore.sessionProperties("imaps",
                new MailEndpoint("imap.example.com", 993, true, true),
                new MailCredentials("me@example.com", "secret", false));

        // Then
        assertEquals("imap.example.com", props.getProperty("mail.imaps.host"));
        assertEquals("993", props.getProperty("mail.imaps.port"));
        assertEquals("true", props.getProperty("mail.imaps.ssl.enable"));
        assertNull(props.getProperty("mail.imaps.ssl.trust"));
        assertNull(props.getProperty("mail.imaps.auth.mechanisms"));
        assertNotNull(props.getProperty("mail.imaps.connectiontimeout"));
    }

    @Test
    void sessionProperties_WithoutCertificateChecks_ShouldTrustAllHosts() {
        Properties props = ImapMailStore.sessionProperties("imaps",
                new MailEndpoint("localhost", 1993, true, false),
                new MailCredentials("me", "secret", false));

        assertEquals("*", props.getProperty("mail.imaps.ssl.trust"));
        assertEquals("false", props.getProperty("mail.imaps.ssl.checkserveridentity"));
    }

    @Test
    void sessionProperties_WithBearerToken_ShouldUseXoauth2() {
        Properties props = ImapMailStore.sessionProperties("imap",
                new MailEndpoint("imap.example.com", 143, false, true),
                new MailCredentials("me@example.com", "ya29.token", true));

        assertEquals("XOAUTH2", props.getProperty("mail.imap.auth.mechanisms"));
        assertEquals("true", props.getProperty("mail.imap.starttls.enable"));
    }

    @Test
    void toSummary_ShouldMapEnvelopeFlagsAndLabels() throws Exception {
        // Given
        MimeMessage message = new MimeMessage(Session.getInstance(new Properties()));
        message.setSubject("Quarterly numbers");
        message.setFrom(new InternetAddress("cfo@example.com", "The CFO"));
        message.setRecipients(Message.RecipientType.TO, "me@example.com, team@example.com");
        message.setSentDate(new Date(1_700_000_000_000L));
        MimeBodyPart text = new MimeBodyPart();
        text.setText("See attached");
        MimeBodyPart attachment = new MimeBodyPart();
        attachment.setText("a,b,c");
        attachment.setDisposition(MimeBodyPart.ATTACHMENT);
        attachment.setFileName("numbers.csv");
        message.setContent(new MimeMultipart(text, attachment));
        message.saveChanges();
        message.setFlag(Flags.Flag.FLAGGED, true);
        message.setFlags(new Flags("Finance"), true);

        // When
        MessageSummary summary = ImapMailConnection.toSummary(4711, message);

        // Then
        assertEquals("4711", summary.getId());
        assertEquals("Quarterly numbers", summary.getSubject());
        assertEquals("The CFO", summary.getFrom().getName());
        assertEquals("cfo@example.com", summary.getFrom().getAddress());
        assertEquals(2, summary.getTo().size());
        assertEquals(1_700_000_000_000L, summary.getDate().toEpochMilli());
        assertTrue(summary.isFlagged());
        assertFalse(summary.isSeen());
        assertTrue(summary.isHasAttachments());
        assertEquals(List.of("Finance"), summary.getLabels());
    }

    @Test
    void toSummary_WithoutSubjectOrSender_ShouldUseDefaults() throws Exception {
        MimeMessage message = new MimeMessage(Session.getInstance(new Properties()));
        message.setText("plain");
        message.saveChanges();

        MessageSummary summary = ImapMailConnection.toSummary(1, message);

        assertEquals("(no subject)", summary.getSubject());
        assertEquals("", summary.getFrom().getAddress());
        assertFalse(summary.isHasAttachments());
        assertTrue(summary.getLabels().isEmpty());
    }
}
