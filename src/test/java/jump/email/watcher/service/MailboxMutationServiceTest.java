package jump.email.watcher.service;

import jump.email.watcher.config.WatcherProperties;
import jump.email.watcher.mail.MailConnection;
import jump.email.watcher.mail.MailMutation;
import jump.email.watcher.mail.MailStore;
import jump.email.watcher.mail.MailStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MailboxMutationServiceTest {

    @Mock
    private MailStore mailStore;

    @Mock
    private MailConnection connection;

    private MailboxMutationService mutationService;

    @BeforeEach
    void setUp() {
        WatcherProperties properties = new WatcherProperties();
        WatcherProperties.Account account = new WatcherProperties.Account();
        account.setName("work");
        account.setUsername("me@example.com");
        account.setPassword("secret");
        account.getImap().setHost("imap.example.com");
        properties.setAccounts(List.of(account));
        mutationService = new MailboxMutationService(properties, mailStore);
    }

    @Test
    void mutations_ShouldReuseOneConnectionPerAccount() throws Exception {
        // Given
        when(mailStore.connect(any(), any())).thenReturn(connection);
        when(connection.isUsable()).thenReturn(true);

        // When
        mutationService.addLabel("work", "INBOX", "7", "Finance");
        mutationService.setFlag("work", "INBOX", "7");
        mutationService.markRead("work", "INBOX", "7");

        // Then
        verify(mailStore, times(1)).connect(any(), any());
        verify(connection).mutate("INBOX", "7", MailMutation.addLabel("Finance"));
        verify(connection).mutate("INBOX", "7", MailMutation.setFlag());
        verify(connection).mutate("INBOX", "7", MailMutation.markRead());
    }

    @Test
    void mutate_WhenConnectionDropped_ShouldReconnect() throws Exception {
        // Given
        MailConnection fresh = mock(MailConnection.class);
        when(mailStore.connect(any(), any())).thenReturn(connection, fresh);
        when(connection.isUsable()).thenReturn(false);

        // When
        mutationService.setFlag("work", "INBOX", "1");
        mutationService.setFlag("work", "INBOX", "2");

        // Then
        verify(connection).close();
        verify(fresh).mutate("INBOX", "2", MailMutation.setFlag());
    }

    @Test
    void mutate_UnknownAccount_ShouldThrow() {
        MailStoreException e = assertThrows(MailStoreException.class,
                () -> mutationService.setFlag("nobody", "INBOX", "1"));

        assertEquals("Unknown account: nobody", e.getMessage());
        verifyNoInteractions(mailStore);
    }

    @Test
    void closeAll_ShouldCloseOpenConnections() throws Exception {
        when(mailStore.connect(any(), any())).thenReturn(connection);
        mutationService.markRead("work", "INBOX", "3");

        mutationService.closeAll();

        verify(connection).close();
    }
}
