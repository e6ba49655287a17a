package jump.email.watcher.service;

import jump.email.watcher.model.EmailArrivedEvent;
import jump.email.watcher.model.MessagesExpungedEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class EmailEventBusTest {

    private final EmailEventBus eventBus = new EmailEventBus();

    @Test
    void emit_ShouldDeliverInRegistrationOrder() {
        // Given
        List<String> calls = new ArrayList<>();
        eventBus.on(EmailArrivedEvent.class, e -> calls.add("first"));
        eventBus.on(EmailArrivedEvent.class, e -> calls.add("second"));

        // When
        eventBus.emit(new EmailArrivedEvent("work", "INBOX", List.of()));

        // Then
        assertEquals(List.of("first", "second"), calls);
    }

    @Test
    void emit_WhenListenerThrows_ShouldStillDeliverToOthers() {
        // Given
        List<MessagesExpungedEvent> received = new ArrayList<>();
        eventBus.on(MessagesExpungedEvent.class, e -> {
            throw new IllegalStateException("boom");
        });
        eventBus.on(MessagesExpungedEvent.class, received::add);

        // When
        eventBus.emit(new MessagesExpungedEvent("work", "INBOX", 2));

        // Then
        assertEquals(1, received.size());
        assertEquals(2, received.get(0).getCount());
    }

    @Test
    void emit_ShouldOnlyReachListenersOfTheEventType() {
        // Given
        List<Object> received = new ArrayList<>();
        eventBus.on(EmailArrivedEvent.class, received::add);

        // When
        eventBus.emit(new MessagesExpungedEvent("work", "INBOX", 1));

        // Then
        assertTrue(received.isEmpty());
    }

    @Test
    void emit_WhenListenerSubscribesDuringDelivery_ShouldNotDeliverToNewListenerThisRound() {
        // Given
        List<String> calls = new ArrayList<>();
        eventBus.on(EmailArrivedEvent.class, e -> {
            calls.add("outer");
            eventBus.on(EmailArrivedEvent.class, inner -> calls.add("inner"));
        });

        // When
        eventBus.emit(new EmailArrivedEvent("work", "INBOX", List.of()));

        // Then
        assertEquals(List.of("outer"), calls);
        assertEquals(2, eventBus.listenerCount(EmailArrivedEvent.class));
    }

    @Test
    void off_ShouldRemoveOnlyThatListener() {
        // Given
        List<String> calls = new ArrayList<>();
        Consumer<EmailArrivedEvent> removed = e -> calls.add("removed");
        eventBus.on(EmailArrivedEvent.class, removed);
        eventBus.on(EmailArrivedEvent.class, e -> calls.add("kept"));

        // When
        eventBus.off(EmailArrivedEvent.class, removed);
        eventBus.emit(new EmailArrivedEvent("work", "INBOX", List.of()));

        // Then
        assertEquals(List.of("kept"), calls);
    }

    @Test
    void removeAllListeners_ShouldClearType() {
        eventBus.on(EmailArrivedEvent.class, e -> { });
        eventBus.on(MessagesExpungedEvent.class, e -> { });

        eventBus.removeAllListeners(EmailArrivedEvent.class);

        assertEquals(0, eventBus.listenerCount(EmailArrivedEvent.class));
        assertEquals(1, eventBus.listenerCount(MessagesExpungedEvent.class));
    }
}
