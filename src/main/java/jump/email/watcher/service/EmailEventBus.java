package jump.email.watcher.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process typed publish/subscribe hub for mailbox events.
 * Decouples the IDLE watcher from the hooks that react to new mail.
 * Created once by the container and handed to every component that needs it.
 */
@Slf4j
@Service
public class EmailEventBus {
    private final Map<Class<?>, List<Registration<?>>> listeners = new ConcurrentHashMap<>();

    public <E> void on(Class<E> eventType, Consumer<? super E> listener) {
        listeners.computeIfAbsent(eventType, type -> new CopyOnWriteArrayList<>())
                .add(new Registration<>(eventType, listener));
    }

    /**
     * Delivers the event synchronously to every listener of its type, in registration order.
     * A failing listener is logged and does not stop delivery to the rest.
     */
    public void emit(Object event) {
        List<Registration<?>> registered = listeners.get(event.getClass());
        if (registered == null) {
            return;
        }
        for (Registration<?> registration : registered) {
            try {
                registration.deliver(event);
            } catch (RuntimeException e) {
                log.warn("Listener for {} failed: {}", event.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    public <E> void off(Class<E> eventType, Consumer<? super E> listener) {
        List<Registration<?>> registered = listeners.get(eventType);
        if (registered != null) {
            registered.removeIf(registration -> registration.listener == listener);
        }
    }

    public void removeAllListeners(Class<?> eventType) {
        listeners.remove(eventType);
    }

    public int listenerCount(Class<?> eventType) {
        List<Registration<?>> registered = listeners.get(eventType);
        return registered == null ? 0 : registered.size();
    }

    private static final class Registration<E> {
        private final Class<E> eventType;
        private final Consumer<? super E> listener;

        Registration(Class<E> eventType, Consumer<? super E> listener) {
            this.eventType = eventType;
            this.listener = listener;
        }

        void deliver(Object event) {
            listener.accept(eventType.cast(event));
        }
    }
}
