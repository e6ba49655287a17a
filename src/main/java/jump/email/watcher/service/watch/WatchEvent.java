package jump.email.watcher.service.watch;

import lombok.Value;

/**
 * Input to the per-target state machine. Store signals carry the generation of the connection
 * that produced them so signals from a discarded connection can be ignored.
 */
@Value
public class WatchEvent {
    public enum Type {
        CONNECT_DUE,
        CONNECTED,
        CONNECT_FAILED,
        ITEMS_ARRIVED,
        ITEMS_EXPUNGED,
        FETCHED,
        FETCH_FAILED,
        CLOSED,
        STOP
    }

    Type type;
    long value;
    int generation;

    public static WatchEvent connectDue() {
        return new WatchEvent(Type.CONNECT_DUE, 0, 0);
    }

    public static WatchEvent connected(long nextId) {
        return new WatchEvent(Type.CONNECTED, nextId, 0);
    }

    public static WatchEvent connectFailed() {
        return new WatchEvent(Type.CONNECT_FAILED, 0, 0);
    }

    public static WatchEvent itemsArrived(int generation) {
        return new WatchEvent(Type.ITEMS_ARRIVED, 0, generation);
    }

    public static WatchEvent itemsExpunged(int count, int generation) {
        return new WatchEvent(Type.ITEMS_EXPUNGED, count, generation);
    }

    public static WatchEvent fetched(long maxId) {
        return new WatchEvent(Type.FETCHED, maxId, 0);
    }

    public static WatchEvent fetchFailed() {
        return new WatchEvent(Type.FETCH_FAILED, 0, 0);
    }

    public static WatchEvent closed(int generation) {
        return new WatchEvent(Type.CLOSED, 0, generation);
    }

    public static WatchEvent stop() {
        return new WatchEvent(Type.STOP, 0, 0);
    }

    public boolean isStoreSignal() {
        return type == Type.ITEMS_ARRIVED || type == Type.ITEMS_EXPUNGED || type == Type.CLOSED;
    }
}
