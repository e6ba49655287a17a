package jump.email.watcher.mail;

import lombok.Value;

/**
 * Push notification from a subscribed folder.
 */
@Value
public class StoreSignal {
    public enum Kind {
        ITEM_COUNT_INCREASED,
        ITEMS_EXPUNGED,
        CLOSED
    }

    Kind kind;
    int count;

    public static StoreSignal itemCountIncreased(int count) {
        return new StoreSignal(Kind.ITEM_COUNT_INCREASED, count);
    }

    public static StoreSignal itemsExpunged(int count) {
        return new StoreSignal(Kind.ITEMS_EXPUNGED, count);
    }

    public static StoreSignal closed() {
        return new StoreSignal(Kind.CLOSED, 0);
    }
}
