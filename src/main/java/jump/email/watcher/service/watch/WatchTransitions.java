package jump.email.watcher.service.watch;

/**
 * The watcher state machine as a total function. Side effects (connecting, fetching, timers)
 * live in {@link TargetWorker}; this class only decides the next state.
 */
public final class WatchTransitions {

    private WatchTransitions() {
    }

    public static WatchState apply(WatchState state, WatchEvent event, BackoffPolicy policy) {
        if (state.isStopped()) {
            return state;
        }
        switch (event.getType()) {
            case STOP:
                return state.withPhase(WatchPhase.STOPPED);
            case CONNECT_DUE:
                if (state.getPhase() == WatchPhase.RECONNECTING) {
                    return state.withPhase(WatchPhase.CONNECTING).withBackoffMs(policy.next(state.getBackoffMs()));
                }
                return state;
            case CONNECTED:
                if (state.getPhase() != WatchPhase.CONNECTING) {
                    return state;
                }
                return state.withPhase(WatchPhase.IDLE)
                        .withLastSeenId(Math.max(0, event.getValue() - 1))
                        .withBackoffMs(policy.getInitialMs())
                        .withConsecutiveFailures(0);
            case CONNECT_FAILED:
                if (state.getPhase() != WatchPhase.CONNECTING) {
                    return state;
                }
                int failures = state.getConsecutiveFailures() + 1;
                if (policy.exhausted(failures)) {
                    return state.withPhase(WatchPhase.STOPPED).withConsecutiveFailures(failures);
                }
                return state.withPhase(WatchPhase.RECONNECTING).withConsecutiveFailures(failures);
            case ITEMS_ARRIVED:
                return state.getPhase() == WatchPhase.IDLE ? state.withPhase(WatchPhase.NOTIFYING) : state;
            case FETCHED:
                if (state.getPhase() != WatchPhase.NOTIFYING) {
                    return state;
                }
                return state.withPhase(WatchPhase.IDLE)
                        .withLastSeenId(Math.max(state.getLastSeenId(), event.getValue()));
            case FETCH_FAILED:
                return state.getPhase() == WatchPhase.NOTIFYING ? state.withPhase(WatchPhase.IDLE) : state;
            case CLOSED:
                return state.isConnected() ? state.withPhase(WatchPhase.RECONNECTING) : state;
            case ITEMS_EXPUNGED:
            default:
                return state;
        }
    }
}
