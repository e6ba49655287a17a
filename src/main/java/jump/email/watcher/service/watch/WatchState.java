package jump.email.watcher.service.watch;

import lombok.Builder;
import lombok.Value;
import lombok.With;

@Value
@With
@Builder
public class WatchState {
    WatchKey key;
    WatchPhase phase;
    long lastSeenId;
    long backoffMs;
    int consecutiveFailures;

    public static WatchState initial(WatchKey key, BackoffPolicy policy) {
        return WatchState.builder()
                .key(key)
                .phase(WatchPhase.CONNECTING)
                .lastSeenId(0)
                .backoffMs(policy.getInitialMs())
                .consecutiveFailures(0)
                .build();
    }

    public boolean isConnected() {
        return phase == WatchPhase.IDLE || phase == WatchPhase.NOTIFYING;
    }

    public boolean isStopped() {
        return phase == WatchPhase.STOPPED;
    }
}
