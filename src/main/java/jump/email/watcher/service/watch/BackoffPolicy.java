package jump.email.watcher.service.watch;

import lombok.Value;

/**
 * Exponential reconnect delay: starts at {@code initialMs}, doubles per consecutive failure,
 * never exceeds {@code maxMs}. {@code maxConsecutiveFailures} of 0 means retry forever.
 */
@Value
public class BackoffPolicy {
    long initialMs;
    long maxMs;
    int maxConsecutiveFailures;

    public long next(long currentMs) {
        return Math.min(currentMs * 2, maxMs);
    }

    public boolean exhausted(int consecutiveFailures) {
        return maxConsecutiveFailures > 0 && consecutiveFailures >= maxConsecutiveFailures;
    }
}
