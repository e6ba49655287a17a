package jump.email.watcher.service.watch;

public enum WatchPhase {
    CONNECTING,
    IDLE,
    NOTIFYING,
    RECONNECTING,
    STOPPED
}
