package jump.email.watcher.service.watch;

import lombok.Value;

@Value
public class WatchKey {
    String account;
    String folder;

    @Override
    public String toString() {
        return account + ":" + folder;
    }
}
