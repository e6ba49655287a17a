package jump.email.watcher;

import jump.email.watcher.config.HooksProperties;
import jump.email.watcher.config.WatcherProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;


@EnableConfigurationProperties({WatcherProperties.class, HooksProperties.class})
@SpringBootApplication
public class WatcherApplication {

    public static void main(String[] args) {
        SpringApplication.run(WatcherApplication.class, args);
    }

}
