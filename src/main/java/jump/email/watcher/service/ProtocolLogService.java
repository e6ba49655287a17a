package jump.email.watcher.service;

import jump.email.watcher.model.LogLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Log channel visible to the connected client. Every entry goes to SLF4J under
 * {@code protocol.<component>} and is then forwarded to the client event stream.
 */
@Service
public class ProtocolLogService {
    private final ClientNotificationService clientNotificationService;
    private final Map<String, Logger> loggers = new ConcurrentHashMap<>();

    public ProtocolLogService(ClientNotificationService clientNotificationService) {
        this.clientNotificationService = clientNotificationService;
    }

    public void log(LogLevel level, String component, String message) {
        Logger logger = loggers.computeIfAbsent(component, name -> LoggerFactory.getLogger("protocol." + name));
        switch (level) {
            case ALERT:
            case ERROR:
                logger.error(message);
                break;
            case WARNING:
                logger.warn(message);
                break;
            case DEBUG:
                logger.debug(message);
                break;
            default:
                logger.info(message);
                break;
        }
        clientNotificationService.sendLog(level, component, message);
    }

    public void info(String component, String message) {
        log(LogLevel.INFO, component, message);
    }

    public void warning(String component, String message) {
        log(LogLevel.WARNING, component, message);
    }
}
