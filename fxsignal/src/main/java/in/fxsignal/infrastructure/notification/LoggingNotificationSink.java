package in.fxsignal.infrastructure.notification;

import in.fxsignal.application.port.output.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Notification sink that writes messages to the log.
 *
 * Default channel when no external transport is wired. Each line of a
 * multi-line message is logged under the same tag.
 */
public final class LoggingNotificationSink implements NotificationSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public boolean send(String text) {
        if (text == null || text.isBlank()) {
            log.warn("[NOTIFY] Ignoring empty message");
            return false;
        }
        for (String line : text.split("\n")) {
            log.info("[NOTIFY] {}", line);
        }
        return true;
    }
}
