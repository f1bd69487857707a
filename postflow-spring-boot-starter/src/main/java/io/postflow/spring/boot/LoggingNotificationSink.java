package io.postflow.spring.boot;

import io.postflow.event.PublicationEvent;
import io.postflow.spi.NotificationSink;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default sink used when the application defines none: logs each terminal publication.
 */
public class LoggingNotificationSink implements NotificationSink {
    private static final Logger logger = Logger.getLogger(LoggingNotificationSink.class.getName());

    @Override
    public void onPublicationEvent(PublicationEvent event) {
        if (event.outcome() == PublicationEvent.Outcome.PUBLISHED) {
            logger.log(Level.INFO, "Published schedule {0} to {1} as {2} after {3} attempt(s)",
                    new Object[]{event.scheduleId(), event.platform().tag(), event.remotePostId(),
                            event.attemptCount()});
        } else {
            logger.log(Level.WARNING, "Publishing schedule {0} to {1} failed ({2}) after {3} attempt(s): {4}",
                    new Object[]{event.scheduleId(), event.platform().tag(), event.errorKind(),
                            event.attemptCount(), event.errorMessage()});
        }
    }
}
