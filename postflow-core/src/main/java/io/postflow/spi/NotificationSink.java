package io.postflow.spi;

import io.postflow.event.PublicationEvent;

/**
 * Receives terminal publication events. Delivery is asynchronous and at-least-once, so
 * implementations should tolerate duplicates.
 */
@FunctionalInterface
public interface NotificationSink {

    /**
     * Sink that drops every event.
     */
    NotificationSink NOOP = event -> {
    };

    /**
     * @throws Exception any failure; the emitter retries delivery
     */
    void onPublicationEvent(PublicationEvent event) throws Exception;
}
