package io.postflow.event;

/**
 * Told once a sink has accepted an event, so the owed-event marker can be cleared.
 */
@FunctionalInterface
public interface EventAcknowledger {

  EventAcknowledger NOOP = event -> {
  };

  void acknowledge(PublicationEvent event) throws Exception;
}
