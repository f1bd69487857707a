package io.postflow.model;

/**
 * Classification of a failed publish attempt, persisted with the publication so that the
 * next attempt can tell whether the previous one was also an authentication failure.
 */
public enum ErrorKind {
  RATE_LIMITED,
  AUTH,
  TRANSIENT,
  PERMANENT
}
