package io.postflow.model;

/**
 * Lifecycle of a {@link Publication}: {@code pending -> publishing -> (published | failed | pending)}.
 *
 * <p>{@link #PUBLISHED} and {@link #FAILED} are terminal. Every status is persisted as its
 * lowercase {@link #code()}.
 */
public enum PublicationStatus {
  PENDING("pending"),
  PUBLISHING("publishing"),
  PUBLISHED("published"),
  FAILED("failed");

  private final String code;

  PublicationStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public boolean isTerminal() {
    return this == PUBLISHED || this == FAILED;
  }

  public static PublicationStatus fromCode(String code) {
    for (PublicationStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown publication status: " + code);
  }
}
