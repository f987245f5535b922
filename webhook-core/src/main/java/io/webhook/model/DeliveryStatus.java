package io.webhook.model;

/**
 * Lifecycle status of a persisted delivery record.
 *
 * <p>Transitions are one-way: {@code PENDING → DELIVERED} or {@code PENDING → FAILED}.
 */
public enum DeliveryStatus {
  PENDING("pending"),
  DELIVERED("delivered"),
  FAILED("failed");

  private final String code;

  DeliveryStatus(String code) {
    this.code = code;
  }

  /**
   * Returns the value stored in the {@code status} column.
   *
   * @return the persisted status code
   */
  public String code() {
    return code;
  }

  public boolean isTerminal() {
    return this != PENDING;
  }

  /**
   * Resolves a stored status code.
   *
   * @param code the persisted value
   * @return the matching status
   * @throws IllegalArgumentException if the code is unknown
   */
  public static DeliveryStatus fromCode(String code) {
    for (DeliveryStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown delivery status: " + code);
  }
}
