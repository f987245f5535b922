package io.webhook.jdbc;

/**
 * Unchecked wrapper for {@link java.sql.SQLException}s raised by the JDBC delivery store.
 */
public class DeliveryStoreException extends RuntimeException {

  public DeliveryStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
