package io.webhook.jdbc;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Validation for the name of the delivery record table.
 *
 * <p>The name is concatenated into every store statement, so only unquoted identifiers
 * that H2, MySQL and PostgreSQL all accept verbatim pass: ASCII letters, digits and
 * underscores, not starting with a digit, at most {@value #MAX_LENGTH} characters
 * (PostgreSQL truncates longer identifiers silently).
 */
public final class TableNames {
  public static final String DEFAULT_TABLE = "webhook_deliveries";
  public static final int MAX_LENGTH = 63;

  private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

  private TableNames() {}

  /**
   * Returns {@code tableName} unchanged if it is usable as the delivery record table.
   *
   * @param tableName the configured table name
   * @return the same name
   * @throws IllegalArgumentException if the name is not a plain identifier or is too long
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (tableName.length() > MAX_LENGTH) {
      throw new IllegalArgumentException("Delivery table name longer than " + MAX_LENGTH
          + " characters: " + tableName);
    }
    if (!IDENTIFIER.matcher(tableName).matches()) {
      throw new IllegalArgumentException("Delivery table name must be a plain identifier, got: "
          + tableName);
    }
    return tableName;
  }
}
