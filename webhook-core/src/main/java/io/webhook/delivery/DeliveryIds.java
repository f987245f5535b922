package io.webhook.delivery;

import com.github.f4b6a3.ulid.UlidCreator;

/**
 * Generates delivery identifiers: {@code "whd_"} followed by a lower-case monotonic ULID.
 */
public final class DeliveryIds {
  public static final String PREFIX = "whd_";

  private DeliveryIds() {
  }

  public static String newId() {
    return PREFIX + UlidCreator.getMonotonicUlid().toLowerCase();
  }
}
