package io.webhook;

import io.webhook.DeliveryResult.FailureReason;
import io.webhook.model.DeliveryStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryResultTest {

  @Test
  void deliveredResult() {
    DeliveryResult result = new DeliveryResult("whd_1", DeliveryStatus.DELIVERED, 1, 200, null,
        Duration.ofMillis(5), FailureReason.NONE);

    assertTrue(result.isDelivered());
  }

  @Test
  void statusAndReasonMustAgree() {
    assertThrows(IllegalArgumentException.class, () -> new DeliveryResult("whd_1",
        DeliveryStatus.DELIVERED, 1, 200, null, Duration.ZERO, FailureReason.CLIENT_REJECTED));
    assertThrows(IllegalArgumentException.class, () -> new DeliveryResult("whd_1",
        DeliveryStatus.FAILED, 1, 500, "x", Duration.ZERO, FailureReason.NONE));
    assertThrows(IllegalArgumentException.class, () -> new DeliveryResult("whd_1",
        DeliveryStatus.PENDING, 0, null, null, Duration.ZERO, FailureReason.NONE));
  }
}
