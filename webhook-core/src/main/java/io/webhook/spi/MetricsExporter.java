package io.webhook.spi;

import java.time.Duration;

/**
 * Observability hook for exporting delivery counters and distributions to a metrics backend.
 *
 * <p>Only tracked deliveries (both {@code tenantId} and {@code eventType} present) are
 * reported. Implementations must be safe for concurrent use. The {@link #NOOP}
 * instance discards everything.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /** Value of the {@code status} tag on the delivery counter. */
    enum Outcome {
        SUCCESS("success"),
        CLIENT_ERROR("client_error"),
        MAX_RETRIES_EXCEEDED("max_retries_exceeded"),
        VALIDATION_FAILED("validation_failed"),
        CIRCUIT_OPEN("circuit_open");

        private final String tag;

        Outcome(String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }
    }

    /**
     * Increments the delivery counter for a terminal outcome.
     *
     * @param tenantId  the tenant
     * @param eventType the event type
     * @param outcome   the terminal outcome
     */
    void incrementDelivery(String tenantId, String eventType, Outcome outcome);

    /**
     * Records total wall-clock time of a delivery, including backoff.
     *
     * @param tenantId  the tenant
     * @param eventType the event type
     * @param duration  elapsed time (non-negative)
     */
    void recordDeliveryDuration(String tenantId, String eventType, Duration duration);

    /**
     * Records how many attempts a delivery took.
     *
     * @param tenantId  the tenant
     * @param eventType the event type
     * @param attempts  attempts made (&ge; 1)
     */
    void recordDeliveryAttempts(String tenantId, String eventType, int attempts);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDelivery(String tenantId, String eventType, Outcome outcome) {
        }

        @Override
        public void recordDeliveryDuration(String tenantId, String eventType, Duration duration) {
        }

        @Override
        public void recordDeliveryAttempts(String tenantId, String eventType, int attempts) {
        }
    }
}
