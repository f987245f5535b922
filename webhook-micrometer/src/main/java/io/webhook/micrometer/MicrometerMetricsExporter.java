package io.webhook.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.webhook.spi.MetricsExporter;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Meters are tagged per tenant and event type and registered lazily on first use.
 * With the default prefix {@code "webhook"} the Prometheus names are:
 *
 * <ul>
 *   <li>{@code webhook_delivery_total{tenant,event_type,status}} (counter)</li>
 *   <li>{@code webhook_delivery_duration_seconds{tenant,event_type}} (timer, includes backoff)</li>
 *   <li>{@code webhook_delivery_attempts{tenant,event_type}} (distribution summary)</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    public static final String DEFAULT_PREFIX = "webhook";

    static final String TAG_TENANT = "tenant";
    static final String TAG_EVENT_TYPE = "event_type";
    static final String TAG_STATUS = "status";
    private static final String UNKNOWN = "unknown";

    private final MeterRegistry registry;
    private final String deliveryName;
    private final String durationName;
    private final String attemptsName;
    private final Set<Meter> registered = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "webhook"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Creates an exporter with a custom metric name prefix.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "billing.webhook"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }
        this.registry = registry;
        this.deliveryName = namePrefix + ".delivery";
        this.durationName = namePrefix + ".delivery.duration";
        this.attemptsName = namePrefix + ".delivery.attempts";
    }

    @Override
    public void incrementDelivery(String tenantId, String eventType, Outcome outcome) {
        if (closed) return;
        Counter counter = Counter.builder(deliveryName)
                .description("Webhook deliveries by terminal outcome")
                .tags(tags(tenantId, eventType).and(TAG_STATUS, outcome.tag()))
                .register(registry);
        registered.add(counter);
        counter.increment();
    }

    @Override
    public void recordDeliveryDuration(String tenantId, String eventType, Duration duration) {
        if (closed) return;
        Timer timer = Timer.builder(durationName)
                .description("Wall-clock time of a delivery including retries and backoff")
                .tags(tags(tenantId, eventType))
                .register(registry);
        registered.add(timer);
        timer.record(duration);
    }

    @Override
    public void recordDeliveryAttempts(String tenantId, String eventType, int attempts) {
        if (closed) return;
        DistributionSummary summary = DistributionSummary.builder(attemptsName)
                .description("HTTP attempts made per delivery")
                .tags(tags(tenantId, eventType))
                .register(registry);
        registered.add(summary);
        summary.record(attempts);
    }

    private static Tags tags(String tenantId, String eventType) {
        return Tags.of(
                TAG_TENANT, tenantId == null ? UNKNOWN : tenantId,
                TAG_EVENT_TYPE, eventType == null ? UNKNOWN : eventType);
    }

    /**
     * Removes every meter this exporter registered. Later calls are ignored.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : registered) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        registered.clear();
        if (first != null) throw first;
    }
}
