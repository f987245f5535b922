package io.webhook;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of one webhook to deliver.
 *
 * <p>The payload is a map of JSON-compatible values (see {@link io.webhook.util.JsonCodec}).
 * It is canonicalized once per delivery; the canonical text is both what gets signed and
 * what gets sent. When {@code tenantId} and {@code eventType} are both set the delivery
 * is {@linkplain #isTracked() tracked}: a {@link io.webhook.model.DeliveryRecord} is
 * persisted and metrics are emitted.
 *
 * @see io.webhook.delivery.DeliveryEngine#deliver(DeliveryRequest)
 */
public final class DeliveryRequest {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final String destinationUrl;
    private final Map<String, Object> payload;
    private final Map<String, String> headers;
    private final int maxAttempts;
    private final Duration timeout;
    private final String signingSecret;
    private final String eventType;
    private final String tenantId;
    private final String objectId;

    private DeliveryRequest(Builder builder) {
        this.destinationUrl = Objects.requireNonNull(builder.destinationUrl, "destinationUrl");
        if (destinationUrl.isBlank()) {
            throw new IllegalArgumentException("destinationUrl cannot be empty");
        }

        Objects.requireNonNull(builder.payload, "payload");
        // immutable maps throw on containsKey(null), so check the copy
        Map<String, Object> payloadCopy = new LinkedHashMap<>(builder.payload);
        if (payloadCopy.containsKey(null)) {
            throw new IllegalArgumentException("payload cannot contain null keys");
        }
        this.payload = Collections.unmodifiableMap(payloadCopy);

        Map<String, String> headerCopy = builder.headers == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(builder.headers);
        if (headerCopy.containsKey(null)) {
            throw new IllegalArgumentException("headers cannot contain null keys");
        }
        if (headerCopy.containsValue(null)) {
            throw new IllegalArgumentException("headers cannot contain null values");
        }
        this.headers = Collections.unmodifiableMap(headerCopy);

        if (builder.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + builder.maxAttempts);
        }
        this.maxAttempts = builder.maxAttempts;

        this.timeout = Objects.requireNonNull(builder.timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }

        this.signingSecret = builder.signingSecret == null || builder.signingSecret.isEmpty()
                ? null : builder.signingSecret;
        this.eventType = builder.eventType;
        this.tenantId = builder.tenantId;
        this.objectId = builder.objectId;
    }

    /**
     * Creates a builder for a delivery to the given URL.
     *
     * @param destinationUrl the receiver endpoint
     * @return a new builder
     */
    public static Builder builder(String destinationUrl) {
        return new Builder(destinationUrl);
    }

    public String destinationUrl() {
        return destinationUrl;
    }

    public Map<String, Object> payload() {
        return payload;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Returns the HMAC secret, or {@code null} when the delivery is sent unsigned.
     *
     * @return the signing secret, or {@code null}
     */
    public String signingSecret() {
        return signingSecret;
    }

    public String eventType() {
        return eventType;
    }

    public String tenantId() {
        return tenantId;
    }

    public String objectId() {
        return objectId;
    }

    /**
     * Returns {@code true} if both {@code tenantId} and {@code eventType} are present,
     * enabling persistence and metrics for this delivery.
     *
     * @return whether this delivery is tracked
     */
    public boolean isTracked() {
        return tenantId != null && !tenantId.isEmpty()
                && eventType != null && !eventType.isEmpty();
    }

    @Override
    public String toString() {
        // secret and payload intentionally omitted
        return "DeliveryRequest{destinationUrl=" + destinationUrl
                + ", eventType=" + eventType
                + ", tenantId=" + tenantId
                + ", objectId=" + objectId
                + ", maxAttempts=" + maxAttempts
                + ", signed=" + (signingSecret != null) + '}';
    }

    /**
     * Builder for {@link DeliveryRequest}.
     */
    public static final class Builder {
        private final String destinationUrl;
        private Map<String, ?> payload;
        private Map<String, String> headers;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration timeout = DEFAULT_TIMEOUT;
        private String signingSecret;
        private String eventType;
        private String tenantId;
        private String objectId;

        private Builder(String destinationUrl) {
            this.destinationUrl = destinationUrl;
        }

        /**
         * Sets the JSON payload. The map is copied at build time.
         *
         * <p><b>Required.</b>
         *
         * @param payload the payload
         * @return this builder
         */
        public Builder payload(Map<String, ?> payload) {
            this.payload = payload;
            return this;
        }

        /**
         * Sets extra request headers. The map is copied at build time.
         *
         * <p>Optional. {@code Content-Type} defaults to {@code application/json}; signature
         * headers always replace caller headers of the same name.
         *
         * @param headers the headers
         * @return this builder
         */
        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        /**
         * Sets the maximum number of HTTP attempts.
         *
         * <p>Optional. Defaults to {@value DeliveryRequest#DEFAULT_MAX_ATTEMPTS}. Must be &ge; 1.
         *
         * @param maxAttempts the attempt cap
         * @return this builder
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Sets the per-attempt request timeout.
         *
         * <p>Optional. Defaults to 10 seconds.
         *
         * @param timeout the timeout (must be positive)
         * @return this builder
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * Sets the HMAC secret. An empty or {@code null} secret sends the request unsigned.
         *
         * @param signingSecret the shared secret
         * @return this builder
         */
        public Builder signingSecret(String signingSecret) {
            this.signingSecret = signingSecret;
            return this;
        }

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder objectId(String objectId) {
            this.objectId = objectId;
            return this;
        }

        /**
         * Builds an immutable {@link DeliveryRequest}.
         *
         * @return a new request
         * @throws NullPointerException     if the URL, payload or timeout is null
         * @throws IllegalArgumentException if the URL is blank, {@code maxAttempts < 1},
         *                                  the timeout is not positive, or a map holds null keys
         */
        public DeliveryRequest build() {
            return new DeliveryRequest(this);
        }
    }
}
