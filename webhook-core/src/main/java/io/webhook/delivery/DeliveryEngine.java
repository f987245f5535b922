package io.webhook.delivery;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.webhook.DeliveryRequest;
import io.webhook.DeliveryResult;
import io.webhook.DeliveryResult.FailureReason;
import io.webhook.model.DeliveryStatus;
import io.webhook.record.DeliveryAttemptRecorder;
import io.webhook.signing.RequestSigner;
import io.webhook.spi.HttpTransport;
import io.webhook.spi.MetricsExporter;
import io.webhook.spi.MetricsExporter.Outcome;
import io.webhook.transport.JdkHttpTransport;
import io.webhook.validation.AddressSafetyValidator;
import io.webhook.validation.ValidationResult;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivers webhooks with destination validation, HMAC signing, bounded retries and
 * persisted attempt tracking.
 *
 * <p>{@link #deliver(DeliveryRequest)} runs the whole delivery on the calling thread:
 * <ol>
 *   <li>validate the destination (rejections send nothing and persist nothing),</li>
 *   <li>sign the canonical payload when the request carries a secret,</li>
 *   <li>record a {@code PENDING} row for tracked requests,</li>
 *   <li>POST until a 2xx, a 3xx/4xx, or {@code maxAttempts} retryable failures,
 *       sleeping {@link RetryPolicy#computeDelayMs(int)} between attempts,</li>
 *   <li>record the terminal status exactly once and return a {@link DeliveryResult}.</li>
 * </ol>
 *
 * <p>The engine owns no threads and takes no locks on the delivery path; concurrent
 * deliveries share only the collaborators passed to the {@linkplain Builder builder}.
 * This class is thread-safe.
 *
 * @see DeliveryEngine.Builder
 */
public final class DeliveryEngine {
  private static final Logger logger = Logger.getLogger(DeliveryEngine.class.getName());

  static final String CONTENT_TYPE = "Content-Type";
  static final String APPLICATION_JSON = "application/json";
  static final String MAX_RETRIES_EXCEEDED = "Max retries exceeded";
  static final String INTERRUPTED = "Delivery interrupted";

  private final HttpTransport transport;
  private final AddressSafetyValidator validator;
  private final boolean allowLocalhost;
  private final RequestSigner signer;
  private final DeliveryAttemptRecorder recorder;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;
  private final MetricsExporter metrics;
  private final EndpointCircuitBreakers circuitBreakers;
  private final Clock clock;

  private DeliveryEngine(Builder builder) {
    this.transport = builder.transport != null ? builder.transport : new JdkHttpTransport();
    this.validator = builder.validator != null ? builder.validator : new AddressSafetyValidator();
    this.allowLocalhost = builder.allowLocalhost;
    this.signer = builder.signer != null ? builder.signer : new RequestSigner();
    this.recorder = builder.recorder != null ? builder.recorder : DeliveryAttemptRecorder.NOOP;
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy();
    this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.circuitBreakers = builder.circuitBreakers;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (allowLocalhost) {
      logger.warning("allowLocalhost=true: loopback destinations are accepted (testing only)");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Delivers a webhook, blocking until it is delivered or has terminally failed.
   *
   * <p>Never throws for delivery failures; inspect {@link DeliveryResult#status()} and
   * {@link DeliveryResult#failureReason()}. If the calling thread is interrupted, the
   * delivery stops with {@link FailureReason#INTERRUPTED} and the interrupt flag is
   * restored.
   *
   * @param request the delivery to perform
   * @return the outcome
   * @throws IllegalArgumentException if the payload holds a value that cannot be encoded as JSON
   */
  public DeliveryResult deliver(DeliveryRequest request) {
    Objects.requireNonNull(request, "request");
    long startNanos = System.nanoTime();
    String body = signer.canonicalize(request.payload());

    ValidationResult validation = allowLocalhost
        ? validator.validateForTesting(request.destinationUrl(), true)
        : validator.validate(request.destinationUrl());
    if (!validation.ok()) {
      logger.warning("Rejected webhook destination " + request.destinationUrl()
          + ": " + validation.reason());
      count(request, Outcome.VALIDATION_FAILED);
      return new DeliveryResult(null, DeliveryStatus.FAILED, 0, null,
          "invalid destination: " + validation.reason(), elapsed(startNanos),
          FailureReason.INVALID_DESTINATION);
    }

    URI uri = URI.create(request.destinationUrl().trim());
    String deliveryId = DeliveryIds.newId();
    Map<String, String> headers = mergeHeaders(request, body);

    boolean tracked = request.isTracked();
    if (tracked) {
      try {
        recorder.create(deliveryId, request.tenantId(), request.destinationUrl(), body,
            request.eventType(), request.objectId());
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Recorder failed to create " + deliveryId, e);
      }
    }

    CircuitBreaker breaker = circuitBreakers != null ? circuitBreakers.forEndpoint(uri) : null;
    if (breaker != null && !breaker.tryAcquirePermission()) {
      String error = "Circuit open for endpoint " + breaker.getName();
      logger.warning("Webhook " + deliveryId + " not sent: " + error);
      markFailed(tracked, deliveryId, 0, null, error);
      count(request, Outcome.CIRCUIT_OPEN);
      return new DeliveryResult(deliveryId, DeliveryStatus.FAILED, 0, null, error,
          elapsed(startNanos), FailureReason.CIRCUIT_OPEN);
    }

    Integer lastCode = null;
    String lastError = null;
    int maxAttempts = request.maxAttempts();
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      AttemptOutcome outcome;
      try {
        HttpTransport.Response response = transport.post(uri, body, headers, request.timeout());
        outcome = AttemptOutcome.classify(response.statusCode(), response.body());
      } catch (InterruptedException e) {
        return interrupted(request, deliveryId, attempt, lastCode, breaker, startNanos);
      } catch (Exception e) {
        outcome = AttemptOutcome.classify(e, request.timeout());
      }

      if (outcome instanceof AttemptOutcome.Success success) {
        logger.info("Webhook " + deliveryId + " delivered to " + request.destinationUrl()
            + " (attempt " + attempt + "/" + maxAttempts + ", status " + success.statusCode() + ")");
        if (tracked) {
          record(deliveryId, DeliveryStatus.DELIVERED, attempt, success.statusCode(), null,
              clock.instant());
        }
        Duration duration = elapsed(startNanos);
        if (breaker != null) {
          circuitBreakers.recordSuccess(breaker, duration);
        }
        count(request, Outcome.SUCCESS);
        observe(request, duration, attempt);
        return new DeliveryResult(deliveryId, DeliveryStatus.DELIVERED, attempt,
            success.statusCode(), null, duration, FailureReason.NONE);
      }

      if (outcome instanceof AttemptOutcome.ClientError clientError) {
        logger.warning("Webhook " + deliveryId + " rejected by " + request.destinationUrl()
            + ": " + clientError.error());
        markFailed(tracked, deliveryId, attempt, clientError.statusCode(), clientError.error());
        if (breaker != null) {
          // the endpoint answered, so it is healthy
          circuitBreakers.recordSuccess(breaker, elapsed(startNanos));
        }
        count(request, Outcome.CLIENT_ERROR);
        return new DeliveryResult(deliveryId, DeliveryStatus.FAILED, attempt,
            clientError.statusCode(), clientError.error(), elapsed(startNanos),
            FailureReason.CLIENT_REJECTED);
      }

      AttemptOutcome.RetryableError retryable = (AttemptOutcome.RetryableError) outcome;
      lastCode = retryable.statusCode();
      lastError = retryable.error();
      if (attempt < maxAttempts) {
        long delayMs = retryPolicy.computeDelayMs(attempt);
        logger.warning("Webhook " + deliveryId + " attempt " + attempt + "/" + maxAttempts
            + " failed: " + lastError + "; retrying in " + delayMs + "ms");
        if (delayMs > 0) {
          try {
            sleeper.sleep(Duration.ofMillis(delayMs));
          } catch (InterruptedException e) {
            return interrupted(request, deliveryId, attempt, lastCode, breaker, startNanos);
          }
        }
      }
    }

    String error = lastError != null ? lastError : MAX_RETRIES_EXCEEDED;
    logger.severe("Webhook " + deliveryId + " to " + request.destinationUrl()
        + " failed after " + maxAttempts + " attempts: " + error);
    markFailed(tracked, deliveryId, maxAttempts, lastCode, error);
    Duration duration = elapsed(startNanos);
    if (breaker != null) {
      circuitBreakers.recordFailure(breaker, duration, error);
    }
    count(request, Outcome.MAX_RETRIES_EXCEEDED);
    observe(request, duration, maxAttempts);
    return new DeliveryResult(deliveryId, DeliveryStatus.FAILED, maxAttempts, lastCode, error,
        duration, FailureReason.RETRIES_EXHAUSTED);
  }

  /**
   * Runs {@link #deliver(DeliveryRequest)} on the given executor.
   *
   * <p>Callers that need an overall deadline can apply
   * {@link CompletableFuture#orTimeout} to the returned future.
   *
   * @param request  the delivery to perform
   * @param executor the executor to run on
   * @return a future completed with the outcome
   */
  public CompletableFuture<DeliveryResult> deliverAsync(DeliveryRequest request, Executor executor) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(executor, "executor");
    return CompletableFuture.supplyAsync(() -> deliver(request), executor);
  }

  private Map<String, String> mergeHeaders(DeliveryRequest request, String body) {
    Map<String, String> merged = new LinkedHashMap<>(request.headers());
    if (!containsIgnoreCase(merged, CONTENT_TYPE)) {
      merged.put(CONTENT_TYPE, APPLICATION_JSON);
    }
    if (request.signingSecret() != null) {
      Map<String, String> signature = signer.signCanonical(body, request.signingSecret());
      for (Map.Entry<String, String> header : signature.entrySet()) {
        merged.keySet().removeIf(name -> name.equalsIgnoreCase(header.getKey()));
        merged.put(header.getKey(), header.getValue());
      }
    }
    return merged;
  }

  private static boolean containsIgnoreCase(Map<String, String> headers, String name) {
    for (String key : headers.keySet()) {
      if (key.equalsIgnoreCase(name)) {
        return true;
      }
    }
    return false;
  }

  private DeliveryResult interrupted(DeliveryRequest request, String deliveryId, int attempts,
      Integer lastCode, CircuitBreaker breaker, long startNanos) {
    Thread.currentThread().interrupt();
    if (breaker != null) {
      breaker.releasePermission();
    }
    logger.log(Level.WARNING, "Webhook " + deliveryId + " to " + request.destinationUrl()
        + " interrupted after " + attempts + " attempt(s)");
    markFailed(request.isTracked(), deliveryId, attempts, lastCode, INTERRUPTED);
    return new DeliveryResult(deliveryId, DeliveryStatus.FAILED, attempts, lastCode, INTERRUPTED,
        elapsed(startNanos), FailureReason.INTERRUPTED);
  }

  private void markFailed(boolean tracked, String deliveryId, int attempts, Integer code, String error) {
    if (tracked) {
      record(deliveryId, DeliveryStatus.FAILED, attempts, code, error, null);
    }
  }

  private void record(String deliveryId, DeliveryStatus status, int attempts, Integer code,
      String error, Instant deliveredAt) {
    try {
      recorder.update(deliveryId, status, attempts, code, error, deliveredAt);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Recorder failed to update " + deliveryId, e);
    }
  }

  private void count(DeliveryRequest request, Outcome outcome) {
    if (!request.isTracked()) {
      return;
    }
    try {
      metrics.incrementDelivery(request.tenantId(), request.eventType(), outcome);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Metrics exporter failed", e);
    }
  }

  private void observe(DeliveryRequest request, Duration duration, int attempts) {
    if (!request.isTracked()) {
      return;
    }
    try {
      metrics.recordDeliveryDuration(request.tenantId(), request.eventType(), duration);
      metrics.recordDeliveryAttempts(request.tenantId(), request.eventType(), attempts);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Metrics exporter failed", e);
    }
  }

  private static Duration elapsed(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }

  /** Builder for {@link DeliveryEngine}. */
  public static final class Builder {
    private HttpTransport transport;
    private AddressSafetyValidator validator;
    private boolean allowLocalhost;
    private RequestSigner signer;
    private DeliveryAttemptRecorder recorder;
    private RetryPolicy retryPolicy;
    private Sleeper sleeper;
    private MetricsExporter metrics;
    private EndpointCircuitBreakers circuitBreakers;
    private Clock clock;

    private Builder() {}

    /**
     * Sets the HTTP transport.
     *
     * <p>Optional. Defaults to {@link JdkHttpTransport} with a 10 second connect timeout.
     *
     * @param transport the transport
     * @return this builder
     */
    public Builder transport(HttpTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Sets the destination validator.
     *
     * <p>Optional. Defaults to an {@link AddressSafetyValidator} using system DNS.
     *
     * @param validator the validator
     * @return this builder
     */
    public Builder addressValidator(AddressSafetyValidator validator) {
      this.validator = validator;
      return this;
    }

    /**
     * Accepts loopback destinations. Private, link-local and metadata blocks stay active.
     *
     * <p>Optional. Defaults to {@code false}. Intended for tests that run a local receiver.
     *
     * @param allowLocalhost whether loopback destinations are accepted
     * @return this builder
     */
    public Builder allowLocalhost(boolean allowLocalhost) {
      this.allowLocalhost = allowLocalhost;
      return this;
    }

    /**
     * Sets the signer, which also canonicalizes payloads.
     *
     * <p>Optional. Defaults to a {@link RequestSigner} on the system clock.
     *
     * @param signer the signer
     * @return this builder
     */
    public Builder signer(RequestSigner signer) {
      this.signer = signer;
      return this;
    }

    /**
     * Sets the recorder for tracked deliveries.
     *
     * <p>Optional. Defaults to {@link DeliveryAttemptRecorder#NOOP}.
     *
     * @param recorder the recorder
     * @return this builder
     */
    public Builder recorder(DeliveryAttemptRecorder recorder) {
      this.recorder = recorder;
      return this;
    }

    /**
     * Sets the backoff between attempts.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with a 1 second base,
     * a 60 second cap and no jitter.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets how the engine waits between attempts.
     *
     * <p>Optional. Defaults to {@link Sleeper#SYSTEM}.
     *
     * @param sleeper the sleeper
     * @return this builder
     */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Enables per-endpoint circuit breaking.
     *
     * <p>Optional. Defaults to {@code null} (disabled).
     *
     * @param circuitBreakers the breaker registry
     * @return this builder
     */
    public Builder circuitBreakers(EndpointCircuitBreakers circuitBreakers) {
      this.circuitBreakers = circuitBreakers;
      return this;
    }

    /**
     * Sets the clock used for {@code deliveredAt}.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public DeliveryEngine build() {
      return new DeliveryEngine(this);
    }
  }
}
