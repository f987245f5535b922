package io.webhook.delivery;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Resilience4j {@link CircuitBreaker}s, one per endpoint.
 *
 * <p>Endpoints are keyed by {@code scheme://host:port}, so different paths on the same
 * receiver share a breaker. Breakers are created lazily and live as long as the registry.
 *
 * <p>A breaker opens after {@code failureThreshold} consecutive failed deliveries and
 * rejects deliveries for {@code openDuration}. The first delivery after that moves it to
 * {@code HALF_OPEN}, where {@code successThreshold} successes close it again and any
 * failure reopens it.
 *
 * <p>This class is thread-safe.
 */
public final class EndpointCircuitBreakers {
  private static final Logger logger = Logger.getLogger(EndpointCircuitBreakers.class.getName());

  public static final int DEFAULT_FAILURE_THRESHOLD = 5;
  public static final int DEFAULT_SUCCESS_THRESHOLD = 2;
  public static final Duration DEFAULT_OPEN_DURATION = Duration.ofSeconds(60);

  // deliveries spanning several backed-off attempts are slow but not failed
  private static final Duration SLOW_DELIVERY_THRESHOLD = Duration.ofDays(1);

  private final CircuitBreakerRegistry registry;

  public EndpointCircuitBreakers() {
    this(DEFAULT_FAILURE_THRESHOLD, DEFAULT_SUCCESS_THRESHOLD, DEFAULT_OPEN_DURATION);
  }

  public EndpointCircuitBreakers(int failureThreshold, int successThreshold, Duration openDuration) {
    if (failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be >= 1, got: " + failureThreshold);
    }
    if (successThreshold < 1) {
      throw new IllegalArgumentException("successThreshold must be >= 1, got: " + successThreshold);
    }
    Objects.requireNonNull(openDuration, "openDuration");
    if (openDuration.toMillis() < 1) {
      throw new IllegalArgumentException("openDuration must be at least 1ms, got: " + openDuration);
    }
    CircuitBreakerConfig config = CircuitBreakerConfig.custom()
        .slidingWindowType(SlidingWindowType.COUNT_BASED)
        .slidingWindowSize(failureThreshold)
        .minimumNumberOfCalls(failureThreshold)
        .failureRateThreshold(100.0f)
        .slowCallDurationThreshold(SLOW_DELIVERY_THRESHOLD)
        .permittedNumberOfCallsInHalfOpenState(successThreshold)
        .waitDurationInOpenState(openDuration)
        .automaticTransitionFromOpenToHalfOpenEnabled(false)
        .build();
    this.registry = CircuitBreakerRegistry.of(config);
    registry.getEventPublisher().onEntryAdded(event -> {
      CircuitBreaker added = event.getAddedEntry();
      added.getEventPublisher().onStateTransition(transition -> logger.warning(
          "Circuit for " + added.getName() + " moved "
              + transition.getStateTransition().getFromState() + " -> "
              + transition.getStateTransition().getToState()));
    });
  }

  /**
   * Returns the breaker for the endpoint of {@code uri}, creating it if needed.
   *
   * @param uri an absolute http(s) URI
   * @return the endpoint's breaker, named by its endpoint key
   */
  public CircuitBreaker forEndpoint(URI uri) {
    return registry.circuitBreaker(endpointKey(uri));
  }

  /**
   * Records a delivery the endpoint answered, including client errors.
   *
   * @param breaker the endpoint's breaker
   * @param elapsed time spent on the delivery
   */
  public void recordSuccess(CircuitBreaker breaker, Duration elapsed) {
    breaker.onSuccess(elapsed.toNanos(), TimeUnit.NANOSECONDS);
  }

  /**
   * Records a delivery that exhausted its retries. A failure while {@code HALF_OPEN}
   * reopens the circuit immediately.
   *
   * @param breaker the endpoint's breaker
   * @param elapsed time spent on the delivery
   * @param error   the last attempt's error
   */
  public void recordFailure(CircuitBreaker breaker, Duration elapsed, String error) {
    breaker.onError(elapsed.toNanos(), TimeUnit.NANOSECONDS, new EndpointFailure(error));
    if (breaker.getState() == CircuitBreaker.State.HALF_OPEN) {
      breaker.transitionToOpenState();
    }
  }

  static String endpointKey(URI uri) {
    String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
    int port = uri.getPort();
    if (port < 0) {
      port = "https".equals(scheme) ? 443 : 80;
    }
    return scheme + "://" + uri.getHost().toLowerCase(Locale.ROOT) + ":" + port;
  }

  public int size() {
    return registry.getAllCircuitBreakers().size();
  }

  /** Failure handed to the breaker; carries no stack trace. */
  static final class EndpointFailure extends Exception {
    private static final long serialVersionUID = 1L;

    EndpointFailure(String message) {
      super(message, null, false, false);
    }
  }
}
