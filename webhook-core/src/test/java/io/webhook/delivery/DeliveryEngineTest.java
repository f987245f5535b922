package io.webhook.delivery;

import io.webhook.DeliveryRequest;
import io.webhook.DeliveryResult;
import io.webhook.DeliveryResult.FailureReason;
import io.webhook.model.DeliveryStatus;
import io.webhook.record.DeliveryAttemptRecorder;
import io.webhook.signing.RequestSigner;
import io.webhook.validation.AddressSafetyValidator;
import io.webhook.validation.HostResolver;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryEngineTest {

  private static final String URL = "https://hooks.example.com/webhook";

  private static final HostResolver FAKE_DNS = host -> {
    if (host.endsWith("example.com")) {
      return List.of(InetAddress.getByName("93.184.216.34"));
    }
    throw new UnknownHostException(host);
  };

  private final RecordingRecorder recorder = new RecordingRecorder();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final List<Duration> sleeps = new ArrayList<>();

  private DeliveryEngine engine(StubTransport transport) {
    return DeliveryEngine.builder()
        .transport(transport)
        .addressValidator(new AddressSafetyValidator(FAKE_DNS))
        .recorder(recorder)
        .metrics(metrics)
        .sleeper(sleeps::add)
        .build();
  }

  private static Map<String, Object> payload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("event", "creative.approved");
    payload.put("creative_id", "cr_1");
    return payload;
  }

  private static DeliveryRequest.Builder tracked() {
    return DeliveryRequest.builder(URL)
        .payload(payload())
        .tenantId("tenant_1")
        .eventType("creative.approved")
        .objectId("cr_1");
  }

  @Test
  void deliversOnFirstSuccess() {
    StubTransport transport = StubTransport.responding(200);

    DeliveryResult result = engine(transport).deliver(tracked().build());

    assertEquals(DeliveryStatus.DELIVERED, result.status());
    assertTrue(result.isDelivered());
    assertEquals(1, result.attempts());
    assertEquals(200, result.responseCode());
    assertNull(result.error());
    assertEquals(FailureReason.NONE, result.failureReason());
    assertTrue(result.deliveryId().startsWith("whd_"));
    assertEquals(1, transport.calls());
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void recordsCreateAndSingleTerminalUpdate() {
    DeliveryResult result = engine(StubTransport.responding(201)).deliver(tracked().build());

    assertEquals(1, recorder.created.size());
    RecordingRecorder.Created created = recorder.created.get(0);
    assertEquals(result.deliveryId(), created.deliveryId());
    assertEquals("tenant_1", created.tenantId());
    assertEquals(URL, created.webhookUrl());
    assertEquals("creative.approved", created.eventType());
    assertEquals("cr_1", created.objectId());
    assertEquals("{\"creative_id\":\"cr_1\",\"event\":\"creative.approved\"}", created.payloadJson());

    assertEquals(1, recorder.updated.size());
    RecordingRecorder.Updated updated = recorder.updated.get(0);
    assertEquals(DeliveryStatus.DELIVERED, updated.status());
    assertEquals(1, updated.attempts());
    assertEquals(201, updated.responseCode());
    assertNotNull(updated.deliveredAt());
  }

  @Test
  void clientErrorIsTerminalAfterOneAttempt() {
    StubTransport transport = new StubTransport().then(404, "not found");

    DeliveryResult result = engine(transport).deliver(tracked().maxAttempts(5).build());

    assertEquals(DeliveryStatus.FAILED, result.status());
    assertEquals(1, result.attempts());
    assertEquals(404, result.responseCode());
    assertEquals("Client error 404: not found", result.error());
    assertEquals(FailureReason.CLIENT_REJECTED, result.failureReason());
    assertEquals(1, transport.calls());
    assertTrue(sleeps.isEmpty());

    RecordingRecorder.Updated updated = recorder.updated.get(0);
    assertEquals(DeliveryStatus.FAILED, updated.status());
    assertEquals(1, updated.attempts());
    assertNull(updated.deliveredAt());
  }

  @Test
  void redirectIsNotFollowedOrRetried() {
    StubTransport transport = new StubTransport().then(302, "");

    DeliveryResult result = engine(transport).deliver(tracked().build());

    assertEquals(FailureReason.CLIENT_REJECTED, result.failureReason());
    assertEquals(1, result.attempts());
    assertEquals(302, result.responseCode());
    assertEquals(1, transport.calls());
  }

  @Test
  void serverErrorThenSuccessRetriesWithBackoff() {
    StubTransport transport = StubTransport.responding(503, 200);

    DeliveryResult result = engine(transport).deliver(tracked().build());

    assertEquals(DeliveryStatus.DELIVERED, result.status());
    assertEquals(2, result.attempts());
    assertEquals(List.of(Duration.ofSeconds(1)), sleeps);
  }

  @Test
  void persistentServerErrorExhaustsAttempts() {
    StubTransport transport = new StubTransport().then(500, "boom");

    DeliveryResult result = engine(transport).deliver(tracked().build());

    assertEquals(DeliveryStatus.FAILED, result.status());
    assertEquals(3, result.attempts());
    assertEquals(500, result.responseCode());
    assertEquals("Server error 500: boom", result.error());
    assertEquals(FailureReason.RETRIES_EXHAUSTED, result.failureReason());
    assertEquals(3, transport.calls());
    assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);

    RecordingRecorder.Updated updated = recorder.updated.get(0);
    assertEquals(3, updated.attempts());
    assertEquals(500, updated.responseCode());
    assertEquals("Server error 500: boom", updated.lastError());
  }

  @Test
  void backoffDoublesEachAttempt() {
    StubTransport transport = new StubTransport().then(502, "");

    engine(transport).deliver(tracked().maxAttempts(4).build());

    assertEquals(List.of(Duration.ofMillis(1000), Duration.ofMillis(2000), Duration.ofMillis(4000)), sleeps);
  }

  @Test
  void singleAttemptNeverRetries() {
    StubTransport transport = new StubTransport().then(503, "");

    DeliveryResult result = engine(transport).deliver(tracked().maxAttempts(1).build());

    assertEquals(1, result.attempts());
    assertEquals(FailureReason.RETRIES_EXHAUSTED, result.failureReason());
    assertEquals(1, transport.calls());
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void transportFailuresAreRetriedWithoutStatusCode() {
    StubTransport transport = new StubTransport()
        .thenThrow(new HttpTimeoutException("request timed out"))
        .thenThrow(new ConnectException("Connection refused"))
        .then(200, "ok");

    DeliveryResult result = engine(transport).deliver(tracked().build());

    assertEquals(DeliveryStatus.DELIVERED, result.status());
    assertEquals(3, result.attempts());
  }

  @Test
  void timeoutErrorTextNamesTimeout() {
    StubTransport transport = new StubTransport().thenThrow(new HttpTimeoutException("timed out"));

    DeliveryResult result = engine(transport)
        .deliver(tracked().timeout(Duration.ofSeconds(5)).maxAttempts(2).build());

    assertEquals("Request timeout after 5s", result.error());
    assertNull(result.responseCode());
    assertEquals(FailureReason.RETRIES_EXHAUSTED, result.failureReason());
  }

  @Test
  void connectionErrorTextHasNoClassName() {
    StubTransport transport = new StubTransport().thenThrow(new ConnectException("Connection refused"));

    DeliveryResult result = engine(transport).deliver(tracked().maxAttempts(1).build());

    assertEquals("Connection error: Connection refused", result.error());
  }

  @Test
  void unexpectedRuntimeFailureStillReachesTerminalState() {
    StubTransport transport = new StubTransport().then(() -> {
      throw new IllegalStateException("broken transport");
    });

    DeliveryResult result = engine(transport).deliver(tracked().maxAttempts(2).build());

    assertEquals("Request exception: broken transport", result.error());
    assertEquals(1, recorder.updated.size());
    assertEquals(DeliveryStatus.FAILED, recorder.updated.get(0).status());
  }

  @Test
  void invalidDestinationSendsNothingAndRecordsNothing() {
    StubTransport transport = StubTransport.responding(200);
    DeliveryRequest request = DeliveryRequest.builder("http://169.254.169.254/latest/meta-data/")
        .payload(payload())
        .tenantId("tenant_1")
        .eventType("creative.approved")
        .build();

    DeliveryResult result = engine(transport).deliver(request);

    assertEquals(DeliveryStatus.FAILED, result.status());
    assertEquals(0, result.attempts());
    assertNull(result.deliveryId());
    assertEquals(FailureReason.INVALID_DESTINATION, result.failureReason());
    assertTrue(result.error().startsWith("invalid destination: "), result.error());
    assertEquals(0, transport.calls());
    assertTrue(recorder.created.isEmpty());
    assertTrue(recorder.updated.isEmpty());
    assertEquals(List.of("tenant_1/creative.approved/validation_failed"), metrics.counters);
  }

  @Test
  void signsExactBodyThatIsSent() {
    StubTransport transport = StubTransport.responding(503, 503, 200);
    DeliveryRequest request = tracked().signingSecret("s3cr3t").build();

    DeliveryResult result = engine(transport).deliver(request);

    assertEquals(DeliveryStatus.DELIVERED, result.status());
    assertEquals(3, result.attempts());
    assertEquals(3, transport.calls());
    RequestSigner signer = new RequestSigner();
    for (StubTransport.Sent sent : transport.sent) {
      assertTrue(signer.verify(sent.body(),
          sent.headers().get(RequestSigner.SIGNATURE_HEADER),
          sent.headers().get(RequestSigner.TIMESTAMP_HEADER), "s3cr3t"));
      assertEquals("application/json", sent.headers().get("Content-Type"));
    }
  }

  @Test
  void unsignedWhenNoSecret() {
    StubTransport transport = StubTransport.responding(200);

    engine(transport).deliver(tracked().build());

    Map<String, String> headers = transport.sent.get(0).headers();
    assertFalse(headers.containsKey(RequestSigner.SIGNATURE_HEADER));
    assertFalse(headers.containsKey(RequestSigner.TIMESTAMP_HEADER));
  }

  @Test
  void callerHeadersAreMergedAndSignatureHeadersWin() {
    StubTransport transport = StubTransport.responding(200);
    Map<String, String> callerHeaders = new LinkedHashMap<>();
    callerHeaders.put("content-type", "application/vnd.custom+json");
    callerHeaders.put("x-webhook-signature", "forged");
    callerHeaders.put("X-Request-Source", "adserver");

    engine(transport).deliver(tracked().headers(callerHeaders).signingSecret("k").build());

    Map<String, String> sent = transport.sent.get(0).headers();
    assertEquals("application/vnd.custom+json", sent.get("content-type"));
    assertFalse(sent.containsKey("Content-Type"));
    assertEquals("adserver", sent.get("X-Request-Source"));
    assertFalse(sent.containsKey("x-webhook-signature"));
    assertTrue(sent.get(RequestSigner.SIGNATURE_HEADER).startsWith("sha256="));
  }

  @Test
  void perAttemptTimeoutIsPassedToTransport() {
    StubTransport transport = StubTransport.responding(200);

    engine(transport).deliver(tracked().timeout(Duration.ofSeconds(3)).build());

    assertEquals(Duration.ofSeconds(3), transport.sent.get(0).timeout());
  }

  @Test
  void untrackedDeliveryPersistsNothingAndEmitsNoMetrics() {
    StubTransport transport = StubTransport.responding(200);
    DeliveryRequest request = DeliveryRequest.builder(URL).payload(payload()).tenantId("t").build();

    DeliveryResult result = engine(transport).deliver(request);

    assertEquals(DeliveryStatus.DELIVERED, result.status());
    assertNotNull(result.deliveryId());
    assertTrue(recorder.created.isEmpty());
    assertTrue(recorder.updated.isEmpty());
    assertTrue(metrics.counters.isEmpty());
  }

  @Test
  void successEmitsCountDurationAndAttempts() {
    engine(StubTransport.responding(503, 200)).deliver(tracked().build());

    assertEquals(List.of("tenant_1/creative.approved/success"), metrics.counters);
    assertEquals(1, metrics.durations.size());
    assertEquals(List.of(2), metrics.attempts);
  }

  @Test
  void clientErrorEmitsCountOnly() {
    engine(StubTransport.responding(400)).deliver(tracked().build());

    assertEquals(List.of("tenant_1/creative.approved/client_error"), metrics.counters);
    assertTrue(metrics.durations.isEmpty());
    assertTrue(metrics.attempts.isEmpty());
  }

  @Test
  void exhaustionEmitsCountDurationAndAttempts() {
    engine(new StubTransport().then(500, "")).deliver(tracked().build());

    assertEquals(List.of("tenant_1/creative.approved/max_retries_exceeded"), metrics.counters);
    assertEquals(1, metrics.durations.size());
    assertEquals(List.of(3), metrics.attempts);
  }

  private static final DeliveryAttemptRecorder FAILING_RECORDER = new DeliveryAttemptRecorder() {
    @Override
    public void create(String deliveryId, String tenantId, String webhookUrl, String payloadJson,
        String eventType, String objectId) {
      throw new IllegalStateException("db down");
    }

    @Override
    public void update(String deliveryId, DeliveryStatus status, int attempts, Integer responseCode,
        String lastError, Instant deliveredAt) {
      throw new IllegalStateException("db down");
    }
  };

  private DeliveryEngine engineWithFailingRecorder(StubTransport transport) {
    return DeliveryEngine.builder()
        .transport(transport)
        .addressValidator(new AddressSafetyValidator(FAKE_DNS))
        .recorder(FAILING_RECORDER)
        .metrics(metrics)
        .sleeper(sleeps::add)
        .build();
  }

  @Test
  void persistenceFailureDoesNotChangeOutcome() {
    DeliveryResult result = engineWithFailingRecorder(StubTransport.responding(503, 200))
        .deliver(tracked().build());

    assertEquals(DeliveryStatus.DELIVERED, result.status());
    assertEquals(2, result.attempts());
  }

  @Test
  void persistenceFailureDoesNotChangeClientRejection() {
    StubTransport transport = StubTransport.responding(404);

    DeliveryResult result = engineWithFailingRecorder(transport).deliver(tracked().build());

    assertEquals(DeliveryStatus.FAILED, result.status());
    assertEquals(FailureReason.CLIENT_REJECTED, result.failureReason());
    assertEquals(404, result.responseCode());
    assertEquals(1, result.attempts());
    assertEquals(1, transport.calls());
    assertEquals(List.of("tenant_1/creative.approved/client_error"), metrics.counters);
  }

  @Test
  void persistenceFailureDoesNotChangeExhaustion() {
    StubTransport transport = new StubTransport().then(503, "unavailable");

    DeliveryResult result = engineWithFailingRecorder(transport).deliver(tracked().build());

    assertEquals(DeliveryStatus.FAILED, result.status());
    assertEquals(FailureReason.RETRIES_EXHAUSTED, result.failureReason());
    assertEquals(503, result.responseCode());
    assertEquals(3, result.attempts());
    assertEquals(3, transport.calls());
    assertEquals(2, sleeps.size());
    assertEquals(List.of("tenant_1/creative.approved/max_retries_exceeded"), metrics.counters);
  }

  @Test
  void metricsFailureDoesNotChangeOutcome() {
    DeliveryEngine engine = DeliveryEngine.builder()
        .transport(StubTransport.responding(200))
        .addressValidator(new AddressSafetyValidator(FAKE_DNS))
        .metrics(new RecordingMetrics() {
          @Override
          public void incrementDelivery(String tenantId, String eventType, Outcome outcome) {
            throw new IllegalStateException("registry closed");
          }
        })
        .build();

    assertTrue(engine.deliver(tracked().build()).isDelivered());
  }

  @Test
  void deliveryIdsAreUnique() {
    DeliveryEngine engine = engine(StubTransport.responding(200));

    String first = engine.deliver(tracked().build()).deliveryId();
    String second = engine.deliver(tracked().build()).deliveryId();

    assertNotEquals(first, second);
  }

  @Test
  void interruptDuringBackoffStopsDelivery() {
    StubTransport transport = new StubTransport().then(503, "");
    DeliveryEngine engine = DeliveryEngine.builder()
        .transport(transport)
        .addressValidator(new AddressSafetyValidator(FAKE_DNS))
        .recorder(recorder)
        .sleeper(d -> {
          throw new InterruptedException();
        })
        .build();

    DeliveryResult result;
    try {
      result = engine.deliver(tracked().build());
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }

    assertEquals(DeliveryStatus.FAILED, result.status());
    assertEquals(FailureReason.INTERRUPTED, result.failureReason());
    assertEquals(1, result.attempts());
    assertEquals(1, transport.calls());
    assertEquals(1, recorder.updated.size());
    assertEquals("Delivery interrupted", recorder.updated.get(0).lastError());
  }

  @Test
  void openCircuitSkipsNetwork() {
    EndpointCircuitBreakers breakers = new EndpointCircuitBreakers(
        2, 1, Duration.ofMinutes(5));
    StubTransport transport = new StubTransport().then(500, "");
    DeliveryEngine engine = DeliveryEngine.builder()
        .transport(transport)
        .addressValidator(new AddressSafetyValidator(FAKE_DNS))
        .recorder(recorder)
        .metrics(metrics)
        .sleeper(sleeps::add)
        .circuitBreakers(breakers)
        .build();
    DeliveryRequest request = tracked().maxAttempts(1).build();

    engine.deliver(request);
    engine.deliver(request);
    DeliveryResult skipped = engine.deliver(request);

    assertEquals(FailureReason.CIRCUIT_OPEN, skipped.failureReason());
    assertEquals(0, skipped.attempts());
    assertEquals(2, transport.calls());
    assertEquals(3, recorder.created.size());
    assertEquals(0, recorder.updated.get(2).attempts());
    assertEquals("tenant_1/creative.approved/circuit_open", metrics.counters.get(2));
  }

  @Test
  void clientErrorsKeepCircuitClosed() {
    EndpointCircuitBreakers breakers = new EndpointCircuitBreakers(
        1, 1, Duration.ofMinutes(5));
    StubTransport transport = new StubTransport().then(422, "bad");
    DeliveryEngine engine = DeliveryEngine.builder()
        .transport(transport)
        .addressValidator(new AddressSafetyValidator(FAKE_DNS))
        .circuitBreakers(breakers)
        .build();

    engine.deliver(tracked().build());
    DeliveryResult second = engine.deliver(tracked().build());

    assertEquals(FailureReason.CLIENT_REJECTED, second.failureReason());
    assertEquals(2, transport.calls());
  }

  @Test
  void payloadThatCannotBeEncodedIsRejected() {
    DeliveryRequest request = DeliveryRequest.builder(URL)
        .payload(Map.of("bad", new Object()))
        .build();

    assertThrows(IllegalArgumentException.class,
        () -> engine(StubTransport.responding(200)).deliver(request));
  }

  @Test
  void deliverAsyncRunsOnExecutor() throws Exception {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      CompletableFuture<DeliveryResult> future =
          engine(StubTransport.responding(200)).deliverAsync(tracked().build(), executor);

      assertTrue(future.get(5, TimeUnit.SECONDS).isDelivered());
    } finally {
      executor.shutdownNow();
    }
  }
}
