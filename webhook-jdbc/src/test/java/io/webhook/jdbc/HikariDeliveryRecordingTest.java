package io.webhook.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.webhook.DeliveryRequest;
import io.webhook.DeliveryResult;
import io.webhook.delivery.DeliveryEngine;
import io.webhook.delivery.ExponentialBackoffRetryPolicy;
import io.webhook.jdbc.store.AbstractJdbcDeliveryRecordStore;
import io.webhook.jdbc.store.JdbcDeliveryRecordStores;
import io.webhook.model.DeliveryRecord;
import io.webhook.model.DeliveryStatus;
import io.webhook.record.DefaultDeliveryAttemptRecorder;
import io.webhook.record.DeliveryRecordManager;
import io.webhook.spi.HttpTransport;
import io.webhook.validation.AddressSafetyValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Drives the delivery engine against a pooled H2 database and checks what lands in
 * {@code webhook_deliveries}.
 */
class HikariDeliveryRecordingTest {
  private static final String URL = "https://hooks.example.com/adcp";

  private HikariDataSource hikariDs;
  private AbstractJdbcDeliveryRecordStore store;
  private DataSourceConnectionProvider connectionProvider;
  private DeliveryRecordManager manager;

  @BeforeEach
  void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(4);
    config.setMinimumIdle(1);
    config.setPoolName("webhook-test-pool");

    hikariDs = new HikariDataSource(config);
    store = JdbcDeliveryRecordStores.detect(hikariDs);
    connectionProvider = new DataSourceConnectionProvider(hikariDs);
    manager = new DeliveryRecordManager(connectionProvider, store);

    try (Connection conn = hikariDs.getConnection()) {
      Schemas.apply(conn, "h2");
    }
  }

  @AfterEach
  void tearDown() {
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  private DeliveryEngine engine(HttpTransport transport) {
    return DeliveryEngine.builder()
        .transport(transport)
        .addressValidator(new AddressSafetyValidator(
            host -> List.of(InetAddress.getByAddress(host, new byte[] {93, (byte) 184, (byte) 216, 34}))))
        .recorder(new DefaultDeliveryAttemptRecorder(connectionProvider, store))
        .retryPolicy(new ExponentialBackoffRetryPolicy(0, 0, 0.0))
        .build();
  }

  private static DeliveryRequest tracked(String objectId) {
    return DeliveryRequest.builder(URL)
        .payload(Map.of("media_buy_id", objectId, "status", "active"))
        .tenantId("acme")
        .eventType("media_buy.status_changed")
        .objectId(objectId)
        .signingSecret("s3cr3t")
        .build();
  }

  @Test
  void successfulDeliveryIsRecorded() {
    List<String> bodies = new ArrayList<>();
    DeliveryEngine engine = engine((uri, body, headers, timeout) -> {
      bodies.add(body);
      return new HttpTransport.Response(200, "ok");
    });

    DeliveryResult result = engine.deliver(tracked("mb_1"));

    assertTrue(result.isDelivered());
    DeliveryRecord record = manager.find(result.deliveryId()).orElseThrow();
    assertEquals(DeliveryStatus.DELIVERED, record.status());
    assertEquals(1, record.attempts());
    assertEquals(200, record.responseCode());
    assertEquals("acme", record.tenantId());
    assertEquals("mb_1", record.objectId());
    assertEquals(bodies.get(0), record.payloadJson());
    assertNotNull(record.deliveredAt());
    assertNull(record.lastError());
  }

  @Test
  void exhaustedRetriesAreRecordedAsFailed() {
    AtomicInteger calls = new AtomicInteger();
    DeliveryEngine engine = engine((uri, body, headers, timeout) -> {
      calls.incrementAndGet();
      return new HttpTransport.Response(503, "maintenance");
    });

    DeliveryResult result = engine.deliver(tracked("mb_2"));

    assertEquals(3, calls.get());
    DeliveryRecord record = manager.find(result.deliveryId()).orElseThrow();
    assertEquals(DeliveryStatus.FAILED, record.status());
    assertEquals(3, record.attempts());
    assertEquals(503, record.responseCode());
    assertEquals("Server error 503: maintenance", record.lastError());
    assertNull(record.deliveredAt());
    assertEquals(1, manager.count("acme", DeliveryStatus.FAILED));
  }

  @Test
  void untrackedDeliveryLeavesNoRow() {
    DeliveryEngine engine = engine((uri, body, headers, timeout) -> new HttpTransport.Response(204, ""));

    DeliveryResult result = engine.deliver(DeliveryRequest.builder(URL).payload(Map.of("a", 1)).build());

    assertTrue(result.isDelivered());
    assertEquals(0, manager.count(null, null));
  }

  @Test
  void concurrentDeliveriesShareThePool() throws Exception {
    DeliveryEngine engine = engine((uri, body, headers, timeout) -> new HttpTransport.Response(202, ""));
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<CompletableFuture<DeliveryResult>> futures = new ArrayList<>();
      for (int i = 0; i < 40; i++) {
        futures.add(engine.deliverAsync(tracked("mb_c" + i), executor));
      }
      for (CompletableFuture<DeliveryResult> future : futures) {
        assertTrue(future.get(30, TimeUnit.SECONDS).isDelivered());
      }
    } finally {
      executor.shutdownNow();
    }

    assertEquals(40, manager.count("acme", DeliveryStatus.DELIVERED));
    assertEquals(0, manager.count("acme", DeliveryStatus.PENDING));
    assertEquals(10, manager.query("acme", null, "media_buy.status_changed", 10).size());
  }
}
