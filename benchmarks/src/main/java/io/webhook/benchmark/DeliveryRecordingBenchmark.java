package io.webhook.benchmark;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.webhook.DeliveryRequest;
import io.webhook.DeliveryResult;
import io.webhook.delivery.DeliveryEngine;
import io.webhook.jdbc.DataSourceConnectionProvider;
import io.webhook.jdbc.store.AbstractJdbcDeliveryRecordStore;
import io.webhook.jdbc.store.JdbcDeliveryRecordStores;
import io.webhook.record.DefaultDeliveryAttemptRecorder;
import io.webhook.spi.HttpTransport;
import io.webhook.validation.AddressSafetyValidator;
import org.openjdk.jmh.annotations.*;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Measures end-to-end {@link DeliveryEngine#deliver} throughput with an in-memory
 * transport and H2-backed attempt recording, so the numbers isolate signing,
 * validation and the two JDBC round trips per delivery.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar DeliveryRecordingBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class DeliveryRecordingBenchmark {

  @Param({"true", "false"})
  private boolean tracked;

  private HikariDataSource dataSource;
  private DeliveryEngine engine;
  private DeliveryRequest request;

  @Setup(Level.Trial)
  public void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:bench_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(8);
    config.setPoolName("webhook-bench");
    dataSource = new HikariDataSource(config);
    try (Connection conn = dataSource.getConnection()) {
      applySchema(conn);
    }

    AbstractJdbcDeliveryRecordStore store = JdbcDeliveryRecordStores.detect(dataSource);
    HttpTransport transport = (uri, body, headers, timeout) -> new HttpTransport.Response(200, "ok");
    engine = DeliveryEngine.builder()
        .transport(transport)
        .addressValidator(new AddressSafetyValidator(
            host -> List.of(InetAddress.getByAddress(host, new byte[] {93, (byte) 184, (byte) 216, 34}))))
        .recorder(new DefaultDeliveryAttemptRecorder(new DataSourceConnectionProvider(dataSource), store))
        .build();

    DeliveryRequest.Builder builder = DeliveryRequest.builder("https://hooks.example.com/adcp")
        .payload(Map.of("media_buy_id", "mb_1", "status", "active", "impressions", 125000))
        .signingSecret("whsec_benchmark_secret");
    if (tracked) {
      builder.tenantId("bench").eventType("media_buy.status_changed").objectId("mb_1");
    }
    request = builder.build();
  }

  @Benchmark
  public DeliveryResult deliver() {
    return engine.deliver(request);
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    dataSource.close();
  }

  private static void applySchema(Connection conn) throws SQLException, IOException {
    String script;
    try (InputStream is = DeliveryRecordingBenchmark.class.getResourceAsStream("/schema/h2.sql")) {
      if (is == null) throw new IOException("Resource not found: /schema/h2.sql");
      script = new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
    try (Statement st = conn.createStatement()) {
      for (String stmt : script.split(";")) {
        if (!stmt.isBlank()) {
          st.execute(stmt.trim());
        }
      }
    }
  }
}
