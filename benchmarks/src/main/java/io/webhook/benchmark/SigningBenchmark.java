package io.webhook.benchmark;

import io.webhook.signing.RequestSigner;
import org.openjdk.jmh.annotations.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Measures canonicalization, signing and verification cost per payload size.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar SigningBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class SigningBenchmark {

  private static final String SECRET = "whsec_benchmark_secret";

  @Param({"10", "100", "1000"})
  private int fieldCount;

  private RequestSigner signer;
  private Map<String, Object> payload;
  private String canonical;
  private Map<String, String> headers;

  @Setup(Level.Trial)
  public void setup() {
    signer = new RequestSigner();
    payload = new LinkedHashMap<>();
    for (int i = 0; i < fieldCount; i++) {
      payload.put("field_" + i, i % 3 == 0
          ? Map.of("impressions", i * 1000L, "spend", i * 1.25)
          : i % 3 == 1 ? "value-" + i : List.of(i, i + 1, "ü"));
    }
    canonical = signer.canonicalize(payload);
    headers = signer.signCanonical(canonical, SECRET);
  }

  @Benchmark
  public String canonicalize() {
    return signer.canonicalize(payload);
  }

  @Benchmark
  public Map<String, String> canonicalizeAndSign() {
    return signer.sign(payload, SECRET);
  }

  @Benchmark
  public boolean verify() {
    return signer.verify(canonical,
        headers.get(RequestSigner.SIGNATURE_HEADER),
        headers.get(RequestSigner.TIMESTAMP_HEADER),
        SECRET);
  }
}
