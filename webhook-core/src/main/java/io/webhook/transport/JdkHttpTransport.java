package io.webhook.transport;

import io.webhook.spi.HttpTransport;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * {@link HttpTransport} on the JDK {@link HttpClient}.
 *
 * <p>Redirects are never followed. Headers the JDK client manages itself
 * ({@code Connection}, {@code Content-Length}, {@code Expect}, {@code Host},
 * {@code Upgrade}) are dropped with a warning.
 *
 * <p>The timeout bounds the whole exchange, response body included: a receiver
 * that sends headers and then stalls fails with {@link HttpTimeoutException}.
 * At most {@value #MAX_RESPONSE_BODY_BYTES} bytes of the response body are read;
 * the rest is discarded and the connection closed.
 *
 * <p>The client resolves the host again when it connects, so a name whose DNS
 * answer changes between validation and connection is not pinned to the
 * validated address.
 *
 * <p>This class is thread-safe; share one instance.
 */
public final class JdkHttpTransport implements HttpTransport {
  private static final Logger logger = Logger.getLogger(JdkHttpTransport.class.getName());

  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

  public static final int MAX_RESPONSE_BODY_BYTES = 64 * 1024;

  private static final Set<String> RESTRICTED_HEADERS =
      Set.of("connection", "content-length", "expect", "host", "upgrade");

  private final HttpClient client;

  public JdkHttpTransport() {
    this(DEFAULT_CONNECT_TIMEOUT);
  }

  public JdkHttpTransport(Duration connectTimeout) {
    this(HttpClient.newBuilder()
        .followRedirects(HttpClient.Redirect.NEVER)
        .connectTimeout(Objects.requireNonNull(connectTimeout, "connectTimeout"))
        .build());
  }

  /**
   * Wraps a preconfigured client. The client must not follow redirects.
   *
   * @param client the HTTP client
   */
  public JdkHttpTransport(HttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
    if (client.followRedirects() != HttpClient.Redirect.NEVER) {
      throw new IllegalArgumentException("HttpClient must use Redirect.NEVER");
    }
  }

  @Override
  public Response post(URI uri, String body, Map<String, String> headers, Duration timeout)
      throws IOException, InterruptedException {
    HttpRequest.Builder request = HttpRequest.newBuilder(uri)
        .timeout(timeout)
        .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
    for (Map.Entry<String, String> header : headers.entrySet()) {
      if (RESTRICTED_HEADERS.contains(header.getKey().toLowerCase(Locale.ROOT))) {
        logger.warning("Dropping restricted header: " + header.getKey());
        continue;
      }
      request.header(header.getKey(), header.getValue());
    }
    CompletableFuture<HttpResponse<String>> pending = client.sendAsync(request.build(),
        info -> new BoundedBodySubscriber(MAX_RESPONSE_BODY_BYTES));
    try {
      HttpResponse<String> response = pending.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
      return new Response(response.statusCode(), response.body());
    } catch (TimeoutException e) {
      pending.cancel(true);
      throw new HttpTimeoutException("Response not complete within " + timeout);
    } catch (InterruptedException e) {
      pending.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      throw unwrap(e);
    }
  }

  private static IOException unwrap(ExecutionException e) {
    Throwable cause = e.getCause();
    while (cause instanceof CompletionException && cause.getCause() != null) {
      cause = cause.getCause();
    }
    if (cause instanceof IOException io) {
      return io;
    }
    if (cause instanceof RuntimeException re) {
      throw re;
    }
    return new IOException(cause);
  }

  /**
   * Collects the response body up to a byte cap, then cancels the subscription.
   */
  static final class BoundedBodySubscriber implements HttpResponse.BodySubscriber<String> {
    private final int maxBytes;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final CompletableFuture<String> body = new CompletableFuture<>();
    private Flow.Subscription subscription;

    BoundedBodySubscriber(int maxBytes) {
      this.maxBytes = maxBytes;
    }

    @Override
    public CompletionStage<String> getBody() {
      return body;
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
      this.subscription = subscription;
      subscription.request(1);
    }

    @Override
    public void onNext(List<ByteBuffer> items) {
      if (body.isDone()) {
        return;
      }
      for (ByteBuffer item : items) {
        int take = Math.min(item.remaining(), maxBytes - buffer.size());
        byte[] chunk = new byte[take];
        item.get(chunk);
        buffer.write(chunk, 0, take);
        if (buffer.size() >= maxBytes) {
          subscription.cancel();
          complete();
          return;
        }
      }
      subscription.request(1);
    }

    @Override
    public void onError(Throwable throwable) {
      body.completeExceptionally(throwable);
    }

    @Override
    public void onComplete() {
      complete();
    }

    private void complete() {
      body.complete(new String(buffer.toByteArray(), StandardCharsets.UTF_8));
    }
  }
}
