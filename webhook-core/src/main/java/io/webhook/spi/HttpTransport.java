package io.webhook.spi;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Executes a single webhook POST.
 *
 * <p>Implementations must not follow redirects and must not retry; the delivery engine
 * owns the retry loop. Any status code is a normal return; only transport-level failures
 * (timeouts, refused connections, DNS errors) are thrown.
 *
 * @see io.webhook.transport.JdkHttpTransport
 */
public interface HttpTransport {

    /**
     * Sends one POST request.
     *
     * @param uri     the destination
     * @param body    the JSON body
     * @param headers headers to send
     * @param timeout per-request timeout
     * @return the response status and body
     * @throws IOException          on transport failure
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    Response post(URI uri, String body, Map<String, String> headers, Duration timeout)
            throws IOException, InterruptedException;

    /**
     * HTTP response summary.
     *
     * @param statusCode the HTTP status code
     * @param body       the response body (never {@code null}, may be empty)
     */
    record Response(int statusCode, String body) {
        public Response {
            body = body == null ? "" : body;
        }
    }
}
