package io.webhook.delivery;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Classification of a single HTTP attempt.
 *
 * <ul>
 *   <li>{@link Success}: 2xx; the delivery is done.</li>
 *   <li>{@link ClientError}: 3xx or 4xx; terminal, never retried.</li>
 *   <li>{@link RetryableError}: 5xx, 1xx or a transport failure; retried while attempts remain.</li>
 * </ul>
 *
 * <p>The {@code classify} factories are pure functions of their inputs.
 */
public sealed interface AttemptOutcome
        permits AttemptOutcome.Success, AttemptOutcome.ClientError, AttemptOutcome.RetryableError {

    /** Maximum characters of a response body or exception message kept in error text. */
    int EXCERPT_LENGTH = 200;

    /**
     * Status code of the response, or {@code null} when no response was received.
     *
     * @return the status code, or {@code null}
     */
    Integer statusCode();

    /**
     * Classifies a received response.
     *
     * @param statusCode the HTTP status code
     * @param body       the response body ({@code null} treated as empty)
     * @return the outcome
     */
    static AttemptOutcome classify(int statusCode, String body) {
        String excerpt = excerpt(body);
        if (statusCode >= 200 && statusCode < 300) {
            return new Success(statusCode);
        }
        if (statusCode >= 300 && statusCode < 400) {
            return new ClientError(statusCode, "Redirect not followed " + statusCode + ": " + excerpt);
        }
        if (statusCode >= 400 && statusCode < 500) {
            return new ClientError(statusCode, "Client error " + statusCode + ": " + excerpt);
        }
        if (statusCode >= 500) {
            return new RetryableError(statusCode, "Server error " + statusCode + ": " + excerpt);
        }
        return new RetryableError(statusCode, "Unexpected status " + statusCode + ": " + excerpt);
    }

    /**
     * Classifies a transport failure. All transport failures are retryable.
     *
     * @param failure the exception thrown by the transport (usually an {@code IOException})
     * @param timeout the per-attempt timeout that was in force
     * @return the outcome
     */
    static AttemptOutcome classify(Exception failure, Duration timeout) {
        if (failure instanceof HttpTimeoutException) {
            return new RetryableError(null, "Request timeout after " + seconds(timeout) + "s");
        }
        String message = failure.getMessage() == null ? "no detail" : excerpt(failure.getMessage());
        if (failure instanceof ConnectException || failure instanceof UnknownHostException) {
            return new RetryableError(null, "Connection error: " + message);
        }
        return new RetryableError(null, "Request exception: " + message);
    }

    private static String excerpt(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= EXCERPT_LENGTH ? text : text.substring(0, EXCERPT_LENGTH);
    }

    private static String seconds(Duration timeout) {
        long millis = timeout.toMillis();
        if (millis % 1000 == 0) {
            return Long.toString(millis / 1000);
        }
        return Double.toString(millis / 1000.0);
    }

    /**
     * Receiver accepted the webhook.
     *
     * @param statusCode the 2xx status
     */
    record Success(Integer statusCode) implements AttemptOutcome {
    }

    /**
     * Receiver rejected the webhook; retrying would not help.
     *
     * @param statusCode the 3xx or 4xx status
     * @param error      error text including a body excerpt
     */
    record ClientError(Integer statusCode, String error) implements AttemptOutcome {
    }

    /**
     * Transient failure.
     *
     * @param statusCode the status, or {@code null} for transport failures
     * @param error      error text
     */
    record RetryableError(Integer statusCode, String error) implements AttemptOutcome {
    }
}
