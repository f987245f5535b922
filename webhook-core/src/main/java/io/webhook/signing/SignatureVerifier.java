package io.webhook.signing;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Receiver-side helper that checks an incoming webhook request against a shared secret.
 *
 * <p>Header names are matched case-insensitively, since servlet containers and proxies
 * differ in how they present them.
 *
 * <pre>{@code
 * SignatureVerifier verifier = new SignatureVerifier(secret);
 * if (!verifier.verify(requestHeaders, rawBody)) {
 *     return 401;
 * }
 * }</pre>
 */
public final class SignatureVerifier {
  private final String secret;
  private final long toleranceSeconds;
  private final RequestSigner signer;

  public SignatureVerifier(String secret) {
    this(secret, RequestSigner.DEFAULT_TOLERANCE_SECONDS, new RequestSigner());
  }

  public SignatureVerifier(String secret, long toleranceSeconds, RequestSigner signer) {
    this.secret = Objects.requireNonNull(secret, "secret");
    if (secret.isEmpty()) {
      throw new IllegalArgumentException("secret must not be empty");
    }
    if (toleranceSeconds < 0) {
      throw new IllegalArgumentException("toleranceSeconds must be >= 0, got: " + toleranceSeconds);
    }
    this.toleranceSeconds = toleranceSeconds;
    this.signer = Objects.requireNonNull(signer, "signer");
  }

  /**
   * Verifies a request given its headers and raw body.
   *
   * @param requestHeaders the request headers (any case)
   * @param rawBody        the body exactly as received
   * @return {@code false} if either signature header is missing or verification fails
   */
  public boolean verify(Map<String, String> requestHeaders, String rawBody) {
    if (requestHeaders == null) {
      return false;
    }
    String signature = header(requestHeaders, RequestSigner.SIGNATURE_HEADER);
    String timestamp = header(requestHeaders, RequestSigner.TIMESTAMP_HEADER);
    if (signature == null || timestamp == null) {
      return false;
    }
    return signer.verify(rawBody, signature, timestamp, secret, toleranceSeconds);
  }

  private static String header(Map<String, String> headers, String name) {
    String target = name.toLowerCase(Locale.ROOT);
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (entry.getKey() != null && entry.getKey().toLowerCase(Locale.ROOT).equals(target)) {
        return entry.getValue();
      }
    }
    return null;
  }
}
