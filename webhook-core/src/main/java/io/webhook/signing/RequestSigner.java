package io.webhook.signing;

import io.webhook.util.JsonCodec;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * HMAC-SHA256 request signing and the matching receiver-side verification.
 *
 * <p>The signed message is {@code timestamp + "." + canonicalJson(payload)}, where the
 * timestamp is the current Unix time in seconds. The signature is sent as
 * {@value #SIGNATURE_HEADER}{@code : sha256=<hex>} together with
 * {@value #TIMESTAMP_HEADER}{@code : <seconds>}.
 *
 * <p>Receivers call {@link #verify(String, String, String, String, long)} on the raw
 * request body. The delivery engine posts exactly the canonical text it signed, so
 * the raw body and the canonical payload are the same bytes.
 *
 * <p>This class is immutable and thread-safe.
 */
public final class RequestSigner {

  public static final String SIGNATURE_HEADER = "X-Webhook-Signature";
  public static final String TIMESTAMP_HEADER = "X-Webhook-Timestamp";
  public static final String SIGNATURE_PREFIX = "sha256=";
  public static final long DEFAULT_TOLERANCE_SECONDS = 300;

  private static final String HMAC_ALGORITHM = "HmacSHA256";
  private static final HexFormat HEX = HexFormat.of();

  private final JsonCodec jsonCodec;
  private final Clock clock;

  public RequestSigner() {
    this(JsonCodec.getDefault(), Clock.systemUTC());
  }

  public RequestSigner(JsonCodec jsonCodec, Clock clock) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Canonicalizes a payload with this signer's codec.
   *
   * @param payload the payload
   * @return the canonical JSON text
   */
  public String canonicalize(Map<String, ?> payload) {
    return jsonCodec.canonicalize(payload);
  }

  /**
   * Signs a payload at the current time.
   *
   * @param payload the payload to sign
   * @param secret  the shared secret
   * @return the signature and timestamp headers, in that order
   */
  public Map<String, String> sign(Map<String, ?> payload, String secret) {
    return signCanonical(canonicalize(payload), secret);
  }

  /**
   * Signs already-canonical payload text at the current time.
   *
   * @param canonicalPayload the exact body that will be sent
   * @param secret           the shared secret
   * @return the signature and timestamp headers, in that order
   */
  public Map<String, String> signCanonical(String canonicalPayload, String secret) {
    Objects.requireNonNull(canonicalPayload, "canonicalPayload");
    requireSecret(secret);
    String timestamp = Long.toString(clock.instant().getEpochSecond());
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put(SIGNATURE_HEADER, SIGNATURE_PREFIX + hmacHex(secret, timestamp, canonicalPayload));
    headers.put(TIMESTAMP_HEADER, timestamp);
    return headers;
  }

  /**
   * Verifies a signature with the default {@value #DEFAULT_TOLERANCE_SECONDS}-second
   * replay window.
   *
   * @see #verify(String, String, String, String, long)
   */
  public boolean verify(String rawPayload, String signature, String timestamp, String secret) {
    return verify(rawPayload, signature, timestamp, secret, DEFAULT_TOLERANCE_SECONDS);
  }

  /**
   * Verifies a signature over the raw request body.
   *
   * <p>Returns {@code false}, never throws, when any input is missing, the timestamp is
   * not an integer, the timestamp is more than {@code toleranceSeconds} away from now in
   * either direction, or the signature does not match. The {@code sha256=} prefix is
   * optional.
   *
   * @param rawPayload       the request body exactly as received
   * @param signature        the {@value #SIGNATURE_HEADER} value
   * @param timestamp        the {@value #TIMESTAMP_HEADER} value
   * @param secret           the shared secret
   * @param toleranceSeconds the accepted clock skew
   * @return whether the request is authentic and fresh
   */
  public boolean verify(String rawPayload, String signature, String timestamp,
      String secret, long toleranceSeconds) {
    if (rawPayload == null || signature == null || timestamp == null
        || secret == null || secret.isEmpty()) {
      return false;
    }
    long ts;
    try {
      ts = Long.parseLong(timestamp.trim());
    } catch (NumberFormatException e) {
      return false;
    }
    if (!withinTolerance(clock.instant().getEpochSecond(), ts, toleranceSeconds)) {
      return false;
    }

    String provided = signature.trim();
    if (provided.regionMatches(true, 0, SIGNATURE_PREFIX, 0, SIGNATURE_PREFIX.length())) {
      provided = provided.substring(SIGNATURE_PREFIX.length());
    }
    String expected = hmacHex(secret, timestamp.trim(), rawPayload);
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.US_ASCII),
        provided.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII));
  }

  private static boolean withinTolerance(long now, long timestamp, long toleranceSeconds) {
    try {
      return Math.absExact(Math.subtractExact(now, timestamp)) <= toleranceSeconds;
    } catch (ArithmeticException e) {
      // skew beyond the range of a long
      return false;
    }
  }

  private static String hmacHex(String secret, String timestamp, String payload) {
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
      byte[] digest = mac.doFinal((timestamp + "." + payload).getBytes(StandardCharsets.UTF_8));
      return HEX.formatHex(digest);
    } catch (GeneralSecurityException e) {
      // HmacSHA256 is mandatory on every JRE
      throw new IllegalStateException("HMAC-SHA256 unavailable", e);
    }
  }

  private static void requireSecret(String secret) {
    Objects.requireNonNull(secret, "secret");
    if (secret.isEmpty()) {
      throw new IllegalArgumentException("secret must not be empty");
    }
  }
}
