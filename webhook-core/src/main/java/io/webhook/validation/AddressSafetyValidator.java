package io.webhook.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Rejects webhook destinations that would let a tenant-configured URL reach the
 * sender's own infrastructure (server-side request forgery).
 *
 * <p>A URL passes only if it uses {@code http} or {@code https}, has a hostname, is not a
 * known cloud-metadata hostname, and every address the host resolves to lies outside
 * loopback, private (RFC 1918 and IPv6 unique-local), link-local and unspecified space.
 * Unresolvable hosts are rejected.
 *
 * <p>Validation never throws for bad input; problems are reported through
 * {@link ValidationResult}. This class is thread-safe.
 */
public final class AddressSafetyValidator {

  private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");

  private static final Set<String> BLOCKED_HOSTNAMES = Set.of(
      "metadata.google.internal",
      "metadata.goog",
      "metadata",
      "instance-data",
      "instance-data.ec2.internal");

  private static final String LOCALHOST = "localhost";

  private final HostResolver resolver;

  public AddressSafetyValidator() {
    this(HostResolver.SYSTEM);
  }

  public AddressSafetyValidator(HostResolver resolver) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  /**
   * Validates a destination with every block active.
   *
   * @param url the destination URL
   * @return the validation outcome
   */
  public ValidationResult validate(String url) {
    return check(url, false);
  }

  /**
   * Validates a destination for test harnesses that run a local receiver.
   *
   * <p>{@code allowLocalhost} relaxes only the loopback check. Private-network,
   * link-local and metadata blocks stay active.
   *
   * @param url            the destination URL
   * @param allowLocalhost whether loopback destinations are accepted
   * @return the validation outcome
   */
  public ValidationResult validateForTesting(String url, boolean allowLocalhost) {
    return check(url, allowLocalhost);
  }

  private ValidationResult check(String url, boolean allowLoopback) {
    if (url == null || url.isBlank()) {
      return ValidationResult.rejected("URL must not be empty");
    }
    URI uri;
    try {
      uri = new URI(url.trim());
    } catch (URISyntaxException e) {
      return ValidationResult.rejected("Invalid URL format: " + e.getReason());
    }

    String scheme = uri.getScheme();
    if (scheme == null || !ALLOWED_SCHEMES.contains(scheme.toLowerCase(Locale.ROOT))) {
      return ValidationResult.rejected("URL must use http or https scheme");
    }

    String host = uri.getHost();
    if (host == null || host.isEmpty()) {
      return ValidationResult.rejected("URL must include a hostname");
    }
    host = host.toLowerCase(Locale.ROOT);
    if (host.endsWith(".")) {
      host = host.substring(0, host.length() - 1);
    }

    if (BLOCKED_HOSTNAMES.contains(host)) {
      return ValidationResult.rejected("Hostname is blocked (cloud metadata service): " + host);
    }
    if (LOCALHOST.equals(host) || host.endsWith("." + LOCALHOST)) {
      // RFC 6761: always loopback, never sent to DNS
      return allowLoopback
          ? ValidationResult.accepted()
          : ValidationResult.rejected("Hostname is blocked (localhost): " + host);
    }

    List<InetAddress> addresses;
    try {
      addresses = resolve(host);
    } catch (UnknownHostException e) {
      return ValidationResult.rejected("Cannot resolve hostname: " + host);
    }

    for (InetAddress address : addresses) {
      String blocked = blockedRange(address, allowLoopback);
      if (blocked != null) {
        return ValidationResult.rejected(blocked + " address is blocked: " + address.getHostAddress());
      }
    }
    return ValidationResult.accepted();
  }

  private List<InetAddress> resolve(String host) throws UnknownHostException {
    if (isIpLiteral(host)) {
      String literal = host.startsWith("[") ? host.substring(1, host.length() - 1) : host;
      // getByName performs no lookup for literals
      return List.of(InetAddress.getByName(literal));
    }
    List<InetAddress> resolved = resolver.resolve(host);
    if (resolved == null || resolved.isEmpty()) {
      throw new UnknownHostException(host);
    }
    return resolved;
  }

  private static boolean isIpLiteral(String host) {
    if (host.startsWith("[") && host.endsWith("]")) {
      return true;
    }
    if (host.indexOf(':') >= 0) {
      return true;
    }
    for (int i = 0; i < host.length(); i++) {
      char c = host.charAt(i);
      if ((c < '0' || c > '9') && c != '.') {
        return false;
      }
    }
    return true;
  }

  /**
   * Names the blocked range an address falls in, or {@code null} if it is routable.
   */
  static String blockedRange(InetAddress address, boolean allowLoopback) {
    if (address.isLoopbackAddress()) {
      return allowLoopback ? null : "Loopback";
    }
    if (address.isAnyLocalAddress()) {
      return "Unspecified";
    }
    if (address.isLinkLocalAddress()) {
      return "Link-local";
    }
    if (address.isSiteLocalAddress() || isUniqueLocal(address)) {
      return "Private network";
    }
    return null;
  }

  private static boolean isUniqueLocal(InetAddress address) {
    // fc00::/7
    return address instanceof Inet6Address && (address.getAddress()[0] & 0xfe) == 0xfc;
  }
}
