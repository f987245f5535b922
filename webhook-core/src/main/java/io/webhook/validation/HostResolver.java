package io.webhook.validation;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

/**
 * Resolves a hostname to every address it maps to.
 *
 * <p>{@link #SYSTEM} uses the JVM resolver. Tests substitute a fixed mapping.
 */
@FunctionalInterface
public interface HostResolver {

    /** Resolver backed by {@link InetAddress#getAllByName(String)}. */
    HostResolver SYSTEM = host -> List.of(InetAddress.getAllByName(host));

    /**
     * Resolves a hostname.
     *
     * @param host the hostname (never a literal IP)
     * @return all resolved addresses (never empty)
     * @throws UnknownHostException if the host cannot be resolved
     */
    List<InetAddress> resolve(String host) throws UnknownHostException;
}
