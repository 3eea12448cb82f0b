package com.mk.fx.qa.pingit.echo;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Objects;

/**
 * Echo client issuing a single reachability probe per call. Uses ICMP echo when the process is
 * allowed to open raw sockets and falls back to a TCP connection on the echo port otherwise (see
 * {@link InetAddress#isReachable(int)}). This implementation does not include retry logic.
 */
@Slf4j
public class EchoClient {

    /** Maximum number of hops, 0 lets the operating system decide. */
    private final int ttl;

    /**
     * Constructs an EchoClient that lets the operating system pick the TTL.
     */
    public EchoClient() {
        this(0);
    }

    /**
     * Constructs an EchoClient.
     *
     * @param ttl maximum number of hops, 0 for the system default
     */
    public EchoClient(int ttl) {
        if (ttl < 0) {
            throw new IllegalArgumentException("TTL must not be negative");
        }
        this.ttl = ttl;

        log.debug("EchoClient initialised - ttl: {}", ttl);
    }

    /**
     * Sends one echo request. The host is resolved before the clock starts, so the reported
     * round-trip time does not include name resolution.
     *
     * @param host host name or literal address
     * @param timeout maximum time to wait for the reply
     * @return the echo outcome, {@code reachable=false} when no reply arrived within the timeout
     * @throws UnknownHostException if the host cannot be resolved
     * @throws IOException if a network error occurs
     */
    public EchoResponse echo(String host, Duration timeout) throws IOException {
        var normalizedHost = validateHost(host);
        var effectiveTimeout = requirePositive(timeout);

        var address = resolve(normalizedHost);

        var startTime = System.nanoTime();
        var reachable = address.isReachable(null, ttl, toTimeoutMillis(effectiveTimeout));
        var roundTripMs = (System.nanoTime() - startTime) / 1_000_000.0;

        var response = new EchoResponse();
        response.setHost(normalizedHost);
        response.setAddress(address.getHostAddress());
        response.setReachable(reachable);
        response.setRoundTripMs(reachable ? roundTripMs : 0.0);

        log.debug(
                "Echo {} ({}) reachable={} in {} ms",
                normalizedHost,
                response.getAddress(),
                reachable,
                String.format("%.2f", roundTripMs));
        return response;
    }

    /**
     * Resolves the host to an address.
     *
     * @param host the host to resolve
     * @return the resolved address
     * @throws UnknownHostException if resolution fails
     */
    protected InetAddress resolve(String host) throws UnknownHostException {
        return InetAddress.getByName(host);
    }

    /**
     * Validates and trims the host.
     *
     * @param host the host to validate
     * @return the trimmed host
     * @throws IllegalArgumentException if the host is null or empty
     */
    private String validateHost(String host) {
        Objects.requireNonNull(host, "Host cannot be null");
        var trimmed = host.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Host cannot be empty");
        }
        return trimmed;
    }

    private static Duration requirePositive(Duration timeout) {
        Objects.requireNonNull(timeout, "Timeout cannot be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
        return timeout;
    }

    private static int toTimeoutMillis(Duration timeout) {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, timeout.toMillis()));
    }
}
