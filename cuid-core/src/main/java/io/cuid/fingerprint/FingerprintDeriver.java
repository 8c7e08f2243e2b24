package io.cuid.fingerprint;

import io.cuid.core.CuidException;
import io.cuid.encoding.Base36;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Derives the {@link Fingerprint} of the running process.
 * <p>
 * The fingerprint is {@code processComponent + hostComponent} where
 * <pre>
 * processComponent = (pid mod 36^2) * 36^2
 * hostComponent    = (sum of hostname code points + hostname length + 36) mod 36^2
 * </pre>
 * so the process id occupies the two high digits and the host checksum the two low digits.
 * <p>
 * Both inputs come from injectable sources; {@link #currentProcessId()} and
 * {@link #localHostname()} read them from the JVM.
 */
public final class FingerprintDeriver {

    private static final long BLOCK = (long) Base36.RADIX * Base36.RADIX;

    private final LongSupplier processIdSource;
    private final Supplier<String> hostnameSource;

    public FingerprintDeriver(LongSupplier processIdSource, Supplier<String> hostnameSource) {
        this.processIdSource = Objects.requireNonNull(processIdSource, "processIdSource");
        this.hostnameSource = Objects.requireNonNull(hostnameSource, "hostnameSource");
    }

    /**
     * Reads the environment and computes the fingerprint.
     *
     * @return the fingerprint
     * @throws CuidException if the process id or host name cannot be obtained
     */
    public Fingerprint derive() {
        long pid = readProcessId();
        String hostname = readHostname();
        return Fingerprint.ofNumeric(processComponent(pid) + hostComponent(hostname));
    }

    static long processComponent(long pid) {
        return Math.floorMod(pid, BLOCK) * BLOCK;
    }

    static long hostComponent(String hostname) {
        long sum = hostname.codePoints().asLongStream().sum();
        long count = hostname.codePointCount(0, hostname.length());
        return Math.floorMod(sum + count + Base36.RADIX, BLOCK);
    }

    private long readProcessId() {
        try {
            return processIdSource.getAsLong();
        } catch (RuntimeException e) {
            throw new CuidException("Unable to read process id", e);
        }
    }

    private String readHostname() {
        String hostname;
        try {
            hostname = hostnameSource.get();
        } catch (RuntimeException e) {
            throw new CuidException("Unable to read host name", e);
        }
        if (hostname == null || hostname.isBlank()) {
            throw new CuidException("Host name is not available");
        }
        return hostname;
    }

    /**
     * Process id of the running JVM.
     */
    public static long currentProcessId() {
        return ProcessHandle.current().pid();
    }

    /**
     * Name of the local host.
     *
     * @throws CuidException if the local host cannot be resolved
     */
    public static String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            throw new CuidException("Unable to resolve local host", e);
        }
    }
}
