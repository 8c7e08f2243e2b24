package io.cuid.generator;

import io.cuid.core.CuidException;
import io.cuid.core.IdGenerator;
import io.cuid.encoding.Base36;
import io.cuid.fingerprint.Fingerprint;
import io.cuid.random.RandomBlockSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Generates collision-resistant identifiers of the form
 * <pre>
 * c &lt;timestamp&gt; &lt;counter&gt; &lt;fingerprint&gt; &lt;random&gt; &lt;random&gt;
 * </pre>
 * where the timestamp is epoch microseconds modulo {@code 36^8} in base 36 and every other
 * block is four base-36 characters.
 * <p>
 * Each instance owns its counter and fingerprint. Calls on one instance are serialized so
 * that no two calls embed the same counter value; separate instances share nothing.
 * The counter wraps to zero after {@code 36^4 - 1}.
 */
public final class CuidGenerator implements IdGenerator<String> {

    private static final Logger log = LoggerFactory.getLogger(CuidGenerator.class);

    public static final String PREFIX = "c";

    /** Width of the counter, fingerprint and random blocks. */
    public static final int BLOCK_SIZE = 4;

    /** Number of values a block can hold, {@code 36^4}. */
    public static final long DISCRETE_VALUES = Base36.capacity(BLOCK_SIZE);

    /** Modulus applied to the microsecond timestamp, {@code 36^8}. */
    public static final long TIMESTAMP_MODULUS = DISCRETE_VALUES * DISCRETE_VALUES;

    private final Object lock = new Object();
    private final Fingerprint fingerprint;
    private final Clock clock;
    private final RandomBlockSource randomBlockSource;

    // guarded by lock
    private long counter;

    CuidGenerator(CuidConfiguration configuration, long initialCounter) {
        Objects.requireNonNull(configuration, "configuration");
        if (initialCounter < 0 || initialCounter >= DISCRETE_VALUES) {
            throw new IllegalArgumentException("Counter out of range: " + initialCounter);
        }
        this.fingerprint = configuration.resolveFingerprint();
        this.clock = configuration.clock();
        this.randomBlockSource = configuration.randomBlockSource();
        this.counter = initialCounter;
        log.debug("Created CUID generator with fingerprint {}", fingerprint);
    }

    /**
     * Create a generator reading the system clock, process id and host name.
     *
     * @return a new, independent generator
     * @throws CuidException if the process id or host name cannot be read
     */
    public static CuidGenerator create() {
        return create(CuidConfiguration.defaults());
    }

    /**
     * Create a generator from the given configuration.
     *
     * @param configuration the configuration
     * @return a new, independent generator
     * @throws CuidException if the fingerprint cannot be resolved
     */
    public static CuidGenerator create(CuidConfiguration configuration) {
        return new CuidGenerator(configuration, 0L);
    }

    /**
     * Generate the next identifier and advance the counter.
     *
     * @return a lowercase identifier starting with {@value #PREFIX}
     * @throws CuidException if the random block source fails; the counter is left unchanged
     */
    @Override
    public String generate() {
        synchronized (lock) {
            String cuid = new StringBuilder(32)
                    .append(PREFIX)
                    .append(timestamp())
                    .append(Base36.encodeFixed(counter, BLOCK_SIZE))
                    .append(fingerprint.value())
                    .append(randomBlock())
                    .append(randomBlock())
                    .toString()
                    .toLowerCase(Locale.ROOT);
            advanceCounter();
            return cuid;
        }
    }

    /**
     * Get the fingerprint embedded in every identifier from this generator.
     *
     * @return the fingerprint
     */
    public Fingerprint fingerprint() {
        return fingerprint;
    }

    /**
     * Get the counter value the next identifier will embed.
     *
     * @return the counter
     */
    public long counter() {
        synchronized (lock) {
            return counter;
        }
    }

    private void advanceCounter() {
        counter++;
        if (counter == DISCRETE_VALUES) {
            counter = 0L;
            log.warn("CUID counter wrapped after {} identifiers (fingerprint {})", DISCRETE_VALUES, fingerprint);
        }
    }

    private String timestamp() {
        Instant now = clock.instant();
        long micros = Math.addExact(Math.multiplyExact(now.getEpochSecond(), 1_000_000L), now.getNano() / 1_000L);
        return Base36.encode(Math.floorMod(micros, TIMESTAMP_MODULUS));
    }

    private String randomBlock() {
        long value;
        try {
            value = randomBlockSource.nextBlock();
        } catch (RuntimeException e) {
            throw new CuidException("Random block source failed", e);
        }
        if (value < RandomBlockSource.MIN_VALUE || value >= RandomBlockSource.BOUND) {
            throw new CuidException("Random block out of range: " + value);
        }
        return Base36.encodeFixed(value, BLOCK_SIZE);
    }
}
