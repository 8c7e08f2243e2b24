package io.cuid.generator;

import io.cuid.core.CuidException;
import io.cuid.fingerprint.Fingerprint;
import io.cuid.fingerprint.FingerprintDeriver;
import io.cuid.random.RandomBlockSource;

import java.time.Clock;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Immutable configuration for {@link CuidGenerator}.
 * <p>
 * Use the builder to replace any of the ambient sources:
 * <pre>
 * CuidConfiguration config = CuidConfiguration.builder()
 *     .hostnameSource(() -&gt; "node-7")
 *     .randomBlockSource(RandomBlockSource.secure())
 *     .build();
 * </pre>
 * An explicit {@link Fingerprint} takes precedence over the process id and host name sources.
 */
public final class CuidConfiguration {

    private final Clock clock;
    private final RandomBlockSource randomBlockSource;
    private final LongSupplier processIdSource;
    private final Supplier<String> hostnameSource;
    private final Fingerprint fingerprint;

    private CuidConfiguration(Builder builder) {
        this.clock = builder.clock;
        this.randomBlockSource = builder.randomBlockSource;
        this.processIdSource = builder.processIdSource;
        this.hostnameSource = builder.hostnameSource;
        this.fingerprint = builder.fingerprint;
    }

    /**
     * Create a new builder for CuidConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration reading the system clock, process id and host name.
     */
    public static CuidConfiguration defaults() {
        return builder().build();
    }

    /**
     * Get the clock sampled for the timestamp block.
     *
     * @return the clock (default: UTC system clock)
     */
    public Clock clock() {
        return clock;
    }

    /**
     * Get the source of the two random blocks.
     *
     * @return the random block source (default: thread-local random)
     */
    public RandomBlockSource randomBlockSource() {
        return randomBlockSource;
    }

    public LongSupplier processIdSource() {
        return processIdSource;
    }

    public Supplier<String> hostnameSource() {
        return hostnameSource;
    }

    /**
     * Get the explicit fingerprint, if one was configured.
     *
     * @return the fingerprint or null when it is derived from the environment
     */
    public Fingerprint fingerprint() {
        return fingerprint;
    }

    /**
     * Resolve the fingerprint for a new generator: the explicit one, or one derived
     * from the configured sources.
     *
     * @return the fingerprint
     * @throws CuidException if the environment cannot be read
     */
    Fingerprint resolveFingerprint() {
        if (fingerprint != null) {
            return fingerprint;
        }
        return new FingerprintDeriver(processIdSource, hostnameSource).derive();
    }

    /**
     * Builder for CuidConfiguration.
     */
    public static class Builder {
        private Clock clock = Clock.systemUTC();
        private RandomBlockSource randomBlockSource = RandomBlockSource.threadLocal();
        private LongSupplier processIdSource = FingerprintDeriver::currentProcessId;
        private Supplier<String> hostnameSource = FingerprintDeriver::localHostname;
        private Fingerprint fingerprint;

        private Builder() {
        }

        /**
         * Set the clock sampled for the timestamp block.
         *
         * @param clock the clock
         * @return this builder for method chaining
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Set the source of the random blocks.
         *
         * @param randomBlockSource the random block source
         * @return this builder for method chaining
         */
        public Builder randomBlockSource(RandomBlockSource randomBlockSource) {
            this.randomBlockSource = Objects.requireNonNull(randomBlockSource, "randomBlockSource");
            return this;
        }

        /**
         * Set the process id source used to derive the fingerprint.
         *
         * @param processIdSource the process id source
         * @return this builder for method chaining
         */
        public Builder processIdSource(LongSupplier processIdSource) {
            this.processIdSource = Objects.requireNonNull(processIdSource, "processIdSource");
            return this;
        }

        /**
         * Set the host name source used to derive the fingerprint.
         *
         * @param hostnameSource the host name source
         * @return this builder for method chaining
         */
        public Builder hostnameSource(Supplier<String> hostnameSource) {
            this.hostnameSource = Objects.requireNonNull(hostnameSource, "hostnameSource");
            return this;
        }

        /**
         * Pin the fingerprint instead of deriving it.
         *
         * @param fingerprint the fingerprint, or null to derive it
         * @return this builder for method chaining
         */
        public Builder fingerprint(Fingerprint fingerprint) {
            this.fingerprint = fingerprint;
            return this;
        }

        /**
         * Pin the fingerprint from its text form.
         *
         * @param fingerprint four base-36 characters
         * @return this builder for method chaining
         * @throws CuidException if the text is not a valid fingerprint
         */
        public Builder fingerprint(String fingerprint) {
            this.fingerprint = fingerprint == null ? null : Fingerprint.of(fingerprint);
            return this;
        }

        /**
         * Build the immutable CuidConfiguration.
         *
         * @return a new CuidConfiguration instance
         */
        public CuidConfiguration build() {
            return new CuidConfiguration(this);
        }
    }
}
