package io.cuid.random;

import io.cuid.encoding.Base36;

import java.security.SecureRandom;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

/**
 * Source of the random blocks appended to every identifier.
 * <p>
 * Values are drawn uniformly from {@code [1, 36^4 - 1]}, so a block always fits four base-36 digits.
 */
@FunctionalInterface
public interface RandomBlockSource {

    /** Smallest value a block may take. */
    long MIN_VALUE = 1L;

    /** Exclusive upper bound of a block, {@code 36^4}. */
    long BOUND = Base36.capacity(4);

    /**
     * Draw the next block value.
     *
     * @return a value in {@code [MIN_VALUE, BOUND)}
     */
    long nextBlock();

    /**
     * Default source backed by {@link ThreadLocalRandom}.
     */
    static RandomBlockSource threadLocal() {
        return () -> ThreadLocalRandom.current().nextLong(MIN_VALUE, BOUND);
    }

    /**
     * Source backed by a new {@link SecureRandom}.
     */
    static RandomBlockSource secure() {
        return of(new SecureRandom());
    }

    /**
     * Source backed by the given generator. The generator must be safe for the threads calling it.
     */
    static RandomBlockSource of(RandomGenerator generator) {
        Objects.requireNonNull(generator, "generator");
        return () -> generator.nextLong(MIN_VALUE, BOUND);
    }
}
