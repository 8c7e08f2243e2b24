package io.cuid.core;

/**
 * Thread-safe identifier generator.
 *
 * @param <T> identifier type
 */
@FunctionalInterface
public interface IdGenerator<T> {
    /**
     * Generate the next identifier.
     * Must be safe to call from multiple threads.
     *
     * @return The generated identifier
     */
    T generate();
}
