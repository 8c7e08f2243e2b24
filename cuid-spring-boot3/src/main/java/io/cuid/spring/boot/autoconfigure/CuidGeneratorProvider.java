package io.cuid.spring.boot.autoconfigure;

import io.cuid.generator.CuidGenerator;

/**
 * Provides access to the CUID generators configured in the Spring context.
 */
public interface CuidGeneratorProvider {
    /**
     * Returns the default generator.
     *
     * @return default CUID generator
     */
    CuidGenerator getDefaultGenerator();

    /**
     * Returns a generator by name, creating it on first use.
     *
     * @param name generator name; blank resolves to the default
     * @return resolved CUID generator
     */
    CuidGenerator getGenerator(String name);
}
