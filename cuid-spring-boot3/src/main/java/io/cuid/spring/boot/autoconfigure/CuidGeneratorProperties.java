package io.cuid.spring.boot.autoconfigure;

import io.cuid.generator.CuidConfiguration;
import io.cuid.random.RandomBlockSource;
import lombok.Data;

/**
 * Per-generator CUID properties.
 */
@Data
public class CuidGeneratorProperties {
    /**
     * Four base-36 characters pinning the fingerprint, e.g. one per container.
     */
    private String fingerprint;
    /**
     * Host name used to derive the fingerprint instead of the resolved local host.
     */
    private String hostname;
    /**
     * Process id used to derive the fingerprint instead of the JVM's own.
     */
    private Long processId;
    /**
     * Draw random blocks from SecureRandom instead of ThreadLocalRandom.
     */
    private boolean secureRandom = false;

    /**
     * Creates property values that derive everything from the environment.
     */
    public CuidGeneratorProperties() {
    }

    /**
     * Creates the immutable CUID configuration from these bound properties.
     *
     * @return CUID configuration
     */
    public CuidConfiguration toConfiguration() {
        var builder = CuidConfiguration.builder();
        if (fingerprint != null && !fingerprint.isBlank()) {
            builder.fingerprint(fingerprint.trim());
        }
        if (hostname != null && !hostname.isBlank()) {
            var configuredHostname = hostname;
            builder.hostnameSource(() -> configuredHostname);
        }
        if (processId != null) {
            long configuredProcessId = processId;
            builder.processIdSource(() -> configuredProcessId);
        }
        if (secureRandom) {
            builder.randomBlockSource(RandomBlockSource.secure());
        }
        return builder.build();
    }
}
