package io.cuid.spring.boot.autoconfigure;

import io.cuid.generator.CuidConfiguration;
import io.cuid.generator.CuidGenerator;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default {@link CuidGeneratorProvider} that lazily creates one generator per name.
 */
public final class CuidGeneratorProviderImpl implements CuidGeneratorProvider {
    private final CuidConfiguration defaultConfiguration;
    private final String defaultGeneratorName;
    private final Map<String, CuidGenerator> generators = new ConcurrentHashMap<>();
    private final Map<String, CuidGeneratorProperties> generatorConfigs;

    /**
     * Creates a generator provider backed by the default configuration and configured generators.
     *
     * @param defaultConfiguration configuration of the default generator
     * @param properties configured generator properties
     */
    public CuidGeneratorProviderImpl(CuidConfiguration defaultConfiguration, CuidProperties properties) {
        this.defaultConfiguration = defaultConfiguration;
        this.defaultGeneratorName = properties.getDefaultGenerator();
        this.generatorConfigs = properties.getGenerators();
    }

    @Override
    public CuidGenerator getDefaultGenerator() {
        return getGenerator(defaultGeneratorName);
    }

    @Override
    public CuidGenerator getGenerator(String name) {
        var generatorName = name == null || name.isBlank() ? defaultGeneratorName : name;
        return generators.computeIfAbsent(generatorName, this::createGenerator);
    }

    private CuidGenerator createGenerator(String name) {
        var configProps = generatorConfigs.get(name);
        if (configProps == null || defaultGeneratorName.equals(name)) {
            return CuidGenerator.create(defaultConfiguration);
        }
        return CuidGenerator.create(configProps.toConfiguration());
    }
}
