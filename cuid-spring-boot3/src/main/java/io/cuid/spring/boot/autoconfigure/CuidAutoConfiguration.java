package io.cuid.spring.boot.autoconfigure;

import io.cuid.generator.CuidConfiguration;
import io.cuid.generator.CuidGenerator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for CUID generators.
 */
@AutoConfiguration
@ConditionalOnClass(CuidGenerator.class)
@EnableConfigurationProperties(CuidProperties.class)
public class CuidAutoConfiguration {

    /**
     * Creates the auto-configuration instance.
     */
    public CuidAutoConfiguration() {
    }

    /**
     * Creates the default generator configuration from bound properties.
     *
     * @param properties bound CUID properties
     * @return CUID configuration
     */
    @Bean
    @ConditionalOnMissingBean
    public CuidConfiguration cuidConfiguration(CuidProperties properties) {
        var defaultProps = properties.getGenerators().getOrDefault(properties.getDefaultGenerator(),
                new CuidGeneratorProperties());
        return defaultProps.toConfiguration();
    }

    /**
     * Creates a provider capable of resolving named generators.
     *
     * @param configuration default generator configuration
     * @param properties CUID properties
     * @return generator provider
     */
    @Bean
    @ConditionalOnMissingBean
    public CuidGeneratorProvider cuidGeneratorProvider(CuidConfiguration configuration, CuidProperties properties) {
        return new CuidGeneratorProviderImpl(configuration, properties);
    }

    /**
     * Exposes the default generator as a bean.
     *
     * @param provider generator provider
     * @return default generator
     */
    @Bean
    @ConditionalOnMissingBean
    public CuidGenerator cuidGenerator(CuidGeneratorProvider provider) {
        return provider.getDefaultGenerator();
    }
}
