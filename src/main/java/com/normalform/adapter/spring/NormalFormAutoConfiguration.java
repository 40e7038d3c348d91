package com.normalform.adapter.spring;

import com.normalform.config.ConfigLoader;
import com.normalform.config.NormalFormConfig;
import com.normalform.core.NormalFormConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for normal form conversion.
 */
@Configuration
@ConditionalOnProperty(prefix = "normal-form", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(NormalFormProperties.class)
public class NormalFormAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(NormalFormAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public NormalFormConfig normalFormConfig(NormalFormProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public NormalFormConverter normalFormConverter(NormalFormConfig config) {
        log.info("Creating NormalFormConverter with default form {}", config.defaultForm());
        return new NormalFormConverter(config);
    }
}
