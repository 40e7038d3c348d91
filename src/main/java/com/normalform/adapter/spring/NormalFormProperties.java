package com.normalform.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for normal form conversion.
 */
@ConfigurationProperties(prefix = "normal-form")
public class NormalFormProperties {

    /**
     * Whether the converter beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the normal form configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:normal-form.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
