package com.rmatrix.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for rmatrix.
 */
@ConfigurationProperties(prefix = "rmatrix")
public class RmatrixProperties {

    /**
     * Whether rmatrix is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the rmatrix configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:rmatrix.yaml";

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
