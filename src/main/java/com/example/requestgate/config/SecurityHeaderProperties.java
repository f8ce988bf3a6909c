package com.example.requestgate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "security-headers")
public class SecurityHeaderProperties {

    private static final String PRODUCTION = "production";

    /**
     * Deployment environment name. Strict-Transport-Security is only sent in "production".
     */
    private String environment = "development";

    public String getEnvironment() {
        return environment;
    }

    public void setEnvironment(String environment) {
        this.environment = environment;
    }

    public boolean isProduction() {
        return environment != null && PRODUCTION.equalsIgnoreCase(environment.trim());
    }
}
