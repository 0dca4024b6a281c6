package com.sldce.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sldce.signals")
public record SignalProviderProperties(
        String baseUrl,
        Integer timeoutSeconds
) {
    public SignalProviderProperties {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "http://localhost:8000";
        }
        if (timeoutSeconds == null || timeoutSeconds <= 0) {
            timeoutSeconds = 30;
        }
    }
}
