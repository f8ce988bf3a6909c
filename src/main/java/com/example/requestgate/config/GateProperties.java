package com.example.requestgate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "gate")
public class GateProperties {

    /**
     * Ant-style patterns the gate never sees: static assets and framework internals.
     */
    private List<String> excludedPaths = new ArrayList<>(List.of(
            "/_next/static/**",
            "/_next/image/**",
            "/favicon.ico",
            "/**/*.svg",
            "/**/*.png",
            "/**/*.jpg",
            "/**/*.jpeg",
            "/**/*.gif",
            "/**/*.webp"
    ));

    public List<String> getExcludedPaths() {
        return excludedPaths;
    }

    public void setExcludedPaths(List<String> excludedPaths) {
        this.excludedPaths = excludedPaths;
    }
}
