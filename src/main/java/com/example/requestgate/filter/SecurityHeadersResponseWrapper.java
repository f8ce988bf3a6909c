package com.example.requestgate.filter;

import com.example.requestgate.service.SecurityHeaderComposer;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpServletResponseWrapper;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Carries the gate's security headers through the downstream handler.
 * <p>
 * The headers are written up front, because nothing can be added once the handler commits the response.
 * The handler may still replace any of them except {@code Content-Security-Policy}, which stays owned by
 * the gate; attempts to set or add it are dropped. The handler's first {@code addHeader} for a gate header
 * replaces the gate's value, so the response never carries both.
 */
class SecurityHeadersResponseWrapper extends HttpServletResponseWrapper {

    private final Map<String, String> securityHeaders;
    private final Set<String> overriddenByHandler = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);

    SecurityHeadersResponseWrapper(HttpServletResponse response, Map<String, String> securityHeaders) {
        super(response);
        this.securityHeaders = securityHeaders;
        applySecurityHeaders();
    }

    @Override
    public void setHeader(String name, String value) {
        if (isGateOwned(name)) {
            return;
        }
        if (isSecurityHeader(name)) {
            overriddenByHandler.add(name);
        }
        super.setHeader(name, value);
    }

    @Override
    public void addHeader(String name, String value) {
        if (isGateOwned(name)) {
            return;
        }
        if (isSecurityHeader(name) && overriddenByHandler.add(name)) {
            super.setHeader(name, value);
            return;
        }
        super.addHeader(name, value);
    }

    @Override
    public void reset() {
        super.reset();
        overriddenByHandler.clear();
        applySecurityHeaders();
    }

    private void applySecurityHeaders() {
        HttpServletResponse response = (HttpServletResponse) getResponse();
        securityHeaders.forEach(response::setHeader);
    }

    private boolean isSecurityHeader(String name) {
        for (String header : securityHeaders.keySet()) {
            if (header.equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isGateOwned(String name) {
        return SecurityHeaderComposer.CONTENT_SECURITY_POLICY.equalsIgnoreCase(name);
    }
}
