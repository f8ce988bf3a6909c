package com.example.requestgate.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Derives the rate limit key for a caller.
 * <p>
 * Sources are tried from most to least trusted and the first non-blank one wins:
 * <ol>
 *     <li>the connection-level client address (rewritten by the container from trusted proxy
 *     headers when {@code server.forward-headers-strategy} is enabled)</li>
 *     <li>the first entry of {@code X-Forwarded-For}</li>
 *     <li>{@code X-Real-IP}</li>
 *     <li>{@link #UNKNOWN_CLIENT_KEY}</li>
 * </ol>
 * Every caller that falls through to the last step shares a single bucket.
 */
@Component
public class ClientKeyExtractor {

    private static final Logger log = LoggerFactory.getLogger(ClientKeyExtractor.class);

    public static final String UNKNOWN_CLIENT_KEY = "127.0.0.1";

    public String extractKey(RequestMetadata metadata) {
        if (hasText(metadata.connectionAddress())) {
            return metadata.connectionAddress().trim();
        }

        String firstForwarded = firstForwardedFor(metadata.forwardedFor());
        if (hasText(firstForwarded)) {
            return firstForwarded;
        }

        if (hasText(metadata.realIp())) {
            return metadata.realIp().trim();
        }

        log.warn("Could not identify client, rate limiting it under the shared key {}", UNKNOWN_CLIENT_KEY);
        return UNKNOWN_CLIENT_KEY;
    }

    private static String firstForwardedFor(String header) {
        if (header == null) {
            return null;
        }
        int comma = header.indexOf(',');
        String first = comma >= 0 ? header.substring(0, comma) : header;
        return first.trim();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
