package com.example.requestgate.filter;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Connection and header facts the client key is derived from.
 *
 * @param connectionAddress address of the peer as reported by the servlet container
 * @param forwardedFor      raw {@code X-Forwarded-For} header value
 * @param realIp            raw {@code X-Real-IP} header value
 */
public record RequestMetadata(String connectionAddress, String forwardedFor, String realIp) {

    public static final String X_FORWARDED_FOR = "X-Forwarded-For";
    public static final String X_REAL_IP = "X-Real-IP";

    public static RequestMetadata from(HttpServletRequest request) {
        return new RequestMetadata(
                request.getRemoteAddr(),
                request.getHeader(X_FORWARDED_FOR),
                request.getHeader(X_REAL_IP)
        );
    }
}
