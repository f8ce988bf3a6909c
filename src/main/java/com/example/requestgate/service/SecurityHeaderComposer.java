package com.example.requestgate.service;

import com.example.requestgate.model.SecurityPolicyContext;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Builds the security headers attached to every gated response.
 * The result depends only on the environment, never on the request.
 */
@Component
public class SecurityHeaderComposer {

    public static final String X_XSS_PROTECTION = "X-XSS-Protection";
    public static final String X_CONTENT_TYPE_OPTIONS = "X-Content-Type-Options";
    public static final String X_FRAME_OPTIONS = "X-Frame-Options";
    public static final String STRICT_TRANSPORT_SECURITY = "Strict-Transport-Security";
    public static final String CONTENT_SECURITY_POLICY = "Content-Security-Policy";

    static final String CSP_TEMPLATE = """
            default-src 'self';
            script-src 'self' 'unsafe-inline' 'unsafe-eval' https://cdn.jsdelivr.net;
            style-src 'self' 'unsafe-inline' https://fonts.googleapis.com;
            font-src 'self' https://fonts.gstatic.com;
            img-src 'self' data: https:;
            connect-src 'self' https://*.supabase.co wss://*.supabase.co;
            frame-ancestors 'none';
            """;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final String contentSecurityPolicy = collapseWhitespace(CSP_TEMPLATE);

    public Map<String, String> compose(SecurityPolicyContext context) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(X_XSS_PROTECTION, "1; mode=block");
        headers.put(X_CONTENT_TYPE_OPTIONS, "nosniff");
        headers.put(X_FRAME_OPTIONS, "DENY");
        if (context.production()) {
            headers.put(STRICT_TRANSPORT_SECURITY, "max-age=31536000; includeSubDomains");
        }
        headers.put(CONTENT_SECURITY_POLICY, contentSecurityPolicy);
        return Collections.unmodifiableMap(headers);
    }

    /**
     * Header values must be a single line: every whitespace run becomes one space, ends are trimmed.
     */
    static String collapseWhitespace(String value) {
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }
}
