package com.example.requestgate.filter;

import com.example.requestgate.config.GateProperties;
import com.example.requestgate.model.RateLimitDecision;
import com.example.requestgate.model.RateLimitErrorBody;
import com.example.requestgate.model.RateLimitResult;
import com.example.requestgate.model.SecurityPolicyContext;
import com.example.requestgate.service.RateLimiterService;
import com.example.requestgate.service.SecurityHeaderComposer;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Servlet filter gating every incoming HTTP request.
 *
 * Rate-limited paths are checked against the client's quota first; a denied request is answered here with
 * 429 and never reaches the handler. Every request that goes through gets the security headers.
 */
@Component
public class RequestGatingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestGatingFilter.class);

    static final String DEGRADED_HEADER = "X-RateLimit-Degraded";

    private final PathClassifier pathClassifier;
    private final ClientKeyExtractor clientKeyExtractor;
    private final RateLimiterService rateLimiterService;
    private final ObjectMapper objectMapper;
    private final Map<String, String> securityHeaders;
    private final List<String> excludedPaths;

    private final AntPathMatcher pathMatcher = new AntPathMatcher();
    private final UrlPathHelper urlPathHelper = new UrlPathHelper();

    public RequestGatingFilter(
            PathClassifier pathClassifier,
            ClientKeyExtractor clientKeyExtractor,
            RateLimiterService rateLimiterService,
            SecurityHeaderComposer securityHeaderComposer,
            SecurityPolicyContext securityPolicyContext,
            GateProperties gateProperties,
            ObjectMapper objectMapper
    ) {
        this.pathClassifier = pathClassifier;
        this.clientKeyExtractor = clientKeyExtractor;
        this.rateLimiterService = rateLimiterService;
        this.objectMapper = objectMapper;
        this.securityHeaders = securityHeaderComposer.compose(securityPolicyContext);
        this.excludedPaths = List.copyOf(gateProperties.getExcludedPaths());
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = urlPathHelper.getPathWithinApplication(request);
        for (String pattern : excludedPaths) {
            if (pathMatcher.match(pattern, path)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String path = urlPathHelper.getPathWithinApplication(request);

        if (pathClassifier.isRateLimited(path)) {
            String clientKey = clientKeyExtractor.extractKey(RequestMetadata.from(request));
            RateLimitResult result = rateLimiterService.check(clientKey);

            if (result.getDecision() == RateLimitDecision.REJECT_RATE_LIMITED) {
                log.debug("Rejecting {} {} for client {}: rate limit exceeded", request.getMethod(), path, clientKey);
                writeRejection(response, HttpStatus.TOO_MANY_REQUESTS, RateLimitErrorBody.tooManyRequests(),
                        Long.toString(rateLimiterService.getPolicy().windowSeconds()));
                return;
            }

            if (result.getDecision() == RateLimitDecision.REJECT_STORE_FAILURE) {
                // When configured to fail closed, we reject the request with a 503 and
                // make the root cause explicit in logs and the response body.
                log.error("Rejecting request for client {} due to rate limit store failure and fail-closed configuration",
                        clientKey);
                writeRejection(response, HttpStatus.SERVICE_UNAVAILABLE, RateLimitErrorBody.storeUnavailable(), null);
                return;
            }

            if (result.isDegraded()) {
                response.setHeader(DEGRADED_HEADER, "true");
            }
        }

        filterChain.doFilter(request, new SecurityHeadersResponseWrapper(response, securityHeaders));
    }

    private void writeRejection(HttpServletResponse response, HttpStatus status, RateLimitErrorBody body,
                                String retryAfter) throws IOException {
        byte[] payload = objectMapper.writeValueAsBytes(body);
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        if (retryAfter != null) {
            response.setHeader(HttpHeaders.RETRY_AFTER, retryAfter);
        }
        response.setContentLength(payload.length);
        // raw bytes: going through a writer makes the container append a charset to Content-Type
        response.getOutputStream().write(payload);
        response.flushBuffer();
    }
}
