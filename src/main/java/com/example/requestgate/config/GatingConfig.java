package com.example.requestgate.config;

import com.example.requestgate.model.RateLimitPolicy;
import com.example.requestgate.model.SecurityPolicyContext;
import com.example.requestgate.store.InMemoryRateLimitStore;
import com.example.requestgate.store.RateLimitStore;
import com.example.requestgate.store.RedisRateLimitStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Clock;
import java.util.List;

@Configuration
public class GatingConfig {

    private static final Logger log = LoggerFactory.getLogger(GatingConfig.class);

    /**
     * Clock bean for time-based operations in the rate limiter.
     * <p>
     * Can be overridden in tests with a fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Fails startup on a non-positive max or window instead of falling back to a default.
     */
    @Bean
    public RateLimitPolicy rateLimitPolicy(RateLimiterProperties properties) {
        RateLimitPolicy policy = new RateLimitPolicy(properties.getMaxRequests(), properties.getWindow());
        log.info("Rate limiting {} requests per {} on paths {} using {} store",
                policy.maxRequests(), policy.window(), properties.getLimitedPathPrefixes(), properties.getStore());
        return policy;
    }

    @Bean
    public SecurityPolicyContext securityPolicyContext(SecurityHeaderProperties properties) {
        return new SecurityPolicyContext(properties.isProduction());
    }

    /**
     * Picks the counter store from {@code rate-limiter.store}, which binds leniently
     * ({@code redis}, {@code REDIS}, {@code in-memory} and {@code IN_MEMORY} all work).
     * The Redis beans only exist when {@link RedisConfig} is active for the same value.
     */
    @Bean
    public RateLimitStore rateLimitStore(
            RateLimiterProperties properties,
            RateLimitPolicy policy,
            Clock clock,
            ObjectProvider<StringRedisTemplate> redisTemplate,
            ObjectProvider<DefaultRedisScript<List>> fixedWindowScript
    ) {
        switch (properties.getStore()) {
            case REDIS:
                return new RedisRateLimitStore(
                        redisTemplate.getObject(),
                        fixedWindowScript.getObject(),
                        policy,
                        properties.isFailOpenOnRedisError());
            case IN_MEMORY:
            default:
                return new InMemoryRateLimitStore(policy, clock, properties.getSweepGrace(), properties.getMaxKeys());
        }
    }
}
