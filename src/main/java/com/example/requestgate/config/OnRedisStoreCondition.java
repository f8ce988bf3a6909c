package com.example.requestgate.config;

import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

/**
 * Matches when {@code rate-limiter.store} binds to {@link RateLimiterProperties.Store#REDIS}.
 * <p>
 * Uses the same relaxed binding as the properties class, so the property and the
 * {@code RATE_LIMIT_STORE} variable accept any case and {@code -} or {@code _}.
 */
class OnRedisStoreCondition extends SpringBootCondition {

    static final String PROPERTY = "rate-limiter.store";

    @Override
    public ConditionOutcome getMatchOutcome(ConditionContext context, AnnotatedTypeMetadata metadata) {
        RateLimiterProperties.Store store = Binder.get(context.getEnvironment())
                .bind(PROPERTY, RateLimiterProperties.Store.class)
                .orElse(RateLimiterProperties.Store.IN_MEMORY);
        if (store == RateLimiterProperties.Store.REDIS) {
            return ConditionOutcome.match(PROPERTY + " is " + store);
        }
        return ConditionOutcome.noMatch(PROPERTY + " is " + store);
    }
}
