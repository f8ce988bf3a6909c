package com.example.requestgate.store;

import com.example.requestgate.model.RateLimitPolicy;
import com.example.requestgate.model.RateLimitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Fixed window counters shared by every instance through Redis.
 *
 * All concurrency control lives inside the Lua script. This store is mostly responsible for:
 *  - building the correct Redis key
 *  - passing parameters
 *  - translating the script result into a domain-level decision
 *  - defining the behavior when Redis is unavailable (fail-open vs fail-closed)
 */
public class RedisRateLimitStore implements RateLimitStore {

    private static final Logger log = LoggerFactory.getLogger(RedisRateLimitStore.class);

    static final String KEY_PREFIX = "rate_limiter:";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<List> fixedWindowScript;
    private final RateLimitPolicy policy;
    private final boolean failOpenOnRedisError;

    public RedisRateLimitStore(
            StringRedisTemplate redisTemplate,
            DefaultRedisScript<List> fixedWindowScript,
            RateLimitPolicy policy,
            boolean failOpenOnRedisError
    ) {
        this.redisTemplate = redisTemplate;
        this.fixedWindowScript = fixedWindowScript;
        this.policy = policy;
        this.failOpenOnRedisError = failOpenOnRedisError;
    }

    @Override
    public RateLimitResult tryAcquire(String key, Instant now) {
        List<String> keys = Collections.singletonList(KEY_PREFIX + key);
        String maxRequests = Integer.toString(policy.maxRequests());
        String windowMillis = Long.toString(policy.window().toMillis());
        String nowMillis = Long.toString(now.toEpochMilli());

        try {
            Object result = redisTemplate.execute(fixedWindowScript, keys, maxRequests, windowMillis, nowMillis);

            if (!(result instanceof List<?> listResult) || listResult.size() < 3) {
                log.error("Unexpected Lua script result for client {}: {}", key, result);
                return handleRedisFailure();
            }

            long allowedFlag = toLong(listResult.get(0));
            long remaining = toLong(listResult.get(1));
            Instant windowEnd = Instant.ofEpochMilli(toLong(listResult.get(2)));

            if (allowedFlag == 1L) {
                return RateLimitResult.allow(remaining, windowEnd);
            }
            return RateLimitResult.rejectRateLimited(windowEnd);
        } catch (RedisConnectionFailureException ex) {
            log.warn("Redis connection failure while evaluating rate limit for client {}. failOpenOnRedisError={}",
                    key, failOpenOnRedisError, ex);
            return handleRedisFailure();
        } catch (DataAccessException ex) {
            // Catches script execution and other Redis-related errors.
            log.error("Redis data access error while evaluating rate limit for client {}. failOpenOnRedisError={}",
                    key, failOpenOnRedisError, ex);
            return handleRedisFailure();
        } catch (RuntimeException ex) {
            // Last resort; do not let rate limiting crash the request thread.
            log.error("Unexpected error while evaluating rate limit for client {}. failOpenOnRedisError={}",
                    key, failOpenOnRedisError, ex);
            return handleRedisFailure();
        }
    }

    private RateLimitResult handleRedisFailure() {
        if (failOpenOnRedisError) {
            // Fail-open: the protected service stays available while enforcement is lost.
            return RateLimitResult.allowDegraded();
        }
        return RateLimitResult.rejectStoreFailure();
    }

    private long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(String.valueOf(value));
    }
}
