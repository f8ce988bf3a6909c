package com.example.requestgate.filter;

import com.example.requestgate.config.RateLimiterProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides which request paths are rate limited. Plain prefix match: {@code /api} also covers {@code /apis}.
 */
@Component
public class PathClassifier {

    private final List<String> limitedPrefixes;

    @Autowired
    public PathClassifier(RateLimiterProperties properties) {
        this(properties.getLimitedPathPrefixes());
    }

    public PathClassifier(List<String> limitedPrefixes) {
        this.limitedPrefixes = List.copyOf(limitedPrefixes);
    }

    public boolean isRateLimited(String path) {
        if (path == null) {
            return false;
        }
        for (String prefix : limitedPrefixes) {
            if (path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
