package com.issuepilot.orchestrator.pool;

import com.issuepilot.orchestrator.config.IssuePilotProperties.PoolConfig;
import com.issuepilot.orchestrator.model.TargetFilter;

import java.time.Duration;

/**
 * Parameters of one drain.
 *
 * @param maxIssues   lifecycles to start before stopping; 0 means no limit
 * @param continuous  keep polling every {@code checkInterval} instead of
 *                    stopping once nothing is eligible
 */
public record PoolOptions(int maxConcurrency,
                          TargetFilter target,
                          int maxIssues,
                          Duration checkInterval,
                          boolean continuous) {

    public PoolOptions {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got " + maxConcurrency);
        }
        if (maxIssues < 0) {
            throw new IllegalArgumentException("max-issues must not be negative, got " + maxIssues);
        }
        if (target == null) {
            throw new IllegalArgumentException("target is required");
        }
        if (checkInterval == null || checkInterval.isNegative() || checkInterval.isZero()) {
            throw new IllegalArgumentException("check-interval must be positive, got " + checkInterval);
        }
    }

    public static PoolOptions from(PoolConfig config, boolean continuous) {
        return new PoolOptions(config.getConcurrency(), config.getTarget(), config.getMaxIssues(),
                config.getCheckInterval(), continuous);
    }

    public boolean limited() {
        return maxIssues > 0;
    }
}
