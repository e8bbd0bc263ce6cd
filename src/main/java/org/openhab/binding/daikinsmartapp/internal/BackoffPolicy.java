package org.openhab.binding.daikinsmartapp.internal;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.eclipse.jdt.annotation.NonNullByDefault;

/**
 * Counts consecutive poll failures per unit and derives the delay before the
 * next poll. Each unit backs off on its own; one unreachable unit never slows
 * down the others.
 */
@NonNullByDefault
public final class BackoffPolicy {

    private static final int MAX_EXPONENT = 16;

    private final Duration baseInterval;
    private final Duration maxDelay;
    private final ConcurrentMap<String, Integer> failures = new ConcurrentHashMap<>();

    public BackoffPolicy(Duration baseInterval, Duration maxDelay) {
        this.baseInterval = Objects.requireNonNull(baseInterval, "baseInterval");
        this.maxDelay = maxDelay.compareTo(baseInterval) < 0 ? baseInterval : maxDelay;
    }

    /**
     * @return the updated number of consecutive failures
     */
    public int recordFailure(String deviceId) {
        return failures.merge(deviceId, 1, Integer::sum);
    }

    public void reset(String deviceId) {
        failures.remove(deviceId);
    }

    public int failuresFor(String deviceId) {
        return failures.getOrDefault(deviceId, 0);
    }

    /**
     * Base interval while healthy, then base * 2^failures capped at the
     * maximum delay.
     */
    public Duration nextDelay(String deviceId) {
        int count = failuresFor(deviceId);
        if (count == 0) {
            return baseInterval;
        }
        Duration delay = baseInterval.multipliedBy(1L << Math.min(count, MAX_EXPONENT));
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}
