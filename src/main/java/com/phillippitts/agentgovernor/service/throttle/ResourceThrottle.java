package com.phillippitts.agentgovernor.service.throttle;

import com.phillippitts.agentgovernor.config.properties.GovernanceProperties;
import com.phillippitts.agentgovernor.domain.ThrottleStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket gating an agent's task intake.
 *
 * <p>Tokens refill continuously at {@code refillRate × penaltyMultiplier} per second and never
 * exceed capacity. A penalty lowers the multiplier; {@link #reset()} restores a full bucket.
 *
 * <p>Every operation refills and then reads or mutates under one lock, so concurrent callers
 * can never consume more tokens than were available.
 */
public class ResourceThrottle {

    private final double capacity;
    private final double refillRate;
    private final double multiplierStep;
    private final double multiplierFloor;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private double tokens;
    private double penaltyMultiplier = 1.0;
    private Instant lastRefill;

    public ResourceThrottle(double capacity, double refillRate, double multiplierStep, double multiplierFloor, Clock clock) {
        if (capacity <= 0.0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        if (refillRate < 0.0) {
            throw new IllegalArgumentException("refillRate must not be negative, got: " + refillRate);
        }
        this.capacity = capacity;
        this.refillRate = refillRate;
        this.multiplierStep = multiplierStep;
        this.multiplierFloor = multiplierFloor;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.tokens = capacity;
        this.lastRefill = clock.instant();
    }

    /** Creates a full throttle from {@code governance.throttle.*}. */
    public static ResourceThrottle from(GovernanceProperties.Throttle settings, Clock clock) {
        return new ResourceThrottle(settings.getCapacity(), settings.getRefillRate(),
                settings.getMultiplierStep(), settings.getMultiplierFloor(), clock);
    }

    /**
     * Takes {@code required} tokens if available.
     *
     * @return true when the tokens were taken; false leaves the bucket unchanged
     */
    public boolean consumeTokens(double required) {
        if (required < 0.0) {
            throw new IllegalArgumentException("required must not be negative, got: " + required);
        }
        lock.lock();
        try {
            refill();
            if (tokens >= required) {
                tokens -= required;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Slows the refill: {@code multiplier = max(floor, 1 - (severity - 1) × step)}.
     * Tokens accrued so far are credited at the previous rate first.
     */
    public void applyPenalty(int severity) {
        if (severity < 1) {
            throw new IllegalArgumentException("severity must be at least 1, got: " + severity);
        }
        lock.lock();
        try {
            refill();
            penaltyMultiplier = multiplierFor(severity);
        } finally {
            lock.unlock();
        }
    }

    public ThrottleStatus getStatus() {
        lock.lock();
        try {
            refill();
            return new ThrottleStatus(tokens, capacity, refillRate, penaltyMultiplier);
        } finally {
            lock.unlock();
        }
    }

    public double getPenaltyMultiplier() {
        lock.lock();
        try {
            return penaltyMultiplier;
        } finally {
            lock.unlock();
        }
    }

    /** Refills to capacity and lifts the penalty. */
    public void reset() {
        lock.lock();
        try {
            tokens = capacity;
            penaltyMultiplier = 1.0;
            lastRefill = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    double multiplierFor(int severity) {
        return Math.max(multiplierFloor, 1.0 - (severity - 1) * multiplierStep);
    }

    private void refill() {
        Instant now = clock.instant();
        if (now.isAfter(lastRefill)) {
            double elapsedSeconds = Duration.between(lastRefill, now).toNanos() / 1_000_000_000.0;
            tokens = Math.min(capacity, tokens + elapsedSeconds * refillRate * penaltyMultiplier);
            lastRefill = now;
        }
    }
}
