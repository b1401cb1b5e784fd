package com.phillippitts.agentgovernor.domain;

/**
 * Point-in-time view of a token bucket.
 *
 * @param available          tokens available right now
 * @param capacity           bucket capacity
 * @param refillRate         nominal refill in tokens per second
 * @param penaltyMultiplier  scaling applied to the refill rate
 */
public record ThrottleStatus(double available, double capacity, double refillRate, double penaltyMultiplier) {

    public double utilizationPercent() {
        return capacity == 0.0 ? 0.0 : (available / capacity) * 100.0;
    }
}
