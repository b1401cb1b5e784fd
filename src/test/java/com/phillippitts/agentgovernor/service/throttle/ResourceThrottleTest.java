package com.phillippitts.agentgovernor.service.throttle;

import com.phillippitts.agentgovernor.domain.ThrottleStatus;
import com.phillippitts.agentgovernor.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ResourceThrottleTest {

    private MutableClock clock;
    private ResourceThrottle throttle;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        throttle = new ResourceThrottle(100.0, 10.0, 0.1, 0.1, clock);
    }

    @Test
    void startsFull() {
        ThrottleStatus status = throttle.getStatus();

        assertThat(status.available()).isEqualTo(100.0);
        assertThat(status.utilizationPercent()).isEqualTo(100.0);
        assertThat(status.penaltyMultiplier()).isEqualTo(1.0);
    }

    @Test
    void failedConsumeLeavesBucketUnchanged() {
        assertThat(throttle.consumeTokens(70.0)).isTrue();
        assertThat(throttle.consumeTokens(40.0)).isFalse();

        assertThat(throttle.getStatus().available()).isEqualTo(30.0);
    }

    @Test
    void refillNeverExceedsCapacity() {
        throttle.consumeTokens(50.0);
        clock.advance(Duration.ofHours(1));

        assertThat(throttle.getStatus().available()).isEqualTo(100.0);
    }

    @Test
    void penaltySlowsRefill() {
        throttle.consumeTokens(100.0);
        throttle.applyPenalty(3);
        clock.advance(Duration.ofSeconds(2));

        // 2 s x 10 tokens/s x 0.8
        assertThat(throttle.getStatus().available()).isCloseTo(16.0, within(1e-9));
        assertThat(throttle.getPenaltyMultiplier()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void multiplierIsMonotoneAndFloored() {
        double previous = Double.MAX_VALUE;
        for (int severity = 1; severity <= 20; severity++) {
            double m = throttle.multiplierFor(severity);
            assertThat(m).isLessThanOrEqualTo(previous).isGreaterThanOrEqualTo(0.1);
            previous = m;
        }
        assertThat(throttle.multiplierFor(1)).isEqualTo(1.0);
        assertThat(throttle.multiplierFor(20)).isEqualTo(0.1);
    }

    @Test
    void resetRestoresFullBucketAndMultiplier() {
        throttle.applyPenalty(6);
        throttle.consumeTokens(90.0);

        throttle.reset();

        assertThat(throttle.getStatus().available()).isEqualTo(100.0);
        assertThat(throttle.getPenaltyMultiplier()).isEqualTo(1.0);
    }

    @Test
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> throttle.consumeTokens(-1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> throttle.applyPenalty(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResourceThrottle(0.0, 1.0, 0.1, 0.1, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentConsumersNeverOverdraw() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    int granted = 0;
                    for (int j = 0; j < 50; j++) {
                        if (throttle.consumeTokens(1.0)) {
                            granted++;
                        }
                    }
                    return granted;
                }));
            }
            start.countDown();
            int total = 0;
            for (Future<Integer> f : results) {
                total += f.get(10, TimeUnit.SECONDS);
            }

            // clock is frozen, so nothing refills
            assertThat(total).isEqualTo(100);
            assertThat(throttle.getStatus().available()).isZero();
        } finally {
            pool.shutdownNow();
        }
    }
}
