package com.trendearly.pipeline.ratelimit;

import com.trendearly.pipeline.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateGateTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T02:00:00Z"));
    private final List<Duration> sleeps = new ArrayList<>();

    // 실제로 자지 않고 시계만 진행
    private final Sleeper sleeper = duration -> {
        sleeps.add(duration);
        clock.advance(duration);
    };

    @Test
    void firstCallDoesNotWait() throws Exception {
        RateGate gate = new RateGate(Duration.ofSeconds(1), clock, sleeper);

        gate.acquire();

        assertThat(sleeps).isEmpty();
    }

    @Test
    void backToBackCallsWaitForTheRemainingInterval() throws Exception {
        RateGate gate = new RateGate(Duration.ofSeconds(1), clock, sleeper);

        gate.acquire();
        clock.advance(Duration.ofMillis(300));
        gate.acquire();

        assertThat(sleeps).containsExactly(Duration.ofMillis(700));
    }

    @Test
    void noWaitWhenIntervalAlreadyPassed() throws Exception {
        RateGate gate = new RateGate(Duration.ofSeconds(1), clock, sleeper);

        gate.acquire();
        clock.advance(Duration.ofSeconds(5));
        gate.acquire();

        assertThat(sleeps).isEmpty();
    }

    @Test
    void intervalHoldsAcrossEveryCaller() throws Exception {
        RateGate gate = new RateGate(Duration.ofSeconds(1), clock, sleeper);
        List<Instant> callTimes = new ArrayList<>();

        for (int i = 0; i < 5; i++) {
            gate.acquire();
            callTimes.add(clock.instant());
        }

        for (int i = 1; i < callTimes.size(); i++) {
            assertThat(Duration.between(callTimes.get(i - 1), callTimes.get(i)))
                    .isGreaterThanOrEqualTo(Duration.ofSeconds(1));
        }
    }

    @Test
    void interruptPropagates() throws Exception {
        RateGate gate = new RateGate(Duration.ofSeconds(1), clock, duration -> {
            throw new InterruptedException("stop");
        });

        gate.acquire();

        assertThatThrownBy(gate::acquire).isInstanceOf(InterruptedException.class);
    }

    @Test
    void rejectsNegativeInterval() {
        assertThatThrownBy(() -> new RateGate(Duration.ofSeconds(-1), clock, sleeper))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
