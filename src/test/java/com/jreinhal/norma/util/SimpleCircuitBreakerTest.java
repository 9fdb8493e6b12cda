package com.jreinhal.norma.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SimpleCircuitBreakerTest {

    private Clock clock;
    private SimpleCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = mock(Clock.class);
        when(clock.millis()).thenReturn(1_000L);
        breaker = new SimpleCircuitBreaker("openai", 2, Duration.ofSeconds(30), 1, clock);
    }

    @Test
    void opensAfterThresholdFailures() {
        breaker.recordFailure(new RuntimeException("503"));
        assertThat(breaker.getState()).isEqualTo(SimpleCircuitBreaker.State.CLOSED);

        breaker.recordFailure(new RuntimeException("503"));

        assertThat(breaker.getState()).isEqualTo(SimpleCircuitBreaker.State.OPEN);
        assertThat(breaker.allowRequest()).isFalse();
        assertThat(breaker.getLastFailure()).contains("503");
    }

    @Test
    void halfOpensAfterOpenDurationAndClosesOnSuccess() {
        breaker.forceOpen(new IllegalStateException("invalid api key"));
        when(clock.millis()).thenReturn(31_001L);

        assertThat(breaker.allowRequest()).isTrue();
        assertThat(breaker.getState()).isEqualTo(SimpleCircuitBreaker.State.HALF_OPEN);
        assertThat(breaker.allowRequest()).isFalse();

        breaker.recordSuccess();

        assertThat(breaker.getState()).isEqualTo(SimpleCircuitBreaker.State.CLOSED);
        assertThat(breaker.allowRequest()).isTrue();
    }

    @Test
    void failureWhileHalfOpenReopens() {
        breaker.forceOpen(null);
        when(clock.millis()).thenReturn(31_001L);
        breaker.allowRequest();

        breaker.recordFailure(new RuntimeException("timeout"));

        assertThat(breaker.getState()).isEqualTo(SimpleCircuitBreaker.State.OPEN);
    }
}
