package com.livepipe.realtime.scheduling;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffTest {

    @Test
    void delayFor_doublesFromBaseUntilCap() {
        Backoff backoff = Backoff.exponential(Duration.ofSeconds(3), Duration.ofSeconds(30));

        assertThat(backoff.delayFor(1)).isEqualTo(Duration.ofSeconds(3));
        assertThat(backoff.delayFor(2)).isEqualTo(Duration.ofSeconds(6));
        assertThat(backoff.delayFor(3)).isEqualTo(Duration.ofSeconds(12));
        assertThat(backoff.delayFor(4)).isEqualTo(Duration.ofSeconds(24));
        assertThat(backoff.delayFor(5)).isEqualTo(Duration.ofSeconds(30));
        assertThat(backoff.delayFor(10)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void delayFor_isNonDecreasingAcrossAttempts() {
        Backoff backoff = Backoff.exponential(Duration.ofMillis(250), Duration.ofSeconds(45));

        List<Duration> delays = new ArrayList<>();
        for (int attempt = 1; attempt <= 40; attempt++) {
            delays.add(backoff.delayFor(attempt));
        }

        assertThat(delays).isSorted();
        assertThat(delays.get(delays.size() - 1)).isEqualTo(Duration.ofSeconds(45));
    }

    @Test
    void delayFor_hugeAttemptDoesNotOverflow() {
        Backoff backoff = Backoff.exponential(Duration.ofDays(1000), Duration.ofDays(100_000));

        assertThat(backoff.delayFor(Integer.MAX_VALUE)).isEqualTo(Duration.ofDays(100_000));
    }

    @Test
    void delayFor_attemptBelowOneUsesBase() {
        Backoff backoff = Backoff.exponential(Duration.ofSeconds(2), Duration.ofSeconds(8));

        assertThat(backoff.delayFor(0)).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void constructor_rejectsCapBelowBase() {
        assertThatThrownBy(() -> Backoff.exponential(Duration.ofSeconds(5), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
