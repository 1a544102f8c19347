package com.umitunal.qtask.worker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class UniformProcessingDelayTest {

    @Test
    @DisplayName("Delays should stay within the inclusive range and reach both ends")
    void testRange() {
        // Given
        UniformProcessingDelay delay =
                new UniformProcessingDelay(Duration.ofMillis(5), Duration.ofMillis(10), new Random(42));

        // When
        Set<Long> seen = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            seen.add(delay.nextDelayMillis());
        }

        // Then
        assertThat(seen).containsExactlyInAnyOrder(5L, 6L, 7L, 8L, 9L, 10L);
    }

    @Test
    @DisplayName("Equal bounds should give a fixed delay")
    void testDegenerateRange() {
        UniformProcessingDelay delay =
                new UniformProcessingDelay(Duration.ofMillis(3), Duration.ofMillis(3), new Random());

        assertThat(delay.nextDelayMillis()).isEqualTo(3L);
        assertThat(delay.nextDelayMillis()).isEqualTo(3L);
    }

    @Test
    @DisplayName("Default factory should use the given bounds")
    void testFactory() {
        ProcessingDelay delay = ProcessingDelay.uniform(Duration.ofSeconds(5), Duration.ofSeconds(10));

        assertThat(delay).isInstanceOf(UniformProcessingDelay.class);
        UniformProcessingDelay uniform = (UniformProcessingDelay) delay;
        assertThat(uniform.getMinMillis()).isEqualTo(5000);
        assertThat(uniform.getMaxMillis()).isEqualTo(10000);
    }

    @Test
    @DisplayName("Should reject inverted or negative ranges")
    void testInvalidRange() {
        assertThatThrownBy(() -> new UniformProcessingDelay(Duration.ofMillis(10), Duration.ofMillis(5), new Random()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new UniformProcessingDelay(Duration.ofMillis(-1), Duration.ofMillis(5), new Random()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Pause should sleep at least the drawn delay")
    void testPause() throws InterruptedException {
        UniformProcessingDelay delay =
                new UniformProcessingDelay(Duration.ofMillis(20), Duration.ofMillis(20), new Random());

        long start = System.nanoTime();
        delay.pause();

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(15));
    }
}
