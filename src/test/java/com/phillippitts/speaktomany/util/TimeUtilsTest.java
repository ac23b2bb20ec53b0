package com.phillippitts.speaktomany.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldConvertNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(1_000_000L)).isEqualTo(1L);
        assertThat(TimeUtils.nanosToMillis(100_000_000L)).isEqualTo(100L);
    }

    @Test
    void shouldTruncateNanosToMillis() {
        // 2.999 milliseconds truncates to 2 milliseconds
        assertThat(TimeUtils.nanosToMillis(2_999_999L)).isEqualTo(2L);
    }

    @Test
    void shouldCalculateElapsedMillis() throws InterruptedException {
        long startNanos = System.nanoTime();
        Thread.sleep(10);

        assertThat(TimeUtils.elapsedMillis(startNanos)).isGreaterThanOrEqualTo(10L);
    }

    @Test
    void millisBetweenIsNeverNegative() {
        assertThat(TimeUtils.millisBetween(5_000_000L, 1_000_000L)).isZero();
        assertThat(TimeUtils.millisBetween(1_000_000L, 5_000_000L)).isEqualTo(4L);
    }
}
