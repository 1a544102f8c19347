package com.umitunal.qtask.worker;

import java.time.Duration;
import java.util.Random;

/**
 * Delay drawn uniformly, in milliseconds, from a closed range.
 */
public class UniformProcessingDelay implements ProcessingDelay {
    private final long minMillis;
    private final long maxMillis;
    private final Random random;

    public UniformProcessingDelay(Duration min, Duration max, Random random) {
        if (min.isNegative() || max.compareTo(min) < 0) {
            throw new IllegalArgumentException("Invalid delay range: " + min + " to " + max);
        }
        this.minMillis = min.toMillis();
        this.maxMillis = max.toMillis();
        this.random = random;
    }

    public long nextDelayMillis() {
        long span = maxMillis - minMillis + 1;
        return minMillis + Math.floorMod(random.nextLong(), span);
    }

    @Override
    public void pause() throws InterruptedException {
        Thread.sleep(nextDelayMillis());
    }

    public long getMinMillis() { return minMillis; }
    public long getMaxMillis() { return maxMillis; }

    @Override
    public String toString() {
        return "UniformProcessingDelay[" + minMillis + "ms.." + maxMillis + "ms]";
    }
}
