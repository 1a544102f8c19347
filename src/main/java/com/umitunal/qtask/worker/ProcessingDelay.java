package com.umitunal.qtask.worker;

import java.time.Duration;
import java.util.Random;

/**
 * Pause applied by a worker before it settles a job, standing in for real
 * processing time.
 */
@FunctionalInterface
public interface ProcessingDelay {

    /**
     * Block the calling worker for the configured time.
     */
    void pause() throws InterruptedException;

    static ProcessingDelay none() {
        return () -> { };
    }

    static ProcessingDelay fixed(Duration duration) {
        return new UniformProcessingDelay(duration, duration, new Random());
    }

    /**
     * Uniformly distributed delay in {@code [min, max]}, both inclusive.
     */
    static ProcessingDelay uniform(Duration min, Duration max) {
        return new UniformProcessingDelay(min, max, new Random());
    }
}
