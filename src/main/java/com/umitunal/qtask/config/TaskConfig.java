package com.umitunal.qtask.config;

import com.umitunal.qtask.serialization.ResultSerializer;
import com.umitunal.qtask.worker.ProcessingDelay;
import com.umitunal.qtask.worker.UniformProcessingDelay;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Everything the broker channel, the result backend and the workers need at
 * construction time. Nothing in the core reads the process environment; use
 * {@link #fromEnvironment(Map)} at the edge of the application instead.
 */
public class TaskConfig {

    /** Data directory of the broker channel. Required. */
    public static final String BROKER_DIR = "QTASK_BROKER_DIR";

    /** Data directory of the result backend. Required. */
    public static final String RESULT_BACKEND_DIR = "QTASK_RESULT_BACKEND_DIR";

    /** Result record format, {@code json} or {@code kryo}. */
    public static final String RESULT_SERIALIZER = "QTASK_RESULT_SERIALIZER";

    /** Lower bound of the simulated processing delay, in milliseconds. */
    public static final String DELAY_MIN_MS = "QTASK_DELAY_MIN_MS";

    /** Upper bound of the simulated processing delay, in milliseconds. */
    public static final String DELAY_MAX_MS = "QTASK_DELAY_MAX_MS";

    /** Number of worker threads started by the application. */
    public static final String WORKERS = "QTASK_WORKERS";

    static final Duration DEFAULT_DELAY_MIN = Duration.ofSeconds(5);
    static final Duration DEFAULT_DELAY_MAX = Duration.ofSeconds(10);

    private final StorageConfig broker;
    private final StorageConfig resultBackend;
    private final ResultSerializer resultSerializer;
    private final long leaseDuration;
    private final long pollInterval;
    private final int maxDeliveries;
    private final ProcessingDelay processingDelay;
    private final int workerCount;

    private TaskConfig(Builder builder) {
        this.broker = builder.broker;
        this.resultBackend = builder.resultBackend;
        this.resultSerializer = builder.resultSerializer;
        this.leaseDuration = builder.leaseDuration;
        this.pollInterval = builder.pollInterval;
        this.maxDeliveries = builder.maxDeliveries;
        this.processingDelay = builder.processingDelay;
        this.workerCount = builder.workerCount;
    }

    public StorageConfig getBroker() { return broker; }
    public StorageConfig getResultBackend() { return resultBackend; }
    public ResultSerializer getResultSerializer() { return resultSerializer; }
    public long getLeaseDuration() { return leaseDuration; }
    public long getPollInterval() { return pollInterval; }
    public int getMaxDeliveries() { return maxDeliveries; }
    public ProcessingDelay getProcessingDelay() { return processingDelay; }
    public int getWorkerCount() { return workerCount; }

    public static Builder builder(StorageConfig broker, StorageConfig resultBackend) {
        return new Builder(broker, resultBackend);
    }

    /**
     * Build a configuration from environment-style settings.
     *
     * @param env settings, usually {@code System.getenv()} passed in by {@code main}
     * @throws IllegalArgumentException if a required setting is missing or a value is malformed
     */
    public static TaskConfig fromEnvironment(Map<String, String> env) {
        StorageConfig broker = StorageConfig.newBuilder(required(env, BROKER_DIR)).build();
        StorageConfig backend = StorageConfig.newBuilder(required(env, RESULT_BACKEND_DIR)).build();

        Builder builder = builder(broker, backend);

        String serializer = env.get(RESULT_SERIALIZER);
        if (serializer != null && !serializer.isBlank()) {
            try {
                builder.withResultSerializer(ResultSerializer.valueOf(serializer.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown " + RESULT_SERIALIZER + ": " + serializer, e);
            }
        }

        Duration min = millis(env, DELAY_MIN_MS, DEFAULT_DELAY_MIN);
        Duration max = millis(env, DELAY_MAX_MS, DEFAULT_DELAY_MAX);
        builder.withProcessingDelay(ProcessingDelay.uniform(min, max));

        String workers = env.get(WORKERS);
        if (workers != null && !workers.isBlank()) {
            try {
                builder.withWorkerCount(Integer.parseInt(workers.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(WORKERS + " must be a number, was '" + workers + "'", e);
            }
        }

        return builder.build();
    }

    private static String required(Map<String, String> env, String key) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required setting " + key);
        }
        return value.trim();
    }

    private static Duration millis(Map<String, String> env, String key, Duration fallback) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Duration.ofMillis(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number of milliseconds, was '" + value + "'", e);
        }
    }

    public static class Builder {
        private final StorageConfig broker;
        private final StorageConfig resultBackend;
        private ResultSerializer resultSerializer = ResultSerializer.JSON;
        private long leaseDuration = 60000;  // 1 minute
        private long pollInterval = 1000;    // 1 second
        private int maxDeliveries = 3;
        private ProcessingDelay processingDelay = ProcessingDelay.uniform(DEFAULT_DELAY_MIN, DEFAULT_DELAY_MAX);
        private int workerCount = 2;

        private Builder(StorageConfig broker, StorageConfig resultBackend) {
            if (broker.getDataDirectory().equals(resultBackend.getDataDirectory())) {
                throw new IllegalArgumentException("Broker and result backend need separate data directories");
            }
            this.broker = broker;
            this.resultBackend = resultBackend;
        }

        /**
         * Default: JSON
         */
        public Builder withResultSerializer(ResultSerializer serializer) {
            this.resultSerializer = serializer;
            return this;
        }

        /**
         * How long a worker holds a job before it may be redelivered.
         * Must exceed the longest processing delay.
         * Default: 60 seconds
         */
        public Builder withLeaseDuration(long millis) {
            this.leaseDuration = millis;
            return this;
        }

        /**
         * Idle wait between broker polls when no job is deliverable.
         * Default: 1 second
         */
        public Builder withPollInterval(long millis) {
            this.pollInterval = millis;
            return this;
        }

        /**
         * Deliveries before a job is given up on by the broker.
         * Default: 3
         */
        public Builder withMaxDeliveries(int count) {
            if (count < 1) {
                throw new IllegalArgumentException("maxDeliveries must be at least 1");
            }
            this.maxDeliveries = count;
            return this;
        }

        /**
         * Default: uniform between 5 and 10 seconds
         */
        public Builder withProcessingDelay(ProcessingDelay delay) {
            this.processingDelay = delay;
            return this;
        }

        /**
         * Default: 2
         */
        public Builder withWorkerCount(int count) {
            if (count < 1) {
                throw new IllegalArgumentException("workerCount must be at least 1");
            }
            this.workerCount = count;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a job could outlive its lease
         *         while waiting out the processing delay
         */
        public TaskConfig build() {
            if (leaseDuration < 1) {
                throw new IllegalArgumentException("leaseDuration must be positive");
            }
            if (processingDelay instanceof UniformProcessingDelay) {
                long maxDelay = ((UniformProcessingDelay) processingDelay).getMaxMillis();
                if (leaseDuration <= maxDelay) {
                    throw new IllegalArgumentException("leaseDuration (" + leaseDuration
                            + " ms) must exceed the longest processing delay (" + maxDelay + " ms)");
                }
            }
            return new TaskConfig(this);
        }
    }
}
