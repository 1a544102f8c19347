package com.umitunal.qtask.core;

/**
 * A delivery held by the broker channel: one submitted unit of work together
 * with its delivery bookkeeping.
 *
 * @param <T> the type of the message carried by the job
 */
public interface Job<T> {

    /**
     * Gets the job identifier. Shared with the result backend.
     */
    String getId();

    /**
     * Gets the message delivered to the worker.
     */
    T getPayload();

    /**
     * Gets the earliest delivery time in milliseconds since epoch.
     */
    long getScheduledTime();

    /**
     * Gets the current delivery state inside the broker.
     */
    DeliveryState getState();

    /**
     * Gets the number of times this job has been delivered so far.
     */
    int getCurrentAttempt();

    /**
     * Gets the maximum number of deliveries allowed.
     */
    int getMaxAttempts();

    /**
     * Checks if the scheduled time has passed.
     */
    boolean isReady();

    /**
     * Checks if another delivery is allowed.
     */
    boolean canRetry();

    /**
     * Broker-side delivery states. These are not visible to clients, which only
     * ever see {@link JobState}.
     */
    enum DeliveryState {
        QUEUED,      // Waiting for a worker
        LEASED,      // Delivered, lease running
        FAILED,      // Out of deliveries
        ABANDONED    // Lease expired without acknowledgement
    }
}
