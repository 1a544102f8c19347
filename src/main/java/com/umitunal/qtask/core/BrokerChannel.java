package com.umitunal.qtask.core;

/**
 * Durable, at-least-once channel between submitters and workers.
 * <p>
 * A leased job whose lease runs out becomes deliverable again, so a worker may
 * see the same job more than once. No ordering between jobs is promised.
 *
 * @param <T> the type of message carried by each job
 */
public interface BrokerChannel<T> extends AutoCloseable {

    /**
     * Record a job for delivery. Returns once the entry is written; never waits
     * for a worker.
     *
     * @param jobId unique identifier for the job
     * @param message the message to deliver
     * @param scheduledTime earliest delivery time (millis since epoch)
     * @param maxDeliveries maximum number of deliveries before the job is dead
     */
    void enqueue(String jobId, T message, long scheduledTime, int maxDeliveries) throws BrokerUnavailableException;

    /**
     * Lease the next deliverable job.
     *
     * @param workerId unique identifier for the worker
     * @param leaseDuration how long the worker can hold the job (milliseconds)
     * @return the leased job, or null if none is deliverable
     */
    Job<T> acquire(String workerId, long leaseDuration) throws BrokerUnavailableException;

    /**
     * Remove a job once its outcome has been settled.
     */
    void acknowledge(Job<T> job) throws BrokerUnavailableException;

    /**
     * Hand a job back for redelivery, or mark it dead when no deliveries remain.
     *
     * @param job the job that could not be completed
     * @param reason why the job is handed back
     */
    void reject(Job<T> job, String reason) throws BrokerUnavailableException;

    /**
     * Hand a job back for redelivery without counting the delivery, for when
     * the worker could not start it through no fault of the job.
     *
     * @param job the job that was not started
     * @param reason why the job is handed back
     */
    void release(Job<T> job, String reason) throws BrokerUnavailableException;

    /**
     * Mark jobs with expired leases as abandoned.
     *
     * @return number of jobs marked
     */
    long recoverAbandoned() throws BrokerUnavailableException;

    /**
     * Get counts per delivery state.
     */
    BrokerMetrics getMetrics() throws BrokerUnavailableException;

    @Override
    void close();
}
