package com.umitunal.qtask.core;

/**
 * Keyed store of job outcomes.
 * <p>
 * Each job id is settled at most once: the first terminal write wins and later
 * writes for the same id are refused. Reads never block on writers.
 */
public interface ResultBackend extends AutoCloseable {

    /**
     * Record a freshly submitted job as pending. Does nothing if the id is
     * already known, so a worker that settled first is never overwritten.
     *
     * @param jobId the job identifier
     * @param taskName the task the job was submitted to
     */
    void markPending(String jobId, String taskName) throws ResultBackendUnavailableException;

    /**
     * Write the terminal outcome of a job.
     *
     * @param jobId the job identifier
     * @param outcome the outcome to store
     * @param workerId the worker that produced the outcome
     * @return true if this call settled the job, false if it was already settled
     */
    boolean settle(String jobId, TaskOutcome outcome, String workerId) throws ResultBackendUnavailableException;

    /**
     * Read the current status of a job. Unknown ids are reported as pending.
     */
    JobStatus getStatus(String jobId) throws ResultBackendUnavailableException;

    @Override
    void close();
}
