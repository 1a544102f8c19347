package com.umitunal.qtask.client;

import com.umitunal.qtask.core.JobState;
import com.umitunal.qtask.core.JobStatus;
import com.umitunal.qtask.core.NotReadyException;
import com.umitunal.qtask.core.ResultBackend;
import com.umitunal.qtask.core.ResultBackendUnavailableException;
import com.umitunal.qtask.core.TaskOutcome;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Client-side reference to a submitted job.
 * <p>
 * Holds nothing but the job id, so a handle rebuilt from a stored id behaves
 * exactly like the one returned by submit. Every query reads the result
 * backend and has no side effects.
 */
public final class JobHandle {
    private final String id;
    private final ResultBackend backend;

    JobHandle(String id, ResultBackend backend) {
        this.id = id;
        this.backend = backend;
    }

    public String getId() {
        return id;
    }

    public JobStatus status() throws ResultBackendUnavailableException {
        return backend.getStatus(id);
    }

    /**
     * True once the job reached a terminal state, successful or not.
     */
    public boolean isReady() throws ResultBackendUnavailableException {
        return status().isTerminal();
    }

    public boolean isSuccessful() throws ResultBackendUnavailableException {
        return status().getState() == JobState.SUCCESS;
    }

    /**
     * The outcome of a finished job.
     *
     * @throws NotReadyException if the job is still pending
     */
    public TaskOutcome result() throws ResultBackendUnavailableException {
        JobStatus status = status();
        if (!status.isTerminal()) {
            throw new NotReadyException(id);
        }
        return status.getOutcome();
    }

    /**
     * Poll until the job finishes.
     *
     * @param timeout how long to keep polling
     * @param pollInterval wait between polls
     * @throws TimeoutException if the job is still pending when the timeout runs out
     */
    public TaskOutcome await(Duration timeout, Duration pollInterval)
            throws ResultBackendUnavailableException, InterruptedException, TimeoutException {
        long deadline = System.nanoTime() + timeout.toNanos();

        while (true) {
            JobStatus status = status();
            if (status.isTerminal()) {
                return status.getOutcome();
            }
            if (System.nanoTime() - deadline >= 0) {
                throw new TimeoutException("Job " + id + " still pending after " + timeout);
            }
            Thread.sleep(pollInterval.toMillis());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobHandle)) return false;
        return id.equals(((JobHandle) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "JobHandle{" + id + "}";
    }
}
