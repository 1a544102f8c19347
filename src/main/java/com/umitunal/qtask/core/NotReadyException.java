package com.umitunal.qtask.core;

/**
 * The result of a job was requested while the job is still pending.
 * Poll again later.
 */
public class NotReadyException extends IllegalStateException {
    private final String jobId;

    public NotReadyException(String jobId) {
        super("Job " + jobId + " is not yet complete");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
