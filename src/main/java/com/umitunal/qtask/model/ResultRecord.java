package com.umitunal.qtask.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.umitunal.qtask.core.JobState;
import com.umitunal.qtask.core.JobStatus;
import com.umitunal.qtask.core.TaskOutcome;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Row of the result backend, keyed by job id.
 * <p>
 * Written once as {@code PENDING} by the submitter and once more, terminally,
 * by the worker that settles the job. Must stay readable by both the JSON and
 * the Kryo result serializer.
 */
public class ResultRecord {
    private String jobId;
    private String taskName;
    private JobState state;
    private LinkedHashMap<String, Long> statistics;
    private String message;
    private String workerId;
    private long submittedAt;
    private long completedAt;

    // Kryo
    private ResultRecord() {
    }

    @JsonCreator
    public ResultRecord(@JsonProperty("jobId") String jobId,
                        @JsonProperty("taskName") String taskName,
                        @JsonProperty("state") JobState state,
                        @JsonProperty("statistics") Map<String, Long> statistics,
                        @JsonProperty("message") String message,
                        @JsonProperty("workerId") String workerId,
                        @JsonProperty("submittedAt") long submittedAt,
                        @JsonProperty("completedAt") long completedAt) {
        this.jobId = jobId;
        this.taskName = taskName;
        this.state = state;
        this.statistics = statistics == null ? null : new LinkedHashMap<>(statistics);
        this.message = message;
        this.workerId = workerId;
        this.submittedAt = submittedAt;
        this.completedAt = completedAt;
    }

    public static ResultRecord pending(String jobId, String taskName, long submittedAt) {
        return new ResultRecord(jobId, taskName, JobState.PENDING, null, null, null, submittedAt, 0);
    }

    /**
     * Terminal copy of this record. The submit time survives; a record that was
     * never marked pending has a submit time of 0.
     */
    public ResultRecord settle(TaskOutcome outcome, String workerId, long completedAt) {
        return new ResultRecord(jobId, taskName, outcome.toState(), outcome.getStatistics(),
                outcome.getMessage(), workerId, submittedAt, completedAt);
    }

    public String getJobId() { return jobId; }
    public String getTaskName() { return taskName; }
    public JobState getState() { return state; }
    public Map<String, Long> getStatistics() { return statistics; }
    public String getMessage() { return message; }
    public String getWorkerId() { return workerId; }
    public long getSubmittedAt() { return submittedAt; }
    public long getCompletedAt() { return completedAt; }

    @JsonIgnore
    public boolean isTerminal() {
        return state.isTerminal();
    }

    public JobStatus toStatus() {
        return switch (state) {
            case PENDING -> JobStatus.pending(jobId);
            case SUCCESS -> JobStatus.completed(jobId, TaskOutcome.success(statistics));
            case FAILURE -> JobStatus.completed(jobId, TaskOutcome.failure(message));
        };
    }

    @Override
    public String toString() {
        return String.format("ResultRecord{jobId='%s', task='%s', state=%s, worker='%s'}",
                jobId, taskName, state, workerId);
    }
}
