package com.umitunal.qtask.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Point-in-time view of a job as seen by a client.
 * <p>
 * The result is null while the job is pending, never an empty value.
 */
@JsonPropertyOrder({"task_id", "status", "result"})
public final class JobStatus {
    private final String id;
    private final JobState state;
    private final TaskOutcome outcome;

    private JobStatus(String id, JobState state, TaskOutcome outcome) {
        this.id = Objects.requireNonNull(id, "id");
        this.state = state;
        this.outcome = outcome;
    }

    public static JobStatus pending(String id) {
        return new JobStatus(id, JobState.PENDING, null);
    }

    public static JobStatus completed(String id, TaskOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        return new JobStatus(id, outcome.toState(), outcome);
    }

    @JsonProperty("task_id")
    public String getId() { return id; }

    @JsonProperty("status")
    public JobState getState() { return state; }

    @JsonProperty("result")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public Object getResult() {
        return outcome == null ? null : outcome.asResult();
    }

    @JsonIgnore
    public TaskOutcome getOutcome() { return outcome; }

    @JsonIgnore
    public boolean isTerminal() { return state.isTerminal(); }

    @JsonIgnore
    public boolean isSuccessful() { return state == JobState.SUCCESS; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobStatus)) return false;
        JobStatus that = (JobStatus) o;
        return id.equals(that.id) && state == that.state && Objects.equals(outcome, that.outcome);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, state, outcome);
    }

    @Override
    public String toString() {
        return String.format("JobStatus{id='%s', state=%s, result=%s}", id, state, getResult());
    }
}
