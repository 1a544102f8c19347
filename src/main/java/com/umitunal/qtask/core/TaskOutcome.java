package com.umitunal.qtask.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Business outcome of a job: named statistics on success, a message on failure.
 * <p>
 * Failures described here are data, not faults. Broker and backend faults are
 * reported through {@link InfrastructureException} instead.
 */
public final class TaskOutcome {
    private final boolean success;
    private final Map<String, Long> statistics;
    private final String message;

    private TaskOutcome(boolean success, Map<String, Long> statistics, String message) {
        this.success = success;
        this.statistics = statistics;
        this.message = message;
    }

    public static TaskOutcome success(Map<String, Long> statistics) {
        Objects.requireNonNull(statistics, "statistics");
        return new TaskOutcome(true, Collections.unmodifiableMap(new LinkedHashMap<>(statistics)), null);
    }

    public static TaskOutcome failure(String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Failure message must not be empty");
        }
        return new TaskOutcome(false, null, message);
    }

    public boolean isSuccess() { return success; }

    /**
     * Statistics of a successful job, or null for a failure.
     */
    public Map<String, Long> getStatistics() { return statistics; }

    /**
     * Failure message, or null for a success.
     */
    public String getMessage() { return message; }

    /**
     * The value exposed to callers: the statistics map or the failure message.
     */
    public Object asResult() {
        return success ? statistics : message;
    }

    public JobState toState() {
        return success ? JobState.SUCCESS : JobState.FAILURE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaskOutcome)) return false;
        TaskOutcome that = (TaskOutcome) o;
        return success == that.success
                && Objects.equals(statistics, that.statistics)
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(success, statistics, message);
    }

    @Override
    public String toString() {
        return success ? "Success" + statistics : "Failure('" + message + "')";
    }
}
