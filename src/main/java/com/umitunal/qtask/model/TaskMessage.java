package com.umitunal.qtask.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Message carried through the broker: the name of the task to run and its
 * transport-encoded argument.
 */
public final class TaskMessage {
    private final String taskName;
    private final String argument;

    @JsonCreator
    public TaskMessage(@JsonProperty("task") String taskName,
                       @JsonProperty("argument") String argument) {
        this.taskName = Objects.requireNonNull(taskName, "taskName");
        this.argument = argument;
    }

    @JsonProperty("task")
    public String getTaskName() { return taskName; }

    @JsonProperty("argument")
    public String getArgument() { return argument; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaskMessage)) return false;
        TaskMessage that = (TaskMessage) o;
        return taskName.equals(that.taskName) && Objects.equals(argument, that.argument);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskName, argument);
    }

    @Override
    public String toString() {
        int length = argument == null ? 0 : argument.length();
        return "TaskMessage{task='" + taskName + "', argumentLength=" + length + "}";
    }
}
