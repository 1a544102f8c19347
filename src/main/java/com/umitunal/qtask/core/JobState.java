package com.umitunal.qtask.core;

/**
 * Client-visible job states.
 * <p>
 * {@code PENDING -> SUCCESS | FAILURE}. Terminal states never change. A job
 * being executed is still reported as {@code PENDING}.
 */
public enum JobState {
    PENDING,
    SUCCESS,
    FAILURE;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
