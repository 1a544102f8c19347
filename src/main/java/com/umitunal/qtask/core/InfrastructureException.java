package com.umitunal.qtask.core;

/**
 * Base type for faults in the broker channel or the result backend.
 * These never describe the outcome of a job.
 */
public abstract class InfrastructureException extends Exception {

    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
