package com.umitunal.qtask.core;

/**
 * The result backend could not be read or written.
 * Callers must not read this as "still pending".
 */
public class ResultBackendUnavailableException extends InfrastructureException {

    public ResultBackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
