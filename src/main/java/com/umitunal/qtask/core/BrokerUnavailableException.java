package com.umitunal.qtask.core;

/**
 * The broker channel could not record or deliver a job.
 */
public class BrokerUnavailableException extends InfrastructureException {

    public BrokerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
