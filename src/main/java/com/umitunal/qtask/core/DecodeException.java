package com.umitunal.qtask.core;

/**
 * A job payload could not be turned back into content.
 * <p>
 * Workers convert this into a {@link JobState#FAILURE} outcome; it never
 * reaches the broker.
 */
public class DecodeException extends RuntimeException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
