package com.umitunal.qtask.worker;

import com.umitunal.qtask.core.DecodeException;

import java.util.Map;

/**
 * A task a worker can run, looked up by name in a {@link TaskRegistry}.
 */
@FunctionalInterface
public interface TaskFunction {

    /**
     * Compute the task's statistics for decoded content.
     *
     * @param content the job content after transport decoding
     * @return named numeric statistics
     * @throws DecodeException if the content cannot be interpreted
     * @throws Exception any other failure, recorded as the job's failure message
     */
    Map<String, Long> apply(byte[] content) throws Exception;
}
