package com.umitunal.qtask.client;

import com.umitunal.qtask.config.TaskConfig;
import com.umitunal.qtask.core.BrokerChannel;
import com.umitunal.qtask.core.BrokerUnavailableException;
import com.umitunal.qtask.core.JobStatus;
import com.umitunal.qtask.core.ResultBackend;
import com.umitunal.qtask.core.ResultBackendUnavailableException;
import com.umitunal.qtask.core.TaskOutcome;
import com.umitunal.qtask.model.TaskMessage;
import com.umitunal.qtask.serialization.TransportCodec;
import com.umitunal.qtask.serialization.UrlSafeBase64Codec;
import com.umitunal.qtask.worker.FileStatisticsTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.UUID;

/**
 * Entry point for submitters: submit, check status, fetch result.
 * <p>
 * Submitting never waits for a worker. It returns as soon as the broker has
 * recorded the job.
 */
public class TaskClient {
    private static final Logger log = LoggerFactory.getLogger(TaskClient.class);

    private final BrokerChannel<TaskMessage> broker;
    private final ResultBackend backend;
    private final TransportCodec transportCodec;
    private final int maxDeliveries;

    public TaskClient(BrokerChannel<TaskMessage> broker, ResultBackend backend, TaskConfig config) {
        this(broker, backend, new UrlSafeBase64Codec(), config.getMaxDeliveries());
    }

    public TaskClient(BrokerChannel<TaskMessage> broker, ResultBackend backend,
                      TransportCodec transportCodec, int maxDeliveries) {
        this.broker = broker;
        this.backend = backend;
        this.transportCodec = transportCodec;
        this.maxDeliveries = maxDeliveries;
    }

    /**
     * Submit file content for statistics.
     */
    public JobHandle submit(byte[] content) throws BrokerUnavailableException, ResultBackendUnavailableException {
        return submit(FileStatisticsTask.NAME, content, Duration.ZERO);
    }

    /**
     * Submit content to a named task.
     *
     * @param taskName registered task name
     * @param content raw content, any bytes
     * @param countdown earliest delivery relative to now
     * @throws BrokerUnavailableException if the job could not be recorded; nothing was submitted
     * @throws ResultBackendUnavailableException if the job was queued but its pending record
     *         could not be written; the job will still run
     */
    public JobHandle submit(String taskName, byte[] content, Duration countdown)
            throws BrokerUnavailableException, ResultBackendUnavailableException {
        if (countdown.isNegative()) {
            throw new IllegalArgumentException("countdown must not be negative");
        }
        String jobId = UUID.randomUUID().toString();
        TaskMessage message = new TaskMessage(taskName, transportCodec.encode(content));

        broker.enqueue(jobId, message, System.currentTimeMillis() + countdown.toMillis(), maxDeliveries);
        backend.markPending(jobId, taskName);

        log.debug("Queued job {} for task '{}' ({} bytes)", jobId, taskName, content.length);
        return new JobHandle(jobId, backend);
    }

    /**
     * Rebuild a handle from a job id obtained earlier.
     */
    public JobHandle handle(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId must not be empty");
        }
        return new JobHandle(jobId, backend);
    }

    public JobStatus status(String jobId) throws ResultBackendUnavailableException {
        return handle(jobId).status();
    }

    /**
     * @throws com.umitunal.qtask.core.NotReadyException if the job is still pending
     */
    public TaskOutcome result(String jobId) throws ResultBackendUnavailableException {
        return handle(jobId).result();
    }
}
