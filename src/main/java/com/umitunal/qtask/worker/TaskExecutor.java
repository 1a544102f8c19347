package com.umitunal.qtask.worker;

import com.umitunal.qtask.core.DecodeException;
import com.umitunal.qtask.core.TaskOutcome;
import com.umitunal.qtask.model.TaskMessage;
import com.umitunal.qtask.serialization.TransportCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Runs one task message to an outcome: look up the task, decode the argument,
 * compute, then wait out the processing delay.
 * <p>
 * Everything that goes wrong with the job itself becomes a failure outcome.
 * Only interruption escapes.
 */
public class TaskExecutor {
    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final TaskRegistry registry;
    private final TransportCodec transportCodec;
    private final ProcessingDelay processingDelay;

    public TaskExecutor(TaskRegistry registry, TransportCodec transportCodec, ProcessingDelay processingDelay) {
        this.registry = registry;
        this.transportCodec = transportCodec;
        this.processingDelay = processingDelay;
    }

    public TaskOutcome execute(TaskMessage message) throws InterruptedException {
        TaskOutcome outcome = compute(message);
        // Failures wait too, so every job completes within the same bound
        processingDelay.pause();
        return outcome;
    }

    TaskOutcome compute(TaskMessage message) throws InterruptedException {
        Optional<TaskFunction> task = registry.find(message.getTaskName());
        if (task.isEmpty()) {
            log.warn("Received unregistered task '{}'", message.getTaskName());
            return TaskOutcome.failure("Received unregistered task: " + message.getTaskName());
        }

        try {
            byte[] content = transportCodec.decode(message.getArgument());
            return TaskOutcome.success(task.get().apply(content));
        } catch (DecodeException e) {
            log.warn("Failed to decode argument of task '{}': {}", message.getTaskName(), e.getMessage());
            return TaskOutcome.failure("failed to decode: " + e.getMessage());
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Task '{}' failed", message.getTaskName(), e);
            return TaskOutcome.failure(describe(e));
        }
    }

    private static String describe(Exception e) {
        String name = e.getClass().getSimpleName();
        return e.getMessage() == null ? name : name + ": " + e.getMessage();
    }
}
