package com.umitunal.qtask.worker;

import com.umitunal.qtask.core.BrokerChannel;
import com.umitunal.qtask.core.BrokerUnavailableException;
import com.umitunal.qtask.core.InfrastructureException;
import com.umitunal.qtask.core.Job;
import com.umitunal.qtask.core.JobStatus;
import com.umitunal.qtask.core.ResultBackend;
import com.umitunal.qtask.core.ResultBackendUnavailableException;
import com.umitunal.qtask.core.TaskOutcome;
import com.umitunal.qtask.model.TaskMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A worker that pulls jobs from the broker one at a time, runs them and
 * settles their outcome in the result backend.
 * <p>
 * Several workers may share one broker and one backend. A job the broker
 * delivers twice is settled once: a worker that finds the job already settled
 * only acknowledges it, and two workers settling at the same time are
 * arbitrated by the backend.
 */
public class TaskWorker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskWorker.class);

    private final String workerId;
    private final BrokerChannel<TaskMessage> broker;
    private final ResultBackend backend;
    private final TaskExecutor executor;
    private final long leaseDuration;
    private final long pollInterval;
    private final AtomicBoolean running;
    private final AtomicLong succeededCount;
    private final AtomicLong failedCount;
    private final AtomicLong duplicateCount;

    private volatile Thread workerThread;

    private TaskWorker(Builder builder) {
        this.workerId = builder.workerId;
        this.broker = builder.broker;
        this.backend = builder.backend;
        this.executor = builder.executor;
        this.leaseDuration = builder.leaseDuration;
        this.pollInterval = builder.pollInterval;
        this.running = new AtomicBoolean(false);
        this.succeededCount = new AtomicLong(0);
        this.failedCount = new AtomicLong(0);
        this.duplicateCount = new AtomicLong(0);
    }

    /**
     * Start the worker in the background.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            workerThread = new Thread(this::run, "TaskWorker-" + workerId);
            workerThread.setDaemon(false);
            workerThread.start();
            log.info("Worker {} started", workerId);
        }
    }

    /**
     * Stop the worker. A job in progress is handed back to the broker.
     */
    public void stop() {
        running.set(false);
        Thread thread = workerThread;
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            log.info("Worker {} stopped (succeeded={}, failed={}, duplicates={})",
                    workerId, getSucceededCount(), getFailedCount(), getDuplicateCount());
        }
    }

    /**
     * Take and process a single job synchronously.
     *
     * @return false if no job was deliverable
     * @throws InfrastructureException if the broker or the backend failed; the
     *         job, if any, has been handed back for redelivery
     * @throws InterruptedException if interrupted mid-job; the job has been handed back
     */
    public boolean processOne() throws InfrastructureException, InterruptedException {
        Job<TaskMessage> job = broker.acquire(workerId, leaseDuration);

        if (job == null) {
            return false;
        }

        MDC.put("jobId", job.getId());
        try {
            JobStatus current;
            try {
                current = backend.getStatus(job.getId());
            } catch (ResultBackendUnavailableException e) {
                // Nothing ran yet, so this delivery does not count
                handBack(job, e, false);
                throw e;
            }

            if (current.isTerminal()) {
                log.info("Job {} already settled, acknowledging delivery {}", job.getId(), job.getCurrentAttempt());
                broker.acknowledge(job);
                duplicateCount.incrementAndGet();
                return true;
            }

            try {
                process(job);
            } catch (InterruptedException | InfrastructureException e) {
                handBack(job, e, true);
                throw e;
            }
            return true;
        } finally {
            MDC.remove("jobId");
        }
    }

    private void process(Job<TaskMessage> job) throws InfrastructureException, InterruptedException {
        String jobId = job.getId();

        log.info("Received job {} for task '{}' (delivery {}/{})",
                jobId, job.getPayload().getTaskName(), job.getCurrentAttempt(), job.getMaxAttempts());

        TaskOutcome outcome = executor.execute(job.getPayload());

        if (backend.settle(jobId, outcome, workerId)) {
            log.info("Job {} settled: {}", jobId, outcome);
            if (outcome.isSuccess()) {
                succeededCount.incrementAndGet();
            } else {
                failedCount.incrementAndGet();
            }
        } else {
            log.info("Job {} was settled by another worker, discarding {}", jobId, outcome);
            duplicateCount.incrementAndGet();
        }

        broker.acknowledge(job);
    }

    /**
     * Return a job to the broker. A counted delivery brings the job closer to
     * the dead-letter state; an uncounted one does not.
     */
    private void handBack(Job<TaskMessage> job, Exception cause, boolean countDelivery) {
        String reason = cause instanceof InterruptedException
                ? "Worker " + workerId + " interrupted"
                : cause.getMessage();
        try {
            if (countDelivery) {
                broker.reject(job, reason);
            } else {
                broker.release(job, reason);
            }
        } catch (BrokerUnavailableException | RuntimeException e) {
            // The lease will expire and the broker redelivers anyway
            cause.addSuppressed(e);
            log.warn("Could not hand back job {}, it will be redelivered after its lease", job.getId(), e);
        }
    }

    private void run() {
        while (running.get()) {
            try {
                boolean processed = processOne();

                if (!processed) {
                    Thread.sleep(pollInterval);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (InfrastructureException e) {
                log.error("Worker {} infrastructure error", workerId, e);
                if (!pause()) {
                    break;
                }
            } catch (RuntimeException e) {
                log.error("Worker {} unexpected error", workerId, e);
                if (!pause()) {
                    break;
                }
            }
        }
        running.set(false);
    }

    private boolean pause() {
        try {
            Thread.sleep(pollInterval);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public String getWorkerId() { return workerId; }
    public long getSucceededCount() { return succeededCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
    public long getDuplicateCount() { return duplicateCount.get(); }
    public boolean isRunning() { return running.get(); }

    @Override
    public void close() {
        stop();
    }

    public static Builder builder(String workerId, BrokerChannel<TaskMessage> broker,
                                  ResultBackend backend, TaskExecutor executor) {
        return new Builder(workerId, broker, backend, executor);
    }

    public static class Builder {
        private final String workerId;
        private final BrokerChannel<TaskMessage> broker;
        private final ResultBackend backend;
        private final TaskExecutor executor;
        private long leaseDuration = 60000; // 1 minute
        private long pollInterval = 1000;   // 1 second

        private Builder(String workerId, BrokerChannel<TaskMessage> broker,
                        ResultBackend backend, TaskExecutor executor) {
            this.workerId = workerId;
            this.broker = broker;
            this.backend = backend;
            this.executor = executor;
        }

        public Builder withLeaseDuration(long millis) {
            this.leaseDuration = millis;
            return this;
        }

        public Builder withPollInterval(long millis) {
            this.pollInterval = millis;
            return this;
        }

        public TaskWorker build() {
            return new TaskWorker(this);
        }
    }
}
