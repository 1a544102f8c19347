package com.umitunal.qtask.model;

import com.umitunal.qtask.core.Job;
import com.umitunal.qtask.serialization.RecordCodec;

import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Broker entry: a job plus its delivery bookkeeping.
 *
 * @param <T> the type of the message carried by the job
 */
public class WorkUnit<T> implements Job<T> {
    private final String id;
    private final T payload;
    private final long scheduledTime;
    private final int maxAttempts;

    private int currentAttempt;
    private long leaseExpiry;
    private String assignedWorker;
    private DeliveryState state;
    private long createdAt;
    private long lastModified;
    private String failureReason;
    private long version;  // For optimistic locking

    public WorkUnit(String id, T payload, long scheduledTime, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        this.id = id;
        this.payload = payload;
        this.scheduledTime = scheduledTime;
        this.maxAttempts = maxAttempts;
        this.state = DeliveryState.QUEUED;
        this.createdAt = System.currentTimeMillis();
        this.lastModified = this.createdAt;
    }

    @Override
    public String getId() { return id; }

    @Override
    public T getPayload() { return payload; }

    @Override
    public long getScheduledTime() { return scheduledTime; }

    @Override
    public DeliveryState getState() { return state; }

    @Override
    public int getCurrentAttempt() { return currentAttempt; }

    @Override
    public int getMaxAttempts() { return maxAttempts; }

    @Override
    public boolean isReady() {
        return System.currentTimeMillis() >= scheduledTime;
    }

    @Override
    public boolean canRetry() {
        return currentAttempt < maxAttempts;
    }

    public long getLeaseExpiry() { return leaseExpiry; }
    public String getAssignedWorker() { return assignedWorker; }
    public long getCreatedAt() { return createdAt; }
    public long getLastModified() { return lastModified; }
    public String getFailureReason() { return failureReason; }
    public long getVersion() { return version; }

    // Restored by WorkUnitSerializer
    void restore(int currentAttempt, long leaseExpiry, String assignedWorker, DeliveryState state,
                 long createdAt, long lastModified, String failureReason, long version) {
        this.currentAttempt = currentAttempt;
        this.leaseExpiry = leaseExpiry;
        this.assignedWorker = assignedWorker;
        this.state = state;
        this.createdAt = createdAt;
        this.lastModified = lastModified;
        this.failureReason = failureReason;
        this.version = version;
    }

    public boolean isLeaseExpired() {
        return System.currentTimeMillis() > leaseExpiry;
    }

    /**
     * Whether a worker may take this entry now. Expired leases count, which is
     * how a crashed worker's job gets redelivered.
     */
    public boolean isDeliverable() {
        return switch (state) {
            case QUEUED, ABANDONED -> true;
            case LEASED -> isLeaseExpired();
            case FAILED -> false;
        };
    }

    public void lease(String workerId, long durationMs) {
        long now = System.currentTimeMillis();
        this.assignedWorker = workerId;
        this.leaseExpiry = now + durationMs;
        this.state = DeliveryState.LEASED;
        this.currentAttempt++;
        touch(now);
    }

    public void markFailed(String reason) {
        this.failureReason = reason;
        this.state = DeliveryState.FAILED;
        touch(System.currentTimeMillis());
    }

    public void markAbandoned() {
        this.state = DeliveryState.ABANDONED;
        touch(System.currentTimeMillis());
    }

    public void resetForRedelivery(String reason) {
        this.state = DeliveryState.QUEUED;
        this.assignedWorker = null;
        this.leaseExpiry = 0;
        this.failureReason = reason;
        touch(System.currentTimeMillis());
    }

    /**
     * Like {@link #resetForRedelivery(String)}, but the current delivery does
     * not count towards the maximum.
     */
    public void release(String reason) {
        if (currentAttempt > 0) {
            this.currentAttempt--;
        }
        resetForRedelivery(reason);
    }

    private void touch(long now) {
        this.lastModified = now;
        this.version++;
    }

    @Override
    public String toString() {
        return String.format("WorkUnit{id='%s', state=%s, attempt=%d/%d, scheduled=%d, worker='%s'}",
                id, state, currentAttempt, maxAttempts, scheduledTime, assignedWorker);
    }

    public byte[] serialize(RecordCodec<T> codec) {
        return new WorkUnitSerializer<>(codec).serialize(this);
    }

    public static <T> WorkUnit<T> deserialize(byte[] bytes, RecordCodec<T> codec) {
        return new WorkUnitSerializer<>(codec).deserialize(bytes);
    }

    /**
     * Storage key: [scheduledTime(8 bytes)][jobId bytes].
     * Keys sort by delivery time, and the id keeps them unique.
     */
    public static byte[] createStorageKey(long scheduledTime, String jobId) {
        byte[] jobIdBytes = jobId.getBytes(UTF_8);
        return ByteBuffer.allocate(Long.BYTES + jobIdBytes.length)
                .putLong(scheduledTime)
                .put(jobIdBytes)
                .array();
    }

    public byte[] storageKey() {
        return createStorageKey(scheduledTime, id);
    }
}
