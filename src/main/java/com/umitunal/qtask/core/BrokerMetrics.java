package com.umitunal.qtask.core;

/**
 * Count of broker entries per delivery state, taken in one scan.
 * Acknowledged jobs are gone from the broker and not counted.
 */
public class BrokerMetrics {
    private final long queuedJobs;
    private final long leasedJobs;
    private final long deadJobs;
    private final long abandonedJobs;

    public BrokerMetrics(long queuedJobs, long leasedJobs, long deadJobs, long abandonedJobs) {
        this.queuedJobs = queuedJobs;
        this.leasedJobs = leasedJobs;
        this.deadJobs = deadJobs;
        this.abandonedJobs = abandonedJobs;
    }

    public long getQueuedJobs() { return queuedJobs; }
    public long getLeasedJobs() { return leasedJobs; }
    public long getDeadJobs() { return deadJobs; }
    public long getAbandonedJobs() { return abandonedJobs; }

    public long getTotalJobs() {
        return queuedJobs + leasedJobs + deadJobs + abandonedJobs;
    }

    /**
     * Jobs a worker may still settle: waiting, in flight, or waiting for redelivery.
     */
    public long getOutstandingJobs() {
        return queuedJobs + leasedJobs + abandonedJobs;
    }

    /**
     * True once every job was acknowledged or purged.
     */
    public boolean isEmpty() {
        return getTotalJobs() == 0;
    }

    @Override
    public String toString() {
        return String.format("BrokerMetrics{queued=%d, leased=%d, dead=%d, abandoned=%d}",
                queuedJobs, leasedJobs, deadJobs, abandonedJobs);
    }
}
