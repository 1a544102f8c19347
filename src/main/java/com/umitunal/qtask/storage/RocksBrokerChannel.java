package com.umitunal.qtask.storage;

import com.umitunal.qtask.config.StorageConfig;
import com.umitunal.qtask.core.BrokerChannel;
import com.umitunal.qtask.core.BrokerUnavailableException;
import com.umitunal.qtask.core.Job;
import com.umitunal.qtask.core.BrokerMetrics;
import com.umitunal.qtask.model.WorkUnit;
import com.umitunal.qtask.serialization.RecordCodec;
import org.rocksdb.OptimisticTransactionDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Transaction;
import org.rocksdb.WriteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * RocksDB-backed broker channel.
 * <p>
 * Entries are keyed by scheduled time, so a scan meets deliverable jobs first.
 * Leasing runs in an optimistic transaction that also checks the entry's
 * version; of several workers racing for one entry exactly one commits.
 *
 * @param <T> the type of message carried by each job
 */
public class RocksBrokerChannel<T> implements BrokerChannel<T> {
    private static final Logger log = LoggerFactory.getLogger(RocksBrokerChannel.class);

    private final OptimisticTransactionDB transactionDB;
    private final RocksResources resources;
    private final RecordCodec<T> codec;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong txnConflictCount = new AtomicLong(0);

    public RocksBrokerChannel(StorageConfig config, RecordCodec<T> codec) throws BrokerUnavailableException {
        this.codec = codec;
        this.resources = new RocksResources(config);
        try {
            RocksResources.ensureDirectory(config.getDataDirectory());
            this.transactionDB = OptimisticTransactionDB.open(resources.dbOptions, config.getDataDirectory());
        } catch (RocksDBException | IOException e) {
            resources.close();
            throw new BrokerUnavailableException("Failed to open broker at " + config.getDataDirectory(), e);
        }
        log.info("Broker channel opened at {} carrying {}", config.getDataDirectory(), codec.getType().getSimpleName());
    }

    @Override
    public void enqueue(String jobId, T message, long scheduledTime, int maxDeliveries)
            throws BrokerUnavailableException {
        ensureOpen();
        WorkUnit<T> unit = new WorkUnit<>(jobId, message, scheduledTime, maxDeliveries);
        try {
            transactionDB.put(resources.writeOpts, unit.storageKey(), unit.serialize(codec));
        } catch (RocksDBException e) {
            throw new BrokerUnavailableException("Failed to enqueue job " + jobId, e);
        }
    }

    @Override
    public Job<T> acquire(String workerId, long leaseDuration) throws BrokerUnavailableException {
        ensureOpen();
        long now = System.currentTimeMillis();

        try (RocksIterator iter = transactionDB.newIterator(resources.scanReadOpts)) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                WorkUnit<T> unit = WorkUnit.deserialize(iter.value(), codec);

                // Sorted by scheduled time: nothing after this is ready either
                if (unit.getScheduledTime() > now) {
                    break;
                }
                if (!unit.isDeliverable()) {
                    continue;
                }

                if (!unit.canRetry()) {
                    update(iter.key(), unit, u -> u.markFailed("Maximum deliveries exceeded"));
                    log.warn("Job {} exhausted {} deliveries", unit.getId(), unit.getMaxAttempts());
                    continue;
                }

                WorkUnit<T> leased = update(iter.key(), unit, u -> u.lease(workerId, leaseDuration));
                if (leased != null) {
                    return leased;
                }
                // Lost the race, try the next entry
            }
        }

        return null;
    }

    @Override
    public void acknowledge(Job<T> job) throws BrokerUnavailableException {
        ensureOpen();
        try {
            transactionDB.delete(resources.writeOpts, WorkUnit.createStorageKey(job.getScheduledTime(), job.getId()));
        } catch (RocksDBException e) {
            throw new BrokerUnavailableException("Failed to acknowledge job " + job.getId(), e);
        }
    }

    @Override
    public void reject(Job<T> job, String reason) throws BrokerUnavailableException {
        handBack(job, unit -> {
            if (unit.canRetry()) {
                unit.resetForRedelivery(reason);
            } else {
                unit.markFailed(reason);
            }
        });
    }

    @Override
    public void release(Job<T> job, String reason) throws BrokerUnavailableException {
        handBack(job, unit -> unit.release(reason));
    }

    private void handBack(Job<T> job, Consumer<WorkUnit<T>> change) throws BrokerUnavailableException {
        ensureOpen();
        byte[] key = WorkUnit.createStorageKey(job.getScheduledTime(), job.getId());

        try (Transaction txn = transactionDB.beginTransaction(resources.writeOpts, resources.txnOpts)) {
            byte[] value = txn.getForUpdate(resources.readOpts, key, true);

            if (value == null) {
                throw new IllegalStateException("Job not found: " + job.getId());
            }

            WorkUnit<T> unit = WorkUnit.deserialize(value, codec);
            change.accept(unit);

            txn.put(key, unit.serialize(codec));
            txn.commit();
        } catch (RocksDBException e) {
            throw new BrokerUnavailableException("Failed to hand back job " + job.getId(), e);
        }
    }

    @Override
    public long recoverAbandoned() throws BrokerUnavailableException {
        ensureOpen();
        long recovered = 0;

        try (RocksIterator iter = transactionDB.newIterator(resources.scanReadOpts)) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                WorkUnit<T> unit = WorkUnit.deserialize(iter.value(), codec);

                if (unit.getState() == Job.DeliveryState.LEASED && unit.isLeaseExpired()
                        && update(iter.key(), unit, WorkUnit::markAbandoned) != null) {
                    recovered++;
                }
            }
        }

        if (recovered > 0) {
            log.info("Marked {} jobs with expired leases as abandoned", recovered);
        }
        return recovered;
    }

    @Override
    public BrokerMetrics getMetrics() throws BrokerUnavailableException {
        ensureOpen();
        long queued = 0;
        long leased = 0;
        long dead = 0;
        long abandoned = 0;

        try (RocksIterator iter = transactionDB.newIterator(resources.scanReadOpts)) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                switch (WorkUnit.deserialize(iter.value(), codec).getState()) {
                    case QUEUED -> queued++;
                    case LEASED -> leased++;
                    case FAILED -> dead++;
                    case ABANDONED -> abandoned++;
                }
            }
        }

        return new BrokerMetrics(queued, leased, dead, abandoned);
    }

    /**
     * Delete jobs that ran out of deliveries.
     *
     * @return number of entries deleted
     */
    public long purgeDeadLetters() throws BrokerUnavailableException {
        ensureOpen();
        long purged = 0;

        try (RocksIterator iter = transactionDB.newIterator(resources.scanReadOpts);
             WriteBatch batch = new WriteBatch()) {

            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                if (WorkUnit.deserialize(iter.value(), codec).getState() == Job.DeliveryState.FAILED) {
                    batch.delete(iter.key());
                    purged++;
                }
            }

            if (batch.count() > 0) {
                transactionDB.write(resources.writeOpts, batch);
            }
        } catch (RocksDBException e) {
            throw new BrokerUnavailableException("Failed to purge dead jobs", e);
        }

        return purged;
    }

    /**
     * Number of optimistic transactions that lost a race. Useful for
     * monitoring worker contention.
     */
    public long getTransactionConflictCount() {
        return txnConflictCount.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            transactionDB.close();
            resources.close();
        }
    }

    /**
     * Apply a change to an entry if it is still the version that was scanned.
     *
     * @return the updated entry, or null if another worker changed it first
     */
    private WorkUnit<T> update(byte[] key, WorkUnit<T> scanned, Consumer<WorkUnit<T>> change)
            throws BrokerUnavailableException {
        try (Transaction txn = transactionDB.beginTransaction(resources.writeOpts, resources.txnOpts)) {
            byte[] currentValue = txn.getForUpdate(resources.readOpts, key, true);
            if (currentValue == null) {
                return null; // Acknowledged meanwhile
            }

            WorkUnit<T> current = WorkUnit.deserialize(currentValue, codec);
            if (current.getVersion() != scanned.getVersion()) {
                return null;
            }

            change.accept(current);
            txn.put(key, current.serialize(codec));
            txn.commit();
            return current;

        } catch (RocksDBException e) {
            if (RocksResources.isConflict(e)) {
                txnConflictCount.incrementAndGet();
                return null;
            }
            throw new BrokerUnavailableException("Failed to update job " + scanned.getId(), e);
        }
    }

    private void ensureOpen() throws BrokerUnavailableException {
        if (closed.get()) {
            throw new BrokerUnavailableException("Broker channel is closed", null);
        }
    }
}
