package com.umitunal.qtask.storage;

import com.umitunal.qtask.config.StorageConfig;
import com.umitunal.qtask.core.JobStatus;
import com.umitunal.qtask.core.ResultBackend;
import com.umitunal.qtask.core.ResultBackendUnavailableException;
import com.umitunal.qtask.core.TaskOutcome;
import com.umitunal.qtask.model.ResultRecord;
import com.umitunal.qtask.serialization.RecordCodec;
import com.umitunal.qtask.serialization.ResultSerializer;
import org.rocksdb.OptimisticTransactionDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed result backend, one record per job id.
 * <p>
 * Reads are plain point lookups and never wait on writers. Writes are
 * check-then-put inside an optimistic transaction, so a terminal record is
 * written once and never replaced.
 */
public class RocksResultBackend implements ResultBackend {
    private static final Logger log = LoggerFactory.getLogger(RocksResultBackend.class);

    // A conflicting commit means another writer got in; the re-read decides
    static final int MAX_WRITE_ATTEMPTS = 5;

    private final OptimisticTransactionDB transactionDB;
    private final RocksResources resources;
    private final RecordCodec<ResultRecord> codec;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RocksResultBackend(StorageConfig config) throws ResultBackendUnavailableException {
        this(config, ResultSerializer.JSON);
    }

    public RocksResultBackend(StorageConfig config, ResultSerializer serializer)
            throws ResultBackendUnavailableException {
        this.codec = serializer.codec();
        this.resources = new RocksResources(config);
        try {
            RocksResources.ensureDirectory(config.getDataDirectory());
            this.transactionDB = OptimisticTransactionDB.open(resources.dbOptions, config.getDataDirectory());
        } catch (RocksDBException | IOException e) {
            resources.close();
            throw new ResultBackendUnavailableException(
                    "Failed to open result backend at " + config.getDataDirectory(), e);
        }
        log.info("Result backend opened at {} ({})", config.getDataDirectory(), serializer);
    }

    @Override
    public void markPending(String jobId, String taskName) throws ResultBackendUnavailableException {
        ensureOpen();
        byte[] key = key(jobId);

        try (Transaction txn = transactionDB.beginTransaction(resources.writeOpts, resources.txnOpts)) {
            if (txn.getForUpdate(resources.readOpts, key, true) != null) {
                return;
            }
            txn.put(key, codec.encode(ResultRecord.pending(jobId, taskName, System.currentTimeMillis())));
            txn.commit();
        } catch (RocksDBException e) {
            if (RocksResources.isConflict(e)) {
                // Someone else wrote the key first, which is all we wanted
                log.debug("Job {} was recorded concurrently, keeping existing record", jobId);
                return;
            }
            throw new ResultBackendUnavailableException("Failed to record job " + jobId, e);
        }
    }

    @Override
    public boolean settle(String jobId, TaskOutcome outcome, String workerId)
            throws ResultBackendUnavailableException {
        ensureOpen();
        byte[] key = key(jobId);

        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            try (Transaction txn = transactionDB.beginTransaction(resources.writeOpts, resources.txnOpts)) {
                byte[] value = txn.getForUpdate(resources.readOpts, key, true);
                ResultRecord existing = value == null ? null : codec.decode(value);

                if (existing != null && existing.isTerminal()) {
                    return false;
                }

                ResultRecord base = existing != null ? existing : ResultRecord.pending(jobId, null, 0);
                txn.put(key, codec.encode(base.settle(outcome, workerId, System.currentTimeMillis())));
                txn.commit();
                return true;

            } catch (RocksDBException e) {
                if (!RocksResources.isConflict(e)) {
                    throw new ResultBackendUnavailableException("Failed to settle job " + jobId, e);
                }
                log.debug("Write conflict settling job {} (attempt {})", jobId, attempt);
            }
        }

        throw new ResultBackendUnavailableException(
                "Gave up settling job " + jobId + " after " + MAX_WRITE_ATTEMPTS + " conflicting writes", null);
    }

    @Override
    public JobStatus getStatus(String jobId) throws ResultBackendUnavailableException {
        return find(jobId)
                .map(ResultRecord::toStatus)
                .orElseGet(() -> JobStatus.pending(jobId));
    }

    /**
     * Full stored record of a job, if one was written.
     */
    public Optional<ResultRecord> find(String jobId) throws ResultBackendUnavailableException {
        ensureOpen();
        try {
            byte[] value = transactionDB.get(resources.readOpts, key(jobId));
            return value == null ? Optional.empty() : Optional.of(codec.decode(value));
        } catch (RocksDBException e) {
            throw new ResultBackendUnavailableException("Failed to read job " + jobId, e);
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            transactionDB.close();
            resources.close();
        }
    }

    private static byte[] key(String jobId) {
        return jobId.getBytes(UTF_8);
    }

    private void ensureOpen() throws ResultBackendUnavailableException {
        if (closed.get()) {
            throw new ResultBackendUnavailableException("Result backend is closed", null);
        }
    }
}
