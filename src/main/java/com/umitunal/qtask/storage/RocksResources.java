package com.umitunal.qtask.storage;

import com.umitunal.qtask.config.StorageConfig;
import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.BloomFilter;
import org.rocksdb.Cache;
import org.rocksdb.CompressionType;
import org.rocksdb.Filter;
import org.rocksdb.LRUCache;
import org.rocksdb.Options;
import org.rocksdb.OptimisticTransactionOptions;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.Status;
import org.rocksdb.WriteOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Native option handles shared by the RocksDB-backed stores.
 * Everything here must be closed after the database that uses it.
 */
final class RocksResources implements AutoCloseable {
    private static final long MB = 1024L * 1024L;

    final Options dbOptions;
    final WriteOptions writeOpts;
    final ReadOptions readOpts;
    final ReadOptions scanReadOpts;
    final OptimisticTransactionOptions txnOpts;
    private final Cache blockCache;
    private final Filter bloomFilter;

    RocksResources(StorageConfig config) {
        RocksDB.loadLibrary();

        this.blockCache = new LRUCache(config.getBlockCacheSizeMB() * MB);
        this.bloomFilter = new BloomFilter(10, false); // 10 bits per key

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true);

        this.dbOptions = new Options()
                .setCreateIfMissing(true)
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize(config.getMemoryBufferSizeMB() * MB)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setAllowConcurrentMemtableWrite(true)
                .setEnableWriteThreadAdaptiveYield(true)
                .setTableFormatConfig(tableConfig)
                .setMaxOpenFiles(-1);

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites())
                .setDisableWAL(!config.isDurableWrites());

        this.readOpts = new ReadOptions();

        // Scans must not evict point-lookup blocks from the cache
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);
    }

    static void ensureDirectory(String dataDirectory) throws IOException {
        Files.createDirectories(Path.of(dataDirectory));
    }

    /**
     * Whether a failed commit lost an optimistic race rather than hit a fault.
     */
    static boolean isConflict(RocksDBException e) {
        Status status = e.getStatus();
        if (status == null) {
            return false;
        }
        return status.getCode() == Status.Code.Busy || status.getCode() == Status.Code.TryAgain;
    }

    @Override
    public void close() {
        txnOpts.close();
        scanReadOpts.close();
        readOpts.close();
        writeOpts.close();
        dbOptions.close();
        // BlockBasedTableConfig has no close(); it goes with the Options
        blockCache.close();
        bloomFilter.close();
    }
}
