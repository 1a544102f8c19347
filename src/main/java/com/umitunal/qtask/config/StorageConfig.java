package com.umitunal.qtask.config;

/**
 * Configuration for one embedded RocksDB store (the broker channel or the
 * result backend).
 */
public class StorageConfig {
    private final String dataDirectory;
    private final boolean durableWrites;
    private final int memoryBufferSizeMB;
    private final int maxMemoryBuffers;
    private final int backgroundThreads;
    private final int blockCacheSizeMB;

    private StorageConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.durableWrites = builder.durableWrites;
        this.memoryBufferSizeMB = builder.memoryBufferSizeMB;
        this.maxMemoryBuffers = builder.maxMemoryBuffers;
        this.backgroundThreads = builder.backgroundThreads;
        this.blockCacheSizeMB = builder.blockCacheSizeMB;
    }

    public String getDataDirectory() { return dataDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getMemoryBufferSizeMB() { return memoryBufferSizeMB; }
    public int getMaxMemoryBuffers() { return maxMemoryBuffers; }
    public int getBackgroundThreads() { return backgroundThreads; }
    public int getBlockCacheSizeMB() { return blockCacheSizeMB; }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    @Override
    public String toString() {
        return "StorageConfig{dir='" + dataDirectory + "', durable=" + durableWrites + "}";
    }

    public static class Builder {
        private final String dataDirectory;
        private boolean durableWrites = true;
        private int memoryBufferSizeMB = 16;
        private int maxMemoryBuffers = 3;
        private int backgroundThreads = 2;
        private int blockCacheSizeMB = 32;

        private Builder(String dataDirectory) {
            if (dataDirectory == null || dataDirectory.isBlank()) {
                throw new IllegalArgumentException("dataDirectory must not be empty");
            }
            this.dataDirectory = dataDirectory;
        }

        /**
         * Write-ahead log with fsync on every write.
         * A submitted job survives a process crash only with this enabled.
         * Default: true
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Set memtable size in MB.
         * Default: 16 MB
         */
        public Builder withMemoryBufferSize(int sizeMB) {
            this.memoryBufferSizeMB = positive("memoryBufferSizeMB", sizeMB);
            return this;
        }

        /**
         * Set maximum number of memtables.
         * Default: 3
         */
        public Builder withMaxMemoryBuffers(int count) {
            this.maxMemoryBuffers = positive("maxMemoryBuffers", count);
            return this;
        }

        /**
         * Set number of background flush and compaction jobs.
         * Default: 2
         */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = positive("backgroundThreads", count);
            return this;
        }

        /**
         * Set block cache size in MB.
         * Default: 32 MB
         */
        public Builder withBlockCacheSize(int sizeMB) {
            this.blockCacheSizeMB = positive("blockCacheSizeMB", sizeMB);
            return this;
        }

        private static int positive(String name, int value) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be positive, was " + value);
            }
            return value;
        }

        public StorageConfig build() {
            return new StorageConfig(this);
        }
    }
}
