package com.umitunal.qtask.serialization;

/**
 * Byte format of a value kept in one of the RocksDB stores: broker messages
 * inside {@code WorkUnit} entries, and result records.
 * <p>
 * Unlike {@link TransportCodec}, a failure here means stored data is corrupt
 * or was written by an incompatible format, and is reported unchecked.
 *
 * @param <T> the stored type
 */
public interface RecordCodec<T> {

    byte[] encode(T value);

    T decode(byte[] bytes);

    /**
     * The type this codec reads, for error messages.
     */
    Class<T> getType();
}
