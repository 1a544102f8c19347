package com.umitunal.qtask.model;

import com.umitunal.qtask.core.Job;
import com.umitunal.qtask.serialization.RecordCodec;

import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Binary layout of a broker entry.
 *
 * <pre>
 * format version (1 byte)
 * id            (4 byte length + UTF-8)
 * payload       (4 byte length + codec bytes)
 * scheduledTime (8) maxAttempts (4) currentAttempt (4) leaseExpiry (8)
 * worker        (4 byte length + UTF-8, -1 for none)
 * state ordinal (1)
 * createdAt (8) lastModified (8)
 * reason        (4 byte length + UTF-8, -1 for none)
 * version (8)
 * </pre>
 *
 * @param <T> the type of the message carried by the entry
 */
public class WorkUnitSerializer<T> {
    static final byte FORMAT_VERSION = 1;

    private final RecordCodec<T> payloadCodec;

    public WorkUnitSerializer(RecordCodec<T> payloadCodec) {
        this.payloadCodec = payloadCodec;
    }

    public byte[] serialize(WorkUnit<T> unit) {
        byte[] id = unit.getId().getBytes(UTF_8);
        byte[] payload = payloadCodec.encode(unit.getPayload());
        byte[] worker = bytesOrNull(unit.getAssignedWorker());
        byte[] reason = bytesOrNull(unit.getFailureReason());

        int size = 1
                + sized(id) + sized(payload)
                + 8 + 4 + 4 + 8
                + sized(worker)
                + 1
                + 8 + 8
                + sized(reason)
                + 8;

        ByteBuffer buffer = ByteBuffer.allocate(size);
        buffer.put(FORMAT_VERSION);
        putBytes(buffer, id);
        putBytes(buffer, payload);
        buffer.putLong(unit.getScheduledTime());
        buffer.putInt(unit.getMaxAttempts());
        buffer.putInt(unit.getCurrentAttempt());
        buffer.putLong(unit.getLeaseExpiry());
        putBytes(buffer, worker);
        buffer.put((byte) unit.getState().ordinal());
        buffer.putLong(unit.getCreatedAt());
        buffer.putLong(unit.getLastModified());
        putBytes(buffer, reason);
        buffer.putLong(unit.getVersion());
        return buffer.array();
    }

    public WorkUnit<T> deserialize(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);

        byte format = buffer.get();
        if (format != FORMAT_VERSION) {
            throw new IllegalStateException("Unsupported broker entry format: " + format);
        }

        String id = getString(buffer);
        T payload = payloadCodec.decode(getBytes(buffer));
        long scheduledTime = buffer.getLong();
        int maxAttempts = buffer.getInt();

        WorkUnit<T> unit = new WorkUnit<>(id, payload, scheduledTime, maxAttempts);

        int currentAttempt = buffer.getInt();
        long leaseExpiry = buffer.getLong();
        String worker = getString(buffer);
        Job.DeliveryState state = Job.DeliveryState.values()[buffer.get()];
        long createdAt = buffer.getLong();
        long lastModified = buffer.getLong();
        String reason = getString(buffer);
        long version = buffer.getLong();

        unit.restore(currentAttempt, leaseExpiry, worker, state, createdAt, lastModified, reason, version);
        return unit;
    }

    private static byte[] bytesOrNull(String value) {
        return value == null ? null : value.getBytes(UTF_8);
    }

    private static int sized(byte[] bytes) {
        return 4 + (bytes == null ? 0 : bytes.length);
    }

    private static void putBytes(ByteBuffer buffer, byte[] bytes) {
        if (bytes == null) {
            buffer.putInt(-1);
        } else {
            buffer.putInt(bytes.length);
            buffer.put(bytes);
        }
    }

    private static byte[] getBytes(ByteBuffer buffer) {
        int length = buffer.getInt();
        if (length < 0) {
            return null;
        }
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return bytes;
    }

    private static String getString(ByteBuffer buffer) {
        byte[] bytes = getBytes(buffer);
        return bytes == null ? null : new String(bytes, UTF_8);
    }
}
