package com.umitunal.qtask.model;

import com.umitunal.qtask.core.Job;
import com.umitunal.qtask.serialization.JsonCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class WorkUnitSerializerTest {

    private final WorkUnitSerializer<TaskMessage> serializer =
            new WorkUnitSerializer<>(new JsonCodec<>(TaskMessage.class));

    @Test
    @DisplayName("Should restore a freshly queued entry")
    void testQueuedEntry() {
        // Given
        long now = System.currentTimeMillis();
        WorkUnit<TaskMessage> original =
                new WorkUnit<>("job-1", new TaskMessage("file.statistics", "YQpiCmM="), now, 3);

        // When
        WorkUnit<TaskMessage> restored = serializer.deserialize(serializer.serialize(original));

        // Then
        assertThat(restored.getId()).isEqualTo("job-1");
        assertThat(restored.getPayload()).isEqualTo(original.getPayload());
        assertThat(restored.getScheduledTime()).isEqualTo(now);
        assertThat(restored.getMaxAttempts()).isEqualTo(3);
        assertThat(restored.getCurrentAttempt()).isZero();
        assertThat(restored.getState()).isEqualTo(Job.DeliveryState.QUEUED);
        assertThat(restored.getAssignedWorker()).isNull();
        assertThat(restored.getFailureReason()).isNull();
    }

    @Test
    @DisplayName("Should preserve delivery bookkeeping")
    void testDeliveryBookkeeping() {
        // Given
        WorkUnit<TaskMessage> original =
                new WorkUnit<>("job-2", new TaskMessage("file.statistics", ""), 1000L, 2);
        original.lease("worker-1", 30000);
        original.resetForRedelivery("Result backend is closed");
        original.lease("worker-2", 30000);

        // When
        WorkUnit<TaskMessage> restored = serializer.deserialize(serializer.serialize(original));

        // Then
        assertThat(restored.getState()).isEqualTo(Job.DeliveryState.LEASED);
        assertThat(restored.getCurrentAttempt()).isEqualTo(2);
        assertThat(restored.canRetry()).isFalse();
        assertThat(restored.getAssignedWorker()).isEqualTo("worker-2");
        assertThat(restored.getFailureReason()).isEqualTo("Result backend is closed");
        assertThat(restored.getLeaseExpiry()).isEqualTo(original.getLeaseExpiry());
        assertThat(restored.getCreatedAt()).isEqualTo(original.getCreatedAt());
        assertThat(restored.getLastModified()).isEqualTo(original.getLastModified());
        assertThat(restored.getVersion()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should keep non-ASCII identifiers and reasons intact")
    void testUnicodeFields() {
        // Given
        WorkUnit<TaskMessage> original =
                new WorkUnit<>("iş-ü", new TaskMessage("file.statistics", "w6c="), 1L, 1);
        original.markFailed("zaman aşımı");

        // When
        WorkUnit<TaskMessage> restored = serializer.deserialize(serializer.serialize(original));

        // Then
        assertThat(restored.getId()).isEqualTo("iş-ü");
        assertThat(restored.getFailureReason()).isEqualTo("zaman aşımı");
        assertThat(restored.getState()).isEqualTo(Job.DeliveryState.FAILED);
    }

    @Test
    @DisplayName("Should refuse entries written in an unknown format")
    void testUnknownFormat() {
        // Given
        byte[] bytes = serializer.serialize(
                new WorkUnit<>("job-3", new TaskMessage("file.statistics", ""), 1L, 1));
        bytes[0] = 42;

        // When/Then
        assertThatThrownBy(() -> serializer.deserialize(bytes))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("format");
    }

    @Test
    @DisplayName("Storage keys should sort by scheduled time")
    void testStorageKeyOrdering() {
        byte[] early = WorkUnit.createStorageKey(1000L, "zzz");
        byte[] late = WorkUnit.createStorageKey(2000L, "aaa");

        assertThat(java.util.Arrays.compareUnsigned(early, late)).isNegative();
    }

    @Test
    @DisplayName("Should require at least one delivery")
    void testInvalidMaxAttempts() {
        assertThatThrownBy(() -> new WorkUnit<>("job-4", new TaskMessage("t", ""), 1L, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
