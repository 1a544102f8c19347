package com.umitunal.qtask.serialization;

import com.umitunal.qtask.core.JobState;
import com.umitunal.qtask.core.TaskOutcome;
import com.umitunal.qtask.model.ResultRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.UncheckedIOException;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

class ResultSerializerTest {

    @ParameterizedTest
    @EnumSource(ResultSerializer.class)
    @DisplayName("Should store a pending record")
    void testPendingRecord(ResultSerializer serializer) {
        // Given
        RecordCodec<ResultRecord> codec = serializer.codec();
        ResultRecord record = ResultRecord.pending("job-1", "file.statistics", 1000L);

        // When
        ResultRecord decoded = codec.decode(codec.encode(record));

        // Then
        assertThat(decoded.getJobId()).isEqualTo("job-1");
        assertThat(decoded.getTaskName()).isEqualTo("file.statistics");
        assertThat(decoded.getState()).isEqualTo(JobState.PENDING);
        assertThat(decoded.getStatistics()).isNull();
        assertThat(decoded.getMessage()).isNull();
        assertThat(decoded.getSubmittedAt()).isEqualTo(1000L);
    }

    @ParameterizedTest
    @EnumSource(ResultSerializer.class)
    @DisplayName("Should store a successful record with its statistics")
    void testSuccessRecord(ResultSerializer serializer) {
        // Given
        RecordCodec<ResultRecord> codec = serializer.codec();
        ResultRecord record = ResultRecord.pending("job-2", "file.statistics", 1000L)
                .settle(TaskOutcome.success(Map.of("lines", 2L, "characters", 5L)), "worker-1", 2000L);

        // When
        ResultRecord decoded = codec.decode(codec.encode(record));

        // Then
        assertThat(decoded.getState()).isEqualTo(JobState.SUCCESS);
        assertThat(decoded.getStatistics()).containsOnly(entry("lines", 2L), entry("characters", 5L));
        assertThat(decoded.getWorkerId()).isEqualTo("worker-1");
        assertThat(decoded.getSubmittedAt()).isEqualTo(1000L);
        assertThat(decoded.getCompletedAt()).isEqualTo(2000L);
    }

    @ParameterizedTest
    @EnumSource(ResultSerializer.class)
    @DisplayName("Should store a failed record with its message")
    void testFailureRecord(ResultSerializer serializer) {
        // Given
        RecordCodec<ResultRecord> codec = serializer.codec();
        ResultRecord record = ResultRecord.pending("job-3", "file.statistics", 1000L)
                .settle(TaskOutcome.failure("failed to decode."), "worker-2", 3000L);

        // When
        ResultRecord decoded = codec.decode(codec.encode(record));

        // Then
        assertThat(decoded.getState()).isEqualTo(JobState.FAILURE);
        assertThat(decoded.getMessage()).isEqualTo("failed to decode.");
        assertThat(decoded.toStatus().getResult()).isEqualTo("failed to decode.");
    }

    @Test
    @DisplayName("JSON records should be readable as plain JSON")
    void testJsonLayout() {
        // Given
        RecordCodec<ResultRecord> codec = ResultSerializer.JSON.codec();
        ResultRecord record = ResultRecord.pending("job-4", "file.statistics", 1L)
                .settle(TaskOutcome.success(Map.of("lines", 0L)), "worker-1", 2L);

        // When
        String json = new String(codec.encode(record), UTF_8);

        // Then
        assertThat(json)
                .contains("\"jobId\":\"job-4\"")
                .contains("\"state\":\"SUCCESS\"")
                .contains("\"lines\":0")
                .doesNotContain("terminal");
    }

    @Test
    @DisplayName("Kryo records should be smaller than JSON records")
    void testKryoIsCompact() {
        ResultRecord record = ResultRecord.pending("job-5", "file.statistics", 1L)
                .settle(TaskOutcome.success(Map.of("lines", 10L, "characters", 200L)), "worker-1", 2L);

        byte[] kryo = ResultSerializer.KRYO.codec().encode(record);
        byte[] json = ResultSerializer.JSON.codec().encode(record);

        assertThat(kryo.length).isLessThan(json.length);
    }

    @Test
    @DisplayName("Corrupt records should fail loudly instead of reading as pending")
    void testCorruptRecord() {
        assertThatThrownBy(() -> ResultSerializer.KRYO.codec().decode(new byte[0]))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ResultRecord");
        assertThatThrownBy(() -> ResultSerializer.JSON.codec().decode(new byte[0]))
                .isInstanceOf(UncheckedIOException.class);
    }
}
