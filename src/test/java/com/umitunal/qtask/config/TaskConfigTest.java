package com.umitunal.qtask.config;

import com.umitunal.qtask.serialization.ResultSerializer;
import com.umitunal.qtask.worker.ProcessingDelay;
import com.umitunal.qtask.worker.UniformProcessingDelay;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TaskConfigTest {

    private static Map<String, String> minimal() {
        Map<String, String> env = new HashMap<>();
        env.put(TaskConfig.BROKER_DIR, "/var/lib/qtask/broker");
        env.put(TaskConfig.RESULT_BACKEND_DIR, "/var/lib/qtask/results");
        return env;
    }

    @Test
    @DisplayName("Should apply defaults when only the directories are set")
    void testDefaults() {
        // When
        TaskConfig config = TaskConfig.fromEnvironment(minimal());

        // Then
        assertThat(config.getBroker().getDataDirectory()).isEqualTo("/var/lib/qtask/broker");
        assertThat(config.getResultBackend().getDataDirectory()).isEqualTo("/var/lib/qtask/results");
        assertThat(config.getResultSerializer()).isEqualTo(ResultSerializer.JSON);
        assertThat(config.getMaxDeliveries()).isEqualTo(3);
        assertThat(config.getWorkerCount()).isEqualTo(2);
        assertThat(config.getProcessingDelay()).isInstanceOfSatisfying(UniformProcessingDelay.class, delay -> {
            assertThat(delay.getMinMillis()).isEqualTo(5000);
            assertThat(delay.getMaxMillis()).isEqualTo(10000);
        });
    }

    @Test
    @DisplayName("Should read optional settings")
    void testOptionalSettings() {
        // Given
        Map<String, String> env = minimal();
        env.put(TaskConfig.RESULT_SERIALIZER, " kryo ");
        env.put(TaskConfig.DELAY_MIN_MS, "0");
        env.put(TaskConfig.DELAY_MAX_MS, "250");
        env.put(TaskConfig.WORKERS, "8");

        // When
        TaskConfig config = TaskConfig.fromEnvironment(env);

        // Then
        assertThat(config.getResultSerializer()).isEqualTo(ResultSerializer.KRYO);
        assertThat(config.getWorkerCount()).isEqualTo(8);
        UniformProcessingDelay delay = (UniformProcessingDelay) config.getProcessingDelay();
        assertThat(delay.getMinMillis()).isZero();
        assertThat(delay.getMaxMillis()).isEqualTo(250);
    }

    @Test
    @DisplayName("Missing directories should be reported by name")
    void testMissingDirectory() {
        Map<String, String> env = minimal();
        env.remove(TaskConfig.RESULT_BACKEND_DIR);

        assertThatThrownBy(() -> TaskConfig.fromEnvironment(env))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing required setting " + TaskConfig.RESULT_BACKEND_DIR);
    }

    @Test
    @DisplayName("Malformed values should be rejected")
    void testMalformedValues() {
        Map<String, String> badDelay = minimal();
        badDelay.put(TaskConfig.DELAY_MAX_MS, "ten seconds");
        assertThatThrownBy(() -> TaskConfig.fromEnvironment(badDelay))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(TaskConfig.DELAY_MAX_MS);

        Map<String, String> badSerializer = minimal();
        badSerializer.put(TaskConfig.RESULT_SERIALIZER, "xml");
        assertThatThrownBy(() -> TaskConfig.fromEnvironment(badSerializer))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("xml");

        Map<String, String> noWorkers = minimal();
        noWorkers.put(TaskConfig.WORKERS, "0");
        assertThatThrownBy(() -> TaskConfig.fromEnvironment(noWorkers))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("The lease must outlast the longest processing delay")
    void testLeaseShorterThanDelay() {
        // Given - the default lease is 60 seconds
        Map<String, String> env = minimal();
        env.put(TaskConfig.DELAY_MAX_MS, "90000");

        // When/Then
        assertThatThrownBy(() -> TaskConfig.fromEnvironment(env))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("leaseDuration");

        TaskConfig.Builder builder = TaskConfig.builder(
                StorageConfig.newBuilder("/tmp/qtask/broker").build(),
                StorageConfig.newBuilder("/tmp/qtask/results").build())
                .withProcessingDelay(ProcessingDelay.fixed(Duration.ofSeconds(2)))
                .withLeaseDuration(2000);
        assertThatThrownBy(builder::build).isInstanceOf(IllegalArgumentException.class);
        assertThat(builder.withLeaseDuration(2001).build().getLeaseDuration()).isEqualTo(2001);
    }

    @Test
    @DisplayName("Broker and result backend must not share a directory")
    void testSharedDirectory() {
        StorageConfig shared = StorageConfig.newBuilder("/tmp/qtask").build();

        assertThatThrownBy(() -> TaskConfig.builder(shared, shared))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Storage settings should have sensible defaults")
    void testStorageDefaults() {
        StorageConfig config = StorageConfig.newBuilder("/tmp/qtask").build();

        assertThat(config.isDurableWrites()).isTrue();
        assertThatThrownBy(() -> StorageConfig.newBuilder(" ").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StorageConfig.newBuilder("/tmp/qtask").withBlockCacheSize(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("blockCacheSizeMB");
    }
}
