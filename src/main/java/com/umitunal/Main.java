package com.umitunal;

import com.umitunal.qtask.client.JobHandle;
import com.umitunal.qtask.client.TaskClient;
import com.umitunal.qtask.config.TaskConfig;
import com.umitunal.qtask.core.InfrastructureException;
import com.umitunal.qtask.model.TaskMessage;
import com.umitunal.qtask.serialization.JsonCodec;
import com.umitunal.qtask.serialization.UrlSafeBase64Codec;
import com.umitunal.qtask.storage.RocksBrokerChannel;
import com.umitunal.qtask.storage.RocksResultBackend;
import com.umitunal.qtask.worker.TaskExecutor;
import com.umitunal.qtask.worker.TaskRegistry;
import com.umitunal.qtask.worker.TaskWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Runs workers, submits every file named on the command line, then polls each
 * job until it finishes and prints its status as JSON.
 * <p>
 * Storage locations come from {@code QTASK_BROKER_DIR} and
 * {@code QTASK_RESULT_BACKEND_DIR}.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        if (args.length == 0) {
            System.err.println("Usage: qtask <file>...");
            System.exit(2);
        }

        TaskConfig config = TaskConfig.fromEnvironment(System.getenv());

        try (RocksBrokerChannel<TaskMessage> broker =
                     new RocksBrokerChannel<>(config.getBroker(), new JsonCodec<>(TaskMessage.class));
             RocksResultBackend backend =
                     new RocksResultBackend(config.getResultBackend(), config.getResultSerializer())) {

            List<TaskWorker> workers = startWorkers(config, broker, backend);
            try {
                TaskClient client = new TaskClient(broker, backend, config);
                Map<Path, JobHandle> handles = submitAll(client, args);

                // Long enough for every delivery to time out
                Duration timeout = Duration.ofMillis(config.getLeaseDuration() * config.getMaxDeliveries());
                for (Map.Entry<Path, JobHandle> entry : handles.entrySet()) {
                    JobHandle handle = entry.getValue();
                    try {
                        handle.await(timeout, Duration.ofSeconds(1));
                    } catch (TimeoutException e) {
                        log.warn("Job {} for {} is not yet complete", handle.getId(), entry.getKey());
                    }
                    System.out.println(entry.getKey() + " " + JsonCodec.mapper().writeValueAsString(handle.status()));
                }
            } finally {
                workers.forEach(TaskWorker::stop);
                log.info("Broker at shutdown: {}", broker.getMetrics());
            }
        }
    }

    private static List<TaskWorker> startWorkers(TaskConfig config, RocksBrokerChannel<TaskMessage> broker,
                                                 RocksResultBackend backend) {
        TaskExecutor executor = new TaskExecutor(
                TaskRegistry.withDefaults(), new UrlSafeBase64Codec(), config.getProcessingDelay());

        List<TaskWorker> workers = new ArrayList<>();
        for (int i = 1; i <= config.getWorkerCount(); i++) {
            TaskWorker worker = TaskWorker.builder("worker-" + i, broker, backend, executor)
                    .withLeaseDuration(config.getLeaseDuration())
                    .withPollInterval(config.getPollInterval())
                    .build();
            worker.start();
            workers.add(worker);
        }
        return workers;
    }

    private static Map<Path, JobHandle> submitAll(TaskClient client, String[] files)
            throws IOException, InfrastructureException {
        Map<Path, JobHandle> handles = new LinkedHashMap<>();
        for (String file : files) {
            Path path = Path.of(file);
            JobHandle handle = client.submit(Files.readAllBytes(path));
            System.out.println("Queued task " + handle.getId() + " for " + path);
            handles.put(path, handle);
        }
        return handles;
    }
}
