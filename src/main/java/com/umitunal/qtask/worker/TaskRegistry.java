package com.umitunal.qtask.worker;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit mapping from task name to task function, filled in at startup.
 */
public class TaskRegistry {
    private final Map<String, TaskFunction> tasks = new ConcurrentHashMap<>();

    /**
     * Registry holding the built-in tasks.
     */
    public static TaskRegistry withDefaults() {
        return new TaskRegistry()
                .register(FileStatisticsTask.NAME, new FileStatisticsTask());
    }

    /**
     * @throws IllegalStateException if the name is taken
     */
    public TaskRegistry register(String name, TaskFunction function) {
        Objects.requireNonNull(function, "function");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name must not be empty");
        }
        if (tasks.putIfAbsent(name, function) != null) {
            throw new IllegalStateException("Task already registered: " + name);
        }
        return this;
    }

    public Optional<TaskFunction> find(String name) {
        return Optional.ofNullable(tasks.get(name));
    }

    public boolean contains(String name) {
        return tasks.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(tasks.keySet()));
    }
}
