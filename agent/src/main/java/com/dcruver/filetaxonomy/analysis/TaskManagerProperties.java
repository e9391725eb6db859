package com.dcruver.filetaxonomy.analysis;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Scheduling and recategorization settings for {@link DeepAnalysisTaskManager}.
 */
@Data
@ConfigurationProperties(prefix = "taxonomy.task-manager")
public class TaskManagerProperties {

    private int maxConcurrentTasks = 2;
    private Duration taskStartDelay = Duration.ofMillis(100);
    private boolean autoRecategorize = true;
    private double minConfidenceImprovement = 0.15;
    private boolean respectUserApprovals = true;

    /** Upper bound for {@link DeepAnalysisTaskManager#retryFailed}; nothing is retried automatically. */
    private int maxRetries = 2;

    private Duration taskTimeout = Duration.ofSeconds(120);
    private int maxQueueSize = 10_000;
    private boolean autoStart = true;
    private int statusChannelCapacity = 64;

    public static TaskManagerProperties defaults() {
        return new TaskManagerProperties();
    }

    public static TaskManagerProperties aggressive() {
        TaskManagerProperties properties = new TaskManagerProperties();
        properties.setMaxConcurrentTasks(4);
        properties.setTaskStartDelay(Duration.ofMillis(50));
        properties.setMinConfidenceImprovement(0.10);
        properties.setMaxRetries(1);
        properties.setTaskTimeout(Duration.ofSeconds(60));
        return properties;
    }

    public static TaskManagerProperties conservative() {
        TaskManagerProperties properties = new TaskManagerProperties();
        properties.setMaxConcurrentTasks(1);
        properties.setTaskStartDelay(Duration.ofMillis(500));
        properties.setAutoRecategorize(false);
        properties.setMinConfidenceImprovement(0.20);
        properties.setMaxRetries(3);
        properties.setTaskTimeout(Duration.ofSeconds(180));
        return properties;
    }

    public static TaskManagerProperties forPreset(String preset) {
        if (preset == null) {
            return defaults();
        }
        return switch (preset.toLowerCase()) {
            case "aggressive" -> aggressive();
            case "conservative" -> conservative();
            default -> defaults();
        };
    }
}
