package com.dcruver.filetaxonomy.analysis;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the task manager, pushed on every state change.
 */
@Value
@Builder
public class ManagerStatus {
    boolean running;
    boolean paused;
    int queued;
    int runningCount;
    int completed;
    int failed;
    int cancelled;
    int total;
    List<DeepAnalysisTask> runningTasks;
    double progress;
    Duration estimatedRemaining;
    String fatalError;
    Instant updatedAt;

    public static ManagerStatus idle() {
        return ManagerStatus.builder()
            .runningTasks(List.of())
            .updatedAt(Instant.now())
            .build();
    }

    public int getTerminal() {
        return completed + failed + cancelled;
    }
}
