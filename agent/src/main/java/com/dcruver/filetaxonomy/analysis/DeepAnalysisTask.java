package com.dcruver.filetaxonomy.analysis;

import com.dcruver.filetaxonomy.domain.ScannedFile;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A request to re-analyze one file. Immutable; the task manager replaces it on every transition.
 * Confidence and category path are as recorded when the task was queued.
 */
@Value
@Builder
@With
public class DeepAnalysisTask {
    UUID id;
    ScannedFile file;
    double currentConfidence;
    List<String> currentCategoryPath;
    TaskPriority priority;
    boolean userApproved;
    TaskStatus status;
    Instant queuedAt;
    Instant startedAt;
    Instant completedAt;
    String error;
    DeepAnalysisResult result;
    int attempt;
    long sequence;

    public static DeepAnalysisTask create(ScannedFile file, double currentConfidence, List<String> currentCategoryPath,
                                          TaskPriority priority, boolean userApproved) {
        return DeepAnalysisTask.builder()
            .id(UUID.randomUUID())
            .file(file)
            .currentConfidence(currentConfidence)
            .currentCategoryPath(List.copyOf(currentCategoryPath))
            .priority(priority)
            .userApproved(userApproved)
            .status(TaskStatus.QUEUED)
            .attempt(1)
            .build();
    }

    public UUID getFileId() {
        return file.getId();
    }

    public Duration elapsed() {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt != null ? completedAt : Instant.now());
    }
}
