package com.dcruver.filetaxonomy.persistence;

import com.dcruver.filetaxonomy.analysis.TaskStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One finished deep-analysis task as stored in the ledger.
 */
@Value
@Builder
public class TaskLedgerEntry {
    UUID taskId;
    UUID fileId;
    String filePath;
    TaskStatus status;
    int attempt;
    String error;
    List<String> resultPath;
    Double resultConfidence;
    Instant completedAt;
}
