package com.dcruver.filetaxonomy.domain;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * Placement of one scanned file in one category.
 * Immutable: moving a file replaces its assignment. {@code fileId} survives every move.
 */
@Value
@Builder
@With
@Jacksonized
public class FileAssignment {
    UUID id;
    UUID fileId;
    UUID categoryId;
    String filePath;
    String fileName;
    double confidence;
    boolean needsDeepAnalysis;
    AssignmentSource source;
    Instant assignedAt;
}
