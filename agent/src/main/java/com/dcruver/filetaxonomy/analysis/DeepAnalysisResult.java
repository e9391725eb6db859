package com.dcruver.filetaxonomy.analysis;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Category proposal for one file, derived from its content.
 */
@Value
@Builder
public class DeepAnalysisResult {
    UUID fileId;
    List<String> categoryPath;
    double confidence;
    String rationale;
    String contentSummary;
    @Builder.Default
    List<String> suggestedTags = List.of();
    Duration processingTime;
    String provider;
}
