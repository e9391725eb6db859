package com.dcruver.filetaxonomy.gate;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Proposal to break a category into subcategories. Files whose names appear among a
 * subcategory's exemplars are moved into it when the split is applied.
 */
@Value
@Builder
@With
public class SplitSuggestion {
    UUID id;
    UUID sourceId;
    List<ProposedSubcategory> proposedSubcategories;
    String reason;
    double confidence;
    Instant createdAt;
    SuggestionStatus status;

    @Value
    public static class ProposedSubcategory {
        String name;
        List<String> exemplarFiles;
        double confidence;
    }

    public static SplitSuggestion of(UUID sourceId, List<ProposedSubcategory> subcategories,
                                     String reason, double confidence) {
        return SplitSuggestion.builder()
            .id(UUID.randomUUID())
            .sourceId(sourceId)
            .proposedSubcategories(List.copyOf(subcategories))
            .reason(reason)
            .confidence(confidence)
            .createdAt(Instant.now())
            .status(SuggestionStatus.PENDING)
            .build();
    }
}
