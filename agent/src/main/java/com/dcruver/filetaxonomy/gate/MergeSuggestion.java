package com.dcruver.filetaxonomy.gate;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Proposal to fold several categories into one.
 *
 * The target is either an existing node ({@code targetId}) or a new category called
 * {@code mergedName} created under {@code parentId} (the first source's parent when null). A
 * flattening merge collapses every file below the sources into the target and discards the
 * source subtrees; otherwise the sources' direct files and children move across intact.
 */
@Value
@Builder
@With
public class MergeSuggestion {
    UUID id;
    List<UUID> sourceIds;
    UUID targetId;
    String mergedName;
    UUID parentId;
    boolean flatten;
    String reason;
    double confidence;
    Instant createdAt;
    SuggestionStatus status;

    public static MergeSuggestion intoExisting(List<UUID> sourceIds, UUID targetId, String reason, double confidence) {
        return MergeSuggestion.builder()
            .id(UUID.randomUUID())
            .sourceIds(List.copyOf(sourceIds))
            .targetId(targetId)
            .reason(reason)
            .confidence(confidence)
            .createdAt(Instant.now())
            .status(SuggestionStatus.PENDING)
            .build();
    }

    public static MergeSuggestion intoNew(List<UUID> sourceIds, String mergedName, UUID parentId,
                                          boolean flatten, String reason, double confidence) {
        return MergeSuggestion.builder()
            .id(UUID.randomUUID())
            .sourceIds(List.copyOf(sourceIds))
            .mergedName(mergedName)
            .parentId(parentId)
            .flatten(flatten)
            .reason(reason)
            .confidence(confidence)
            .createdAt(Instant.now())
            .status(SuggestionStatus.PENDING)
            .build();
    }
}
