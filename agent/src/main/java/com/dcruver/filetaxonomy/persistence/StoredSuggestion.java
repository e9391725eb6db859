package com.dcruver.filetaxonomy.persistence;

import com.dcruver.filetaxonomy.gate.SuggestionStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A persisted merge or split suggestion. {@code payload} is the suggestion as JSON.
 */
@Value
public class StoredSuggestion {

    public static final String MERGE = "merge";
    public static final String SPLIT = "split";

    UUID id;
    String kind;
    SuggestionStatus status;
    String reason;
    String payload;
    Instant createdAt;
}
