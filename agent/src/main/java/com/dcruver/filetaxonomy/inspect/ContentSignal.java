package com.dcruver.filetaxonomy.inspect;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * What an inspector could learn about a file's content. Any part may be empty.
 */
@Value
@Builder
public class ContentSignal {
    String textCue;
    @Builder.Default
    List<String> sceneTags = List.of();
    @Builder.Default
    List<String> detectedObjects = List.of();
    Duration duration;
    String kind;

    public static ContentSignal empty(String kind) {
        return ContentSignal.builder().kind(kind).build();
    }

    public boolean hasText() {
        return textCue != null && !textCue.isBlank();
    }

    public boolean isEmpty() {
        return !hasText() && sceneTags.isEmpty() && detectedObjects.isEmpty() && duration == null;
    }
}
