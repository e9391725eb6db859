package com.dcruver.filetaxonomy.nlp;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Keywords and hints pulled from one file name. Keyword sets are sorted.
 */
@Value
@Builder
public class ExtractedKeywords {
    UUID fileId;
    String fileName;
    String filePath;
    Set<String> keywords;
    Set<String> stems;
    DateInfo dateInfo;
    FileTypeHint fileType;

    public Optional<DateInfo> getDate() {
        return Optional.ofNullable(dateInfo);
    }

    public boolean hasKeywords() {
        return !keywords.isEmpty();
    }
}
