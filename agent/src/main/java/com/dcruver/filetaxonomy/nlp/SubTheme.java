package com.dcruver.filetaxonomy.nlp;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * A finer grouping inside a theme. May itself be split further.
 */
@Value
@Builder
public class SubTheme {
    String name;
    Set<String> keywords;
    List<ExtractedKeywords> files;
    List<SubTheme> subThemes;

    public int fileCount() {
        return files.size();
    }
}
