package com.dcruver.filetaxonomy.nlp;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A top-level group of files sharing a theme, as produced by {@link SemanticThemeClusterer}.
 */
@Value
@Builder
public class ThemeCluster {

    public static final String UNCATEGORIZED = "Uncategorized";

    String name;
    Set<String> keywords;
    List<ExtractedKeywords> files;
    List<SubTheme> subThemes;
    boolean uncategorized;

    public int fileCount() {
        return files.size();
    }

    public boolean hasSubThemes() {
        return subThemes != null && !subThemes.isEmpty();
    }

    /**
     * Group files by type in enum order. Types with no files are absent.
     */
    public static Map<FileTypeHint, List<ExtractedKeywords>> groupByType(List<ExtractedKeywords> files) {
        Map<FileTypeHint, List<ExtractedKeywords>> byType = new EnumMap<>(FileTypeHint.class);
        for (ExtractedKeywords file : files) {
            byType.computeIfAbsent(file.getFileType(), t -> new ArrayList<>()).add(file);
        }
        return byType;
    }
}
