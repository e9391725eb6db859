package com.dcruver.filetaxonomy.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * A file (or, in hierarchy-aware scans, a top-level folder) discovered by a scanner.
 * The id is stable across scans of the same path.
 */
@Value
@Builder
@Jacksonized
public class ScannedFile {
    UUID id;
    String name;
    String path;
    String extension;
    long size;
    Instant createdAt;
    Instant modifiedAt;
    boolean directory;

    /**
     * Convenience for callers that only know a name, e.g. tests and shell input.
     */
    public static ScannedFile named(String name) {
        return ScannedFile.builder()
            .id(UUID.randomUUID())
            .name(name)
            .path(name)
            .extension(extensionOf(name))
            .build();
    }

    public static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase();
    }
}
