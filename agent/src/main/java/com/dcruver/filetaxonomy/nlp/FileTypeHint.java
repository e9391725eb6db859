package com.dcruver.filetaxonomy.nlp;

import java.util.Set;

/**
 * Coarse file type guessed from the extension.
 */
public enum FileTypeHint {
    DOCUMENT("Documents", Set.of("pdf", "doc", "docx", "txt", "rtf", "odt", "pages", "md")),
    VIDEO("Videos", Set.of("mp4", "mov", "avi", "mkv", "wmv", "flv", "webm", "m4v")),
    AUDIO("Audio", Set.of("mp3", "wav", "aac", "flac", "m4a", "ogg", "wma")),
    IMAGE("Images", Set.of("jpg", "jpeg", "png", "gif", "bmp", "tiff", "webp", "heic", "svg")),
    ARCHIVE("Archives", Set.of("zip", "rar", "7z", "tar", "gz", "bz2")),
    APPLICATION("Applications", Set.of("app", "exe", "dmg", "pkg")),
    OTHER("Other", Set.of());

    private final String displayName;
    private final Set<String> extensions;

    FileTypeHint(String displayName, Set<String> extensions) {
        this.displayName = displayName;
        this.extensions = extensions;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static FileTypeHint fromExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return OTHER;
        }
        String ext = extension.toLowerCase();
        for (FileTypeHint hint : values()) {
            if (hint.extensions.contains(ext)) {
                return hint;
            }
        }
        return OTHER;
    }
}
