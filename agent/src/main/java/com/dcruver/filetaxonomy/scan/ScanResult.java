package com.dcruver.filetaxonomy.scan;

import com.dcruver.filetaxonomy.domain.ScannedFile;
import lombok.Value;

import java.util.List;

/**
 * Output of a scan. In hierarchy-aware mode top-level folders are treated as single units and
 * listed in {@code folders}; {@code looseFiles} are the files sitting directly in the root.
 * {@code files} is everything to categorize.
 */
@Value
public class ScanResult {
    String rootName;
    List<ScannedFile> files;
    List<ScannedFile> folders;
    List<ScannedFile> looseFiles;

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
