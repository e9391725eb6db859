package com.dcruver.filetaxonomy.scan;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Enumerates the files (and optionally folders) under a root directory.
 */
public interface Scanner {

    ScanResult scan(Path root, boolean hierarchyAware) throws IOException;
}
