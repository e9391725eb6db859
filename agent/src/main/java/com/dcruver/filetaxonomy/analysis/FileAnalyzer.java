package com.dcruver.filetaxonomy.analysis;

import com.dcruver.filetaxonomy.domain.ScannedFile;

import java.util.List;

/**
 * Proposes a category for one file. Implementations should honour thread interruption, which is
 * how timeouts and cancellation reach them.
 */
public interface FileAnalyzer {

    DeepAnalysisResult analyze(ScannedFile file, List<String> existingCategories) throws DeepAnalysisException;
}
