package com.dcruver.filetaxonomy.analysis;

/**
 * Applies an accepted analysis result to wherever files actually live.
 */
public interface Recategorizer {

    /**
     * @return true if the file was moved
     */
    boolean recategorize(DeepAnalysisTask task, DeepAnalysisResult result);
}
