package com.dcruver.filetaxonomy.analysis;

/**
 * Analysis of a single file failed. The task fails; nothing else is affected.
 */
public class DeepAnalysisException extends Exception {

    public DeepAnalysisException(String message) {
        super(message);
    }

    public DeepAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
