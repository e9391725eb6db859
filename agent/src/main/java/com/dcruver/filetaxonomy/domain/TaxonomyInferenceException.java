package com.dcruver.filetaxonomy.domain;

/**
 * Raised when a taxonomy cannot be inferred at all, e.g. there is nothing to cluster.
 */
public class TaxonomyInferenceException extends TaxonomyPipelineException {

    public static final String NO_FILES = "No files provided for taxonomy inference";

    public TaxonomyInferenceException(String message) {
        super(message);
    }

    public static TaxonomyInferenceException noFilesProvided() {
        return new TaxonomyInferenceException(NO_FILES);
    }
}
