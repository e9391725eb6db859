package com.dcruver.filetaxonomy.domain;

/**
 * Base class for failures raised while building or mutating a taxonomy.
 */
public class TaxonomyPipelineException extends RuntimeException {

    public TaxonomyPipelineException(String message) {
        super(message);
    }

    public TaxonomyPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
