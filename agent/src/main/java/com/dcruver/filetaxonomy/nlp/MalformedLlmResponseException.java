package com.dcruver.filetaxonomy.nlp;

import com.dcruver.filetaxonomy.domain.TaxonomyPipelineException;

/**
 * The model answered with text that is not valid UTF-8. Unlike {@link LlmException} this is fatal
 * for the running operation: the provider or its transport is broken, so retrying item by item
 * would only repeat the failure.
 */
public class MalformedLlmResponseException extends TaxonomyPipelineException {

    public MalformedLlmResponseException(String message) {
        super(message);
    }
}
