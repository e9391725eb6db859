package com.dcruver.filetaxonomy.gate;

import com.dcruver.filetaxonomy.domain.TaxonomyPipelineException;

/**
 * An automatic change would touch a category a person has edited.
 */
public class GuardrailViolationException extends TaxonomyPipelineException {

    public GuardrailViolationException(String message) {
        super(message);
    }
}
