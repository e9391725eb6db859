package com.dcruver.filetaxonomy.gate;

import com.dcruver.filetaxonomy.domain.TaxonomyPipelineException;

public class DepthConstraintException extends TaxonomyPipelineException {

    private final DepthValidationResult result;

    public DepthConstraintException(DepthValidationResult result) {
        super("Taxonomy depth " + result.getCurrentDepth() + " violates the configured bounds: "
            + result.getViolations().size() + " violation(s)");
        this.result = result;
    }

    public DepthValidationResult getResult() {
        return result;
    }
}
