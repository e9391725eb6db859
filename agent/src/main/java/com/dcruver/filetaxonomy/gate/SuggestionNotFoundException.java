package com.dcruver.filetaxonomy.gate;

import com.dcruver.filetaxonomy.domain.TaxonomyPipelineException;

import java.util.UUID;

public class SuggestionNotFoundException extends TaxonomyPipelineException {

    public SuggestionNotFoundException(UUID suggestionId) {
        super("Suggestion not found: " + suggestionId);
    }
}
