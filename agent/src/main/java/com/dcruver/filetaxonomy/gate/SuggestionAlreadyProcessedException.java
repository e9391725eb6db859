package com.dcruver.filetaxonomy.gate;

import com.dcruver.filetaxonomy.domain.TaxonomyPipelineException;

import java.util.UUID;

public class SuggestionAlreadyProcessedException extends TaxonomyPipelineException {

    public SuggestionAlreadyProcessedException(UUID suggestionId, SuggestionStatus status) {
        super("Suggestion " + suggestionId + " was already processed (" + status + ")");
    }
}
