package com.dcruver.filetaxonomy.analysis;

import com.dcruver.filetaxonomy.domain.TaxonomyPipelineException;

import java.util.UUID;

public class TaskNotFoundException extends TaxonomyPipelineException {

    public TaskNotFoundException(UUID taskId) {
        super("Task not found: " + taskId);
    }
}
