package com.dcruver.filetaxonomy.analysis;

import com.dcruver.filetaxonomy.domain.TaxonomyPipelineException;

public class QueueFullException extends TaxonomyPipelineException {

    public QueueFullException(int queued, int requested, int capacity) {
        super("Deep analysis queue is full: " + queued + " queued, " + requested + " requested, capacity " + capacity);
    }
}
