package com.dcruver.filetaxonomy.domain;

/**
 * Where a file placement came from.
 */
public enum AssignmentSource {
    FILENAME,    // Keyword clustering on the file name
    CONTENT,     // Deep analysis of the file content
    USER,        // Placed by hand
    MEMORY,      // Recalled from an earlier session
    GRAPH_RAG    // Inferred from related files
}
