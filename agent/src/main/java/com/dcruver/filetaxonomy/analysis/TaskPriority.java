package com.dcruver.filetaxonomy.analysis;

/**
 * Queue priority of a deep-analysis task; higher weight runs first.
 */
public enum TaskPriority {
    LOW(0),
    NORMAL(1),
    HIGH(2),
    CRITICAL(3);

    private final int weight;

    TaskPriority(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }
}
