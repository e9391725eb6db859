package com.dcruver.filetaxonomy.gate;

public enum SuggestionStatus {
    PENDING,
    APPROVED,
    REJECTED,
    APPLIED;

    public boolean isProcessed() {
        return this != PENDING;
    }
}
