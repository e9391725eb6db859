package com.dcruver.filetaxonomy.build;

import lombok.Value;

/**
 * Progress of the background refinement pass.
 */
@Value
public class RefinementProgress {

    public enum Phase {
        REFINING_NAMES,
        SUGGESTING_MERGES,
        MERGING,
        INFERRING_STRUCTURE,
        COMPLETE
    }

    int totalCategories;
    int refinedCategories;
    String currentCategory;
    Phase phase;

    public double getFraction() {
        return totalCategories == 0 ? 1.0 : (double) refinedCategories / totalCategories;
    }

    public boolean isComplete() {
        return phase == Phase.COMPLETE;
    }
}
