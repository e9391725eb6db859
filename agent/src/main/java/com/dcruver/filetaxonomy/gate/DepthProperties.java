package com.dcruver.filetaxonomy.gate;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Depth bounds for the taxonomy and how to react when they are broken.
 */
@Data
@ConfigurationProperties(prefix = "taxonomy.depth")
public class DepthProperties {

    public enum Mode {
        STRICT,     // Throw
        ADVISORY,   // Log only
        FLATTEN     // Fold over-deep categories into their parents
    }

    private int minDepth = 2;
    private int maxDepth = 5;
    private Mode mode = Mode.ADVISORY;
    private boolean warnApproachingMaximum = true;

    public static DepthProperties strict() {
        DepthProperties properties = new DepthProperties();
        properties.setMinDepth(3);
        properties.setMaxDepth(7);
        properties.setMode(Mode.STRICT);
        return properties;
    }

    public boolean isValid(int depth) {
        return depth >= minDepth && depth <= maxDepth;
    }

    public int suggestedDepth() {
        return (minDepth + maxDepth) / 2;
    }
}
