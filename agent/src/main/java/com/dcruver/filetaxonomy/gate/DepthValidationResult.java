package com.dcruver.filetaxonomy.gate;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Depth check of a whole taxonomy. Violations break the maximum; warnings are advisory.
 */
@Value
public class DepthValidationResult {
    int currentDepth;
    List<Issue> violations;
    List<Issue> warnings;

    public enum IssueType {
        EXCEEDS_MAXIMUM,
        NODE_EXCEEDS_MAXIMUM,
        BELOW_MINIMUM,
        APPROACHING_MAXIMUM
    }

    @Value
    public static class Issue {
        IssueType type;
        UUID nodeId;
        String path;
        int depth;
        String message;
    }

    public boolean isValid() {
        return violations.isEmpty();
    }
}
