package com.dcruver.filetaxonomy.gate;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of a guardrail check. When not allowed automatically, a human may still approve.
 */
@Value
public class GuardrailCheckResult {
    boolean allowed;
    boolean requiresApproval;
    String reason;
    List<UUID> affectedNodes;

    public static GuardrailCheckResult allow(List<UUID> affectedNodes) {
        return new GuardrailCheckResult(true, false, null, List.copyOf(affectedNodes));
    }

    public static GuardrailCheckResult block(String reason, List<UUID> affectedNodes) {
        return new GuardrailCheckResult(false, true, reason, List.copyOf(affectedNodes));
    }
}
