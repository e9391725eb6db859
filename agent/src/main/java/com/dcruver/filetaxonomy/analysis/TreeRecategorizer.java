package com.dcruver.filetaxonomy.analysis;

import com.dcruver.filetaxonomy.domain.SharedTaxonomy;
import com.dcruver.filetaxonomy.gate.UserEditGuardrails;
import lombok.extern.slf4j.Slf4j;

/**
 * Moves files inside a shared taxonomy, unless the guardrails object.
 */
@Slf4j
public class TreeRecategorizer implements Recategorizer {

    private final SharedTaxonomy taxonomy;
    private final UserEditGuardrails guardrails;

    public TreeRecategorizer(SharedTaxonomy taxonomy, UserEditGuardrails guardrails) {
        this.taxonomy = taxonomy;
        this.guardrails = guardrails;
    }

    @Override
    public boolean recategorize(DeepAnalysisTask task, DeepAnalysisResult result) {
        return taxonomy.write(tree -> {
            if (!guardrails.canAutoReassign(task.getFileId(), tree)) {
                log.info("Not moving {}: its category was edited by the user", task.getFile().getName());
                return false;
            }
            if (!guardrails.canAutoPlaceInto(result.getCategoryPath(), tree)) {
                log.info("Not moving {} into user-edited {}", task.getFile().getName(), result.getCategoryPath());
                return false;
            }
            tree.reassignFile(task.getFile(), result.getCategoryPath(), result.getConfidence());
            log.info("Recategorized {} -> {} ({} -> {})", task.getFile().getName(),
                String.join(" / ", result.getCategoryPath()), task.getCurrentConfidence(), result.getConfidence());
            return true;
        });
    }
}
