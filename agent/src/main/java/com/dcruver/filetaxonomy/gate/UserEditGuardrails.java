package com.dcruver.filetaxonomy.gate;

import com.dcruver.filetaxonomy.domain.TaxonomyNode;
import com.dcruver.filetaxonomy.domain.TaxonomyTree;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps automatic processes away from categories a person has shaped.
 *
 * A node is protected once it is marked user-edited, and user-created nodes are never changed
 * automatically either. Only explicit approval through {@link MergeSplitGatekeeper} may touch them.
 * All checks read the tree, so callers hold at least the read lock of the owning
 * {@link com.dcruver.filetaxonomy.domain.SharedTaxonomy}.
 */
@Component
@Slf4j
public class UserEditGuardrails {

    /**
     * Protect a node from automatic change. There is no way back.
     */
    public void markAsUserEdited(TaxonomyTree tree, TaxonomyNode node) {
        tree.markUserEdited(node);
        log.info("Category '{}' marked as user-edited", node.getPathString());
    }

    public boolean canAutoModify(TaxonomyNode node) {
        return !node.isUserEdited() && !node.isUserCreated();
    }

    /**
     * A file may be moved automatically unless it currently sits in a user-edited category.
     * Files not yet in the tree may always be placed.
     */
    public boolean canAutoReassign(UUID fileId, TaxonomyTree tree) {
        return tree.nodeContainingFile(fileId)
            .map(node -> !node.isUserEdited())
            .orElse(true);
    }

    /**
     * Files may be placed automatically at {@code path} only if no existing category along it is
     * user-edited; creating a child under such a category would change it too.
     */
    public boolean canAutoPlaceInto(List<String> path, TaxonomyTree tree) {
        for (int i = 1; i <= path.size(); i++) {
            Optional<TaxonomyNode> node = tree.find(path.subList(0, i));
            if (node.isEmpty()) {
                return true;
            }
            if (node.get().isUserEdited()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Moving or removing this node would change its parent's children, so a user-edited parent
     * protects it too.
     */
    public boolean hasUserEditedParent(TaxonomyNode node) {
        return node.getParent().map(TaxonomyNode::isUserEdited).orElse(false);
    }

    public GuardrailCheckResult validateMerge(MergeSuggestion suggestion, TaxonomyTree tree) {
        List<UUID> affected = new ArrayList<>();
        for (UUID sourceId : suggestion.getSourceIds()) {
            Optional<TaxonomyNode> source = tree.node(sourceId);
            if (source.isEmpty()) {
                continue;
            }
            affected.add(sourceId);
            if (!canAutoModify(source.get())) {
                return GuardrailCheckResult.block("Source category '" + source.get().getPathString()
                    + "' is protected by a user edit", affected);
            }
            if (hasUserEditedParent(source.get())) {
                return GuardrailCheckResult.block("Category '" + source.get().getPathString()
                    + "' belongs to a user-edited category", affected);
            }
            if (suggestion.isFlatten() && source.get().containsUserEdits()) {
                return GuardrailCheckResult.block("Category '" + source.get().getPathString()
                    + "' contains user-edited subcategories", affected);
            }
        }

        UUID containerId = suggestion.getTargetId() != null ? suggestion.getTargetId() : suggestion.getParentId();
        if (containerId != null) {
            Optional<TaxonomyNode> container = tree.node(containerId);
            if (container.isPresent()) {
                affected.add(containerId);
                boolean protectedTarget = suggestion.getTargetId() != null
                    ? !canAutoModify(container.get())
                    : container.get().isUserEdited();
                if (protectedTarget) {
                    return GuardrailCheckResult.block("Target category '" + container.get().getPathString()
                        + "' is protected by a user edit", affected);
                }
            }
        }
        return GuardrailCheckResult.allow(affected);
    }

    public GuardrailCheckResult validateSplit(SplitSuggestion suggestion, TaxonomyTree tree) {
        Optional<TaxonomyNode> source = tree.node(suggestion.getSourceId());
        if (source.isEmpty()) {
            return GuardrailCheckResult.allow(List.of());
        }
        if (!canAutoModify(source.get())) {
            return GuardrailCheckResult.block("Category '" + source.get().getPathString()
                + "' is protected by a user edit", List.of(suggestion.getSourceId()));
        }
        return GuardrailCheckResult.allow(List.of(suggestion.getSourceId()));
    }
}
