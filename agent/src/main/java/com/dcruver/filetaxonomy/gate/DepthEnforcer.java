package com.dcruver.filetaxonomy.gate;

import com.dcruver.filetaxonomy.domain.SharedTaxonomy;
import com.dcruver.filetaxonomy.domain.TaxonomyNode;
import com.dcruver.filetaxonomy.domain.TaxonomyTree;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Checks the taxonomy against its depth bounds and, depending on the mode, rejects, reports or
 * flattens. Depth counts the root as 0. Flattening never removes a user-edited category, so a
 * tree can stay too deep below one; that remains a reported violation.
 */
@Component
@Slf4j
public class DepthEnforcer {

    private final DepthProperties config;

    public DepthEnforcer(DepthProperties config) {
        this.config = config;
    }

    public DepthProperties getConfig() {
        return config;
    }

    public DepthValidationResult validate(TaxonomyTree tree) {
        int depth = tree.maxDepth();
        List<DepthValidationResult.Issue> violations = new ArrayList<>();
        List<DepthValidationResult.Issue> warnings = new ArrayList<>();

        if (depth > config.getMaxDepth()) {
            violations.add(new DepthValidationResult.Issue(DepthValidationResult.IssueType.EXCEEDS_MAXIMUM,
                tree.getRoot().getId(), tree.getRoot().getName(), depth,
                "Taxonomy depth " + depth + " exceeds maximum " + config.getMaxDepth()));
        }
        if (depth < config.getMinDepth() && tree.categoryCount() > 0) {
            warnings.add(new DepthValidationResult.Issue(DepthValidationResult.IssueType.BELOW_MINIMUM,
                tree.getRoot().getId(), tree.getRoot().getName(), depth,
                "Taxonomy depth " + depth + " is below minimum " + config.getMinDepth()));
        }

        for (TaxonomyNode node : tree.allCategories()) {
            int nodeDepth = node.getDepth();
            if (nodeDepth > config.getMaxDepth()) {
                violations.add(new DepthValidationResult.Issue(DepthValidationResult.IssueType.NODE_EXCEEDS_MAXIMUM,
                    node.getId(), node.getPathString(), nodeDepth,
                    "Category '" + node.getPathString() + "' sits at depth " + nodeDepth));
            } else if (config.isWarnApproachingMaximum() && nodeDepth == config.getMaxDepth() - 1 && !node.isLeaf()) {
                warnings.add(new DepthValidationResult.Issue(DepthValidationResult.IssueType.APPROACHING_MAXIMUM,
                    node.getId(), node.getPathString(), nodeDepth,
                    "Category '" + node.getPathString() + "' is one level from the maximum depth"));
            }
        }
        return new DepthValidationResult(depth, violations, warnings);
    }

    /**
     * Validate and react according to the configured mode.
     *
     * @return the result after any flattening
     * @throws DepthConstraintException in STRICT mode when the tree is too deep
     */
    public DepthValidationResult enforce(SharedTaxonomy taxonomy) {
        return switch (config.getMode()) {
            case STRICT -> {
                DepthValidationResult result = taxonomy.read(this::validate);
                if (!result.isValid()) {
                    throw new DepthConstraintException(result);
                }
                yield result;
            }
            case ADVISORY -> {
                DepthValidationResult result = taxonomy.read(this::validate);
                result.getViolations().forEach(v -> log.warn("Depth violation: {}", v.getMessage()));
                result.getWarnings().forEach(w -> log.info("Depth warning: {}", w.getMessage()));
                yield result;
            }
            case FLATTEN -> taxonomy.write(tree -> {
                int flattened = flatten(tree);
                if (flattened > 0) {
                    log.info("Flattened {} categories to keep depth within {}", flattened, config.getMaxDepth());
                }
                return validate(tree);
            });
        };
    }

    private int flatten(TaxonomyTree tree) {
        int flattened = 0;
        while (true) {
            Optional<TaxonomyNode> deepest = tree.allCategories().stream()
                .filter(n -> n.getDepth() > config.getMaxDepth() && isFlattenable(n))
                .max(Comparator.comparingInt(TaxonomyNode::getDepth));
            if (deepest.isEmpty()) {
                return flattened;
            }
            log.debug("Flattening {}", deepest.get().getPathString());
            tree.flattenNode(deepest.get());
            flattened++;
        }
    }

    /** Flattening moves a node's files into its parent, so both must be free of user edits. */
    private static boolean isFlattenable(TaxonomyNode node) {
        return !node.isUserEdited() && !node.getParent().map(TaxonomyNode::isUserEdited).orElse(false);
    }
}
