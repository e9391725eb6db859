package com.dcruver.filetaxonomy.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Summary figures for a taxonomy.
 */
@Value
@Builder
public class TaxonomyStatistics {
    int totalCategories;
    int leafCategories;
    int maxDepth;
    int totalFiles;
    int filesNeedingDeepAnalysis;
    int uncategorizedFiles;
    double averageConfidence;
    int userCreatedCategories;
    int userEditedCategories;
    int inferredCategories;

    public static TaxonomyStatistics of(TaxonomyTree tree) {
        List<TaxonomyNode> categories = tree.allCategories();
        List<FileAssignment> files = tree.allAssignments();
        int userCreated = (int) categories.stream().filter(TaxonomyNode::isUserCreated).count();

        return TaxonomyStatistics.builder()
            .totalCategories(categories.size())
            .leafCategories((int) categories.stream().filter(TaxonomyNode::isLeaf).count())
            .maxDepth(tree.maxDepth())
            .totalFiles(files.size())
            .filesNeedingDeepAnalysis((int) files.stream().filter(FileAssignment::isNeedsDeepAnalysis).count())
            .uncategorizedFiles(tree.uncategorizedFileCount())
            .averageConfidence(files.stream().mapToDouble(FileAssignment::getConfidence).average().orElse(0.0))
            .userCreatedCategories(userCreated)
            .userEditedCategories((int) categories.stream().filter(TaxonomyNode::isUserEdited).count())
            .inferredCategories(categories.size() - userCreated)
            .build();
    }
}
