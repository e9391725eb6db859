package com.dcruver.filetaxonomy.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Acyclic, serializable copy of a tree. Used by repositories to persist and restore a taxonomy.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaxonomySnapshot {
    private NodeSnapshot root;
    private Instant createdAt;
    private Instant modifiedAt;
    private String sourceFolderName;
    private boolean verified;

    public static TaxonomySnapshot of(TaxonomyTree tree) {
        return new TaxonomySnapshot(NodeSnapshot.of(tree.getRoot()), tree.getCreatedAt(), tree.getModifiedAt(),
            tree.getSourceFolderName(), tree.isVerified());
    }

    public TaxonomyTree toTree() {
        TaxonomyTree tree = new TaxonomyTree(root.toNode(), createdAt);
        tree.restoreTimestamps(modifiedAt, sourceFolderName, verified);
        return tree;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NodeSnapshot {
        private UUID id;
        private String name;
        private String suggestedName;
        private double confidence;
        private boolean userCreated;
        private RefinementState refinementState;
        private Map<String, String> metadata = new LinkedHashMap<>();
        private List<FileAssignment> files = new ArrayList<>();
        private List<NodeSnapshot> children = new ArrayList<>();
        private Instant createdAt;

        static NodeSnapshot of(TaxonomyNode node) {
            return new NodeSnapshot(node.getId(), node.getName(), node.getSuggestedName(), node.getConfidence(),
                node.isUserCreated(), node.getRefinementState(), new LinkedHashMap<>(node.getMetadata()),
                new ArrayList<>(node.getAssignments()),
                node.getChildren().stream().map(NodeSnapshot::of).toList(),
                node.getCreatedAt());
        }

        TaxonomyNode toNode() {
            TaxonomyNode node = new TaxonomyNode(id, name, confidence, userCreated,
                createdAt != null ? createdAt : Instant.now());
            node.setSuggestedName(suggestedName);
            node.setRefinementState(refinementState != null ? refinementState : RefinementState.INITIAL);
            metadata.forEach(node::putMetadata);
            files.forEach(node::addAssignment);
            for (NodeSnapshot child : children) {
                node.attachChild(child.toNode());
            }
            return node;
        }
    }
}
