package com.dcruver.filetaxonomy.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * A category in the taxonomy.
 *
 * Nodes are owned by a {@link TaxonomyTree}; every structural change goes through the tree so that
 * its indexes stay in step. The mutators here are therefore package-private and callers outside
 * the domain package only see read-only views.
 */
public class TaxonomyNode {

    public static final String KIND = "kind";
    public static final String KIND_ROOT = "root";
    public static final String KIND_THEME = "theme";
    public static final String KIND_SUB_THEME = "subTheme";
    public static final String KIND_FILE_TYPE = "fileType";
    public static final String KIND_UNCATEGORIZED = "uncategorized";

    private final UUID id;
    private final Instant createdAt;
    private String name;
    private String suggestedName;
    private TaxonomyNode parent;
    private final List<TaxonomyNode> children = new ArrayList<>();
    private final List<FileAssignment> assignments = new ArrayList<>();
    private double confidence;
    private boolean userCreated;
    private final Map<String, String> metadata = new LinkedHashMap<>();
    private RefinementState refinementState = RefinementState.INITIAL;

    TaxonomyNode(UUID id, String name, double confidence, boolean userCreated, Instant createdAt) {
        this.id = id;
        this.name = name;
        this.confidence = confidence;
        this.userCreated = userCreated;
        this.createdAt = createdAt;
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /**
     * Name proposed by refinement, or null when nothing has been proposed.
     */
    public String getSuggestedName() {
        return suggestedName;
    }

    public Optional<TaxonomyNode> getParent() {
        return Optional.ofNullable(parent);
    }

    public List<TaxonomyNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<FileAssignment> getAssignments() {
        return Collections.unmodifiableList(assignments);
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isUserCreated() {
        return userCreated;
    }

    public boolean isUserEdited() {
        return refinementState == RefinementState.USER_EDITED;
    }

    public Map<String, String> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public String getKind() {
        return metadata.getOrDefault(KIND, KIND_THEME);
    }

    public RefinementState getRefinementState() {
        return refinementState;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Names from the root's child down to this node. The root itself has an empty path.
     */
    public List<String> getPath() {
        LinkedList<String> path = new LinkedList<>();
        for (TaxonomyNode node = this; node.parent != null; node = node.parent) {
            path.addFirst(node.name);
        }
        return List.copyOf(path);
    }

    public String getPathString() {
        return isRoot() ? name : String.join(" / ", getPath());
    }

    public int getDepth() {
        int depth = 0;
        for (TaxonomyNode node = this; node.parent != null; node = node.parent) {
            depth++;
        }
        return depth;
    }

    /**
     * Height of the subtree below this node; a leaf is 0.
     */
    public int getMaxDepth() {
        int max = 0;
        for (TaxonomyNode child : children) {
            max = Math.max(max, child.getMaxDepth() + 1);
        }
        return max;
    }

    public int getDirectFileCount() {
        return assignments.size();
    }

    public int getTotalFileCount() {
        int total = assignments.size();
        for (TaxonomyNode child : children) {
            total += child.getTotalFileCount();
        }
        return total;
    }

    public List<TaxonomyNode> getAllDescendants() {
        List<TaxonomyNode> result = new ArrayList<>();
        for (TaxonomyNode child : children) {
            result.add(child);
            result.addAll(child.getAllDescendants());
        }
        return result;
    }

    public List<TaxonomyNode> getAllLeaves() {
        if (isLeaf()) {
            return List.of(this);
        }
        List<TaxonomyNode> leaves = new ArrayList<>();
        for (TaxonomyNode child : children) {
            leaves.addAll(child.getAllLeaves());
        }
        return leaves;
    }

    /**
     * Every assignment in this subtree, this node's own first.
     */
    public List<FileAssignment> getAllFiles() {
        List<FileAssignment> files = new ArrayList<>(assignments);
        for (TaxonomyNode child : children) {
            files.addAll(child.getAllFiles());
        }
        return files;
    }

    public Optional<TaxonomyNode> child(String childName) {
        return children.stream()
            .filter(c -> c.name.equals(childName))
            .findFirst();
    }

    public boolean isDescendantOf(TaxonomyNode other) {
        for (TaxonomyNode node = parent; node != null; node = node.parent) {
            if (node == other) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when this node or anything below it has been edited by a person.
     */
    public boolean containsUserEdits() {
        if (isUserEdited()) {
            return true;
        }
        return children.stream().anyMatch(TaxonomyNode::containsUserEdits);
    }

    // Package-private mutators, driven by TaxonomyTree

    void setName(String name) {
        this.name = name;
    }

    void setSuggestedName(String suggestedName) {
        this.suggestedName = suggestedName;
    }

    void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    void setUserCreated(boolean userCreated) {
        this.userCreated = userCreated;
    }

    void putMetadata(String key, String value) {
        metadata.put(key, value);
    }

    void setRefinementState(RefinementState refinementState) {
        this.refinementState = refinementState;
    }

    void attachChild(TaxonomyNode child) {
        child.parent = this;
        children.add(child);
    }

    void detachChild(TaxonomyNode child) {
        children.remove(child);
        child.parent = null;
    }

    void addAssignment(FileAssignment assignment) {
        assignments.add(assignment);
    }

    Optional<FileAssignment> removeAssignment(UUID fileId) {
        for (int i = 0; i < assignments.size(); i++) {
            if (assignments.get(i).getFileId().equals(fileId)) {
                return Optional.of(assignments.remove(i));
            }
        }
        return Optional.empty();
    }

    List<FileAssignment> takeAssignments() {
        List<FileAssignment> taken = new ArrayList<>(assignments);
        assignments.clear();
        return taken;
    }

    List<TaxonomyNode> takeChildren() {
        List<TaxonomyNode> taken = new ArrayList<>(children);
        for (TaxonomyNode child : taken) {
            child.parent = null;
        }
        children.clear();
        return taken;
    }

    @Override
    public String toString() {
        return "TaxonomyNode[" + getPathString() + ", files=" + getTotalFileCount() + "]";
    }
}
