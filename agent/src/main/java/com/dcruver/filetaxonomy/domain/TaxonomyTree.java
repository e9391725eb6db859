package com.dcruver.filetaxonomy.domain;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The category hierarchy plus every file placement in it.
 *
 * All structural mutators live here. The tree keeps two indexes (node id and file id to owning
 * node) so lookups and reassignment cost O(depth) rather than a full walk. A file is placed in at
 * most one category at a time; every operation that moves a file removes its old assignment
 * before inserting the new one.
 *
 * The tree is not thread-safe. Concurrent callers share it through {@link SharedTaxonomy}.
 */
@Slf4j
public class TaxonomyTree {

    public static final String DEFAULT_ROOT_NAME = "Files";

    private final TaxonomyNode root;
    private final Instant createdAt;
    private Instant modifiedAt;
    private String sourceFolderName;
    private boolean verified;

    private final Map<UUID, TaxonomyNode> nodesById = new HashMap<>();
    private final Map<UUID, TaxonomyNode> nodesByFileId = new HashMap<>();

    public TaxonomyTree(String rootName) {
        this(new TaxonomyNode(UUID.randomUUID(), rootName == null || rootName.isBlank() ? DEFAULT_ROOT_NAME : rootName,
            1.0, false, Instant.now()), Instant.now());
    }

    TaxonomyTree(TaxonomyNode root, Instant createdAt) {
        this.root = root;
        this.root.putMetadata(TaxonomyNode.KIND, TaxonomyNode.KIND_ROOT);
        this.createdAt = createdAt;
        this.modifiedAt = createdAt;
        reindex();
    }

    public TaxonomyNode getRoot() {
        return root;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getModifiedAt() {
        return modifiedAt;
    }

    public String getSourceFolderName() {
        return sourceFolderName;
    }

    public void setSourceFolderName(String sourceFolderName) {
        this.sourceFolderName = sourceFolderName;
    }

    public boolean isVerified() {
        return verified;
    }

    public void setVerified(boolean verified) {
        this.verified = verified;
        touch();
    }

    // ---------------------------------------------------------------- lookup

    public Optional<TaxonomyNode> node(UUID id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    /**
     * Find the node at {@code path} without creating anything. The empty path is the root.
     */
    public Optional<TaxonomyNode> find(List<String> path) {
        TaxonomyNode current = root;
        for (String segment : path) {
            Optional<TaxonomyNode> next = current.child(segment);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    public Optional<TaxonomyNode> nodeContainingFile(UUID fileId) {
        return Optional.ofNullable(nodesByFileId.get(fileId));
    }

    public Optional<FileAssignment> assignmentFor(UUID fileId) {
        return nodeContainingFile(fileId).flatMap(node -> node.getAssignments().stream()
            .filter(a -> a.getFileId().equals(fileId))
            .findFirst());
    }

    public Optional<Double> confidenceForFile(UUID fileId) {
        return assignmentFor(fileId).map(FileAssignment::getConfidence);
    }

    public List<TaxonomyNode> allCategories() {
        return root.getAllDescendants();
    }

    public List<TaxonomyNode> allLeafCategories() {
        return allCategories().stream().filter(TaxonomyNode::isLeaf).toList();
    }

    public List<TaxonomyNode> categoriesByFileCount() {
        return allCategories().stream()
            .sorted(Comparator.comparingInt(TaxonomyNode::getTotalFileCount).reversed())
            .toList();
    }

    public List<FileAssignment> allAssignments() {
        return root.getAllFiles();
    }

    public List<FileAssignment> filesNeedingDeepAnalysis() {
        return allAssignments().stream().filter(FileAssignment::isNeedsDeepAnalysis).toList();
    }

    public int uncategorizedFileCount() {
        return allCategories().stream()
            .filter(n -> TaxonomyNode.KIND_UNCATEGORIZED.equals(n.getKind()))
            .mapToInt(TaxonomyNode::getTotalFileCount)
            .sum();
    }

    public int maxDepth() {
        return root.getMaxDepth();
    }

    public int categoryCount() {
        return nodesById.size() - 1;
    }

    public int totalFileCount() {
        return nodesByFileId.size();
    }

    // ---------------------------------------------------------------- categories

    /**
     * Return the node at {@code path}, creating every missing ancestor on the way. Idempotent.
     */
    public TaxonomyNode findOrCreate(List<String> path) {
        TaxonomyNode current = root;
        for (String segment : path) {
            Optional<TaxonomyNode> next = current.child(segment);
            current = next.isPresent() ? next.get() : addCategory(current, segment, false);
        }
        return current;
    }

    public TaxonomyNode addCategory(TaxonomyNode parent, String name, boolean userCreated) {
        requireOwned(parent);
        TaxonomyNode node = new TaxonomyNode(UUID.randomUUID(), name, parent.isRoot() ? 0.5 : parent.getConfidence(),
            userCreated, Instant.now());
        parent.attachChild(node);
        nodesById.put(node.getId(), node);
        touch();
        return node;
    }

    /**
     * Remove the category at {@code path}. Its files and children move up to its parent, so the
     * total file count is unchanged. Removing the root, or a path that does not exist, does nothing.
     */
    public boolean removeCategory(List<String> path) {
        return find(path).map(this::flattenNode).orElse(false);
    }

    public boolean renameCategory(List<String> path, String newName) {
        Optional<TaxonomyNode> node = find(path);
        node.ifPresent(n -> rename(n, newName));
        return node.isPresent();
    }

    public void rename(TaxonomyNode node, String newName) {
        requireOwned(node);
        node.setName(newName);
        node.setSuggestedName(null);
        touch();
    }

    /**
     * Move all of {@code source}'s direct files and children into {@code target}, then drop source.
     * A no-op when the two are the same node, when source is the root, or when target sits inside
     * source's subtree.
     */
    public void mergeCategories(TaxonomyNode source, TaxonomyNode target) {
        requireOwned(source);
        requireOwned(target);
        if (source == target || source.isRoot() || target.isDescendantOf(source)) {
            log.debug("Ignoring merge of {} into {}", source.getPathString(), target.getPathString());
            return;
        }
        for (FileAssignment assignment : source.takeAssignments()) {
            place(assignment.withCategoryId(target.getId()), target);
        }
        for (TaxonomyNode child : source.takeChildren()) {
            target.attachChild(child);
        }
        source.getParent().ifPresent(parent -> parent.detachChild(source));
        nodesById.remove(source.getId());
        touch();
    }

    public boolean mergeCategories(List<String> sourcePath, List<String> targetPath) {
        Optional<TaxonomyNode> source = find(sourcePath);
        Optional<TaxonomyNode> target = find(targetPath);
        if (source.isEmpty() || target.isEmpty()) {
            return false;
        }
        mergeCategories(source.get(), target.get());
        return true;
    }

    /**
     * Create {@code names} as children of the node at {@code path}. Existing children with the same
     * name are reused. Files are not moved.
     */
    public List<TaxonomyNode> splitCategory(List<String> path, List<String> names, boolean userCreated) {
        TaxonomyNode parent = find(path)
            .orElseThrow(() -> new IllegalArgumentException("No category at " + path));
        return splitCategory(parent, names, userCreated);
    }

    public List<TaxonomyNode> splitCategory(TaxonomyNode parent, List<String> names, boolean userCreated) {
        requireOwned(parent);
        List<TaxonomyNode> created = new ArrayList<>();
        for (String name : names) {
            created.add(parent.child(name).orElseGet(() -> addCategory(parent, name, userCreated)));
        }
        return created;
    }

    /**
     * Re-parent a node's children and files to its parent, then detach it. The root cannot be flattened.
     */
    public boolean flattenNode(TaxonomyNode node) {
        requireOwned(node);
        if (node.isRoot()) {
            return false;
        }
        TaxonomyNode parent = node.getParent().orElseThrow();
        for (FileAssignment assignment : node.takeAssignments()) {
            place(assignment.withCategoryId(parent.getId()), parent);
        }
        for (TaxonomyNode child : node.takeChildren()) {
            parent.attachChild(child);
        }
        parent.detachChild(node);
        nodesById.remove(node.getId());
        touch();
        return true;
    }

    /**
     * Drop a subtree that no longer holds files. Any files still inside are dropped from the tree
     * as well, so callers move them out first.
     */
    public void detachSubtree(TaxonomyNode node) {
        requireOwned(node);
        if (node.isRoot()) {
            throw new IllegalArgumentException("The root cannot be detached");
        }
        List<TaxonomyNode> removed = new ArrayList<>(node.getAllDescendants());
        removed.add(node);
        for (TaxonomyNode gone : removed) {
            nodesById.remove(gone.getId());
            for (FileAssignment assignment : gone.getAssignments()) {
                log.warn("Dropping {} with detached category {}", assignment.getFileName(), gone.getPathString());
                nodesByFileId.remove(assignment.getFileId());
            }
        }
        node.getParent().ifPresent(parent -> parent.detachChild(node));
        touch();
    }

    // ---------------------------------------------------------------- refinement bookkeeping

    public void setConfidence(TaxonomyNode node, double confidence) {
        requireOwned(node);
        node.setConfidence(confidence);
        touch();
    }

    public void putMetadata(TaxonomyNode node, String key, String value) {
        requireOwned(node);
        node.putMetadata(key, value);
    }

    /**
     * Move a node through the refinement lifecycle. A user-edited node never leaves that state.
     */
    public boolean updateRefinementState(TaxonomyNode node, RefinementState state) {
        requireOwned(node);
        if (node.isUserEdited() || state == RefinementState.USER_EDITED) {
            return false;
        }
        node.setRefinementState(state);
        return true;
    }

    public void suggestName(TaxonomyNode node, String suggestedName) {
        requireOwned(node);
        node.setSuggestedName(suggestedName);
        touch();
    }

    /**
     * Record that a person changed this node. One-way.
     */
    public void markUserEdited(TaxonomyNode node) {
        requireOwned(node);
        if (!node.isUserEdited()) {
            node.setRefinementState(RefinementState.USER_EDITED);
            touch();
        }
    }

    // ---------------------------------------------------------------- files

    /**
     * Place a file in {@code node}. If the file is already somewhere in the tree its previous
     * assignment is removed first.
     */
    public FileAssignment assignFile(ScannedFile file, TaxonomyNode node, double confidence,
                                     AssignmentSource source, boolean needsDeepAnalysis) {
        requireOwned(node);
        unplace(file.getId());
        FileAssignment assignment = FileAssignment.builder()
            .id(UUID.randomUUID())
            .fileId(file.getId())
            .categoryId(node.getId())
            .filePath(file.getPath())
            .fileName(file.getName())
            .confidence(confidence)
            .needsDeepAnalysis(needsDeepAnalysis)
            .source(source)
            .assignedAt(Instant.now())
            .build();
        place(assignment, node);
        touch();
        return assignment;
    }

    /**
     * Move a known file to the category at {@code newPath}, creating it if needed. The new
     * assignment keeps the file's id, path and name and is marked as content-derived.
     *
     * @throws IllegalArgumentException if the file is not in the tree
     */
    public FileAssignment reassignFile(UUID fileId, List<String> newPath, double confidence) {
        FileAssignment previous = assignmentFor(fileId)
            .orElseThrow(() -> new IllegalArgumentException("File " + fileId + " is not in the taxonomy"));
        TaxonomyNode target = findOrCreate(newPath);
        unplace(fileId);
        FileAssignment assignment = previous
            .withId(UUID.randomUUID())
            .withCategoryId(target.getId())
            .withConfidence(confidence)
            .withNeedsDeepAnalysis(false)
            .withSource(AssignmentSource.CONTENT)
            .withAssignedAt(Instant.now());
        place(assignment, target);
        touch();
        return assignment;
    }

    /**
     * Like {@link #reassignFile(UUID, List, double)} but also accepts files not yet in the tree.
     */
    public FileAssignment reassignFile(ScannedFile file, List<String> newPath, double confidence) {
        if (nodesByFileId.containsKey(file.getId())) {
            return reassignFile(file.getId(), newPath, confidence);
        }
        return assignFile(file, findOrCreate(newPath), confidence, AssignmentSource.CONTENT, false);
    }

    /**
     * Move a file to an existing node, keeping its assignment details.
     */
    public boolean moveFile(UUID fileId, TaxonomyNode target) {
        requireOwned(target);
        TaxonomyNode owner = nodesByFileId.get(fileId);
        if (owner == null) {
            return false;
        }
        if (owner == target) {
            return true;
        }
        owner.removeAssignment(fileId)
            .ifPresent(assignment -> place(assignment.withCategoryId(target.getId()), target));
        touch();
        return true;
    }

    private void place(FileAssignment assignment, TaxonomyNode node) {
        node.addAssignment(assignment);
        nodesByFileId.put(assignment.getFileId(), node);
    }

    private void unplace(UUID fileId) {
        TaxonomyNode owner = nodesByFileId.remove(fileId);
        if (owner != null) {
            owner.removeAssignment(fileId);
        }
    }

    private void requireOwned(TaxonomyNode node) {
        if (nodesById.get(node.getId()) != node) {
            throw new IllegalArgumentException("Node " + node.getName() + " does not belong to this taxonomy");
        }
    }

    private void reindex() {
        nodesById.clear();
        nodesByFileId.clear();
        nodesById.put(root.getId(), root);
        for (FileAssignment assignment : root.getAssignments()) {
            nodesByFileId.put(assignment.getFileId(), root);
        }
        for (TaxonomyNode node : root.getAllDescendants()) {
            nodesById.put(node.getId(), node);
            for (FileAssignment assignment : node.getAssignments()) {
                nodesByFileId.put(assignment.getFileId(), node);
            }
        }
    }

    private void touch() {
        modifiedAt = Instant.now();
    }

    void restoreTimestamps(Instant modifiedAt, String sourceFolderName, boolean verified) {
        this.modifiedAt = modifiedAt;
        this.sourceFolderName = sourceFolderName;
        this.verified = verified;
    }
}
