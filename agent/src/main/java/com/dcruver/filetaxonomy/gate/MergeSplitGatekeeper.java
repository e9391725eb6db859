package com.dcruver.filetaxonomy.gate;

import com.dcruver.filetaxonomy.domain.FileAssignment;
import com.dcruver.filetaxonomy.domain.SharedTaxonomy;
import com.dcruver.filetaxonomy.domain.TaxonomyNode;
import com.dcruver.filetaxonomy.domain.TaxonomyPipelineException;
import com.dcruver.filetaxonomy.domain.TaxonomyTree;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Single entry point for structural merges and splits of one taxonomy.
 *
 * Every change is first recorded as a PENDING suggestion. Approval by a person
 * ({@link #approveMerge}, {@link #approveSplit}) applies it regardless of user edits. The automatic
 * paths used by refinement ({@link #applyMergeAutomatically}, {@link #applySplitAutomatically})
 * are vetoed by {@link UserEditGuardrails}; a vetoed suggestion stays pending for a human.
 * Applied and rejected suggestions never change again.
 */
@Slf4j
public class MergeSplitGatekeeper {

    private final SharedTaxonomy taxonomy;
    private final UserEditGuardrails guardrails;

    private final Map<UUID, MergeSuggestion> merges = new LinkedHashMap<>();
    private final Map<UUID, SplitSuggestion> splits = new LinkedHashMap<>();

    public MergeSplitGatekeeper(SharedTaxonomy taxonomy, UserEditGuardrails guardrails) {
        this.taxonomy = taxonomy;
        this.guardrails = guardrails;
    }

    // ---------------------------------------------------------------- registration

    public MergeSuggestion suggestMerge(MergeSuggestion suggestion) {
        GuardrailCheckResult check = taxonomy.read(tree -> guardrails.validateMerge(suggestion, tree));
        if (!check.isAllowed()) {
            log.warn("Merge suggestion {} touches protected categories: {}", suggestion.getId(), check.getReason());
        }
        MergeSuggestion pending = suggestion.withStatus(SuggestionStatus.PENDING);
        synchronized (this) {
            merges.put(pending.getId(), pending);
        }
        log.debug("Registered merge suggestion {}: {}", pending.getId(), pending.getReason());
        return pending;
    }

    public SplitSuggestion suggestSplit(SplitSuggestion suggestion) {
        GuardrailCheckResult check = taxonomy.read(tree -> guardrails.validateSplit(suggestion, tree));
        if (!check.isAllowed()) {
            log.warn("Split suggestion {} touches protected categories: {}", suggestion.getId(), check.getReason());
        }
        SplitSuggestion pending = suggestion.withStatus(SuggestionStatus.PENDING);
        synchronized (this) {
            splits.put(pending.getId(), pending);
        }
        log.debug("Registered split suggestion {}: {}", pending.getId(), pending.getReason());
        return pending;
    }

    public synchronized List<MergeSuggestion> getPendingMerges() {
        return merges.values().stream().filter(s -> s.getStatus() == SuggestionStatus.PENDING).toList();
    }

    public synchronized List<SplitSuggestion> getPendingSplits() {
        return splits.values().stream().filter(s -> s.getStatus() == SuggestionStatus.PENDING).toList();
    }

    public synchronized List<MergeSuggestion> getAllMerges() {
        return List.copyOf(merges.values());
    }

    public synchronized List<SplitSuggestion> getAllSplits() {
        return List.copyOf(splits.values());
    }

    public synchronized Optional<MergeSuggestion> getMerge(UUID id) {
        return Optional.ofNullable(merges.get(id));
    }

    public synchronized Optional<SplitSuggestion> getSplit(UUID id) {
        return Optional.ofNullable(splits.get(id));
    }

    // ---------------------------------------------------------------- human decisions

    /**
     * Apply a pending merge on a person's say-so. User edits do not block it.
     *
     * @return id of the node that received the files
     */
    public UUID approveMerge(UUID suggestionId) {
        MergeSuggestion suggestion = pendingMerge(suggestionId);
        updateMerge(suggestion.withStatus(SuggestionStatus.APPROVED));
        return applyMerge(suggestion, false);
    }

    /**
     * Apply a pending split on a person's say-so. The new subcategories count as user-created.
     *
     * @return ids of the subcategories
     */
    public List<UUID> approveSplit(UUID suggestionId) {
        SplitSuggestion suggestion = pendingSplit(suggestionId);
        updateSplit(suggestion.withStatus(SuggestionStatus.APPROVED));
        return applySplit(suggestion, false);
    }

    public void rejectMerge(UUID suggestionId) {
        MergeSuggestion suggestion = pendingMerge(suggestionId);
        updateMerge(suggestion.withStatus(SuggestionStatus.REJECTED));
        log.info("Rejected merge suggestion {}", suggestionId);
    }

    public void rejectSplit(UUID suggestionId) {
        SplitSuggestion suggestion = pendingSplit(suggestionId);
        updateSplit(suggestion.withStatus(SuggestionStatus.REJECTED));
        log.info("Rejected split suggestion {}", suggestionId);
    }

    /**
     * Forget applied and rejected suggestions.
     *
     * @return how many were removed
     */
    public synchronized int clearProcessed() {
        int before = merges.size() + splits.size();
        merges.values().removeIf(s -> s.getStatus() == SuggestionStatus.APPLIED || s.getStatus() == SuggestionStatus.REJECTED);
        splits.values().removeIf(s -> s.getStatus() == SuggestionStatus.APPLIED || s.getStatus() == SuggestionStatus.REJECTED);
        return before - merges.size() - splits.size();
    }

    // ---------------------------------------------------------------- automatic paths

    /**
     * Apply a pending merge without a person in the loop.
     *
     * @throws GuardrailViolationException if it would touch a protected category; the suggestion stays pending
     */
    public UUID applyMergeAutomatically(UUID suggestionId) {
        return applyMerge(pendingMerge(suggestionId), true);
    }

    /**
     * Apply a pending split without a person in the loop.
     *
     * @throws GuardrailViolationException if it would touch a protected category; the suggestion stays pending
     */
    public List<UUID> applySplitAutomatically(UUID suggestionId) {
        return applySplit(pendingSplit(suggestionId), true);
    }

    // ---------------------------------------------------------------- application

    private UUID applyMerge(MergeSuggestion suggestion, boolean automatic) {
        UUID targetId = taxonomy.write(tree -> {
            if (automatic) {
                GuardrailCheckResult check = guardrails.validateMerge(suggestion, tree);
                if (!check.isAllowed()) {
                    throw new GuardrailViolationException(check.getReason());
                }
            }

            List<TaxonomyNode> sources = new ArrayList<>();
            for (UUID sourceId : suggestion.getSourceIds()) {
                tree.node(sourceId).ifPresent(sources::add);
            }
            TaxonomyNode target = resolveTarget(suggestion, sources, tree);
            if (target == null) {
                rejectStale(suggestion);
                throw new TaxonomyPipelineException("Merge " + suggestion.getId() + " no longer matches the taxonomy");
            }

            for (TaxonomyNode source : sources) {
                if (source == target || target.isDescendantOf(source) && !suggestion.isFlatten()) {
                    continue;
                }
                if (suggestion.isFlatten()) {
                    for (FileAssignment file : source.getAllFiles()) {
                        tree.moveFile(file.getFileId(), target);
                    }
                    if (!target.isDescendantOf(source)) {
                        tree.detachSubtree(source);
                    }
                } else {
                    tree.mergeCategories(source, target);
                }
            }
            return target.getId();
        });

        updateMerge(suggestion.withStatus(SuggestionStatus.APPLIED));
        log.info("Applied merge {} ({}): {} categories into {}", suggestion.getId(),
            automatic ? "automatic" : "approved", suggestion.getSourceIds().size(), targetId);
        return targetId;
    }

    private TaxonomyNode resolveTarget(MergeSuggestion suggestion, List<TaxonomyNode> sources, TaxonomyTree tree) {
        if (suggestion.getTargetId() != null) {
            Optional<TaxonomyNode> target = tree.node(suggestion.getTargetId());
            return target.isPresent() && !sources.isEmpty() ? target.get() : null;
        }
        if (sources.size() < 2 || suggestion.getMergedName() == null || suggestion.getMergedName().isBlank()) {
            return null;
        }
        TaxonomyNode parent = suggestion.getParentId() != null
            ? tree.node(suggestion.getParentId()).orElse(null)
            : sources.get(0).getParent().orElse(tree.getRoot());
        if (parent == null) {
            return null;
        }
        TaxonomyNode merged = tree.addCategory(parent, suggestion.getMergedName(), false);
        tree.setConfidence(merged, suggestion.getConfidence());
        return merged;
    }

    private List<UUID> applySplit(SplitSuggestion suggestion, boolean automatic) {
        List<UUID> created = taxonomy.write(tree -> {
            if (automatic) {
                GuardrailCheckResult check = guardrails.validateSplit(suggestion, tree);
                if (!check.isAllowed()) {
                    throw new GuardrailViolationException(check.getReason());
                }
            }
            TaxonomyNode source = tree.node(suggestion.getSourceId()).orElse(null);
            if (source == null) {
                rejectStale(suggestion);
                throw new TaxonomyPipelineException("Split " + suggestion.getId() + " refers to a removed category");
            }

            List<String> names = suggestion.getProposedSubcategories().stream()
                .map(SplitSuggestion.ProposedSubcategory::getName)
                .toList();
            List<TaxonomyNode> children = tree.splitCategory(source, names, !automatic);

            List<UUID> ids = new ArrayList<>();
            for (int i = 0; i < children.size(); i++) {
                TaxonomyNode child = children.get(i);
                SplitSuggestion.ProposedSubcategory proposed = suggestion.getProposedSubcategories().get(i);
                tree.setConfidence(child, proposed.getConfidence());
                for (FileAssignment file : source.getAssignments().stream().toList()) {
                    if (matchesAny(file.getFileName(), proposed.getExemplarFiles())) {
                        tree.moveFile(file.getFileId(), child);
                    }
                }
                ids.add(child.getId());
            }
            return ids;
        });

        updateSplit(suggestion.withStatus(SuggestionStatus.APPLIED));
        log.info("Applied split {} ({}): {} subcategories", suggestion.getId(),
            automatic ? "automatic" : "approved", created.size());
        return created;
    }

    private static boolean matchesAny(String fileName, List<String> exemplars) {
        if (exemplars == null) {
            return false;
        }
        return exemplars.stream().anyMatch(e -> e != null && e.trim().equalsIgnoreCase(fileName));
    }

    private MergeSuggestion pendingMerge(UUID suggestionId) {
        MergeSuggestion suggestion = getMerge(suggestionId)
            .orElseThrow(() -> new SuggestionNotFoundException(suggestionId));
        if (suggestion.getStatus().isProcessed()) {
            throw new SuggestionAlreadyProcessedException(suggestionId, suggestion.getStatus());
        }
        return suggestion;
    }

    private SplitSuggestion pendingSplit(UUID suggestionId) {
        SplitSuggestion suggestion = getSplit(suggestionId)
            .orElseThrow(() -> new SuggestionNotFoundException(suggestionId));
        if (suggestion.getStatus().isProcessed()) {
            throw new SuggestionAlreadyProcessedException(suggestionId, suggestion.getStatus());
        }
        return suggestion;
    }

    private void rejectStale(MergeSuggestion suggestion) {
        log.warn("Merge suggestion {} is stale, rejecting it", suggestion.getId());
        updateMerge(suggestion.withStatus(SuggestionStatus.REJECTED));
    }

    private void rejectStale(SplitSuggestion suggestion) {
        log.warn("Split suggestion {} is stale, rejecting it", suggestion.getId());
        updateSplit(suggestion.withStatus(SuggestionStatus.REJECTED));
    }

    private synchronized void updateMerge(MergeSuggestion suggestion) {
        merges.put(suggestion.getId(), suggestion);
    }

    private synchronized void updateSplit(SplitSuggestion suggestion) {
        splits.put(suggestion.getId(), suggestion);
    }
}
