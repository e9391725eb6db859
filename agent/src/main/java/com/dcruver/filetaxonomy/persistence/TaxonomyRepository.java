package com.dcruver.filetaxonomy.persistence;

import com.dcruver.filetaxonomy.analysis.DeepAnalysisTask;
import com.dcruver.filetaxonomy.domain.TaxonomyTree;
import com.dcruver.filetaxonomy.gate.MergeSuggestion;
import com.dcruver.filetaxonomy.gate.SplitSuggestion;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for taxonomies and the work done on them.
 */
public interface TaxonomyRepository {

    /**
     * Store a snapshot of the tree under {@code name}. Earlier snapshots are kept.
     */
    void saveTree(String name, TaxonomyTree tree);

    Optional<TaxonomyTree> loadLatestTree(String name);

    /**
     * Record finished tasks, replacing earlier entries with the same task id.
     */
    void saveTaskLedger(List<DeepAnalysisTask> tasks);

    List<TaskLedgerEntry> loadTaskLedger();

    void saveSuggestions(List<MergeSuggestion> merges, List<SplitSuggestion> splits);

    List<StoredSuggestion> loadSuggestions();
}
