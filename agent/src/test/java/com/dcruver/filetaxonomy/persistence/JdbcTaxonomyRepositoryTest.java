package com.dcruver.filetaxonomy.persistence;

import com.dcruver.filetaxonomy.analysis.DeepAnalysisResult;
import com.dcruver.filetaxonomy.analysis.DeepAnalysisTask;
import com.dcruver.filetaxonomy.analysis.TaskPriority;
import com.dcruver.filetaxonomy.analysis.TaskStatus;
import com.dcruver.filetaxonomy.domain.AssignmentSource;
import com.dcruver.filetaxonomy.domain.ScannedFile;
import com.dcruver.filetaxonomy.domain.TaxonomyNode;
import com.dcruver.filetaxonomy.domain.TaxonomyTree;
import com.dcruver.filetaxonomy.gate.MergeSuggestion;
import com.dcruver.filetaxonomy.gate.SplitSuggestion;
import com.dcruver.filetaxonomy.gate.SuggestionStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTaxonomyRepositoryTest {

    @TempDir
    Path tempDir;

    private JdbcTaxonomyRepository repository;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("taxonomy.db"));
        repository = new JdbcTaxonomyRepository(dataSource, new ObjectMapper().findAndRegisterModules());
        repository.init();
    }

    @Test
    void testLatestSnapshotWins() {
        TaxonomyTree first = new TaxonomyTree("Downloads");
        first.findOrCreate(List.of("Old"));
        repository.saveTree("downloads", first);

        TaxonomyTree second = new TaxonomyTree("Downloads");
        TaxonomyNode magic = second.findOrCreate(List.of("Magic", "Cards"));
        second.suggestName(magic, "Card Magic");
        second.markUserEdited(second.find(List.of("Magic")).orElseThrow());
        ScannedFile file = ScannedFile.named("card_trick.pdf");
        second.assignFile(file, magic, 0.65, AssignmentSource.FILENAME, true);
        repository.saveTree("downloads", second);

        TaxonomyTree loaded = repository.loadLatestTree("downloads").orElseThrow();

        assertEquals("Downloads", loaded.getRoot().getName());
        assertTrue(loaded.find(List.of("Old")).isEmpty());
        TaxonomyNode cards = loaded.find(List.of("Magic", "Cards")).orElseThrow();
        assertEquals("Card Magic", cards.getSuggestedName());
        assertEquals(magic.getId(), cards.getId());
        assertTrue(loaded.find(List.of("Magic")).orElseThrow().isUserEdited());
        assertEquals(0.65, loaded.confidenceForFile(file.getId()).orElseThrow());
        assertEquals(1, loaded.filesNeedingDeepAnalysis().size());
    }

    @Test
    void testUnknownNameLoadsNothing() {
        assertTrue(repository.loadLatestTree("missing").isEmpty());
    }

    @Test
    void testTaskLedger() {
        ScannedFile file = ScannedFile.named("card_trick.pdf");
        DeepAnalysisTask completed = DeepAnalysisTask.create(file, 0.4, List.of("Misc"), TaskPriority.HIGH, false)
            .withStatus(TaskStatus.COMPLETED)
            .withCompletedAt(Instant.ofEpochMilli(2_000))
            .withResult(DeepAnalysisResult.builder()
                .fileId(file.getId())
                .categoryPath(List.of("Magic", "Cards"))
                .confidence(0.9)
                .build());
        DeepAnalysisTask failed = DeepAnalysisTask.create(ScannedFile.named("x.bin"), 0.2, List.of("Misc"),
                TaskPriority.NORMAL, false)
            .withStatus(TaskStatus.FAILED)
            .withError("Timed out")
            .withCompletedAt(Instant.ofEpochMilli(1_000));

        repository.saveTaskLedger(List.of(completed, failed));
        repository.saveTaskLedger(List.of(completed));

        List<TaskLedgerEntry> ledger = repository.loadTaskLedger();
        assertEquals(2, ledger.size());
        TaskLedgerEntry first = ledger.get(0);
        assertEquals(TaskStatus.FAILED, first.getStatus());
        assertEquals("Timed out", first.getError());
        assertNull(first.getResultConfidence());
        assertTrue(first.getResultPath().isEmpty());

        TaskLedgerEntry second = ledger.get(1);
        assertEquals(completed.getId(), second.getTaskId());
        assertEquals(List.of("Magic", "Cards"), second.getResultPath());
        assertEquals(0.9, second.getResultConfidence());
        assertEquals(Instant.ofEpochMilli(2_000), second.getCompletedAt());
    }

    @Test
    void testSuggestions() {
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        MergeSuggestion merge = MergeSuggestion.intoNew(List.of(a, b), "Cards", null, true, "related", 0.7)
            .withStatus(SuggestionStatus.APPLIED);
        SplitSuggestion split = SplitSuggestion.of(a,
            List.of(new SplitSuggestion.ProposedSubcategory("Coins", List.of("coin.mp4"), 0.6)), "broad", 0.6);

        repository.saveSuggestions(List.of(merge), List.of(split));

        List<StoredSuggestion> stored = repository.loadSuggestions();
        assertEquals(2, stored.size());
        StoredSuggestion storedMerge = stored.stream().filter(s -> s.getId().equals(merge.getId())).findFirst().orElseThrow();
        assertEquals(StoredSuggestion.MERGE, storedMerge.getKind());
        assertEquals(SuggestionStatus.APPLIED, storedMerge.getStatus());
        assertTrue(storedMerge.getPayload().contains("Cards"));
        StoredSuggestion storedSplit = stored.stream().filter(s -> s.getId().equals(split.getId())).findFirst().orElseThrow();
        assertEquals(StoredSuggestion.SPLIT, storedSplit.getKind());
        assertEquals(SuggestionStatus.PENDING, storedSplit.getStatus());
    }
}
