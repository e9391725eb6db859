package com.dcruver.filetaxonomy.build;

import com.dcruver.filetaxonomy.domain.AssignmentSource;
import com.dcruver.filetaxonomy.domain.RefinementState;
import com.dcruver.filetaxonomy.domain.ScannedFile;
import com.dcruver.filetaxonomy.domain.SharedTaxonomy;
import com.dcruver.filetaxonomy.domain.TaxonomyInferenceException;
import com.dcruver.filetaxonomy.domain.TaxonomyNode;
import com.dcruver.filetaxonomy.domain.TaxonomyTree;
import com.dcruver.filetaxonomy.gate.MergeSplitGatekeeper;
import com.dcruver.filetaxonomy.gate.SplitSuggestion;
import com.dcruver.filetaxonomy.gate.SuggestionStatus;
import com.dcruver.filetaxonomy.gate.UserEditGuardrails;
import com.dcruver.filetaxonomy.nlp.ClusteringProperties;
import com.dcruver.filetaxonomy.nlp.KeywordExtractor;
import com.dcruver.filetaxonomy.nlp.LlmException;
import com.dcruver.filetaxonomy.nlp.ScriptedLlmProvider;
import com.dcruver.filetaxonomy.nlp.SemanticThemeClusterer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaxonomyBuilderTest {

    private static final List<ScannedFile> MAGIC_AND_RECIPE = List.of(
        ScannedFile.named("magic_trick_1.mp4"),
        ScannedFile.named("card_trick.pdf"),
        ScannedFile.named("recipe_pasta.txt"));

    private BuilderProperties properties;
    private ClusteringProperties clustering;
    private TaxonomyBuilder builder;
    private ScriptedLlmProvider llm;
    private String mergeAnswer = "NO_MERGES";
    private String structureAnswer = "{}";

    @BeforeEach
    void setUp() {
        properties = new BuilderProperties();
        properties.setRefinementDelay(Duration.ZERO);
        clustering = new ClusteringProperties();
        llm = new ScriptedLlmProvider(prompt -> {
            if (prompt.startsWith("Suggest a SHORT")) {
                return "\"Magic Tricks\"\nBecause the files are about tricks.";
            }
            if (prompt.contains("SOURCE1 + SOURCE2")) {
                return mergeAnswer;
            }
            return structureAnswer;
        });
        builder = newBuilder(llm);
    }

    @AfterEach
    void tearDown() {
        builder.shutdown();
    }

    private TaxonomyBuilder newBuilder(ScriptedLlmProvider provider) {
        return new TaxonomyBuilder(KeywordExtractor.fast(), new SemanticThemeClusterer(clustering), provider,
            new ObjectMapper(), properties);
    }

    @Test
    void testNoFilesIsAnError() {
        assertThrows(TaxonomyInferenceException.class, () -> builder.buildInstant(List.of(), "Empty"));
        assertThrows(TaxonomyInferenceException.class, () -> builder.buildInstant(null, "Empty"));
    }

    @Test
    void testInstantBuildSeparatesFileTypes() {
        TaxonomyTree tree = builder.buildInstant(MAGIC_AND_RECIPE, "Downloads");

        assertEquals("Downloads", tree.getRoot().getName());
        assertEquals(TaxonomyNode.KIND_ROOT, tree.getRoot().getKind());
        assertEquals(3, tree.totalFileCount());

        TaxonomyNode magic = tree.find(List.of("Magic")).orElseThrow();
        assertEquals(0.7, magic.getConfidence());
        assertEquals(2, magic.getTotalFileCount());
        assertEquals(0, magic.getDirectFileCount());
        assertEquals(TaxonomyNode.KIND_FILE_TYPE, tree.find(List.of("Magic", "Videos")).orElseThrow().getKind());
        assertEquals(1, tree.find(List.of("Magic", "Documents")).orElseThrow().getDirectFileCount());

        TaxonomyNode uncategorized = tree.find(List.of("Uncategorized")).orElseThrow();
        assertEquals(TaxonomyNode.KIND_UNCATEGORIZED, uncategorized.getKind());
        assertEquals(0.3, uncategorized.getConfidence());
        assertEquals(1, uncategorized.getDirectFileCount());
        assertEquals(1, tree.uncategorizedFileCount());
    }

    @Test
    void testLowConfidenceFilesNeedDeepAnalysis() {
        TaxonomyTree tree = builder.buildInstant(MAGIC_AND_RECIPE, "Downloads");
        assertEquals(3, tree.filesNeedingDeepAnalysis().size());
        assertTrue(tree.allAssignments().stream().allMatch(a -> a.getSource() == AssignmentSource.FILENAME));

        properties.setDeepAnalysisThreshold(0.5);
        TaxonomyTree relaxed = builder.buildInstant(MAGIC_AND_RECIPE, "Downloads");
        assertEquals(1, relaxed.filesNeedingDeepAnalysis().size());
        assertEquals("recipe_pasta.txt", relaxed.filesNeedingDeepAnalysis().get(0).getFileName());
    }

    @Test
    void testFilesStayTogetherWithoutTypeSeparation() {
        clustering.setSeparateFileTypes(false);

        TaxonomyTree tree = builder.buildInstant(MAGIC_AND_RECIPE, null);

        assertEquals("Files", tree.getRoot().getName());
        assertEquals(2, tree.find(List.of("Magic")).orElseThrow().getDirectFileCount());
        assertEquals(2, tree.categoryCount());
    }

    @Test
    void testDuplicateFilesAreCountedOnce() {
        ScannedFile file = ScannedFile.named("card_trick.pdf");
        TaxonomyTree tree = builder.buildInstant(List.of(file, file), "Cards");
        assertEquals(1, tree.totalFileCount());
    }

    @Test
    void testRefinementSuggestsNames() {
        SharedTaxonomy taxonomy = new SharedTaxonomy(builder.buildInstant(MAGIC_AND_RECIPE, "Downloads"));
        List<RefinementProgress> progress = new ArrayList<>();

        RefinementProgress last = builder.refine(taxonomy, gatekeeper(taxonomy), progress::add);

        assertTrue(last.isComplete());
        assertEquals(2, last.getRefinedCategories());
        taxonomy.read(tree -> {
            TaxonomyNode magic = tree.find(List.of("Magic")).orElseThrow();
            assertEquals("Magic Tricks", magic.getSuggestedName());
            assertEquals(RefinementState.REFINED, magic.getRefinementState());
            assertEquals(RefinementState.INITIAL,
                tree.find(List.of("Magic", "Videos")).orElseThrow().getRefinementState());
            return null;
        });
        assertTrue(progress.stream().anyMatch(p -> p.getPhase() == RefinementProgress.Phase.REFINING_NAMES));
    }

    @Test
    void testRefinementLeavesUserEditedCategoriesAlone() {
        properties.setAutoApplyNames(true);
        SharedTaxonomy taxonomy = new SharedTaxonomy(builder.buildInstant(MAGIC_AND_RECIPE, "Downloads"));
        UserEditGuardrails guardrails = new UserEditGuardrails();
        taxonomy.update(tree -> guardrails.markAsUserEdited(tree, tree.find(List.of("Magic")).orElseThrow()));

        builder.refine(taxonomy, new MergeSplitGatekeeper(taxonomy, guardrails), null);

        taxonomy.read(tree -> {
            TaxonomyNode magic = tree.find(List.of("Magic")).orElseThrow();
            assertNull(magic.getSuggestedName());
            assertTrue(magic.isUserEdited());
            assertTrue(tree.find(List.of("Magic Tricks")).isPresent());
            return null;
        });
    }

    @Test
    void testRefinementSkippedWithoutProvider() {
        llm.setAvailable(false);
        SharedTaxonomy taxonomy = new SharedTaxonomy(builder.buildInstant(MAGIC_AND_RECIPE, "Downloads"));

        RefinementProgress last = builder.refine(taxonomy, gatekeeper(taxonomy), null);

        assertTrue(last.isComplete());
        assertEquals(0, last.getTotalCategories());
        assertTrue(llm.getPrompts().isEmpty());
    }

    @Test
    void testMergeAndSubStructure() {
        ScriptedLlmProvider mergingLlm = new ScriptedLlmProvider(prompt -> {
            if (prompt.startsWith("Suggest a SHORT")) {
                throw new LlmException("model offline");
            }
            if (prompt.contains("SOURCE1 + SOURCE2")) {
                return "- Card Tricks + Card Magic -> Cards";
            }
            return """
                ```json
                {"subcategories": [
                  {"name": "Basics", "files": ["a.pdf", "b.pdf"]},
                  {"name": "Advanced", "files": ["c.pdf"]}
                ]}
                ```""";
        });
        TaxonomyBuilder mergingBuilder = newBuilder(mergingLlm);

        TaxonomyTree tree = new TaxonomyTree("Files");
        TaxonomyNode tricks = tree.findOrCreate(List.of("Card Tricks"));
        TaxonomyNode magic = tree.findOrCreate(List.of("Card Magic"));
        tree.assignFile(ScannedFile.named("a.pdf"), tricks, 0.7, AssignmentSource.FILENAME, false);
        tree.assignFile(ScannedFile.named("b.pdf"), tricks, 0.7, AssignmentSource.FILENAME, false);
        tree.assignFile(ScannedFile.named("c.pdf"), magic, 0.7, AssignmentSource.FILENAME, false);
        tree.assignFile(ScannedFile.named("d.pdf"), magic, 0.7, AssignmentSource.FILENAME, false);
        SharedTaxonomy taxonomy = new SharedTaxonomy(tree);
        MergeSplitGatekeeper gatekeeper = gatekeeper(taxonomy);
        List<RefinementProgress> progress = new ArrayList<>();

        try {
            mergingBuilder.refine(taxonomy, gatekeeper, progress::add);
        } finally {
            mergingBuilder.shutdown();
        }

        assertTrue(tree.find(List.of("Card Tricks")).isEmpty());
        assertTrue(tree.find(List.of("Card Magic")).isEmpty());
        TaxonomyNode cards = tree.find(List.of("Cards")).orElseThrow();
        assertEquals(4, cards.getTotalFileCount());
        assertEquals(1, cards.getDirectFileCount());
        assertEquals(2, tree.find(List.of("Cards", "Basics")).orElseThrow().getDirectFileCount());
        assertEquals(1, tree.find(List.of("Cards", "Advanced")).orElseThrow().getDirectFileCount());
        assertEquals(RefinementState.REFINED, cards.getRefinementState());
        assertEquals(4, tree.totalFileCount());

        assertEquals(SuggestionStatus.APPLIED, gatekeeper.getAllMerges().get(0).getStatus());
        assertEquals(SuggestionStatus.APPLIED, gatekeeper.getAllSplits().get(0).getStatus());
        List<RefinementProgress.Phase> phases = progress.stream().map(RefinementProgress::getPhase).toList();
        assertTrue(phases.contains(RefinementProgress.Phase.MERGING));
        assertTrue(phases.contains(RefinementProgress.Phase.INFERRING_STRUCTURE));
        assertEquals(RefinementProgress.Phase.COMPLETE, phases.get(phases.size() - 1));
    }

    @Test
    void testMergeKeepsChildrenOfUserEditedCategories() {
        ScriptedLlmProvider mergingLlm = new ScriptedLlmProvider(prompt -> {
            if (prompt.startsWith("Suggest a SHORT")) {
                throw new LlmException("model offline");
            }
            return "Tricks + Cards -> Magic Stuff";
        });
        TaxonomyBuilder mergingBuilder = newBuilder(mergingLlm);

        TaxonomyTree tree = new TaxonomyTree("Files");
        TaxonomyNode tricks = tree.findOrCreate(List.of("Tricks"));
        TaxonomyNode cards = tree.findOrCreate(List.of("Mine", "Cards"));
        tree.assignFile(ScannedFile.named("a.pdf"), tricks, 0.7, AssignmentSource.FILENAME, false);
        tree.assignFile(ScannedFile.named("b.pdf"), cards, 0.7, AssignmentSource.FILENAME, false);
        UserEditGuardrails guardrails = new UserEditGuardrails();
        guardrails.markAsUserEdited(tree, tree.find(List.of("Mine")).orElseThrow());
        SharedTaxonomy taxonomy = new SharedTaxonomy(tree);
        MergeSplitGatekeeper gatekeeper = new MergeSplitGatekeeper(taxonomy, guardrails);

        try {
            mergingBuilder.refine(taxonomy, gatekeeper, null);
        } finally {
            mergingBuilder.shutdown();
        }

        TaxonomyNode mine = tree.find(List.of("Mine")).orElseThrow();
        assertEquals(1, mine.getChildren().size());
        assertEquals(1, mine.getTotalFileCount());
        assertTrue(tree.find(List.of("Tricks")).isPresent());
        assertTrue(tree.find(List.of("Magic Stuff")).isEmpty());
        assertTrue(gatekeeper.getAllMerges().isEmpty());
    }

    @Test
    void testBackgroundRefinement() {
        SharedTaxonomy taxonomy = new SharedTaxonomy(builder.buildInstant(MAGIC_AND_RECIPE, "Downloads"));

        assertTrue(builder.startRefinement(taxonomy, gatekeeper(taxonomy), null));
        assertTrue(builder.awaitRefinement(Duration.ofSeconds(10)));

        assertFalse(builder.isRefining());
        assertEquals("Magic Tricks",
            taxonomy.read(tree -> tree.find(List.of("Magic")).orElseThrow().getSuggestedName()));
    }

    @Test
    void testParseSubcategories() {
        List<SplitSuggestion.ProposedSubcategory> parsed = builder.parseSubcategories(
            "{\"subcategories\": [{\"name\": \"Coins\", \"files\": [\"coin.mp4\"]}, {\"name\": \"\", \"files\": []}]}");

        assertEquals(1, parsed.size());
        assertEquals("Coins", parsed.get(0).getName());
        assertEquals(List.of("coin.mp4"), parsed.get(0).getExemplarFiles());
        assertTrue(builder.parseSubcategories("not json").isEmpty());
        assertTrue(builder.parseSubcategories("{\"groups\": []}").isEmpty());
    }

    @Test
    void testCleanName() {
        assertEquals("Magic Tricks", TaxonomyBuilder.cleanName("  \"Magic Tricks\"\nsome explanation"));
        assertEquals("", TaxonomyBuilder.cleanName("\"\""));
    }

    private static MergeSplitGatekeeper gatekeeper(SharedTaxonomy taxonomy) {
        return new MergeSplitGatekeeper(taxonomy, new UserEditGuardrails());
    }
}
