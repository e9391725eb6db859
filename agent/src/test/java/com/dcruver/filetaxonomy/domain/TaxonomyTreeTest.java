package com.dcruver.filetaxonomy.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Structural operations on the taxonomy tree.
 */
class TaxonomyTreeTest {

    private TaxonomyTree tree;

    @BeforeEach
    void setUp() {
        tree = new TaxonomyTree("Files");
    }

    @Test
    void testFindOrCreateIsIdempotent() {
        TaxonomyNode first = tree.findOrCreate(List.of("Magic", "Cards"));
        int count = tree.categoryCount();

        TaxonomyNode second = tree.findOrCreate(List.of("Magic", "Cards"));

        assertSame(first, second);
        assertEquals(count, tree.categoryCount());
        assertEquals(2, count);
        assertEquals(List.of("Magic", "Cards"), first.getPath());
    }

    @Test
    void testAddCategoryConfidence() {
        TaxonomyNode theme = tree.addCategory(tree.getRoot(), "Magic", false);
        assertEquals(0.5, theme.getConfidence());

        tree.setConfidence(theme, 0.8);
        TaxonomyNode child = tree.addCategory(theme, "Cards", true);
        assertEquals(0.8, child.getConfidence());
        assertTrue(child.isUserCreated());
    }

    @Test
    void testReassignKeepsFileUnique() {
        ScannedFile file = ScannedFile.named("card_trick.pdf");
        TaxonomyNode magic = tree.findOrCreate(List.of("Magic"));
        tree.assignFile(file, magic, 0.6, AssignmentSource.FILENAME, true);

        FileAssignment moved = tree.reassignFile(file.getId(), List.of("Magic", "Cards"), 0.9);

        assertEquals(1, tree.totalFileCount());
        assertEquals(0, magic.getDirectFileCount());
        assertEquals(List.of("Magic", "Cards"), tree.nodeContainingFile(file.getId()).orElseThrow().getPath());
        assertEquals(file.getId(), moved.getFileId());
        assertEquals(AssignmentSource.CONTENT, moved.getSource());
        assertFalse(moved.isNeedsDeepAnalysis());
        assertEquals(0.9, tree.confidenceForFile(file.getId()).orElseThrow());
    }

    @Test
    void testAssigningAgainReplacesPreviousAssignment() {
        ScannedFile file = ScannedFile.named("notes.txt");
        TaxonomyNode a = tree.findOrCreate(List.of("A"));
        TaxonomyNode b = tree.findOrCreate(List.of("B"));

        tree.assignFile(file, a, 0.5, AssignmentSource.FILENAME, false);
        tree.assignFile(file, b, 0.5, AssignmentSource.FILENAME, false);

        assertEquals(1, tree.totalFileCount());
        assertEquals(0, a.getDirectFileCount());
        assertEquals(1, b.getDirectFileCount());
    }

    @Test
    void testReassignUnknownFileFails() {
        assertThrows(IllegalArgumentException.class,
            () -> tree.reassignFile(UUID.randomUUID(), List.of("Anywhere"), 0.5));
    }

    @Test
    void testReassignScannedFileAddsMissingFile() {
        ScannedFile file = ScannedFile.named("song.mp3");

        tree.reassignFile(file, List.of("Music"), 0.8);

        assertEquals(1, tree.totalFileCount());
        assertTrue(tree.find(List.of("Music")).isPresent());
    }

    @Test
    void testRemoveCategoryConservesFiles() {
        TaxonomyNode magic = tree.findOrCreate(List.of("Magic"));
        TaxonomyNode cards = tree.findOrCreate(List.of("Magic", "Cards"));
        TaxonomyNode coins = tree.findOrCreate(List.of("Magic", "Cards", "Coins"));
        tree.assignFile(ScannedFile.named("a.pdf"), magic, 0.5, AssignmentSource.FILENAME, false);
        tree.assignFile(ScannedFile.named("b.pdf"), cards, 0.5, AssignmentSource.FILENAME, false);
        tree.assignFile(ScannedFile.named("c.pdf"), coins, 0.5, AssignmentSource.FILENAME, false);

        assertTrue(tree.removeCategory(List.of("Magic", "Cards")));

        assertEquals(3, tree.totalFileCount());
        assertEquals(2, magic.getDirectFileCount());
        assertTrue(tree.find(List.of("Magic", "Coins")).isPresent());
        assertTrue(tree.find(List.of("Magic", "Cards")).isEmpty());
    }

    @Test
    void testRemoveMissingCategoryDoesNothing() {
        tree.findOrCreate(List.of("Magic"));
        assertFalse(tree.removeCategory(List.of("Cooking")));
        assertEquals(1, tree.categoryCount());
    }

    @Test
    void testRenameClearsSuggestion() {
        TaxonomyNode node = tree.findOrCreate(List.of("Trick"));
        tree.suggestName(node, "Magic Tricks");

        assertTrue(tree.renameCategory(List.of("Trick"), "Magic"));

        assertEquals("Magic", node.getName());
        assertNull(node.getSuggestedName());
        assertTrue(tree.find(List.of("Magic")).isPresent());
    }

    @Test
    void testMergeMovesFilesAndChildren() {
        TaxonomyNode source = tree.findOrCreate(List.of("Recipes"));
        TaxonomyNode target = tree.findOrCreate(List.of("Cooking"));
        tree.findOrCreate(List.of("Recipes", "Pasta"));
        tree.assignFile(ScannedFile.named("soup.txt"), source, 0.5, AssignmentSource.FILENAME, false);

        assertTrue(tree.mergeCategories(List.of("Recipes"), List.of("Cooking")));

        assertTrue(tree.find(List.of("Recipes")).isEmpty());
        assertEquals(1, target.getDirectFileCount());
        assertTrue(tree.find(List.of("Cooking", "Pasta")).isPresent());
    }

    @Test
    void testMergeIntoOwnDescendantIsIgnored() {
        TaxonomyNode parent = tree.findOrCreate(List.of("Magic"));
        TaxonomyNode child = tree.findOrCreate(List.of("Magic", "Cards"));

        tree.mergeCategories(parent, child);

        assertTrue(tree.find(List.of("Magic", "Cards")).isPresent());
    }

    @Test
    void testSplitReusesExistingChildren() {
        TaxonomyNode existing = tree.findOrCreate(List.of("Magic", "Cards"));

        List<TaxonomyNode> created = tree.splitCategory(List.of("Magic"), List.of("Cards", "Coins"), true);

        assertEquals(2, created.size());
        assertSame(existing, created.get(0));
        assertEquals(3, tree.categoryCount());
    }

    @Test
    void testRootCannotBeFlattened() {
        assertFalse(tree.flattenNode(tree.getRoot()));
    }

    @Test
    void testUserEditedIsOneWay() {
        TaxonomyNode node = tree.findOrCreate(List.of("Magic"));
        tree.markUserEdited(node);

        assertTrue(node.isUserEdited());
        assertFalse(tree.updateRefinementState(node, RefinementState.REFINED));
        assertTrue(node.isUserEdited());
        assertTrue(tree.getRoot().containsUserEdits());
    }

    @Test
    void testFilesNeedingDeepAnalysis() {
        TaxonomyNode node = tree.findOrCreate(List.of("Misc"));
        tree.assignFile(ScannedFile.named("a.bin"), node, 0.3, AssignmentSource.FILENAME, true);
        tree.assignFile(ScannedFile.named("b.bin"), node, 0.9, AssignmentSource.FILENAME, false);

        assertEquals(1, tree.filesNeedingDeepAnalysis().size());
        assertEquals("a.bin", tree.filesNeedingDeepAnalysis().get(0).getFileName());
    }
}
