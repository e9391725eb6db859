package com.dcruver.filetaxonomy.gate;

import com.dcruver.filetaxonomy.domain.AssignmentSource;
import com.dcruver.filetaxonomy.domain.ScannedFile;
import com.dcruver.filetaxonomy.domain.TaxonomyNode;
import com.dcruver.filetaxonomy.domain.TaxonomyTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class UserEditGuardrailsTest {

    private UserEditGuardrails guardrails;
    private TaxonomyTree tree;
    private TaxonomyNode magic;
    private TaxonomyNode cards;

    @BeforeEach
    void setUp() {
        guardrails = new UserEditGuardrails();
        tree = new TaxonomyTree("Files");
        magic = tree.findOrCreate(List.of("Magic"));
        cards = tree.findOrCreate(List.of("Magic", "Cards"));
    }

    @Test
    void testUserEditedAndUserCreatedAreProtected() {
        assertTrue(guardrails.canAutoModify(magic));

        guardrails.markAsUserEdited(tree, magic);
        TaxonomyNode created = tree.addCategory(tree.getRoot(), "Mine", true);

        assertFalse(guardrails.canAutoModify(magic));
        assertFalse(guardrails.canAutoModify(created));
        assertTrue(guardrails.canAutoModify(cards));
    }

    @Test
    void testFilesInEditedCategoriesStay() {
        ScannedFile file = ScannedFile.named("ace.pdf");
        tree.assignFile(file, cards, 0.6, AssignmentSource.FILENAME, true);
        assertTrue(guardrails.canAutoReassign(file.getId(), tree));

        guardrails.markAsUserEdited(tree, cards);

        assertFalse(guardrails.canAutoReassign(file.getId(), tree));
        assertTrue(guardrails.canAutoReassign(UUID.randomUUID(), tree));
    }

    @Test
    void testPlacementThroughEditedCategory() {
        guardrails.markAsUserEdited(tree, magic);

        assertFalse(guardrails.canAutoPlaceInto(List.of("Magic", "Coins"), tree));
        assertFalse(guardrails.canAutoPlaceInto(List.of("Magic"), tree));
        assertTrue(guardrails.canAutoPlaceInto(List.of("Cooking", "Pasta"), tree));
    }

    @Test
    void testFlatteningMergeBlockedByEditedDescendant() {
        TaxonomyNode other = tree.findOrCreate(List.of("Tricks"));
        guardrails.markAsUserEdited(tree, cards);

        GuardrailCheckResult flatten = guardrails.validateMerge(MergeSuggestion.intoNew(
            List.of(magic.getId(), other.getId()), "All Magic", tree.getRoot().getId(), true, "test", 0.7), tree);
        GuardrailCheckResult keep = guardrails.validateMerge(MergeSuggestion.intoNew(
            List.of(magic.getId(), other.getId()), "All Magic", tree.getRoot().getId(), false, "test", 0.7), tree);

        assertFalse(flatten.isAllowed());
        assertTrue(flatten.isRequiresApproval());
        assertTrue(keep.isAllowed());
        assertEquals(3, keep.getAffectedNodes().size());
    }

    @Test
    void testMergeSourceInsideEditedCategory() {
        TaxonomyNode other = tree.findOrCreate(List.of("Tricks"));
        guardrails.markAsUserEdited(tree, magic);

        assertTrue(guardrails.hasUserEditedParent(cards));
        assertFalse(guardrails.hasUserEditedParent(other));
        GuardrailCheckResult result = guardrails.validateMerge(MergeSuggestion.intoNew(
            List.of(other.getId(), cards.getId()), "Magic Stuff", tree.getRoot().getId(), true, "test", 0.7), tree);

        assertFalse(result.isAllowed());
        assertTrue(result.isRequiresApproval());
    }

    @Test
    void testProtectedMergeTarget() {
        TaxonomyNode other = tree.findOrCreate(List.of("Tricks"));
        TaxonomyNode mine = tree.addCategory(tree.getRoot(), "Mine", true);

        assertFalse(guardrails.validateMerge(
            MergeSuggestion.intoExisting(List.of(other.getId()), mine.getId(), "test", 0.7), tree).isAllowed());

        guardrails.markAsUserEdited(tree, magic);
        assertFalse(guardrails.validateMerge(MergeSuggestion.intoNew(
            List.of(cards.getId(), other.getId()), "Cards", magic.getId(), false, "test", 0.7), tree).isAllowed());
    }

    @Test
    void testSplitOfProtectedCategory() {
        SplitSuggestion split = SplitSuggestion.of(magic.getId(),
            List.of(new SplitSuggestion.ProposedSubcategory("Coins", List.of(), 0.7)), "test", 0.7);
        assertTrue(guardrails.validateSplit(split, tree).isAllowed());

        guardrails.markAsUserEdited(tree, magic);
        assertFalse(guardrails.validateSplit(split, tree).isAllowed());
    }
}
