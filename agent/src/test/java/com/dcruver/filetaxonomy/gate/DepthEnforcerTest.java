package com.dcruver.filetaxonomy.gate;

import com.dcruver.filetaxonomy.domain.AssignmentSource;
import com.dcruver.filetaxonomy.domain.ScannedFile;
import com.dcruver.filetaxonomy.domain.SharedTaxonomy;
import com.dcruver.filetaxonomy.domain.TaxonomyTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DepthEnforcerTest {

    private TaxonomyTree tree;

    @BeforeEach
    void setUp() {
        tree = new TaxonomyTree("Files");
        tree.assignFile(ScannedFile.named("b.txt"), tree.findOrCreate(List.of("A", "B")), 0.5,
            AssignmentSource.FILENAME, false);
        tree.assignFile(ScannedFile.named("c.txt"), tree.findOrCreate(List.of("A", "B", "C")), 0.5,
            AssignmentSource.FILENAME, false);
        tree.assignFile(ScannedFile.named("d.txt"), tree.findOrCreate(List.of("A", "B", "C", "D")), 0.5,
            AssignmentSource.FILENAME, false);
    }

    private static DepthEnforcer enforcer(int maxDepth, DepthProperties.Mode mode) {
        DepthProperties properties = new DepthProperties();
        properties.setMinDepth(1);
        properties.setMaxDepth(maxDepth);
        properties.setMode(mode);
        return new DepthEnforcer(properties);
    }

    @Test
    void testValidateReportsDeepCategories() {
        DepthValidationResult result = enforcer(2, DepthProperties.Mode.ADVISORY).validate(tree);

        assertEquals(4, result.getCurrentDepth());
        assertFalse(result.isValid());
        assertEquals(3, result.getViolations().size());
        assertEquals(DepthValidationResult.IssueType.EXCEEDS_MAXIMUM, result.getViolations().get(0).getType());
    }

    @Test
    void testStrictModeRejects() {
        DepthEnforcer strict = enforcer(2, DepthProperties.Mode.STRICT);
        SharedTaxonomy taxonomy = new SharedTaxonomy(tree);

        assertThrows(DepthConstraintException.class, () -> strict.enforce(taxonomy));
        assertEquals(4, tree.maxDepth());
    }

    @Test
    void testAdvisoryModeLeavesTree() {
        DepthValidationResult result = enforcer(2, DepthProperties.Mode.ADVISORY).enforce(new SharedTaxonomy(tree));

        assertFalse(result.isValid());
        assertEquals(4, tree.maxDepth());
    }

    @Test
    void testFlattenModeConservesFiles() {
        DepthValidationResult result = enforcer(2, DepthProperties.Mode.FLATTEN).enforce(new SharedTaxonomy(tree));

        assertTrue(result.isValid());
        assertEquals(2, tree.maxDepth());
        assertEquals(3, tree.totalFileCount());
        assertEquals(3, tree.find(List.of("A", "B")).orElseThrow().getDirectFileCount());
    }

    @Test
    void testFlattenSkipsUserEditedCategories() {
        new UserEditGuardrails().markAsUserEdited(tree, tree.find(List.of("A", "B", "C")).orElseThrow());

        DepthValidationResult result = enforcer(2, DepthProperties.Mode.FLATTEN).enforce(new SharedTaxonomy(tree));

        assertFalse(result.isValid());
        assertTrue(tree.find(List.of("A", "B", "C")).isPresent());
        assertTrue(tree.find(List.of("A", "B", "C", "D")).isPresent());
        assertEquals(1, tree.find(List.of("A", "B", "C")).orElseThrow().getDirectFileCount());
        assertEquals(3, tree.totalFileCount());
    }

    @Test
    void testFlattenKeepsChildrenOfUserEditedCategories() {
        new UserEditGuardrails().markAsUserEdited(tree, tree.find(List.of("A", "B")).orElseThrow());

        DepthValidationResult result = enforcer(2, DepthProperties.Mode.FLATTEN).enforce(new SharedTaxonomy(tree));

        assertFalse(result.isValid());
        assertEquals(3, tree.maxDepth());
        assertTrue(tree.find(List.of("A", "B", "C", "D")).isEmpty());
        assertEquals(1, tree.find(List.of("A", "B")).orElseThrow().getDirectFileCount());
        assertEquals(2, tree.find(List.of("A", "B", "C")).orElseThrow().getDirectFileCount());
    }

    @Test
    void testWarnings() {
        DepthProperties properties = new DepthProperties();
        properties.setMaxDepth(3);
        TaxonomyTree shallow = new TaxonomyTree("Files");
        shallow.findOrCreate(List.of("Only"));

        DepthValidationResult below = new DepthEnforcer(properties).validate(shallow);
        assertTrue(below.isValid());
        assertEquals(DepthValidationResult.IssueType.BELOW_MINIMUM, below.getWarnings().get(0).getType());

        TaxonomyTree approaching = new TaxonomyTree("Files");
        approaching.findOrCreate(List.of("A", "B", "C"));
        DepthValidationResult near = new DepthEnforcer(properties).validate(approaching);
        assertTrue(near.isValid());
        assertTrue(near.getWarnings().stream()
            .anyMatch(w -> w.getType() == DepthValidationResult.IssueType.APPROACHING_MAXIMUM
                && w.getPath().equals("A / B")));
    }
}
