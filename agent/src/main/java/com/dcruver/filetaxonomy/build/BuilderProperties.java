package com.dcruver.filetaxonomy.build;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for {@link TaxonomyBuilder}.
 */
@Data
@ConfigurationProperties(prefix = "taxonomy.builder")
public class BuilderProperties {

    /** Files placed below this confidence are flagged for deep analysis. */
    private double deepAnalysisThreshold = 0.75;

    private double themeConfidence = 0.7;
    private double uncategorizedConfidence = 0.3;

    /** Pause between naming calls during refinement. */
    private Duration refinementDelay = Duration.ofMillis(100);

    /** Rename categories directly instead of only storing the suggestion. */
    private boolean autoApplyNames = false;

    /** Categories with fewer files than this are offered to the merge pass. */
    private int maxMergeCandidateFiles = 5;
    private int maxMergeSuggestions = 5;

    private int maxNamingSamples = 20;
    private int maxStructureSamples = 30;

    /** A merged category needs more files than this before sub-structure is inferred. */
    private int minFilesForSubStructure = 3;

    private String defaultRootName = "Files";

    /** Model override for refinement calls; the provider default when unset. */
    private String refinementModel;
}
