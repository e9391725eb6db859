package com.dcruver.filetaxonomy.nlp;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning for {@link SemanticThemeClusterer}.
 */
@Data
@ConfigurationProperties(prefix = "taxonomy.clustering")
public class ClusteringProperties {

    private int targetThemeCount = 7;
    private boolean separateFileTypes = true;
    private int minFilesPerTheme = 3;
    private double themeSimilarityThreshold = 0.15;
    private int minFilesPerSubTheme = 2;
    private int maxDepth = 3;

    /**
     * Defaults with the theme count derived from a desired number of categories, kept within 3..15.
     */
    public static ClusteringProperties withTargetCount(int targetCategories) {
        ClusteringProperties properties = new ClusteringProperties();
        properties.setTargetThemeCount(Math.max(3, Math.min(15, targetCategories)));
        return properties;
    }
}
