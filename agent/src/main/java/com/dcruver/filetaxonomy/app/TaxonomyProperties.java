package com.dcruver.filetaxonomy.app;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Top-level switches for building a taxonomy from a directory.
 */
@Data
@ConfigurationProperties(prefix = "taxonomy")
public class TaxonomyProperties {

    /** Root category name; the scanned folder's name when unset. */
    private String rootName;

    /** Treat top-level folders as single units instead of walking into them. */
    private boolean hierarchyAware = false;

    private boolean autoRefine = true;
    private boolean autoDeepAnalysis = true;

    /** fast or quality */
    private String keywordPreset = "fast";

    /** aggressive, conservative or unset to use taxonomy.task-manager.* as configured. */
    private String taskManagerPreset;
}
