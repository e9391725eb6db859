package com.dcruver.filetaxonomy.analysis;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "taxonomy.deep-analysis")
public class DeepAnalysisProperties {

    /** Global cap on simultaneous analyzer calls, shared by every caller. */
    private int maxConcurrent = 2;

    /** How long a call may wait for one of those slots before it fails. */
    private Duration permitTimeout = Duration.ofSeconds(120);
    private int maxTextChars = 2000;
    private int maxTags = 10;
    private int maxExistingCategories = 20;
}
