package com.dcruver.filetaxonomy.config;

import com.dcruver.filetaxonomy.app.TaxonomyProperties;
import com.dcruver.filetaxonomy.nlp.ClusteringProperties;
import com.dcruver.filetaxonomy.nlp.KeywordExtractor;
import com.dcruver.filetaxonomy.nlp.SemanticThemeClusterer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Beans for the rule-based first phase, which has no Spring dependencies of its own.
 */
@Configuration
@Slf4j
public class TaxonomyConfiguration {

    @Bean
    public KeywordExtractor keywordExtractor(TaxonomyProperties properties) {
        log.info("Using '{}' keyword extraction", properties.getKeywordPreset());
        return KeywordExtractor.forPreset(properties.getKeywordPreset());
    }

    @Bean
    public SemanticThemeClusterer semanticThemeClusterer(ClusteringProperties properties) {
        return new SemanticThemeClusterer(properties);
    }
}
