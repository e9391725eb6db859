package com.dcruver.filetaxonomy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the file taxonomy shell.
 *
 * Scans a folder, builds a category tree from file names in well under a second, then refines
 * names and structure with a local LLM and re-examines low-confidence files in the background.
 * Categories a person has edited are never changed automatically.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class FileTaxonomyApplication {

    public static void main(String[] args) {
        log.info("Starting File Taxonomy...");
        SpringApplication.run(FileTaxonomyApplication.class, args);
    }
}
