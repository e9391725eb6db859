package com.dcruver.filetaxonomy.analysis;

import com.dcruver.filetaxonomy.domain.ScannedFile;
import com.dcruver.filetaxonomy.inspect.ContentSignal;
import com.dcruver.filetaxonomy.inspect.InspectionException;
import com.dcruver.filetaxonomy.inspect.Inspector;
import com.dcruver.filetaxonomy.nlp.LlmException;
import com.dcruver.filetaxonomy.nlp.LlmJson;
import com.dcruver.filetaxonomy.nlp.LlmOptions;
import com.dcruver.filetaxonomy.nlp.LlmProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * Content-aware categorization of single files.
 *
 * Inspects the file, asks the LLM for a category path with a confidence, and parses the JSON
 * answer. All callers share one fair semaphore so no more than {@code maxConcurrent} analyses hit
 * the model at once, however many schedulers are running.
 */
@Service
@Slf4j
public class DeepAnalyzer implements FileAnalyzer {

    private final Inspector inspector;
    private final LlmProvider llm;
    private final ObjectMapper objectMapper;
    private final DeepAnalysisProperties config;
    private final Semaphore limiter;

    public DeepAnalyzer(Inspector inspector, LlmProvider llm, ObjectMapper objectMapper, DeepAnalysisProperties config) {
        this.inspector = inspector;
        this.llm = llm;
        this.objectMapper = objectMapper;
        this.config = config;
        this.limiter = new Semaphore(Math.max(1, config.getMaxConcurrent()), true);
    }

    @Override
    public DeepAnalysisResult analyze(ScannedFile file, List<String> existingCategories) throws DeepAnalysisException {
        try {
            if (!limiter.tryAcquire(config.getPermitTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                throw new DeepAnalysisException("Timed out waiting to analyze " + file.getName());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeepAnalysisException("Interrupted while waiting to analyze " + file.getName(), e);
        }
        try {
            return analyzeWithPermit(file, existingCategories);
        } finally {
            limiter.release();
        }
    }

    /**
     * Analyze files one after another, skipping failures.
     *
     * @param progress called with (done, total) after each file; may be null
     */
    public List<DeepAnalysisResult> analyzeFiles(List<ScannedFile> files, List<String> existingCategories,
                                                 BiConsumer<Integer, Integer> progress) {
        List<DeepAnalysisResult> results = new ArrayList<>();
        int done = 0;
        for (ScannedFile file : files) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Batch analysis interrupted after {} of {} files", done, files.size());
                break;
            }
            try {
                results.add(analyze(file, existingCategories));
            } catch (DeepAnalysisException e) {
                log.error("Deep analysis failed for {}: {}", file.getName(), e.getMessage());
            }
            done++;
            if (progress != null) {
                progress.accept(done, files.size());
            }
        }
        return results;
    }

    public int availablePermits() {
        return limiter.availablePermits();
    }

    private DeepAnalysisResult analyzeWithPermit(ScannedFile file, List<String> existingCategories)
            throws DeepAnalysisException {
        Instant start = Instant.now();

        ContentSignal signal;
        try {
            signal = inspector.inspect(file);
        } catch (InspectionException e) {
            log.warn("Inspection failed for {}, using file name only: {}", file.getName(), e.getMessage());
            signal = ContentSignal.empty("unknown");
        }

        String prompt = buildPrompt(file, signal, existingCategories);
        String response;
        try {
            response = llm.completeJson(prompt, LlmOptions.defaults().withMaxTokens(500));
        } catch (LlmException e) {
            throw new DeepAnalysisException("LLM call failed for " + file.getName() + ": " + e.getMessage(), e);
        }

        LlmJson.ParseResult parsed = LlmJson.parse(response, objectMapper);
        if (!parsed.isSuccess()) {
            throw new DeepAnalysisException("Invalid response for " + file.getName() + ": " + parsed.getError());
        }
        JsonNode root = parsed.getValue();

        List<String> categoryPath = new ArrayList<>();
        if (root.has("categoryPath") && root.get("categoryPath").isArray()) {
            root.get("categoryPath").forEach(c -> {
                String segment = c.asText("").trim();
                if (!segment.isEmpty()) {
                    categoryPath.add(segment);
                }
            });
        }
        if (categoryPath.isEmpty() || !root.has("confidence") || !root.get("confidence").isNumber()) {
            throw new DeepAnalysisException("Response for " + file.getName() + " lacks categoryPath or confidence");
        }

        List<String> tags = new ArrayList<>();
        if (root.has("suggestedTags") && root.get("suggestedTags").isArray()) {
            root.get("suggestedTags").forEach(t -> tags.add(t.asText()));
        }

        double confidence = Math.max(0.0, Math.min(1.0, root.get("confidence").asDouble()));
        DeepAnalysisResult result = DeepAnalysisResult.builder()
            .fileId(file.getId())
            .categoryPath(List.copyOf(categoryPath))
            .confidence(confidence)
            .rationale(root.path("rationale").asText(""))
            .contentSummary(root.path("contentSummary").asText(""))
            .suggestedTags(List.copyOf(tags))
            .processingTime(Duration.between(start, Instant.now()))
            .provider(llm.identifier())
            .build();

        log.debug("Analyzed {} -> {} ({})", file.getName(), String.join(" / ", categoryPath), confidence);
        return result;
    }

    String buildPrompt(ScannedFile file, ContentSignal signal, List<String> existingCategories) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Categorize this file into a hierarchical category path.\n\n");
        prompt.append("FILE: ").append(file.getName()).append("\n");
        prompt.append("TYPE: ").append(file.isDirectory() ? "folder" : signal.getKind() != null ? signal.getKind() : file.getExtension()).append("\n");

        if (signal.hasText()) {
            String text = signal.getTextCue();
            if (text.length() > config.getMaxTextChars()) {
                text = text.substring(0, config.getMaxTextChars());
            }
            prompt.append("\nEXTRACTED TEXT:\n").append(text).append("\n");
        }
        if (!signal.getSceneTags().isEmpty()) {
            prompt.append("\nVISUAL TAGS: ")
                .append(String.join(", ", signal.getSceneTags().stream().limit(config.getMaxTags()).toList()))
                .append("\n");
        }
        if (!signal.getDetectedObjects().isEmpty()) {
            prompt.append("DETECTED OBJECTS: ")
                .append(String.join(", ", signal.getDetectedObjects().stream().limit(config.getMaxTags()).toList()))
                .append("\n");
        }
        if (signal.getDuration() != null) {
            prompt.append("DURATION: ").append(signal.getDuration().toSeconds()).append(" seconds\n");
        }
        if (existingCategories != null && !existingCategories.isEmpty()) {
            prompt.append("\nEXISTING CATEGORIES (prefer these when they fit):\n");
            existingCategories.stream()
                .limit(config.getMaxExistingCategories())
                .forEach(c -> prompt.append("- ").append(c).append("\n"));
        }

        prompt.append("""

            Respond with JSON only:
            {
              "categoryPath": ["Top Level", "Subcategory"],
              "confidence": 0.85,
              "rationale": "why this category fits",
              "contentSummary": "one sentence about the content",
              "suggestedTags": ["tag1", "tag2"]
            }
            """);
        return prompt.toString();
    }
}
