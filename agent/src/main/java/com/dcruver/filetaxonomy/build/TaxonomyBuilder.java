package com.dcruver.filetaxonomy.build;

import com.dcruver.filetaxonomy.domain.AssignmentSource;
import com.dcruver.filetaxonomy.domain.FileAssignment;
import com.dcruver.filetaxonomy.domain.RefinementState;
import com.dcruver.filetaxonomy.domain.ScannedFile;
import com.dcruver.filetaxonomy.domain.SharedTaxonomy;
import com.dcruver.filetaxonomy.domain.TaxonomyInferenceException;
import com.dcruver.filetaxonomy.domain.TaxonomyNode;
import com.dcruver.filetaxonomy.domain.TaxonomyPipelineException;
import com.dcruver.filetaxonomy.domain.TaxonomyTree;
import com.dcruver.filetaxonomy.gate.GuardrailViolationException;
import com.dcruver.filetaxonomy.gate.MergeSplitGatekeeper;
import com.dcruver.filetaxonomy.gate.MergeSuggestion;
import com.dcruver.filetaxonomy.gate.SplitSuggestion;
import com.dcruver.filetaxonomy.nlp.ExtractedKeywords;
import com.dcruver.filetaxonomy.nlp.FileTypeHint;
import com.dcruver.filetaxonomy.nlp.KeywordExtractor;
import com.dcruver.filetaxonomy.nlp.LlmException;
import com.dcruver.filetaxonomy.nlp.LlmJson;
import com.dcruver.filetaxonomy.nlp.LlmOptions;
import com.dcruver.filetaxonomy.nlp.LlmProvider;
import com.dcruver.filetaxonomy.nlp.SemanticThemeClusterer;
import com.dcruver.filetaxonomy.nlp.SubTheme;
import com.dcruver.filetaxonomy.nlp.ThemeCluster;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Builds a taxonomy in two phases.
 *
 * Phase 1 ({@link #buildInstant}) clusters file names by keyword and materializes the tree with no
 * model calls. Phase 2 ({@link #startRefinement}) runs in the background: it asks the LLM for
 * better category names, merges small related categories and infers sub-structure for the merged
 * ones. Structural changes go through the {@link MergeSplitGatekeeper} so user-edited categories
 * are never touched. Each step may fail on its own without stopping the pass.
 */
@Service
@Slf4j
public class TaxonomyBuilder {

    private final KeywordExtractor extractor;
    private final SemanticThemeClusterer clusterer;
    private final LlmProvider llm;
    private final ObjectMapper objectMapper;
    private final BuilderProperties config;

    private final ExecutorService refinementExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "taxonomy-refinement");
        thread.setDaemon(true);
        return thread;
    });
    private Future<?> refinement;

    public TaxonomyBuilder(KeywordExtractor extractor, SemanticThemeClusterer clusterer, LlmProvider llm,
                           ObjectMapper objectMapper, BuilderProperties config) {
        this.extractor = extractor;
        this.clusterer = clusterer;
        this.llm = llm;
        this.objectMapper = objectMapper;
        this.config = config;
    }

    public BuilderProperties getConfig() {
        return config;
    }

    // ---------------------------------------------------------------- phase 1

    /**
     * Cluster the files by name and build the initial tree.
     *
     * @throws TaxonomyInferenceException if {@code files} is empty
     */
    public TaxonomyTree buildInstant(List<ScannedFile> files, String rootName) {
        if (files == null || files.isEmpty()) {
            throw TaxonomyInferenceException.noFilesProvided();
        }
        long start = System.nanoTime();

        Map<UUID, ScannedFile> filesById = new LinkedHashMap<>();
        files.forEach(f -> filesById.putIfAbsent(f.getId(), f));

        List<ExtractedKeywords> keywords = extractor.extractAll(List.copyOf(filesById.values()));
        List<ThemeCluster> themes = clusterer.cluster(keywords);

        String name = rootName == null || rootName.isBlank() ? config.getDefaultRootName() : rootName;
        TaxonomyTree tree = new TaxonomyTree(name);
        tree.setSourceFolderName(rootName);
        tree.putMetadata(tree.getRoot(), TaxonomyNode.KIND, TaxonomyNode.KIND_ROOT);

        for (ThemeCluster theme : themes) {
            double confidence = theme.isUncategorized() ? config.getUncategorizedConfidence() : config.getThemeConfidence();
            TaxonomyNode themeNode = tree.findOrCreate(List.of(theme.getName()));
            tree.setConfidence(themeNode, confidence);
            tree.putMetadata(themeNode, TaxonomyNode.KIND,
                theme.isUncategorized() ? TaxonomyNode.KIND_UNCATEGORIZED : TaxonomyNode.KIND_THEME);

            if (theme.hasSubThemes()) {
                for (SubTheme subTheme : theme.getSubThemes()) {
                    placeSubTheme(tree, themeNode, subTheme, confidence, filesById);
                }
            } else {
                placeFiles(tree, themeNode, theme.getFiles(), confidence, filesById);
            }
        }

        log.info("Built instant taxonomy in {} ms: {} categories, {} files, {} flagged for deep analysis",
            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), tree.categoryCount(),
            tree.totalFileCount(), tree.filesNeedingDeepAnalysis().size());
        return tree;
    }

    private void placeSubTheme(TaxonomyTree tree, TaxonomyNode parent, SubTheme subTheme, double confidence,
                               Map<UUID, ScannedFile> filesById) {
        TaxonomyNode node = tree.findOrCreate(append(parent.getPath(), subTheme.getName()));
        tree.setConfidence(node, confidence);
        tree.putMetadata(node, TaxonomyNode.KIND, TaxonomyNode.KIND_SUB_THEME);
        if (subTheme.getSubThemes() != null && !subTheme.getSubThemes().isEmpty()) {
            for (SubTheme nested : subTheme.getSubThemes()) {
                placeSubTheme(tree, node, nested, confidence, filesById);
            }
        } else {
            placeFiles(tree, node, subTheme.getFiles(), confidence, filesById);
        }
    }

    /**
     * Assign files to {@code node}, fanning out into one child per file type when types are
     * separated and more than one type is present.
     */
    private void placeFiles(TaxonomyTree tree, TaxonomyNode node, List<ExtractedKeywords> files, double confidence,
                            Map<UUID, ScannedFile> filesById) {
        Map<FileTypeHint, List<ExtractedKeywords>> byType = ThemeCluster.groupByType(files);
        if (!clusterer.getConfig().isSeparateFileTypes() || byType.size() < 2) {
            files.forEach(f -> assign(tree, node, f, confidence, filesById));
            return;
        }
        for (Map.Entry<FileTypeHint, List<ExtractedKeywords>> entry : byType.entrySet()) {
            TaxonomyNode typeNode = tree.findOrCreate(append(node.getPath(), entry.getKey().getDisplayName()));
            tree.setConfidence(typeNode, confidence);
            tree.putMetadata(typeNode, TaxonomyNode.KIND, TaxonomyNode.KIND_FILE_TYPE);
            entry.getValue().forEach(f -> assign(tree, typeNode, f, confidence, filesById));
        }
    }

    private void assign(TaxonomyTree tree, TaxonomyNode node, ExtractedKeywords keywords, double confidence,
                        Map<UUID, ScannedFile> filesById) {
        ScannedFile file = filesById.get(keywords.getFileId());
        if (file == null) {
            log.warn("No scanned file for '{}', skipping", keywords.getFileName());
            return;
        }
        tree.assignFile(file, node, confidence, AssignmentSource.FILENAME,
            confidence < config.getDeepAnalysisThreshold());
    }

    // ---------------------------------------------------------------- phase 2

    /**
     * Start refinement in the background.
     *
     * @return false if a refinement is already running
     */
    public synchronized boolean startRefinement(SharedTaxonomy taxonomy, MergeSplitGatekeeper gatekeeper,
                                                Consumer<RefinementProgress> listener) {
        if (isRefining()) {
            log.warn("Refinement already in progress");
            return false;
        }
        refinement = refinementExecutor.submit(() -> {
            try {
                refine(taxonomy, gatekeeper, listener);
            } catch (TaxonomyPipelineException e) {
                log.error("Refinement aborted: {}", e.getMessage());
            }
        });
        return true;
    }

    public synchronized boolean isRefining() {
        return refinement != null && !refinement.isDone();
    }

    /**
     * Interrupt a running refinement. Steps already applied stay applied.
     */
    public synchronized void cancelRefinement() {
        if (isRefining()) {
            log.info("Cancelling refinement");
            refinement.cancel(true);
        }
    }

    /**
     * Wait for the current refinement to end.
     *
     * @return true if no refinement is running any more
     */
    public boolean awaitRefinement(Duration timeout) {
        Future<?> current;
        synchronized (this) {
            current = refinement;
        }
        if (current == null) {
            return true;
        }
        try {
            current.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (CancellationException e) {
            return true;
        } catch (ExecutionException e) {
            log.error("Refinement failed: {}", e.getCause().getMessage());
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @PreDestroy
    public void shutdown() {
        refinementExecutor.shutdownNow();
    }

    /**
     * Run the whole refinement pass on the calling thread.
     *
     * @return the last progress reported
     */
    public RefinementProgress refine(SharedTaxonomy taxonomy, MergeSplitGatekeeper gatekeeper,
                                     Consumer<RefinementProgress> listener) {
        if (!llm.isAvailable()) {
            log.warn("No LLM provider available, skipping refinement");
            return report(listener, new RefinementProgress(0, 0, null, RefinementProgress.Phase.COMPLETE));
        }
        long start = System.nanoTime();
        log.info("Starting taxonomy refinement with {}", llm.identifier());

        List<UUID> candidates = taxonomy.read(tree -> tree.allCategories().stream()
            .filter(n -> !n.isUserEdited())
            .filter(n -> !TaxonomyNode.KIND_FILE_TYPE.equals(n.getKind()))
            .filter(n -> n.getTotalFileCount() > 0)
            .map(TaxonomyNode::getId)
            .toList());

        int refined = refineNames(taxonomy, candidates, listener);

        if (!cancelled()) {
            suggestMerges(taxonomy, gatekeeper, listener);
        }

        int total = taxonomy.read(TaxonomyTree::categoryCount);
        log.info("Refinement {} in {} ms: {} categories renamed", cancelled() ? "cancelled" : "complete",
            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), refined);
        return report(listener, new RefinementProgress(total, refined, null, RefinementProgress.Phase.COMPLETE));
    }

    private int refineNames(SharedTaxonomy taxonomy, List<UUID> candidates, Consumer<RefinementProgress> listener) {
        int refined = 0;
        for (UUID id : candidates) {
            if (cancelled()) {
                log.info("Refinement cancelled after {} of {} categories", refined, candidates.size());
                break;
            }
            Optional<NamingRequest> request = taxonomy.write(tree -> tree.node(id)
                .filter(n -> !n.isUserEdited())
                .map(n -> {
                    tree.updateRefinementState(n, RefinementState.REFINING);
                    return new NamingRequest(n.getName(), n.getAllFiles().stream()
                        .limit(config.getMaxNamingSamples())
                        .map(FileAssignment::getFileName)
                        .toList());
                }));
            if (request.isEmpty()) {
                continue;
            }

            try {
                String name = cleanName(llm.complete(namingPrompt(request.get()),
                    refinementOptions().withMaxTokens(50)));
                if (name.isEmpty()) {
                    throw new LlmException("Empty name suggested");
                }
                boolean applied = taxonomy.write(tree -> tree.node(id)
                    .filter(n -> !n.isUserEdited())
                    .map(n -> {
                        if (config.isAutoApplyNames()) {
                            tree.rename(n, name);
                        } else {
                            tree.suggestName(n, name);
                        }
                        return tree.updateRefinementState(n, RefinementState.REFINED);
                    })
                    .orElse(false));
                if (applied) {
                    refined++;
                    report(listener, new RefinementProgress(candidates.size(), refined, request.get().currentName,
                        RefinementProgress.Phase.REFINING_NAMES));
                }
            } catch (LlmException e) {
                log.warn("Failed to refine category '{}': {}", request.get().currentName, e.getMessage());
                resetState(taxonomy, id);
            } catch (TaxonomyPipelineException e) {
                resetState(taxonomy, id);
                throw e;
            }

            if (!pause()) {
                break;
            }
        }
        return refined;
    }

    private void suggestMerges(SharedTaxonomy taxonomy, MergeSplitGatekeeper gatekeeper,
                               Consumer<RefinementProgress> listener) {
        List<String> candidates = taxonomy.read(tree -> tree.allCategories().stream()
            .filter(TaxonomyBuilder::isMergeable)
            .filter(n -> !TaxonomyNode.KIND_FILE_TYPE.equals(n.getKind()))
            .filter(n -> n.getTotalFileCount() < config.getMaxMergeCandidateFiles())
            .map(n -> "- " + n.getName() + " (" + n.getTotalFileCount() + " files): " + n.getAllFiles().stream()
                .limit(5)
                .map(FileAssignment::getFileName)
                .reduce((a, b) -> a + ", " + b)
                .orElse(""))
            .toList());
        if (candidates.size() < 2) {
            log.debug("Not enough merge candidates ({})", candidates.size());
            return;
        }

        int total = taxonomy.read(TaxonomyTree::categoryCount);
        report(listener, new RefinementProgress(total, 0, null, RefinementProgress.Phase.SUGGESTING_MERGES));
        log.info("Asking for merge suggestions over {} small categories", candidates.size());

        List<MergeLineParser.MergeLine> lines;
        try {
            String response = llm.complete(mergePrompt(candidates), refinementOptions().withMaxTokens(300));
            lines = MergeLineParser.parse(response, config.getMaxMergeSuggestions());
        } catch (LlmException e) {
            log.warn("Failed to get merge suggestions: {}", e.getMessage());
            return;
        }
        if (lines.isEmpty()) {
            log.info("No merges suggested");
            return;
        }

        for (MergeLineParser.MergeLine line : lines) {
            if (cancelled()) {
                return;
            }
            applyMergeLine(taxonomy, gatekeeper, line, listener);
        }
    }

    private void applyMergeLine(SharedTaxonomy taxonomy, MergeSplitGatekeeper gatekeeper,
                                MergeLineParser.MergeLine line, Consumer<RefinementProgress> listener) {
        Optional<MergeSuggestion> proposal = taxonomy.read(tree -> mergeProposal(tree, line));
        if (proposal.isEmpty()) {
            log.warn("Could not resolve enough categories for merge {} -> {}", line.getSources(), line.getMergedName());
            return;
        }

        MergeSuggestion registered = gatekeeper.suggestMerge(proposal.get());
        UUID mergedId;
        try {
            mergedId = gatekeeper.applyMergeAutomatically(registered.getId());
        } catch (GuardrailViolationException e) {
            log.warn("Merge into '{}' left for review: {}", line.getMergedName(), e.getMessage());
            return;
        } catch (TaxonomyPipelineException e) {
            log.warn("Merge into '{}' failed: {}", line.getMergedName(), e.getMessage());
            return;
        }

        taxonomy.update(tree -> tree.node(mergedId).ifPresent(n -> tree.updateRefinementState(n, RefinementState.REFINING)));
        inferSubStructure(taxonomy, gatekeeper, mergedId, listener);
        taxonomy.update(tree -> tree.node(mergedId).ifPresent(n -> {
            tree.updateRefinementState(n, RefinementState.REFINED);
            n.getChildren().forEach(c -> tree.updateRefinementState(c, RefinementState.REFINED));
        }));

        RefinementProgress progress = taxonomy.read(tree -> new RefinementProgress(tree.categoryCount(),
            (int) tree.allCategories().stream().filter(n -> n.getRefinementState() == RefinementState.REFINED).count(),
            line.getMergedName(), RefinementProgress.Phase.MERGING));
        report(listener, progress);
        log.info("Merged {} into '{}'", line.getSources(), line.getMergedName());
    }

    /**
     * Resolve the named sources to distinct, unprotected nodes. Sources nested inside another
     * source are dropped since flattening the outer one takes their files along.
     */
    private Optional<MergeSuggestion> mergeProposal(TaxonomyTree tree, MergeLineParser.MergeLine line) {
        List<TaxonomyNode> sources = new ArrayList<>();
        for (String name : line.getSources()) {
            tree.allCategories().stream()
                .filter(n -> isMergeable(n) && n.getName().equalsIgnoreCase(name))
                .filter(n -> !sources.contains(n))
                .findFirst()
                .ifPresent(sources::add);
        }
        List<TaxonomyNode> outermost = sources.stream()
            .filter(n -> sources.stream().noneMatch(other -> other != n && n.isDescendantOf(other)))
            .toList();
        if (outermost.size() < 2 || outermost.stream().mapToInt(TaxonomyNode::getTotalFileCount).sum() == 0) {
            return Optional.empty();
        }
        UUID parentId = outermost.get(0).getParent().map(TaxonomyNode::getId).orElse(tree.getRoot().getId());
        return Optional.of(MergeSuggestion.intoNew(
            outermost.stream().map(TaxonomyNode::getId).toList(),
            line.getMergedName(),
            parentId,
            true,
            "Related small categories: " + String.join(" + ", line.getSources()),
            config.getThemeConfidence()));
    }

    /**
     * A merge detaches its sources, so neither the source nor its parent may be user-edited.
     */
    private static boolean isMergeable(TaxonomyNode node) {
        return !node.isUserEdited() && !node.getParent().map(TaxonomyNode::isUserEdited).orElse(false);
    }

    private void inferSubStructure(SharedTaxonomy taxonomy, MergeSplitGatekeeper gatekeeper, UUID mergedId,
                                   Consumer<RefinementProgress> listener) {
        List<String> fileNames = taxonomy.read(tree -> tree.node(mergedId)
            .map(n -> n.getAllFiles().stream().map(FileAssignment::getFileName).toList())
            .orElse(List.of()));
        if (fileNames.size() <= config.getMinFilesForSubStructure() || cancelled()) {
            return;
        }

        String mergedName = taxonomy.read(tree -> tree.node(mergedId).map(TaxonomyNode::getName).orElse(""));
        int total = taxonomy.read(TaxonomyTree::categoryCount);
        report(listener, new RefinementProgress(total, 0, mergedName, RefinementProgress.Phase.INFERRING_STRUCTURE));

        String response;
        try {
            response = llm.completeJson(structurePrompt(fileNames), refinementOptions().withMaxTokens(500));
        } catch (LlmException e) {
            log.warn("Failed to infer sub-structure for '{}': {}", mergedName, e.getMessage());
            return;
        }

        List<SplitSuggestion.ProposedSubcategory> subcategories = parseSubcategories(response);
        if (subcategories.isEmpty()) {
            log.warn("Could not parse sub-structure for '{}', leaving files flat", mergedName);
            return;
        }

        SplitSuggestion split = gatekeeper.suggestSplit(SplitSuggestion.of(mergedId, subcategories,
            "Sub-structure of merged category '" + mergedName + "'", config.getThemeConfidence()));
        try {
            List<UUID> created = gatekeeper.applySplitAutomatically(split.getId());
            log.info("Created {} subcategories for '{}'", created.size(), mergedName);
        } catch (TaxonomyPipelineException e) {
            log.warn("Sub-structure for '{}' not applied: {}", mergedName, e.getMessage());
        }
    }

    List<SplitSuggestion.ProposedSubcategory> parseSubcategories(String response) {
        LlmJson.ParseResult parsed = LlmJson.parse(response, objectMapper);
        if (!parsed.isSuccess()) {
            return List.of();
        }
        JsonNode root = parsed.getValue();
        if (!root.has("subcategories") || !root.get("subcategories").isArray()) {
            return List.of();
        }
        List<SplitSuggestion.ProposedSubcategory> subcategories = new ArrayList<>();
        for (JsonNode entry : root.get("subcategories")) {
            String name = entry.path("name").asText("").trim();
            if (name.isEmpty() || !entry.path("files").isArray()) {
                continue;
            }
            List<String> files = new ArrayList<>();
            entry.get("files").forEach(f -> files.add(f.asText()));
            subcategories.add(new SplitSuggestion.ProposedSubcategory(name, List.copyOf(files), config.getThemeConfidence()));
        }
        return subcategories;
    }

    // ---------------------------------------------------------------- prompts

    private String namingPrompt(NamingRequest request) {
        return "Suggest a SHORT, descriptive folder name (2-4 words max) for files like these:\n"
            + String.join("\n", request.sampleFiles) + "\n\n"
            + "Current name: " + request.currentName + "\n\n"
            + "Return ONLY the suggested name, nothing else. Be concise.";
    }

    private String mergePrompt(List<String> candidates) {
        return """
            Analyze these small categories and suggest which should be merged together.

            Categories:
            %s

            Rules:
            1. Only merge categories that are semantically related
            2. Suggest a good name for the merged category
            3. Return ONLY in this exact format, one per line:
               SOURCE1 + SOURCE2 -> MERGED_NAME
            4. Maximum %d suggestions
            5. If categories shouldn't be merged, return "NO_MERGES"

            Examples:
            Card Tricks + Card Magic -> Card Magic
            Cooking + Recipes -> Cooking & Recipes
            """.formatted(String.join("\n", candidates), config.getMaxMergeSuggestions());
    }

    private String structurePrompt(List<String> fileNames) {
        return """
            Group these files into 2-4 logical subcategories:
            %s

            Return ONLY in this JSON format:
            {
              "subcategories": [
                {"name": "SubcategoryName", "files": ["file1.pdf", "file2.mp4"]}
              ]
            }
            """.formatted(String.join("\n", fileNames.stream().limit(config.getMaxStructureSamples()).toList()));
    }

    static String cleanName(String response) {
        String cleaned = response.replace("\"", "").trim();
        int newline = cleaned.indexOf('\n');
        return (newline >= 0 ? cleaned.substring(0, newline) : cleaned).trim();
    }

    // ---------------------------------------------------------------- helpers

    private LlmOptions refinementOptions() {
        return LlmOptions.defaults().withModel(config.getRefinementModel());
    }

    private void resetState(SharedTaxonomy taxonomy, UUID id) {
        taxonomy.update(tree -> tree.node(id).ifPresent(n -> tree.updateRefinementState(n, RefinementState.INITIAL)));
    }

    private static boolean cancelled() {
        return Thread.currentThread().isInterrupted();
    }

    /**
     * @return false if interrupted
     */
    private boolean pause() {
        if (config.getRefinementDelay().isZero()) {
            return true;
        }
        try {
            Thread.sleep(config.getRefinementDelay().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static RefinementProgress report(Consumer<RefinementProgress> listener, RefinementProgress progress) {
        if (listener != null) {
            try {
                listener.accept(progress);
            } catch (RuntimeException e) {
                log.warn("Refinement listener failed: {}", e.getMessage());
            }
        }
        return progress;
    }

    private static List<String> append(List<String> path, String segment) {
        List<String> extended = new ArrayList<>(path);
        extended.add(segment);
        return extended;
    }

    private record NamingRequest(String currentName, List<String> sampleFiles) {
    }
}
