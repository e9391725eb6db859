package com.dcruver.filetaxonomy.app;

import com.dcruver.filetaxonomy.analysis.DeepAnalysisResult;
import com.dcruver.filetaxonomy.analysis.DeepAnalysisTask;
import com.dcruver.filetaxonomy.analysis.DeepAnalysisTaskManager;
import com.dcruver.filetaxonomy.analysis.FileAnalyzer;
import com.dcruver.filetaxonomy.analysis.TaskManagerListener;
import com.dcruver.filetaxonomy.analysis.TaskManagerProperties;
import com.dcruver.filetaxonomy.analysis.TaskPriority;
import com.dcruver.filetaxonomy.analysis.TreeRecategorizer;
import com.dcruver.filetaxonomy.build.RefinementProgress;
import com.dcruver.filetaxonomy.build.TaxonomyBuilder;
import com.dcruver.filetaxonomy.domain.FileAssignment;
import com.dcruver.filetaxonomy.domain.ScannedFile;
import com.dcruver.filetaxonomy.domain.SharedTaxonomy;
import com.dcruver.filetaxonomy.domain.TaxonomyNode;
import com.dcruver.filetaxonomy.domain.TaxonomyTree;
import com.dcruver.filetaxonomy.gate.DepthEnforcer;
import com.dcruver.filetaxonomy.gate.DepthValidationResult;
import com.dcruver.filetaxonomy.gate.MergeSplitGatekeeper;
import com.dcruver.filetaxonomy.gate.UserEditGuardrails;
import com.dcruver.filetaxonomy.persistence.TaxonomyRepository;
import com.dcruver.filetaxonomy.scan.ScanResult;
import com.dcruver.filetaxonomy.scan.Scanner;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs the whole pipeline for one folder: scan, instant build, depth enforcement, then background
 * refinement and deep analysis. Holds the taxonomy currently being worked on.
 */
@Service
@Slf4j
public class TaxonomyService {

    private final Scanner scanner;
    private final TaxonomyBuilder builder;
    private final FileAnalyzer analyzer;
    private final UserEditGuardrails guardrails;
    private final DepthEnforcer depthEnforcer;
    private final TaxonomyRepository repository;
    private final TaskManagerProperties taskManagerProperties;
    private final TaxonomyProperties properties;

    private volatile TaxonomySession session;

    public TaxonomyService(Scanner scanner, TaxonomyBuilder builder, FileAnalyzer analyzer,
                           UserEditGuardrails guardrails, DepthEnforcer depthEnforcer, TaxonomyRepository repository,
                           TaskManagerProperties taskManagerProperties, TaxonomyProperties properties) {
        this.scanner = scanner;
        this.builder = builder;
        this.analyzer = analyzer;
        this.guardrails = guardrails;
        this.depthEnforcer = depthEnforcer;
        this.repository = repository;
        this.taskManagerProperties = taskManagerProperties;
        this.properties = properties;
    }

    public Optional<TaxonomySession> currentSession() {
        return Optional.ofNullable(session);
    }

    public TaxonomySession requireSession() {
        TaxonomySession current = session;
        if (current == null) {
            throw new IllegalStateException("No taxonomy loaded. Run 'build <folder>' first.");
        }
        return current;
    }

    /**
     * Scan {@code directory} and build its taxonomy. The tree is available as soon as this
     * returns; refinement and deep analysis continue in the background when enabled.
     *
     * @throws com.dcruver.filetaxonomy.domain.TaxonomyInferenceException if the folder has no files
     * @throws com.dcruver.filetaxonomy.gate.DepthConstraintException in strict depth mode
     */
    public TaxonomySession buildFromDirectory(Path directory, String rootName) throws IOException {
        log.info("Scanning {}", directory);
        ScanResult scan = scanner.scan(directory, properties.isHierarchyAware());
        log.info("Found {} items ({} folders, {} loose files)", scan.getFiles().size(),
            scan.getFolders().size(), scan.getLooseFiles().size());

        String name = firstNonBlank(rootName, properties.getRootName(), scan.getRootName());
        TaxonomyTree tree = builder.buildInstant(scan.getFiles(), name);

        Map<UUID, ScannedFile> filesById = new LinkedHashMap<>();
        scan.getFiles().forEach(f -> filesById.put(f.getId(), f));
        TaxonomySession created = open(name, tree, filesById);

        depthEnforcer.enforce(created.getTaxonomy());
        created.getTaxonomy().read(t -> {
            repository.saveTree(name, t);
            return null;
        });

        if (properties.isAutoRefine()) {
            startRefinement();
        }
        if (properties.isAutoDeepAnalysis()) {
            enqueueDeepAnalysis();
        }
        return created;
    }

    /**
     * Reopen the most recent snapshot saved under {@code name}. Background work is not restarted.
     */
    public Optional<TaxonomySession> loadLatest(String name) {
        return repository.loadLatestTree(name).map(tree -> {
            Map<UUID, ScannedFile> filesById = new LinkedHashMap<>();
            for (FileAssignment assignment : tree.allAssignments()) {
                filesById.put(assignment.getFileId(), ScannedFile.builder()
                    .id(assignment.getFileId())
                    .name(assignment.getFileName())
                    .path(assignment.getFilePath())
                    .extension(ScannedFile.extensionOf(assignment.getFileName()))
                    .build());
            }
            log.info("Loaded taxonomy '{}' with {} files", name, filesById.size());
            return open(name, tree, filesById);
        });
    }

    public boolean startRefinement() {
        TaxonomySession current = requireSession();
        return builder.startRefinement(current.getTaxonomy(), current.getGatekeeper(), this::logProgress);
    }

    /**
     * Queue every file flagged for deep analysis. Uncategorized files go first.
     *
     * @return the number of tasks queued
     */
    public int enqueueDeepAnalysis() {
        TaxonomySession current = requireSession();
        List<DeepAnalysisTask> tasks = current.getTaxonomy().read(tree -> tree.filesNeedingDeepAnalysis().stream()
            .map(assignment -> toTask(tree, current, assignment, null))
            .filter(Objects::nonNull)
            .toList());
        return current.getTaskManager().enqueueTasks(tasks).size();
    }

    /**
     * Queue one file again, e.g. after a failed analysis or a manual edit.
     */
    public Optional<DeepAnalysisTask> requeueFile(UUID fileId, TaskPriority priority) {
        TaxonomySession current = requireSession();
        DeepAnalysisTask task = current.getTaxonomy().read(tree -> tree.assignmentFor(fileId)
            .map(assignment -> toTask(tree, current, assignment, priority))
            .orElse(null));
        if (task == null) {
            log.warn("File {} is not in the taxonomy", fileId);
            return Optional.empty();
        }
        return current.getTaskManager().enqueueTasks(List.of(task)).stream().findFirst();
    }

    /**
     * Protect the category at {@code path} from automatic change.
     */
    public boolean markUserEdited(List<String> path) {
        return requireSession().getTaxonomy().write(tree -> tree.find(path)
            .map(node -> {
                guardrails.markAsUserEdited(tree, node);
                return true;
            })
            .orElse(false));
    }

    /**
     * Apply the name suggested during refinement.
     *
     * @return the new name, if there was a suggestion to accept
     */
    public Optional<String> acceptSuggestedName(List<String> path) {
        return requireSession().getTaxonomy().write(tree -> tree.find(path)
            .filter(node -> node.getSuggestedName() != null)
            .map(node -> {
                String suggested = node.getSuggestedName();
                tree.rename(node, suggested);
                log.info("Renamed '{}' to '{}'", String.join(" / ", path), suggested);
                return suggested;
            }));
    }

    public DepthValidationResult checkDepth() {
        return requireSession().getTaxonomy().read(depthEnforcer::validate);
    }

    public DepthValidationResult enforceDepth() {
        return depthEnforcer.enforce(requireSession().getTaxonomy());
    }

    /**
     * Persist the tree, the finished tasks and all suggestions.
     */
    public void saveSnapshot() {
        TaxonomySession current = requireSession();
        current.getTaxonomy().read(tree -> {
            repository.saveTree(current.getName(), tree);
            return null;
        });
        repository.saveTaskLedger(current.getTaskManager().getFinishedTasks());
        repository.saveSuggestions(current.getGatekeeper().getAllMerges(), current.getGatekeeper().getAllSplits());
        log.info("Saved taxonomy '{}'", current.getName());
    }

    @PreDestroy
    public void shutdown() {
        close();
    }

    private synchronized TaxonomySession open(String name, TaxonomyTree tree, Map<UUID, ScannedFile> filesById) {
        close();
        SharedTaxonomy shared = new SharedTaxonomy(tree);
        MergeSplitGatekeeper gatekeeper = new MergeSplitGatekeeper(shared, guardrails);
        DeepAnalysisTaskManager taskManager = new DeepAnalysisTaskManager(analyzer,
            new TreeRecategorizer(shared, guardrails), taskManagerConfig());
        taskManager.addListener(new TaskManagerListener() {
            @Override
            public void onRecategorized(DeepAnalysisTask task, DeepAnalysisResult result) {
                log.info("Moved {} to {} ({})", task.getFile().getName(),
                    String.join(" / ", result.getCategoryPath()), result.getConfidence());
            }
        });
        session = new TaxonomySession(name, shared, gatekeeper, taskManager, Map.copyOf(filesById));
        return session;
    }

    private synchronized void close() {
        if (session != null) {
            builder.cancelRefinement();
            session.getTaskManager().shutdown();
            session = null;
        }
    }

    private TaskManagerProperties taskManagerConfig() {
        String preset = properties.getTaskManagerPreset();
        return preset != null && !preset.isBlank()
            ? TaskManagerProperties.forPreset(preset)
            : taskManagerProperties;
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return null;
    }

    private DeepAnalysisTask toTask(TaxonomyTree tree, TaxonomySession current, FileAssignment assignment,
                                    TaskPriority priority) {
        Optional<ScannedFile> file = current.file(assignment.getFileId());
        Optional<TaxonomyNode> node = tree.node(assignment.getCategoryId());
        if (file.isEmpty() || node.isEmpty()) {
            log.warn("Skipping deep analysis of {}: not found", assignment.getFileName());
            return null;
        }
        TaskPriority effective = priority != null ? priority
            : isUncategorized(node.get()) ? TaskPriority.HIGH : TaskPriority.NORMAL;
        return DeepAnalysisTask.create(file.get(), assignment.getConfidence(), node.get().getPath(), effective,
            node.get().isUserEdited());
    }

    private static boolean isUncategorized(TaxonomyNode node) {
        for (TaxonomyNode current = node; current != null; current = current.getParent().orElse(null)) {
            if (TaxonomyNode.KIND_UNCATEGORIZED.equals(current.getKind())) {
                return true;
            }
        }
        return false;
    }

    private void logProgress(RefinementProgress progress) {
        if (progress.isComplete()) {
            log.info("Refinement complete: {} of {} categories refined", progress.getRefinedCategories(),
                progress.getTotalCategories());
        } else {
            log.debug("Refinement {}: {} ({}/{})", progress.getPhase(), progress.getCurrentCategory(),
                progress.getRefinedCategories(), progress.getTotalCategories());
        }
    }
}
