package com.dcruver.filetaxonomy.app;

import com.dcruver.filetaxonomy.analysis.DeepAnalysisTask;
import com.dcruver.filetaxonomy.analysis.DeepAnalysisTaskManager;
import com.dcruver.filetaxonomy.analysis.ManagerStatus;
import com.dcruver.filetaxonomy.analysis.TaskPriority;
import com.dcruver.filetaxonomy.analysis.TaskStatus;
import com.dcruver.filetaxonomy.domain.TaxonomyNode;
import com.dcruver.filetaxonomy.domain.TaxonomyStatistics;
import com.dcruver.filetaxonomy.gate.DepthValidationResult;
import com.dcruver.filetaxonomy.gate.MergeSplitGatekeeper;
import com.dcruver.filetaxonomy.gate.MergeSuggestion;
import com.dcruver.filetaxonomy.gate.SplitSuggestion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Shell commands for building and curating a file taxonomy.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class TaxonomyShellCommands {

    private final TaxonomyService taxonomyService;

    @ShellMethod(key = "build", value = "Scan a folder and build its taxonomy")
    public String build(
            @ShellOption(help = "Folder to organize") String folder,
            @ShellOption(defaultValue = ShellOption.NULL, help = "Root category name") String name) {
        log.info("Building taxonomy for {}", folder);

        try {
            TaxonomySession session = taxonomyService.buildFromDirectory(Path.of(folder), name);
            TaxonomyStatistics stats = session.getTaxonomy().read(TaxonomyStatistics::of);

            StringBuilder result = new StringBuilder();
            result.append("Taxonomy built.\n\n");
            result.append(String.format("- Categories: %d\n", stats.getTotalCategories()));
            result.append(String.format("- Files: %d\n", stats.getTotalFiles()));
            result.append(String.format("- Uncategorized: %d\n", stats.getUncategorizedFiles()));
            result.append(String.format("- Queued for deep analysis: %d\n", session.getTaskManager().getStatus().getQueued()
                + session.getTaskManager().getStatus().getRunningCount()));
            result.append(String.format("- Max depth: %d\n", stats.getMaxDepth()));
            result.append("\nRun 'tree' to see it, 'tasks' to follow deep analysis.\n");
            return result.toString();

        } catch (Exception e) {
            log.error("Build failed", e);
            return "Build failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "load", value = "Reopen the last saved taxonomy with this name")
    public String load(@ShellOption(help = "Taxonomy name") String name) {
        return taxonomyService.loadLatest(name)
            .map(s -> "Loaded '" + name + "'.\n")
            .orElse("No saved taxonomy named '" + name + "'.\n");
    }

    @ShellMethod(key = "tree", value = "Show the current taxonomy")
    public String tree(@ShellOption(defaultValue = "false", help = "List files too") boolean files) {
        try {
            return taxonomyService.requireSession().getTaxonomy().read(tree -> {
                StringBuilder sb = new StringBuilder();
                render(tree.getRoot(), 0, files, sb);
                return sb.toString();
            });
        } catch (Exception e) {
            return e.getMessage();
        }
    }

    @ShellMethod(key = "refine", value = "Run LLM refinement of names and structure in the background")
    public String refine() {
        try {
            return taxonomyService.startRefinement()
                ? "Refinement started.\n"
                : "Refinement already running.\n";
        } catch (Exception e) {
            log.error("Refinement failed to start", e);
            return "Refinement failed: " + e.getMessage();
        }
    }

    // ---------------------------------------------------------------- deep analysis

    @ShellMethod(key = "tasks", value = "Show deep analysis status")
    public String tasks(@ShellOption(defaultValue = "false", help = "List finished tasks") boolean all) {
        try {
            DeepAnalysisTaskManager manager = taxonomyService.requireSession().getTaskManager();
            ManagerStatus status = manager.getStatus();

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Deep analysis: %s%s\n", status.isRunning() ? "running" : "idle",
                status.isPaused() ? " (paused)" : ""));
            sb.append(String.format("- Queued: %d\n", status.getQueued()));
            sb.append(String.format("- Running: %d\n", status.getRunningCount()));
            sb.append(String.format("- Completed: %d, failed: %d, cancelled: %d\n",
                status.getCompleted(), status.getFailed(), status.getCancelled()));
            sb.append(String.format("- Progress: %.0f%%\n", status.getProgress() * 100));
            if (status.getEstimatedRemaining() != null) {
                sb.append(String.format("- Estimated remaining: %ds\n", status.getEstimatedRemaining().toSeconds()));
            }
            if (status.getFatalError() != null) {
                sb.append("- Stopped after error: ").append(status.getFatalError()).append("\n");
            }
            for (DeepAnalysisTask task : status.getRunningTasks()) {
                sb.append(String.format("  > %s (%s)\n", task.getFile().getName(), task.getPriority()));
            }
            if (all) {
                sb.append("\nFinished:\n");
                for (DeepAnalysisTask task : manager.getFinishedTasks()) {
                    sb.append(String.format("  %s %-9s %s%s\n", task.getId(), task.getStatus(), task.getFile().getName(),
                        task.getStatus() == TaskStatus.FAILED ? " - " + task.getError() : ""));
                }
            }
            return sb.toString();
        } catch (Exception e) {
            return e.getMessage();
        }
    }

    @ShellMethod(key = "tasks-pause", value = "Stop launching deep analysis tasks")
    public String pauseTasks() {
        taxonomyService.requireSession().getTaskManager().pause();
        return "Deep analysis paused.\n";
    }

    @ShellMethod(key = "tasks-resume", value = "Resume deep analysis")
    public String resumeTasks() {
        taxonomyService.requireSession().getTaskManager().resume();
        return "Deep analysis resumed.\n";
    }

    @ShellMethod(key = "tasks-stop", value = "Cancel running deep analysis tasks; queued ones are kept")
    public String stopTasks() {
        taxonomyService.requireSession().getTaskManager().stop();
        return "Deep analysis stopped.\n";
    }

    @ShellMethod(key = "tasks-retry", value = "Queue a failed task again")
    public String retryTask(@ShellOption(help = "Task id") String taskId) {
        try {
            DeepAnalysisTask task = taxonomyService.requireSession().getTaskManager().retryFailed(UUID.fromString(taskId));
            return String.format("Requeued %s (attempt %d).\n", task.getFile().getName(), task.getAttempt());
        } catch (Exception e) {
            return "Retry failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "requeue", value = "Queue a file for deep analysis")
    public String requeue(
            @ShellOption(help = "File id") String fileId,
            @ShellOption(defaultValue = "HIGH", help = "LOW, NORMAL, HIGH or CRITICAL") TaskPriority priority) {
        try {
            return taxonomyService.requeueFile(UUID.fromString(fileId), priority)
                .map(t -> "Queued " + t.getFile().getName() + ".\n")
                .orElse("Nothing queued.\n");
        } catch (Exception e) {
            return "Requeue failed: " + e.getMessage();
        }
    }

    // ---------------------------------------------------------------- suggestions

    @ShellMethod(key = "suggestions", value = "List pending merge and split suggestions")
    public String suggestions() {
        try {
            MergeSplitGatekeeper gatekeeper = taxonomyService.requireSession().getGatekeeper();
            List<MergeSuggestion> merges = gatekeeper.getPendingMerges();
            List<SplitSuggestion> splits = gatekeeper.getPendingSplits();
            if (merges.isEmpty() && splits.isEmpty()) {
                return "No pending suggestions.\n";
            }

            StringBuilder sb = new StringBuilder();
            for (MergeSuggestion merge : merges) {
                sb.append(String.format("merge %s: %d categories -> %s (%s)\n", merge.getId(), merge.getSourceIds().size(),
                    merge.getMergedName() != null ? merge.getMergedName() : merge.getTargetId(), merge.getReason()));
            }
            for (SplitSuggestion split : splits) {
                sb.append(String.format("split %s: into %s (%s)\n", split.getId(),
                    split.getProposedSubcategories().stream().map(SplitSuggestion.ProposedSubcategory::getName).toList(),
                    split.getReason()));
            }
            return sb.toString();
        } catch (Exception e) {
            return e.getMessage();
        }
    }

    @ShellMethod(key = "approve-merge", value = "Apply a pending merge")
    public String approveMerge(@ShellOption(help = "Suggestion id") String id) {
        try {
            UUID target = taxonomyService.requireSession().getGatekeeper().approveMerge(UUID.fromString(id));
            return "Merged into " + target + ".\n";
        } catch (Exception e) {
            log.error("Merge failed", e);
            return "Merge failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "reject-merge", value = "Reject a pending merge")
    public String rejectMerge(@ShellOption(help = "Suggestion id") String id) {
        try {
            taxonomyService.requireSession().getGatekeeper().rejectMerge(UUID.fromString(id));
            return "Rejected.\n";
        } catch (Exception e) {
            return "Reject failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "approve-split", value = "Apply a pending split")
    public String approveSplit(@ShellOption(help = "Suggestion id") String id) {
        try {
            List<UUID> created = taxonomyService.requireSession().getGatekeeper().approveSplit(UUID.fromString(id));
            return "Created " + created.size() + " subcategories.\n";
        } catch (Exception e) {
            log.error("Split failed", e);
            return "Split failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "reject-split", value = "Reject a pending split")
    public String rejectSplit(@ShellOption(help = "Suggestion id") String id) {
        try {
            taxonomyService.requireSession().getGatekeeper().rejectSplit(UUID.fromString(id));
            return "Rejected.\n";
        } catch (Exception e) {
            return "Reject failed: " + e.getMessage();
        }
    }

    // ---------------------------------------------------------------- curation

    @ShellMethod(key = "mark-edited", value = "Protect a category from automatic changes, e.g. 'Magic/Card Tricks'")
    public String markEdited(@ShellOption(help = "Category path separated by '/'") String path) {
        try {
            return taxonomyService.markUserEdited(parsePath(path))
                ? "Protected '" + path + "'.\n"
                : "No category '" + path + "'.\n";
        } catch (Exception e) {
            return e.getMessage();
        }
    }

    @ShellMethod(key = "accept-name", value = "Accept the suggested name for a category")
    public String acceptName(@ShellOption(help = "Category path separated by '/'") String path) {
        try {
            Optional<String> renamed = taxonomyService.acceptSuggestedName(parsePath(path));
            return renamed.map(n -> "Renamed to '" + n + "'.\n").orElse("No suggested name for '" + path + "'.\n");
        } catch (Exception e) {
            return e.getMessage();
        }
    }

    @ShellMethod(key = "depth-check", value = "Check the taxonomy depth against the configured bounds")
    public String depthCheck(@ShellOption(defaultValue = "false", help = "Apply the configured mode") boolean enforce) {
        try {
            DepthValidationResult result = enforce ? taxonomyService.enforceDepth() : taxonomyService.checkDepth();
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Depth %d: %s\n", result.getCurrentDepth(), result.isValid() ? "OK" : "too deep"));
            result.getViolations().forEach(v -> sb.append("  violation: ").append(v.getMessage()).append("\n"));
            result.getWarnings().forEach(w -> sb.append("  warning: ").append(w.getMessage()).append("\n"));
            return sb.toString();
        } catch (Exception e) {
            return "Depth check failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "save", value = "Save the taxonomy, task ledger and suggestions")
    public String save() {
        try {
            taxonomyService.saveSnapshot();
            return "Saved.\n";
        } catch (Exception e) {
            log.error("Save failed", e);
            return "Save failed: " + e.getMessage();
        }
    }

    private static List<String> parsePath(String path) {
        return Arrays.stream(path.split("/"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private static void render(TaxonomyNode node, int indent, boolean files, StringBuilder sb) {
        sb.append("  ".repeat(indent)).append(node.getName());
        if (node.getSuggestedName() != null) {
            sb.append(" -> ").append(node.getSuggestedName()).append("?");
        }
        sb.append(String.format(" (%d)", node.getTotalFileCount()));
        if (node.isUserEdited()) {
            sb.append(" [edited]");
        }
        sb.append("\n");
        if (files) {
            node.getAssignments().forEach(a -> sb.append("  ".repeat(indent + 1))
                .append(String.format("- %s %.2f%s\n", a.getFileName(), a.getConfidence(),
                    a.isNeedsDeepAnalysis() ? " *" : "")));
        }
        for (TaxonomyNode child : node.getChildren()) {
            render(child, indent + 1, files, sb);
        }
    }
}
