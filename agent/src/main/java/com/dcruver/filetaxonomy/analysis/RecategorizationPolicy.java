package com.dcruver.filetaxonomy.analysis;

import java.util.List;

/**
 * Decides whether a finished analysis should move its file.
 */
public final class RecategorizationPolicy {

    private RecategorizationPolicy() {
    }

    /**
     * A user-approved placement is left alone when approvals are respected. Otherwise the file
     * moves only if auto-recategorization is on, the new confidence is strictly higher, and either
     * the gain clears {@code minConfidenceImprovement} or the category itself changed.
     */
    public static boolean shouldRecategorize(DeepAnalysisTask task, DeepAnalysisResult result,
                                             TaskManagerProperties config) {
        if (config.isRespectUserApprovals() && task.isUserApproved()) {
            return false;
        }
        if (!config.isAutoRecategorize()) {
            return false;
        }
        double oldConfidence = task.getCurrentConfidence();
        double newConfidence = result.getConfidence();
        boolean confidenceImproved = newConfidence > oldConfidence + config.getMinConfidenceImprovement();
        boolean categoryChanged = !samePath(task.getCurrentCategoryPath(), result.getCategoryPath());
        return (confidenceImproved || categoryChanged) && newConfidence > oldConfidence;
    }

    static boolean samePath(List<String> a, List<String> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!a.get(i).trim().equalsIgnoreCase(b.get(i).trim())) {
                return false;
            }
        }
        return true;
    }
}
