package com.dcruver.filetaxonomy.analysis;

/**
 * Callbacks from {@link DeepAnalysisTaskManager}. Invoked while the manager holds its lock, so
 * implementations must return quickly and must not block.
 */
public interface TaskManagerListener {

    default void onStatusUpdate(ManagerStatus status) {
    }

    /**
     * @param error null on success, otherwise why the task failed or was cancelled
     */
    default void onTaskCompleted(DeepAnalysisTask task, String error) {
    }

    default void onRecategorized(DeepAnalysisTask task, DeepAnalysisResult result) {
    }
}
