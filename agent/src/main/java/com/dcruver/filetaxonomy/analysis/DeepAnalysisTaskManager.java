package com.dcruver.filetaxonomy.analysis;

import com.dcruver.filetaxonomy.domain.ScannedFile;
import com.dcruver.filetaxonomy.nlp.MalformedLlmResponseException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Background scheduler for deep-analysis tasks.
 *
 * <p>Tasks wait in a priority queue (priority descending, then current confidence ascending, then
 * arrival order). A management thread launches them onto a fixed worker pool, never running more
 * than {@code maxConcurrentTasks} at once and leaving {@code taskStartDelay} between launches. Each
 * task races its analysis against {@code taskTimeout}; the loser is cancelled. Successful results
 * may move the file, as decided by {@link RecategorizationPolicy}.</p>
 *
 * <p>{@link #pause()} lets running tasks finish but starts no new ones; {@link #stop()} cancels
 * the running tasks and keeps the queue for a later {@link #start()}. When the queue and the
 * running set are both empty the manager stops by itself. Failed tasks are never retried
 * automatically; see {@link #retryFailed(UUID)}.</p>
 *
 * <p>A {@link ManagerStatus} snapshot is pushed to listeners and to a bounded status channel on
 * every change; {@link #getStatus()} always returns the most recent one.</p>
 */
@Slf4j
public class DeepAnalysisTaskManager {

    static final Comparator<DeepAnalysisTask> QUEUE_ORDER = Comparator
        .comparingInt((DeepAnalysisTask t) -> t.getPriority().getWeight()).reversed()
        .thenComparingDouble(DeepAnalysisTask::getCurrentConfidence)
        .thenComparingLong(DeepAnalysisTask::getSequence);

    private static final double EMA_ALPHA = 0.3;

    private final FileAnalyzer analyzer;
    private final Recategorizer recategorizer;
    private final TaskManagerProperties config;

    private final Object lock = new Object();
    private final PriorityQueue<DeepAnalysisTask> queue = new PriorityQueue<>(QUEUE_ORDER);
    private final Map<UUID, RunningTask> running = new LinkedHashMap<>();
    private final Map<UUID, DeepAnalysisTask> finished = new LinkedHashMap<>();
    private final List<TaskManagerListener> listeners = new CopyOnWriteArrayList<>();
    private final BlockingQueue<ManagerStatus> statusChannel;
    private final ExecutorService workers;
    private final ScheduledExecutorService timeouts;

    private boolean started;
    private boolean paused;
    private boolean shutdown;
    private long generation;
    private long sequence;
    private long nextLaunchNanos;
    private double averageTaskMillis = -1;
    private String fatalError;
    private volatile ManagerStatus lastStatus = ManagerStatus.idle();

    public DeepAnalysisTaskManager(FileAnalyzer analyzer, Recategorizer recategorizer, TaskManagerProperties config) {
        this.analyzer = analyzer;
        this.recategorizer = recategorizer;
        this.config = config;
        this.statusChannel = new ArrayBlockingQueue<>(Math.max(1, config.getStatusChannelCapacity()));
        this.workers = Executors.newFixedThreadPool(Math.max(1, config.getMaxConcurrentTasks()),
            named("deep-analysis-worker"));
        this.timeouts = Executors.newSingleThreadScheduledExecutor(named("deep-analysis-timeout"));
    }

    public TaskManagerProperties getConfig() {
        return config;
    }

    public void addListener(TaskManagerListener listener) {
        listeners.add(listener);
    }

    public void removeListener(TaskManagerListener listener) {
        listeners.remove(listener);
    }

    // ---------------------------------------------------------------- queue

    /**
     * Queue tasks. Tasks for files that are already queued or running are ignored. Starts the
     * manager when {@code autoStart} is set.
     *
     * @return the tasks actually queued
     * @throws QueueFullException if the batch does not fit; nothing is queued then
     */
    public List<DeepAnalysisTask> enqueueTasks(List<DeepAnalysisTask> tasks) {
        synchronized (lock) {
            requireOpen();
            List<DeepAnalysisTask> accepted = enqueueLocked(tasks);
            if (!accepted.isEmpty()) {
                log.info("Queued {} deep analysis tasks ({} waiting)", accepted.size(), queue.size());
            }
            if (config.isAutoStart() && !started && !accepted.isEmpty()) {
                startLocked();
            }
            publishStatus();
            lock.notifyAll();
            return accepted;
        }
    }

    public Optional<DeepAnalysisTask> enqueue(ScannedFile file, double currentConfidence, List<String> currentPath,
                                              TaskPriority priority, boolean userApproved) {
        return enqueueTasks(List.of(DeepAnalysisTask.create(file, currentConfidence, currentPath, priority, userApproved)))
            .stream()
            .findFirst();
    }

    private List<DeepAnalysisTask> enqueueLocked(List<DeepAnalysisTask> tasks) {
        Set<UUID> active = activeFileIds();
        Map<UUID, DeepAnalysisTask> fresh = new LinkedHashMap<>();
        for (DeepAnalysisTask task : tasks) {
            if (active.contains(task.getFileId())) {
                log.debug("Skipping {}: already queued or running", task.getFile().getName());
                continue;
            }
            fresh.putIfAbsent(task.getFileId(), task);
        }
        if (queue.size() + fresh.size() > config.getMaxQueueSize()) {
            throw new QueueFullException(queue.size(), fresh.size(), config.getMaxQueueSize());
        }

        Instant now = Instant.now();
        List<DeepAnalysisTask> accepted = new ArrayList<>();
        for (DeepAnalysisTask task : fresh.values()) {
            DeepAnalysisTask queued = task
                .withStatus(TaskStatus.QUEUED)
                .withQueuedAt(now)
                .withStartedAt(null)
                .withCompletedAt(null)
                .withError(null)
                .withResult(null)
                .withSequence(sequence++);
            queue.add(queued);
            accepted.add(queued);
        }
        return accepted;
    }

    /**
     * Drop queued tasks for the given files. Running tasks are not affected.
     *
     * @return how many tasks were dropped
     */
    public int removeTasks(Collection<UUID> fileIds) {
        synchronized (lock) {
            int before = queue.size();
            queue.removeIf(t -> fileIds.contains(t.getFileId()));
            int removed = before - queue.size();
            stopIfDrained();
            publishStatus();
            lock.notifyAll();
            return removed;
        }
    }

    public int clearQueue() {
        synchronized (lock) {
            int removed = queue.size();
            queue.clear();
            log.info("Cleared {} queued tasks", removed);
            stopIfDrained();
            publishStatus();
            lock.notifyAll();
            return removed;
        }
    }

    /**
     * Cancel one queued or running task.
     *
     * @throws TaskNotFoundException if the task is neither queued nor running
     */
    public void cancelTask(UUID taskId) {
        synchronized (lock) {
            RunningTask runningTask = running.get(taskId);
            if (runningTask != null) {
                cancelRunning(runningTask, "Cancelled");
            } else {
                DeepAnalysisTask queued = queue.stream()
                    .filter(t -> t.getId().equals(taskId))
                    .findFirst()
                    .orElseThrow(() -> new TaskNotFoundException(taskId));
                queue.remove(queued);
                recordCancelled(queued, "Cancelled");
            }
            stopIfDrained();
            publishStatus();
            lock.notifyAll();
        }
    }

    public void cancelAll() {
        synchronized (lock) {
            for (RunningTask runningTask : new ArrayList<>(running.values())) {
                cancelRunning(runningTask, "Cancelled");
            }
            List<DeepAnalysisTask> queued = new ArrayList<>(queue);
            queue.clear();
            queued.forEach(t -> recordCancelled(t, "Cancelled"));
            log.info("Cancelled all deep analysis tasks");
            stopIfDrained();
            publishStatus();
            lock.notifyAll();
        }
    }

    /**
     * Queue a failed task again. This is the only way a task is retried.
     *
     * @throws TaskNotFoundException if no finished task has this id
     * @throws IllegalStateException if the task did not fail or has used up its retries
     */
    public DeepAnalysisTask retryFailed(UUID taskId) {
        synchronized (lock) {
            requireOpen();
            DeepAnalysisTask failed = finished.get(taskId);
            if (failed == null) {
                throw new TaskNotFoundException(taskId);
            }
            if (failed.getStatus() != TaskStatus.FAILED) {
                throw new IllegalStateException("Task " + taskId + " is " + failed.getStatus() + ", not FAILED");
            }
            if (failed.getAttempt() > config.getMaxRetries()) {
                throw new IllegalStateException("Task " + taskId + " has used all " + config.getMaxRetries() + " retries");
            }
            finished.remove(taskId);
            List<DeepAnalysisTask> accepted = enqueueLocked(List.of(failed.withAttempt(failed.getAttempt() + 1)));
            if (config.isAutoStart() && !started && !accepted.isEmpty()) {
                startLocked();
            }
            publishStatus();
            lock.notifyAll();
            return accepted.isEmpty() ? failed : accepted.get(0);
        }
    }

    // ---------------------------------------------------------------- lifecycle

    public void start() {
        synchronized (lock) {
            requireOpen();
            startLocked();
            publishStatus();
            lock.notifyAll();
        }
    }

    /**
     * Stop launching tasks; running ones finish normally.
     */
    public void pause() {
        synchronized (lock) {
            if (!started || paused) {
                return;
            }
            paused = true;
            log.info("Deep analysis paused ({} running, {} queued)", running.size(), queue.size());
            publishStatus();
        }
    }

    public void resume() {
        synchronized (lock) {
            requireOpen();
            paused = false;
            if (!started && !queue.isEmpty()) {
                startLocked();
            }
            log.info("Deep analysis resumed");
            publishStatus();
            lock.notifyAll();
        }
    }

    /**
     * Cancel running tasks and stop. Queued tasks stay queued.
     */
    public void stop() {
        synchronized (lock) {
            stopLocked("Stopped");
            publishStatus();
            lock.notifyAll();
        }
    }

    /**
     * Stop and release the worker threads. The manager cannot be restarted.
     */
    public void shutdown() {
        synchronized (lock) {
            stopLocked("Shut down");
            shutdown = true;
            publishStatus();
            lock.notifyAll();
        }
        workers.shutdownNow();
        timeouts.shutdownNow();
    }

    public boolean isRunning() {
        synchronized (lock) {
            return started;
        }
    }

    public boolean isPaused() {
        synchronized (lock) {
            return paused;
        }
    }

    // ---------------------------------------------------------------- status

    public ManagerStatus getStatus() {
        return lastStatus;
    }

    /**
     * Take the next status snapshot from the channel, waiting up to {@code timeout}. When nobody
     * drains the channel the oldest snapshots are discarded.
     */
    public ManagerStatus pollStatus(Duration timeout) throws InterruptedException {
        return statusChannel.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public List<DeepAnalysisTask> getQueuedTasks() {
        synchronized (lock) {
            return queue.stream().sorted(QUEUE_ORDER).toList();
        }
    }

    public List<DeepAnalysisTask> getRunningTasks() {
        synchronized (lock) {
            return running.values().stream().map(r -> r.task).toList();
        }
    }

    public List<DeepAnalysisTask> getFinishedTasks() {
        synchronized (lock) {
            return List.copyOf(finished.values());
        }
    }

    public Optional<DeepAnalysisTask> getTask(UUID taskId) {
        synchronized (lock) {
            RunningTask runningTask = running.get(taskId);
            if (runningTask != null) {
                return Optional.of(runningTask.task);
            }
            if (finished.containsKey(taskId)) {
                return Optional.of(finished.get(taskId));
            }
            return queue.stream().filter(t -> t.getId().equals(taskId)).findFirst();
        }
    }

    // ---------------------------------------------------------------- internals

    private void startLocked() {
        if (started) {
            return;
        }
        started = true;
        paused = false;
        fatalError = null;
        long loopGeneration = ++generation;
        Thread loop = new Thread(() -> runLoop(loopGeneration), "deep-analysis-manager");
        loop.setDaemon(true);
        loop.start();
        log.info("Deep analysis started ({} queued, max {} concurrent)", queue.size(), config.getMaxConcurrentTasks());
    }

    private void runLoop(long loopGeneration) {
        synchronized (lock) {
            try {
                while (started && generation == loopGeneration && !shutdown) {
                    if (stopIfDrained()) {
                        publishStatus();
                        return;
                    }
                    if (paused || queue.isEmpty() || running.size() >= config.getMaxConcurrentTasks()) {
                        lock.wait();
                        continue;
                    }
                    long waitNanos = nextLaunchNanos - System.nanoTime();
                    if (waitNanos > 0) {
                        lock.wait(Math.max(1, TimeUnit.NANOSECONDS.toMillis(waitNanos)));
                        continue;
                    }
                    launch(queue.poll());
                    nextLaunchNanos = System.nanoTime() + config.getTaskStartDelay().toNanos();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Deep analysis management loop interrupted");
            }
        }
    }

    private void launch(DeepAnalysisTask queued) {
        DeepAnalysisTask task = queued.withStatus(TaskStatus.RUNNING).withStartedAt(Instant.now());
        List<String> context = existingCategories();
        CompletableFuture<DeepAnalysisResult> race = new CompletableFuture<>();
        RunningTask runningTask = new RunningTask(task, race);
        running.put(task.getId(), runningTask);

        race.whenComplete((result, error) -> onFinished(task.getId(), result, error));
        runningTask.work = workers.submit(() -> {
            if (race.isDone()) {
                return;
            }
            // The clock starts here: a worker still stuck in an earlier call may delay this one
            Future<?> timeout = timeouts.schedule(
                () -> race.completeExceptionally(new TimeoutException(
                    "Timed out after " + config.getTaskTimeout().toMillis() + " ms")),
                config.getTaskTimeout().toMillis(), TimeUnit.MILLISECONDS);
            runningTask.timeout = timeout;
            try {
                race.complete(analyzer.analyze(task.getFile(), context));
            } catch (Throwable e) {
                race.completeExceptionally(e);
            } finally {
                timeout.cancel(false);
            }
        });

        log.debug("Launched deep analysis of {} (priority {}, confidence {})",
            task.getFile().getName(), task.getPriority(), task.getCurrentConfidence());
        publishStatus();
    }

    private void onFinished(UUID taskId, DeepAnalysisResult result, Throwable error) {
        Throwable cause = unwrap(error);
        DeepAnalysisTask task;
        boolean recategorize = false;
        synchronized (lock) {
            RunningTask runningTask = running.get(taskId);
            if (runningTask == null) {
                return;
            }
            task = runningTask.task;
            if (cause == null) {
                recategorize = RecategorizationPolicy.shouldRecategorize(task, result, config);
            }
        }

        // The tree has its own lock; never take it while holding ours
        boolean moved = false;
        if (recategorize) {
            try {
                moved = recategorizer.recategorize(task, result);
            } catch (RuntimeException e) {
                log.error("Failed to recategorize {}: {}", task.getFile().getName(), e.getMessage());
            }
        }

        synchronized (lock) {
            RunningTask runningTask = running.remove(taskId);
            if (runningTask == null) {
                if (moved) {
                    // Cancelled while the file was being moved; the move stands
                    DeepAnalysisTask done = task.withStatus(TaskStatus.COMPLETED).withCompletedAt(Instant.now())
                        .withResult(result);
                    finished.put(taskId, done);
                    log.info("Deep analysis of {} completed before it could be cancelled", task.getFile().getName());
                    notifyListeners(l -> l.onRecategorized(done, result));
                    notifyListeners(l -> l.onTaskCompleted(done, null));
                    publishStatus();
                }
                return;
            }
            if (runningTask.timeout != null) {
                runningTask.timeout.cancel(false);
            }
            Instant now = Instant.now();
            recordDuration(Duration.between(runningTask.task.getStartedAt(), now));

            final DeepAnalysisTask done;
            final String message;
            if (cause == null) {
                done = runningTask.task.withStatus(TaskStatus.COMPLETED).withCompletedAt(now).withResult(result);
                message = null;
                log.info("Deep analysis of {} completed: {} ({})", task.getFile().getName(),
                    String.join(" / ", result.getCategoryPath()), result.getConfidence());
            } else {
                if (cause instanceof TimeoutException && runningTask.work != null) {
                    runningTask.work.cancel(true);
                }
                message = describe(cause);
                done = runningTask.task.withStatus(TaskStatus.FAILED).withCompletedAt(now).withError(message);
                log.error("Deep analysis of {} failed: {}", task.getFile().getName(), message);
            }
            finished.put(taskId, done);

            if (moved) {
                notifyListeners(l -> l.onRecategorized(done, result));
            }
            notifyListeners(l -> l.onTaskCompleted(done, message));

            if (cause instanceof MalformedLlmResponseException) {
                fatalError = message;
                log.error("Stopping deep analysis after a fatal provider error: {}", message);
                stopLocked("Stopped after fatal error");
            } else {
                stopIfDrained();
            }
            publishStatus();
            lock.notifyAll();
        }
    }

    private void stopLocked(String reason) {
        boolean wasStarted = started;
        started = false;
        paused = false;
        generation++;
        for (RunningTask runningTask : new ArrayList<>(running.values())) {
            cancelRunning(runningTask, reason);
        }
        if (wasStarted) {
            log.info("Deep analysis stopped: {} ({} still queued)", reason, queue.size());
        }
    }

    /**
     * Stop when there is nothing left to do.
     *
     * @return true if the manager is (now) stopped because it drained
     */
    private boolean stopIfDrained() {
        if (started && queue.isEmpty() && running.isEmpty()) {
            started = false;
            paused = false;
            log.info("Deep analysis finished: {} completed, {} failed, {} cancelled",
                count(TaskStatus.COMPLETED), count(TaskStatus.FAILED), count(TaskStatus.CANCELLED));
            return true;
        }
        return false;
    }

    private void cancelRunning(RunningTask runningTask, String reason) {
        running.remove(runningTask.task.getId());
        if (runningTask.timeout != null) {
            runningTask.timeout.cancel(false);
        }
        if (runningTask.work != null) {
            runningTask.work.cancel(true);
        }
        recordCancelled(runningTask.task, reason);
        runningTask.race.completeExceptionally(new CancellationException(reason));
    }

    private void recordCancelled(DeepAnalysisTask task, String reason) {
        DeepAnalysisTask cancelled = task.withStatus(TaskStatus.CANCELLED).withCompletedAt(Instant.now()).withError(reason);
        finished.put(task.getId(), cancelled);
        notifyListeners(l -> l.onTaskCompleted(cancelled, reason));
    }

    private void recordDuration(Duration duration) {
        double millis = duration.toMillis();
        averageTaskMillis = averageTaskMillis < 0 ? millis : EMA_ALPHA * millis + (1 - EMA_ALPHA) * averageTaskMillis;
    }

    private void publishStatus() {
        int completed = count(TaskStatus.COMPLETED);
        int failed = count(TaskStatus.FAILED);
        int cancelled = count(TaskStatus.CANCELLED);
        int total = queue.size() + running.size() + finished.size();
        int remaining = queue.size() + running.size();

        Duration estimate = null;
        if (averageTaskMillis >= 0) {
            long millis = (long) (averageTaskMillis * remaining / Math.max(1, config.getMaxConcurrentTasks()));
            estimate = Duration.ofMillis(millis);
        }

        ManagerStatus status = ManagerStatus.builder()
            .running(started)
            .paused(paused)
            .queued(queue.size())
            .runningCount(running.size())
            .completed(completed)
            .failed(failed)
            .cancelled(cancelled)
            .total(total)
            .runningTasks(running.values().stream().map(r -> r.task).toList())
            .progress(total == 0 ? 0.0 : (double) (completed + failed + cancelled) / total)
            .estimatedRemaining(estimate)
            .fatalError(fatalError)
            .updatedAt(Instant.now())
            .build();

        lastStatus = status;
        while (!statusChannel.offer(status)) {
            statusChannel.poll();
        }
        notifyListeners(l -> l.onStatusUpdate(status));
    }

    private void notifyListeners(Consumer<TaskManagerListener> event) {
        for (TaskManagerListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Task manager listener failed: {}", e.getMessage());
            }
        }
    }

    private int count(TaskStatus status) {
        return (int) finished.values().stream().filter(t -> t.getStatus() == status).count();
    }

    private Set<UUID> activeFileIds() {
        Set<UUID> ids = new HashSet<>();
        queue.forEach(t -> ids.add(t.getFileId()));
        running.values().forEach(r -> ids.add(r.task.getFileId()));
        return ids;
    }

    /**
     * Distinct category names on the paths of the tasks still waiting, given to the analyzer as
     * naming hints.
     */
    private List<String> existingCategories() {
        Set<String> categories = new TreeSet<>();
        for (DeepAnalysisTask task : queue) {
            if (task.getCurrentCategoryPath() != null) {
                categories.addAll(task.getCurrentCategoryPath());
            }
        }
        return List.copyOf(categories);
    }

    private void requireOpen() {
        if (shutdown) {
            throw new IllegalStateException("Task manager has been shut down");
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class RunningTask {
        final DeepAnalysisTask task;
        final CompletableFuture<DeepAnalysisResult> race;
        volatile Future<?> work;
        volatile Future<?> timeout;

        RunningTask(DeepAnalysisTask task, CompletableFuture<DeepAnalysisResult> race) {
            this.task = task;
            this.race = race;
        }
    }
}
