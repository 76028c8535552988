package io.xrdflow.core.execution;

import io.xrdflow.core.ProcessingConfig;
import io.xrdflow.core.data.Dataset;
import io.xrdflow.core.exception.PluginExecutionException;
import io.xrdflow.core.results.WorkflowResults;
import io.xrdflow.core.scan.ScanGeometry;
import io.xrdflow.core.workflow.WorkflowTree;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// Processes every frame of a scan on a pool of workers and aggregates the results.
///
/// ### This runner
///
/// - prepares the tree and allocates the {@link WorkflowResults}
/// - hands every worker its own deep copy of the tree
/// - dispatches frame indices to the executor, at most two per worker in flight
/// - stores every completed frame on the calling thread, the only caller of
///   {@link WorkflowResults#storeResults(int, Map)}
/// - applies the configured {@link FailurePolicy} to plugin failures
///
/// {@link #stop()} ends dispatching; results of frames still in flight are discarded.
///
/// @implNote The ExecutorService is NOT shut down by this runner; its lifecycle belongs to
/// the owner, usually {@link io.xrdflow.core.ProcessingContext}.
public class ScanRunner {

    private static final Logger logger = Logger.getLogger(ScanRunner.class.getName());

    private final WorkflowTree tree;
    private final WorkflowResults results;
    private final ExecutorService executorService;
    private final ProcessingConfig config;
    private volatile boolean stopRequested;

    /// @param tree the configured tree, not null; never executed directly, only copied
    /// @param results the aggregator for the tree and scan, not null
    /// @param executorService executor running the workers, not null
    /// @param config worker count, failure policy and timeout, not null
    public ScanRunner(
            WorkflowTree tree,
            WorkflowResults results,
            ExecutorService executorService,
            ProcessingConfig config) {
        this.tree = tree;
        this.results = results;
        this.executorService = executorService;
        this.config = config;
    }

    public ScanSummary run() throws PluginExecutionException {
        return run(ScanListener.NOOP);
    }

    /// Processes all frames of the scan.
    ///
    /// @param listener progress callbacks, not null
    /// @return summary of the run, never null
    /// @throws PluginExecutionException if a plugin failed and the policy is
    /// {@link FailurePolicy#ABORT}
    /// @throws io.xrdflow.core.exception.ConfigException if the tree cannot be prepared
    /// @throws io.xrdflow.core.exception.ShapeMismatchException if a result does not fit
    /// its composite
    /// @throws IllegalStateException if no frame completes within the frame timeout or the
    /// calling thread is interrupted
    public ScanSummary run(ScanListener listener) throws PluginExecutionException {
        stopRequested = false;
        Instant start = Instant.now();
        ScanGeometry scan = results.getScan();
        int nTotal = scan.getNTotal();

        tree.prepareExecution();
        results.updateShapesFromScanAndWorkflow();

        int workers = Math.max(1, Math.min(config.getWorkerCount(), nTotal));
        BlockingQueue<WorkflowTree> workerTrees = new ArrayBlockingQueue<>(workers);
        for (int i = 0; i < workers; i++) {
            WorkflowTree copy = tree.copy();
            copy.prepareExecution();
            workerTrees.add(copy);
        }
        listener.onScanStart(scan, workers);
        logger.info("Processing " + nTotal + " frames with " + workers + " workers");

        CompletionService<Map<Integer, Dataset>> completion =
                new ExecutorCompletionService<>(executorService);
        Map<Future<Map<Integer, Dataset>>, Integer> inFlight = new HashMap<>();
        List<Integer> failedFrames = new ArrayList<>();
        int window = workers * 2;
        int nextFrame = 0;
        int processed = 0;

        try {
            while (true) {
                while (!stopRequested && nextFrame < nTotal && inFlight.size() < window) {
                    int frameIndex = nextFrame++;
                    inFlight.put(
                            completion.submit(() -> processFrame(workerTrees, frameIndex)),
                            frameIndex);
                }
                if (inFlight.isEmpty()) {
                    break;
                }
                Future<Map<Integer, Dataset>> done =
                        completion.poll(config.getFrameTimeout().toNanos(), TimeUnit.NANOSECONDS);
                if (done == null) {
                    throw new IllegalStateException(
                            "No frame completed within " + config.getFrameTimeout());
                }
                int frameIndex = inFlight.remove(done);
                if (stopRequested) {
                    continue;
                }
                try {
                    Map<Integer, Dataset> frameResults = done.get();
                    results.storeResults(frameIndex, frameResults);
                    processed++;
                    listener.onFrameComplete(frameIndex, frameResults);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    listener.onFrameFailed(frameIndex, cause);
                    if (cause instanceof PluginExecutionException
                            && config.getFailurePolicy() == FailurePolicy.SKIP) {
                        logger.warning("Skipping frame " + frameIndex + ": " + cause.getMessage());
                        failedFrames.add(frameIndex);
                        continue;
                    }
                    logger.warning("Aborting scan at frame " + frameIndex + ": " + cause);
                    throw rethrow(frameIndex, cause);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Scan processing interrupted", e);
        } finally {
            for (Future<Map<Integer, Dataset>> future : inFlight.keySet()) {
                future.cancel(true);
            }
        }

        Collections.sort(failedFrames);
        ScanSummary summary =
                new ScanSummary(
                        nTotal,
                        processed,
                        failedFrames,
                        stopRequested,
                        Duration.between(start, Instant.now()));
        logger.info(
                "Scan finished: "
                        + processed
                        + " of "
                        + nTotal
                        + " frames processed, "
                        + failedFrames.size()
                        + " skipped"
                        + (stopRequested ? ", stopped" : ""));
        listener.onScanComplete(summary);
        return summary;
    }

    /// Stops dispatching further frames. Safe to call from any thread.
    public void stop() {
        stopRequested = true;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    private static Map<Integer, Dataset> processFrame(
            BlockingQueue<WorkflowTree> workerTrees, int frameIndex) throws Exception {
        WorkflowTree worker = workerTrees.take();
        try {
            return worker.executeProcess(frameIndex);
        } finally {
            workerTrees.put(worker);
        }
    }

    private static PluginExecutionException rethrow(int frameIndex, Throwable cause) {
        if (cause instanceof PluginExecutionException pluginFailure) {
            return pluginFailure;
        }
        if (cause instanceof RuntimeException runtimeFailure) {
            throw runtimeFailure;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        throw new IllegalStateException("Frame " + frameIndex + " failed", cause);
    }
}
