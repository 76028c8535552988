package io.xrdflow.core;

import io.xrdflow.core.execution.ScanRunner;
import io.xrdflow.core.plugin.PluginRegistry;
import io.xrdflow.core.results.WorkflowResults;
import io.xrdflow.core.scan.ScanGeometry;
import io.xrdflow.core.workflow.WorkflowTree;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// Holds the components of one processing run: tree, scan, result aggregator, plugin
/// registry and the worker executor.
///
/// Every run gets its own context; nothing is shared through global state.
///
/// ### Contracts
/// - **Invariant**: `getResults().getTree() == getTree()`
/// - **Postcondition** of {@link #close()}: the executor is shut down
///
/// @apiNote Create instances via {@link ProcessingFactory}.
public final class ProcessingContext implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(ProcessingContext.class.getName());

    private final ProcessingConfig config;
    private final PluginRegistry pluginRegistry;
    private final WorkflowTree tree;
    private final WorkflowResults results;
    private final ExecutorService executorService;
    private final ScanRunner scanRunner;

    ProcessingContext(
            ProcessingConfig config,
            PluginRegistry pluginRegistry,
            WorkflowTree tree,
            WorkflowResults results,
            ExecutorService executorService) {
        this.config = config;
        this.pluginRegistry = pluginRegistry;
        this.tree = tree;
        this.results = results;
        this.executorService = executorService;
        this.scanRunner = new ScanRunner(tree, results, executorService, config);
    }

    public ProcessingConfig getConfig() {
        return config;
    }

    public PluginRegistry getPluginRegistry() {
        return pluginRegistry;
    }

    public WorkflowTree getTree() {
        return tree;
    }

    public ScanGeometry getScan() {
        return results.getScan();
    }

    public WorkflowResults getResults() {
        return results;
    }

    public ScanRunner getScanRunner() {
        return scanRunner;
    }

    public ExecutorService getExecutorService() {
        return executorService;
    }

    /// Stops the scan runner and shuts down the executor, waiting briefly for workers.
    @Override
    public void close() {
        scanRunner.stop();
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warning("Workers did not terminate in time, forcing shutdown");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
