package io.xrdflow.core;

import io.xrdflow.core.plugin.DefaultPluginRegistry;
import io.xrdflow.core.plugin.PluginRegistry;
import io.xrdflow.core.results.WorkflowResults;
import io.xrdflow.core.scan.ScanGeometry;
import io.xrdflow.core.workflow.WorkflowTree;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/// Factory wiring {@link ProcessingContext} instances.
///
/// ### Usage
/// {@snippet :
/// try (ProcessingContext context = ProcessingFactory.builder()
///         .config(ProcessingConfig.builder().workerCount(4).build())
///         .tree(tree)
///         .scan(scan)
///         .build()) {
///     ScanSummary summary = context.getScanRunner().run();
///     Dataset sums = context.getResults().getResults(1);
/// }
/// }
///
/// @see ProcessingContext
/// @see ProcessingConfig
public final class ProcessingFactory {

    private ProcessingFactory() {}

    /// Creates a context with default configuration and the built-in plugin registry.
    ///
    /// @param tree the workflow tree, not null
    /// @param scan the scan geometry, not null
    /// @return new context, never null
    public static ProcessingContext createContext(WorkflowTree tree, ScanGeometry scan) {
        return builder().tree(tree).scan(scan).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link ProcessingContext}.
    public static class Builder {
        private ProcessingConfig config = new ProcessingConfig();
        private PluginRegistry pluginRegistry;
        private WorkflowTree tree;
        private ScanGeometry scan;
        private ExecutorService executorService;

        private Builder() {}

        public Builder config(ProcessingConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /// Sets the plugin registry; defaults to a {@link DefaultPluginRegistry}.
        public Builder pluginRegistry(PluginRegistry pluginRegistry) {
            this.pluginRegistry = pluginRegistry;
            return this;
        }

        /// Sets the tree; defaults to an empty tree.
        public Builder tree(WorkflowTree tree) {
            this.tree = tree;
            return this;
        }

        public Builder scan(ScanGeometry scan) {
            this.scan = scan;
            return this;
        }

        /// Sets the executor running the workers; defaults to a fixed pool of
        /// `config.getWorkerCount()` daemon threads. The context shuts it down on close.
        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        /// Builds the context.
        ///
        /// @return new context, never null
        /// @throws NullPointerException if no scan was set
        public ProcessingContext build() {
            Objects.requireNonNull(scan, "scan is required");
            WorkflowTree effectiveTree = tree != null ? tree : new WorkflowTree();
            PluginRegistry effectiveRegistry =
                    pluginRegistry != null ? pluginRegistry : new DefaultPluginRegistry();
            ExecutorService effectiveExecutor =
                    executorService != null
                            ? executorService
                            : Executors.newFixedThreadPool(
                                    config.getWorkerCount(), workerThreadFactory());
            return new ProcessingContext(
                    config,
                    effectiveRegistry,
                    effectiveTree,
                    new WorkflowResults(effectiveTree, scan),
                    effectiveExecutor);
        }

        private static ThreadFactory workerThreadFactory() {
            AtomicInteger counter = new AtomicInteger();
            return runnable -> {
                Thread thread = new Thread(runnable, "xrdflow-worker-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            };
        }
    }
}
