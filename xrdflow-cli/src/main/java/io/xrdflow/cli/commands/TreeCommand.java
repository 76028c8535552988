package io.xrdflow.cli.commands;

import io.xrdflow.core.plugin.DefaultPluginRegistry;
import io.xrdflow.core.plugin.PluginRegistry;
import io.xrdflow.core.workflow.WorkflowTree;
import io.xrdflow.serialization.TreeSerializer;
import java.io.IOException;
import java.nio.file.Path;
import picocli.CommandLine.Option;

/// Base class for commands operating on a workflow tree file.
///
/// The tree file is a `.yaml`, `.yml` or `.json` export written by {@link TreeSerializer}.
/// Plugins are resolved through {@link DefaultPluginRegistry} unless a test replaces the
/// registry.
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
public abstract class TreeCommand extends XrdflowCommand {

    @Option(
            names = {"-t", "--tree"},
            required = true,
            description = "Workflow tree file (.yaml, .yml or .json)")
    protected Path treeFile;

    private PluginRegistry pluginRegistry = new DefaultPluginRegistry();

    /// Loads the tree named by `--tree`.
    ///
    /// @return restored, unprepared tree, never null
    /// @throws IOException if the file cannot be read
    /// @throws io.xrdflow.core.exception.ConfigException if the file describes no valid tree
    protected WorkflowTree loadTree() throws IOException {
        System.out.println("Loading workflow tree: " + treeFile);
        return TreeSerializer.importFromFile(treeFile, pluginRegistry);
    }

    protected PluginRegistry getPluginRegistry() {
        return pluginRegistry;
    }
}
