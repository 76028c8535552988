package io.xrdflow.cli.visualizer;

import io.xrdflow.core.workflow.WorkflowTree;

/// Strategy interface for rendering workflow trees in different output formats.
///
/// ### Built-in Formats
/// - `text` - indented tree with ANSI colors ({@link TextVisualizationFormat})
/// - `yaml` - the tree's YAML export ({@link YamlVisualizationFormat})
///
/// @see TreeVisualizer
public interface VisualizationFormat {

    /// Returns the unique identifier for this format.
    ///
    /// @return format name used for CLI selection, never null
    String getName();

    /// Renders the tree in this format.
    ///
    /// @param tree the tree to render, not null
    /// @param useColor whether ANSI color codes may be used
    /// @return formatted representation, never null
    String render(WorkflowTree tree, boolean useColor);
}
