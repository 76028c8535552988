package io.xrdflow.core.plugin;

/// Role of a plugin within a workflow tree.
public enum PluginType {
    /// Loads one frame per frame index; always the root of a tree.
    INPUT,
    /// Transforms the data of its parent.
    PROCESSING,
    /// Writes data out; its results are never aggregated.
    OUTPUT
}
