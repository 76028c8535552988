package io.xrdflow.core.plugin;

import io.xrdflow.core.exception.PluginExecutionException;
import java.util.Map;

/// A unit of computation held by one node of a workflow tree.
///
/// ### Lifecycle
/// ```
/// construct -> set parameters -> preExecute()
///           -> setInputShape(parentShape) -> calculateResultShape()
///           -> execute(data, kwargs) once per frame
/// ```
///
/// The root plugin of a tree is an {@link PluginType#INPUT} plugin and receives the frame
/// index (`Integer`) as `data`; every other plugin receives the {@link
/// io.xrdflow.core.data.Dataset} produced by its parent.
///
/// ### Contracts
/// - `execute` must not assume it owns `data` beyond the call; the tree copies data only at
///   branch points, so an in-place modification is visible to nothing but the own subtree
/// - `calculateResultShape` must leave a fully resolved shape in {@link #getResultShape()}
///   or throw {@link io.xrdflow.core.exception.ConfigException}
///
/// @implNote Implementations need not be thread-safe. Concurrent scans give every worker
/// its own copy obtained via {@link #copy()}.
///
/// @see AbstractPlugin
/// @see PluginRegistry
public interface Plugin {

    /// Returns the human-readable plugin name, unique among registered plugins.
    String getName();

    /// Returns the name under which the plugin is registered and serialized.
    ///
    /// @return registry key, defaults to the simple class name, never null
    default String getPluginClass() {
        return getClass().getSimpleName();
    }

    PluginType getPluginType();

    DataDim getInputDataDim();

    DataDim getOutputDataDim();

    /// Returns the live parameter collection.
    ///
    /// @return parameters, never null
    PluginParameters getParameters();

    /// One-time setup before a scan.
    ///
    /// @throws io.xrdflow.core.exception.ConfigException if the parameters are invalid
    void preExecute();

    /// Processes one frame.
    ///
    /// @param data the frame index for input plugins, otherwise the parent's output
    /// @param kwargs keyword arguments from the parent, not null
    /// @return result data and kwargs for the children, never null
    /// @throws PluginExecutionException if processing this frame failed
    PluginResult execute(Object data, Map<String, Object> kwargs)
            throws PluginExecutionException;

    /// Computes {@link #getResultShape()} from the parameters and, for downstream plugins,
    /// the propagated {@link #getInputShape()}.
    void calculateResultShape();

    /// Returns the shape of the input data, or null if not yet propagated.
    int[] getInputShape();

    void setInputShape(int[] inputShape);

    /// Returns the shape of one result, or null before {@link #calculateResultShape()}.
    int[] getResultShape();

    /// Returns an independent copy with equal parameters and shapes.
    Plugin copy();

    default boolean isKeepResults() {
        return getParameters().getBoolean(PluginParameters.KEEP_RESULTS);
    }

    /// Returns the title used for this plugin's results, e.g. `"Peak (node #003)"` or
    /// `"[Sum] (node #003)"` when no label is set.
    default String getResultTitle(int nodeId) {
        String label = getParameters().getString(PluginParameters.LABEL);
        String prefix = label == null || label.isBlank() ? "[" + getName() + "]" : label;
        return String.format("%s (node #%03d)", prefix, nodeId);
    }
}
