package io.xrdflow.core.plugin;

import io.xrdflow.core.data.Dataset;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/// Output of one plugin call: the resulting data and the keyword arguments handed on to
/// the children of the node.
///
/// @param data result data, not null
/// @param kwargs keyword arguments for downstream plugins, never null
public record PluginResult(Dataset data, Map<String, Object> kwargs) {

    public PluginResult {
        Objects.requireNonNull(data, "data");
        kwargs = kwargs == null ? new HashMap<>() : kwargs;
    }

    /// Returns a result with a deep copy of the data and a shallow copy of the kwargs.
    public PluginResult copy() {
        return new PluginResult(data.copy(), new HashMap<>(kwargs));
    }
}
