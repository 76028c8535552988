package io.xrdflow.core.workflow;

import io.xrdflow.core.plugin.Plugin;
import java.util.List;
import java.util.Objects;

/// Flat description of one node, used to export and restore a tree.
///
/// @param nodeId node id, not negative
/// @param parentId id of the parent, null for the root
/// @param childIds ids of the children in order, never null
/// @param plugin the node's plugin, not null
public record NodeSnapshot(int nodeId, Integer parentId, List<Integer> childIds, Plugin plugin) {

    public NodeSnapshot {
        Objects.requireNonNull(plugin, "plugin");
        childIds = childIds == null ? List.of() : List.copyOf(childIds);
    }
}
