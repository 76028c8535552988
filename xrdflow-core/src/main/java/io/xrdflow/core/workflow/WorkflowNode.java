package io.xrdflow.core.workflow;

import io.xrdflow.core.data.Dataset;
import io.xrdflow.core.exception.PluginExecutionException;
import io.xrdflow.core.plugin.Plugin;
import io.xrdflow.core.plugin.PluginResult;
import io.xrdflow.core.plugin.PluginType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/// A node of a {@link WorkflowTree}, wrapping exactly one plugin.
///
/// Nodes are created and linked only by their tree. The parent link is a navigation aid;
/// the tree owns every node.
///
/// @implNote **Not thread-safe**. A tree and its nodes belong to one thread at a time.
public final class WorkflowNode {

    private int nodeId;
    private Plugin plugin;
    private WorkflowNode parent;
    private final List<WorkflowNode> children = new ArrayList<>();

    WorkflowNode(int nodeId, Plugin plugin) {
        this.nodeId = nodeId;
        this.plugin = plugin;
    }

    public int getNodeId() {
        return nodeId;
    }

    void setNodeId(int nodeId) {
        this.nodeId = nodeId;
    }

    public Plugin getPlugin() {
        return plugin;
    }

    void setPlugin(Plugin plugin) {
        this.plugin = plugin;
    }

    /// Returns the parent node, or null for the root.
    public WorkflowNode getParent() {
        return parent;
    }

    /// Returns the id of the parent node, or null for the root.
    public Integer getParentId() {
        return parent == null ? null : parent.nodeId;
    }

    /// Returns the children in insertion order.
    ///
    /// @return unmodifiable view, never null
    public List<WorkflowNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<Integer> getChildIds() {
        return children.stream().map(WorkflowNode::getNodeId).toList();
    }

    public boolean isRoot() {
        return parent == null;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /// Returns true if the results of this node are aggregated: every leaf and every node
    /// whose plugin sets `keep_results`, except output plugins.
    public boolean isRetained() {
        return plugin.getPluginType() != PluginType.OUTPUT
                && (isLeaf() || plugin.isKeepResults());
    }

    public int[] getResultShape() {
        return plugin.getResultShape();
    }

    /// Returns true if the parent's declared output dimensionality fits this node's declared
    /// input dimensionality. The root is always consistent.
    public boolean isConsistent() {
        return parent == null
                || parent.plugin.getOutputDataDim().isCompatibleWith(plugin.getInputDataDim());
    }

    void addChild(WorkflowNode child) {
        if (child.parent != null) {
            child.parent.children.remove(child);
        }
        child.parent = this;
        children.add(child);
    }

    void removeChild(WorkflowNode child) {
        if (children.remove(child)) {
            child.parent = null;
        }
    }

    /// Runs this node's plugin and recurses into the children.
    ///
    /// A single child receives the result by reference. With several children every child
    /// receives its own copy of data and kwargs, so in-place modifications in one branch
    /// never reach a sibling branch. Results of retained nodes with children are stored as
    /// copies for the same reason.
    ///
    /// @param data the frame index for the root, otherwise the parent's result
    /// @param kwargs keyword arguments from the parent, not null
    /// @param results collector for the results of retained nodes, not null
    /// @throws PluginExecutionException propagated unchanged from any plugin in the subtree
    void executePluginChain(Object data, Map<String, Object> kwargs, Map<Integer, Dataset> results)
            throws PluginExecutionException {
        PluginResult result = plugin.execute(data, kwargs);
        if (isRetained()) {
            results.put(nodeId, children.isEmpty() ? result.data() : result.data().copy());
        }
        if (children.size() == 1) {
            children.get(0).executePluginChain(result.data(), result.kwargs(), results);
            return;
        }
        for (WorkflowNode child : children) {
            PluginResult branch = result.copy();
            child.executePluginChain(branch.data(), branch.kwargs(), results);
        }
    }

    @Override
    public String toString() {
        return "WorkflowNode{nodeId=" + nodeId + ", plugin=" + plugin.getName() + "}";
    }
}
