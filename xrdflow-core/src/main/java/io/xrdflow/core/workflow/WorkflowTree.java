package io.xrdflow.core.workflow;

import io.xrdflow.core.data.Dataset;
import io.xrdflow.core.data.Shapes;
import io.xrdflow.core.exception.ConfigException;
import io.xrdflow.core.exception.PluginExecutionException;
import io.xrdflow.core.exception.UnknownNodeException;
import io.xrdflow.core.plugin.Plugin;
import io.xrdflow.core.plugin.PluginResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/// Rooted tree of plugin nodes driving shape propagation and per-frame execution.
///
/// The tree owns all nodes. Node ids are non-negative, unique and assigned in increasing
/// order; an id is never handed out twice, even after the node holding it was deleted.
///
/// ### Lifecycle
/// ```
/// createAndAddNode(...)*            -- configure
/// prepareExecution()                -- preExecute + shape propagation
/// executeProcess(frameIndex)*       -- once per frame, any order
/// ```
///
/// ### Contracts
/// - **Invariant**: `getNodes().keySet()` equals the set of `getNodeIds()`
/// - **Invariant**: a non-empty tree has exactly one node without parent, {@link #getRoot()}
/// - **Precondition**: the structure is not edited while a scan executes on this instance
///
/// @implNote **Not thread-safe**. Concurrent scans run on independent {@link #copy()}s.
///
/// @see WorkflowNode
/// @see TreeLayout
public class WorkflowTree {

    private static final Logger logger = Logger.getLogger(WorkflowTree.class.getName());

    private final Map<Integer, WorkflowNode> nodes = new HashMap<>();
    private final List<Integer> nodeIds = new ArrayList<>();
    private WorkflowNode root;
    private Integer activeNodeId;
    private int highestIssuedId = -1;
    private boolean treeChanged = true;
    private boolean prepared = false;

    // === Structure ===

    /// Adds a node below the most recently added node.
    ///
    /// @see #createAndAddNode(Plugin, Integer, Integer)
    public int createAndAddNode(Plugin plugin) {
        return createAndAddNode(plugin, null, null);
    }

    /// Adds a node below the given parent.
    ///
    /// @see #createAndAddNode(Plugin, Integer, Integer)
    public int createAndAddNode(Plugin plugin, Integer parentId) {
        return createAndAddNode(plugin, parentId, null);
    }

    /// Creates a node for the plugin and adds it to the tree.
    ///
    /// In an empty tree the node becomes the root and `parentId` is ignored. Otherwise the
    /// node is appended to the children of `parentId`, or of the most recently added node
    /// when `parentId` is null.
    ///
    /// @param plugin the node's plugin, not null
    /// @param parentId id of the parent node, may be null
    /// @param nodeId explicit id, may be null to assign the next free id
    /// @return the id of the new node
    /// @throws ConfigException if `nodeId` is in use or not greater than every id assigned
    /// so far, or if `parentId` does not exist
    /// @apiNote **Side effects**: marks the tree as changed and makes the new node active.
    public int createAndAddNode(Plugin plugin, Integer parentId, Integer nodeId) {
        Objects.requireNonNull(plugin, "plugin");
        int id = nodeId == null ? getNewNodeId() : checkExplicitNodeId(nodeId);

        WorkflowNode node = new WorkflowNode(id, plugin);
        if (root == null) {
            root = node;
        } else {
            int resolvedParentId = parentId != null ? parentId : nodeIds.get(nodeIds.size() - 1);
            WorkflowNode parent = nodes.get(resolvedParentId);
            if (parent == null) {
                throw new ConfigException(
                        "Cannot add node #" + id + ": parent node #" + parentId + " does not exist");
            }
            parent.addChild(node);
        }
        nodes.put(id, node);
        nodeIds.add(id);
        highestIssuedId = Math.max(highestIssuedId, id);
        activeNodeId = id;
        markChanged();
        return id;
    }

    /// Returns the id the next node added without explicit id will receive.
    public int getNewNodeId() {
        return highestIssuedId + 1;
    }

    /// Deletes a node.
    ///
    /// - `recursive`: the node's whole subtree is deleted
    /// - `keepChildren`: the node's children are attached to the node's parent; a root with
    ///   exactly one child hands the root role to that child
    ///
    /// A leaf can be deleted with neither flag.
    ///
    /// @param nodeId id of the node to delete
    /// @param recursive delete the subtree as well
    /// @param keepChildren reconnect the children to the parent
    /// @throws IllegalArgumentException if both flags are set
    /// @throws UnknownNodeException if the node does not exist
    /// @throws ConfigException if the node has children and neither flag is set, or if a
    /// root with several children is deleted with `keepChildren`
    public void deleteNode(int nodeId, boolean recursive, boolean keepChildren) {
        if (recursive && keepChildren) {
            throw new IllegalArgumentException(
                    "A node cannot be deleted recursively while keeping its children");
        }
        WorkflowNode node = getNodeOrThrow(nodeId);
        if (!node.isLeaf() && !recursive && !keepChildren) {
            throw new ConfigException(
                    "Node #"
                            + nodeId
                            + " has children; delete it recursively or keep its children");
        }

        List<Integer> removed;
        WorkflowNode parent = node.getParent();
        if (keepChildren) {
            List<WorkflowNode> children = new ArrayList<>(node.getChildren());
            if (parent == null) {
                if (children.size() > 1) {
                    throw new ConfigException(
                            "The root node #"
                                    + nodeId
                                    + " has "
                                    + children.size()
                                    + " children and cannot be deleted while keeping them");
                }
                for (WorkflowNode child : children) {
                    node.removeChild(child);
                }
                root = children.isEmpty() ? null : children.get(0);
            } else {
                parent.removeChild(node);
                for (WorkflowNode child : children) {
                    parent.addChild(child);
                }
            }
            removed = List.of(nodeId);
        } else {
            removed = TreeLayout.of(this).getSubtreeIds(nodeId);
            if (parent == null) {
                root = null;
            } else {
                parent.removeChild(node);
            }
        }

        for (Integer id : removed) {
            nodes.remove(id);
        }
        nodeIds.removeAll(removed);
        if (parent != null) {
            activeNodeId = parent.getNodeId();
        } else {
            activeNodeId = root == null ? null : root.getNodeId();
        }
        markChanged();
    }

    /// Moves a node, with its subtree, below a new parent.
    ///
    /// If the new parent's id is greater than the node's id, the two nodes swap their ids so
    /// that the parent keeps the smaller id.
    ///
    /// @param nodeId id of the node to move
    /// @param newParentId id of the new parent
    /// @throws UnknownNodeException if either node does not exist
    /// @throws ConfigException if the new parent is the node itself or lies in its subtree
    public void changeNodeParent(int nodeId, int newParentId) {
        WorkflowNode node = getNodeOrThrow(nodeId);
        WorkflowNode newParent = getNodeOrThrow(newParentId);
        if (nodeId == newParentId || TreeLayout.of(this).isDescendant(nodeId, newParentId)) {
            throw new ConfigException(
                    "Node #"
                            + newParentId
                            + " lies in the subtree of node #"
                            + nodeId
                            + " and cannot become its parent");
        }
        node.getParent().removeChild(node);
        newParent.addChild(node);

        if (newParentId > nodeId) {
            node.setNodeId(newParentId);
            newParent.setNodeId(nodeId);
            nodes.put(newParentId, node);
            nodes.put(nodeId, newParent);
            if (activeNodeId != null && activeNodeId == nodeId) {
                activeNodeId = newParentId;
            } else if (activeNodeId != null && activeNodeId == newParentId) {
                activeNodeId = nodeId;
            }
        }
        markChanged();
    }

    /// Renumbers all nodes `0..n-1` in depth-first order.
    public void orderNodeIds() {
        List<Integer> order = TreeLayout.of(this).getDepthFirstOrder();
        Map<Integer, Integer> mapping = new HashMap<>();
        List<WorkflowNode> ordered = new ArrayList<>();
        for (int i = 0; i < order.size(); i++) {
            mapping.put(order.get(i), i);
            ordered.add(nodes.get(order.get(i)));
        }
        nodes.clear();
        nodeIds.clear();
        for (int i = 0; i < ordered.size(); i++) {
            WorkflowNode node = ordered.get(i);
            node.setNodeId(i);
            nodes.put(i, node);
            nodeIds.add(i);
        }
        highestIssuedId = ordered.size() - 1;
        activeNodeId = activeNodeId == null ? null : mapping.get(activeNodeId);
        markChanged();
    }

    /// Replaces the plugin of an existing node.
    ///
    /// @throws UnknownNodeException if the node does not exist
    public void replaceNodePlugin(int nodeId, Plugin plugin) {
        Objects.requireNonNull(plugin, "plugin");
        getNodeOrThrow(nodeId).setPlugin(plugin);
        markChanged();
    }

    /// Removes all nodes and resets id assignment.
    public void clear() {
        nodes.clear();
        nodeIds.clear();
        root = null;
        activeNodeId = null;
        highestIssuedId = -1;
        markChanged();
    }

    /// Replaces the content of this tree with restored nodes.
    ///
    /// Works in two passes: every node is created first, then parents and children are
    /// linked, so snapshots may appear in any order. Children are linked in the order of
    /// their parent's `childIds`; nodes naming a parent that does not list them are
    /// appended in ascending id order.
    ///
    /// @param snapshots one entry per node, not null
    /// @throws ConfigException if ids are duplicated or negative, a parent is missing, child
    /// lists contradict parent ids, or the nodes do not form a single rooted tree
    public void restoreNodes(List<NodeSnapshot> snapshots) {
        Map<Integer, WorkflowNode> restored = new TreeMap<>();
        Map<Integer, NodeSnapshot> byId = new HashMap<>();
        for (NodeSnapshot snapshot : snapshots) {
            if (snapshot.nodeId() < 0) {
                throw new ConfigException("Negative node id: " + snapshot.nodeId());
            }
            if (byId.put(snapshot.nodeId(), snapshot) != null) {
                throw new ConfigException("Duplicate node id: " + snapshot.nodeId());
            }
            restored.put(snapshot.nodeId(), new WorkflowNode(snapshot.nodeId(), snapshot.plugin()));
        }

        WorkflowNode newRoot = null;
        for (NodeSnapshot snapshot : byId.values()) {
            if (snapshot.parentId() == null) {
                if (newRoot != null) {
                    throw new ConfigException(
                            "More than one root node: #"
                                    + newRoot.getNodeId()
                                    + " and #"
                                    + snapshot.nodeId());
                }
                newRoot = restored.get(snapshot.nodeId());
            } else if (!restored.containsKey(snapshot.parentId())) {
                throw new ConfigException(
                        "Parent node #"
                                + snapshot.parentId()
                                + " of node #"
                                + snapshot.nodeId()
                                + " does not exist");
            }
        }
        if (newRoot == null && !restored.isEmpty()) {
            throw new ConfigException("The restored nodes have no root node");
        }

        Set<Integer> linked = new HashSet<>();
        for (WorkflowNode parent : restored.values()) {
            for (Integer childId : byId.get(parent.getNodeId()).childIds()) {
                NodeSnapshot child = byId.get(childId);
                if (child == null || !Objects.equals(child.parentId(), parent.getNodeId())) {
                    throw new ConfigException(
                            "Node #"
                                    + parent.getNodeId()
                                    + " lists child #"
                                    + childId
                                    + " which does not name it as parent");
                }
                if (linked.add(childId)) {
                    parent.addChild(restored.get(childId));
                }
            }
        }
        for (WorkflowNode node : restored.values()) {
            Integer parentId = byId.get(node.getNodeId()).parentId();
            if (parentId != null && linked.add(node.getNodeId())) {
                restored.get(parentId).addChild(node);
            }
        }

        WorkflowNode previousRoot = root;
        root = newRoot;
        int reachable = root == null ? 0 : TreeLayout.of(this).size();
        if (reachable != restored.size()) {
            root = previousRoot;
            throw new ConfigException(
                    "The restored nodes contain a cycle; only "
                            + reachable
                            + " of "
                            + restored.size()
                            + " nodes are reachable from the root");
        }

        nodes.clear();
        nodes.putAll(restored);
        nodeIds.clear();
        nodeIds.addAll(restored.keySet());
        highestIssuedId = nodeIds.isEmpty() ? -1 : nodeIds.get(nodeIds.size() - 1);
        activeNodeId = nodeIds.isEmpty() ? null : nodeIds.get(nodeIds.size() - 1);
        markChanged();
        logger.info("Restored workflow tree with " + nodes.size() + " nodes");
    }

    /// Exports every node in ascending id order.
    public List<NodeSnapshot> snapshot() {
        List<NodeSnapshot> snapshots = new ArrayList<>();
        for (Integer id : getNodeIds()) {
            WorkflowNode node = nodes.get(id);
            snapshots.add(
                    new NodeSnapshot(id, node.getParentId(), node.getChildIds(), node.getPlugin()));
        }
        return snapshots;
    }

    /// Returns a deep copy with copied plugins. The copy must be prepared before execution.
    public WorkflowTree copy() {
        WorkflowTree copy = new WorkflowTree();
        List<NodeSnapshot> snapshots = new ArrayList<>();
        for (NodeSnapshot snapshot : snapshot()) {
            snapshots.add(
                    new NodeSnapshot(
                            snapshot.nodeId(),
                            snapshot.parentId(),
                            snapshot.childIds(),
                            snapshot.plugin().copy()));
        }
        if (!snapshots.isEmpty()) {
            copy.restoreNodes(snapshots);
        }
        copy.highestIssuedId = highestIssuedId;
        copy.activeNodeId = activeNodeId;
        return copy;
    }

    // === Queries ===

    /// Returns the root node, or null for an empty tree.
    public WorkflowNode getRoot() {
        return root;
    }

    public Optional<WorkflowNode> getNode(int nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    /// @throws UnknownNodeException if the node does not exist
    public WorkflowNode getNodeOrThrow(int nodeId) {
        WorkflowNode node = nodes.get(nodeId);
        if (node == null) {
            throw new UnknownNodeException(nodeId);
        }
        return node;
    }

    public boolean containsNode(int nodeId) {
        return nodes.containsKey(nodeId);
    }

    /// Returns the node ids sorted ascending.
    public List<Integer> getNodeIds() {
        List<Integer> ids = new ArrayList<>(nodeIds);
        Collections.sort(ids);
        return ids;
    }

    public Map<Integer, WorkflowNode> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /// Returns all leaves in depth-first order.
    public List<WorkflowNode> getAllLeaves() {
        return TreeLayout.of(this).getLeafIds().stream().map(nodes::get).toList();
    }

    /// Returns all retained nodes in ascending id order.
    ///
    /// @see WorkflowNode#isRetained()
    public List<WorkflowNode> getNodesWithResults() {
        return getNodeIds().stream().map(nodes::get).filter(WorkflowNode::isRetained).toList();
    }

    /// Returns the id of the node last added or selected, or null.
    public Integer getActiveNodeId() {
        return activeNodeId;
    }

    /// @throws UnknownNodeException if the node does not exist
    public void setActiveNodeId(int nodeId) {
        getNodeOrThrow(nodeId);
        this.activeNodeId = nodeId;
    }

    /// Returns true if the structure changed since the last {@link #prepareExecution()}.
    public boolean isTreeChanged() {
        return treeChanged;
    }

    /// Returns true if the tree is prepared and unchanged since.
    public boolean isPrepared() {
        return prepared && !treeChanged;
    }

    /// Checks the declared dimensionality of every node against its parent.
    public ConsistencyReport getConsistentAndInconsistentNodes() {
        List<Integer> consistent = new ArrayList<>();
        List<Integer> inconsistent = new ArrayList<>();
        for (Integer id : getNodeIds()) {
            (nodes.get(id).isConsistent() ? consistent : inconsistent).add(id);
        }
        return new ConsistencyReport(consistent, inconsistent);
    }

    /// Returns the result shape of every retained node.
    ///
    /// @throws ConfigException if the tree is not prepared
    public Map<Integer, int[]> getAllResultShapes() {
        if (!isPrepared()) {
            throw new ConfigException(
                    "Result shapes are only known after prepareExecution() was called");
        }
        Map<Integer, int[]> shapes = new LinkedHashMap<>();
        for (WorkflowNode node : getNodesWithResults()) {
            shapes.put(node.getNodeId(), node.getResultShape());
        }
        return shapes;
    }

    // === Execution ===

    /// Calls `preExecute()` on every plugin, parents before children, and propagates result
    /// shapes from the root to the leaves.
    ///
    /// The root computes its result shape from its parameters. Every other node receives
    /// its parent's result shape as input shape and computes its own. Shapes are always
    /// recomputed, since plugin parameters may have changed since the last call.
    ///
    /// @throws ConfigException if the tree is empty or a result shape cannot be determined;
    /// configuration errors raised by plugins propagate unchanged
    public void prepareExecution() {
        if (root == null) {
            throw new ConfigException("The workflow tree has no nodes");
        }
        prepared = false;
        List<Integer> order = TreeLayout.of(this).getDepthFirstOrder();
        for (Integer id : order) {
            nodes.get(id).getPlugin().preExecute();
        }
        for (Integer id : order) {
            WorkflowNode node = nodes.get(id);
            Plugin plugin = node.getPlugin();
            if (!node.isRoot()) {
                plugin.setInputShape(node.getParent().getResultShape());
            }
            plugin.calculateResultShape();
            if (!Shapes.isResolved(plugin.getResultShape())) {
                throw new ConfigException(
                        "Could not determine the result shape of node #"
                                + id
                                + " ("
                                + plugin.getName()
                                + ")");
            }
        }
        prepared = true;
        treeChanged = false;
        logger.info("Prepared workflow tree with " + nodes.size() + " nodes for execution");
    }

    /// Processes one frame through the whole tree.
    ///
    /// @param frameIndex linear frame index handed to the root plugin
    /// @return results of every retained node keyed by node id, never null
    /// @throws ConfigException if the tree is not prepared
    /// @throws PluginExecutionException propagated unchanged from the failing plugin
    public Map<Integer, Dataset> executeProcess(int frameIndex) throws PluginExecutionException {
        if (!isPrepared()) {
            throw new ConfigException(
                    "prepareExecution() must be called before frames are processed");
        }
        Map<Integer, Dataset> results = new TreeMap<>();
        root.executePluginChain(frameIndex, new HashMap<>(), results);
        logger.fine("Processed frame " + frameIndex);
        return results;
    }

    /// Runs `preExecute()` and `execute()` of exactly one node's plugin.
    ///
    /// @param nodeId id of the node
    /// @param data input data for the plugin
    /// @param kwargs keyword arguments, may be null
    /// @return the plugin's result, never null
    /// @throws UnknownNodeException if the node does not exist
    /// @throws PluginExecutionException propagated unchanged from the plugin
    public PluginResult executeSinglePlugin(int nodeId, Object data, Map<String, Object> kwargs)
            throws PluginExecutionException {
        Plugin plugin = getNodeOrThrow(nodeId).getPlugin();
        plugin.preExecute();
        return plugin.execute(data, kwargs == null ? new HashMap<>() : new HashMap<>(kwargs));
    }

    private int checkExplicitNodeId(int nodeId) {
        if (nodeId < 0) {
            throw new ConfigException("Node ids must not be negative: " + nodeId);
        }
        if (nodes.containsKey(nodeId)) {
            throw new ConfigException("Node id " + nodeId + " is already in use");
        }
        if (nodeId <= highestIssuedId) {
            throw new ConfigException(
                    "Node id "
                            + nodeId
                            + " must be greater than every id assigned so far ("
                            + highestIssuedId
                            + ")");
        }
        return nodeId;
    }

    private void markChanged() {
        treeChanged = true;
    }
}
