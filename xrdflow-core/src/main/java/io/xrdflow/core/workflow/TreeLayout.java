package io.xrdflow.core.workflow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/// Derived tables of a tree snapshot: depth-first order, depths, parent-child connections
/// and subtrees.
///
/// A layout is computed from the tree's current structure and never updated; take a new
/// one after editing the tree.
///
/// @implNote Immutable and thread-safe once created.
public final class TreeLayout {

    /// A parent-child edge.
    public record Connection(int parentId, int childId) {}

    private final List<Integer> depthFirstOrder;
    private final Map<Integer, Integer> depths;
    private final Map<Integer, List<Integer>> childIds;
    private final List<Connection> connections;

    private TreeLayout(
            List<Integer> depthFirstOrder,
            Map<Integer, Integer> depths,
            Map<Integer, List<Integer>> childIds,
            List<Connection> connections) {
        this.depthFirstOrder = List.copyOf(depthFirstOrder);
        this.depths = Collections.unmodifiableMap(depths);
        this.childIds = Collections.unmodifiableMap(childIds);
        this.connections = List.copyOf(connections);
    }

    /// Computes the layout of a tree.
    ///
    /// @param tree the tree to describe, not null
    /// @return new layout, empty for an empty tree, never null
    public static TreeLayout of(WorkflowTree tree) {
        List<Integer> order = new ArrayList<>();
        Map<Integer, Integer> depths = new HashMap<>();
        Map<Integer, List<Integer>> childIds = new HashMap<>();
        List<Connection> connections = new ArrayList<>();

        WorkflowNode root = tree.getRoot();
        if (root != null) {
            Deque<WorkflowNode> stack = new ArrayDeque<>();
            stack.push(root);
            depths.put(root.getNodeId(), 0);
            while (!stack.isEmpty()) {
                WorkflowNode node = stack.pop();
                int depth = depths.get(node.getNodeId());
                order.add(node.getNodeId());
                childIds.put(node.getNodeId(), node.getChildIds());
                List<WorkflowNode> children = node.getChildren();
                for (WorkflowNode child : children) {
                    connections.add(new Connection(node.getNodeId(), child.getNodeId()));
                    depths.put(child.getNodeId(), depth + 1);
                }
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
        }
        return new TreeLayout(order, depths, childIds, connections);
    }

    /// Returns all node ids, parents before children, siblings in insertion order.
    public List<Integer> getDepthFirstOrder() {
        return depthFirstOrder;
    }

    /// Returns the distance from the root (root = 0).
    ///
    /// @throws IllegalArgumentException if the node is not part of the layout
    public int getDepth(int nodeId) {
        Integer depth = depths.get(nodeId);
        if (depth == null) {
            throw new IllegalArgumentException("Node #" + nodeId + " is not part of the layout");
        }
        return depth;
    }

    public int getMaxDepth() {
        return depths.values().stream().mapToInt(Integer::intValue).max().orElse(-1);
    }

    public List<Connection> getConnections() {
        return connections;
    }

    /// Returns the node and all its descendants in depth-first order.
    public List<Integer> getSubtreeIds(int nodeId) {
        getDepth(nodeId);
        List<Integer> ids = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(nodeId);
        while (!stack.isEmpty()) {
            int id = stack.pop();
            ids.add(id);
            List<Integer> children = childIds.get(id);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return ids;
    }

    /// Returns true if `nodeId` lies in the subtree below `ancestorId` (excluding itself).
    public boolean isDescendant(int ancestorId, int nodeId) {
        return ancestorId != nodeId && getSubtreeIds(ancestorId).contains(nodeId);
    }

    public List<Integer> getLeafIds() {
        return depthFirstOrder.stream().filter(id -> childIds.get(id).isEmpty()).toList();
    }

    public int size() {
        return depthFirstOrder.size();
    }
}
