package io.xrdflow.serialization;

import static io.xrdflow.serialization.WorkflowTreeSerializer.CHILDREN;
import static io.xrdflow.serialization.WorkflowTreeSerializer.NODE_ID;
import static io.xrdflow.serialization.WorkflowTreeSerializer.PARENT;
import static io.xrdflow.serialization.WorkflowTreeSerializer.PLUGIN_CLASS;
import static io.xrdflow.serialization.WorkflowTreeSerializer.PLUGIN_PARAMS;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.xrdflow.core.exception.ConfigException;
import io.xrdflow.core.exception.PluginNotFoundException;
import io.xrdflow.core.plugin.Plugin;
import io.xrdflow.core.plugin.PluginRegistry;
import io.xrdflow.core.workflow.NodeSnapshot;
import io.xrdflow.core.workflow.WorkflowTree;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Reads the node records written by {@link WorkflowTreeSerializer}.
///
/// Works in two passes: every record is turned into a plugin and a {@link NodeSnapshot}
/// first, then {@link WorkflowTree#restoreNodes(List)} links parents and children. Records
/// may therefore appear in any order.
///
/// Malformed records raise a `MismatchedInputException`; unknown plugin classes, unknown
/// parameters and inconsistent structure raise {@link ConfigException}.
///
/// @implNote Package-private. Registered by {@link XrdflowJacksonModule}.
class WorkflowTreeDeserializer extends StdDeserializer<WorkflowTree> {

    @Serial private static final long serialVersionUID = -1803915590420668743L;

    private final transient PluginRegistry pluginRegistry;

    WorkflowTreeDeserializer(PluginRegistry pluginRegistry) {
        super(WorkflowTree.class);
        this.pluginRegistry = pluginRegistry;
    }

    @Override
    public WorkflowTree deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectCodec codec = p.getCodec();
        JsonNode root = codec.readTree(p);
        if (root == null || !root.isArray()) {
            return ctxt.reportInputMismatch(
                    WorkflowTree.class, "A workflow tree must be a list of node records");
        }

        List<NodeSnapshot> snapshots = new ArrayList<>();
        for (JsonNode record : root) {
            snapshots.add(readNode(codec, record, ctxt));
        }
        WorkflowTree tree = new WorkflowTree();
        if (!snapshots.isEmpty()) {
            tree.restoreNodes(snapshots);
        }
        return tree;
    }

    private NodeSnapshot readNode(ObjectCodec codec, JsonNode record, DeserializationContext ctxt)
            throws IOException {
        JsonNode id = record.get(NODE_ID);
        JsonNode pluginClass = record.get(PLUGIN_CLASS);
        if (!isInt(id) || pluginClass == null || !pluginClass.isTextual()) {
            return ctxt.reportInputMismatch(
                    WorkflowTree.class,
                    "Node records need an integer '%s' and a '%s': %s",
                    NODE_ID,
                    PLUGIN_CLASS,
                    record);
        }
        int nodeId = id.intValue();

        JsonNode parent = record.get(PARENT);
        Integer parentId = null;
        if (parent != null && !parent.isNull()) {
            if (!isInt(parent)) {
                return ctxt.reportInputMismatch(
                        WorkflowTree.class,
                        "'%s' of node #%d must be an integer or null: %s",
                        PARENT,
                        nodeId,
                        parent);
            }
            parentId = parent.intValue();
        }

        List<Integer> childIds = new ArrayList<>();
        JsonNode children = record.get(CHILDREN);
        if (children != null && !children.isNull()) {
            if (!children.isArray()) {
                return ctxt.reportInputMismatch(
                        WorkflowTree.class,
                        "'%s' of node #%d must be a list of integers: %s",
                        CHILDREN,
                        nodeId,
                        children);
            }
            for (JsonNode child : children) {
                if (!isInt(child)) {
                    return ctxt.reportInputMismatch(
                            WorkflowTree.class,
                            "'%s' of node #%d must be a list of integers: %s",
                            CHILDREN,
                            nodeId,
                            children);
                }
                childIds.add(child.intValue());
            }
        }

        Plugin plugin;
        try {
            plugin = pluginRegistry.createPluginOrThrow(pluginClass.asText());
        } catch (PluginNotFoundException e) {
            throw new ConfigException(
                    "Cannot restore node #" + nodeId + ": " + e.getMessage(), e);
        }

        JsonNode params = record.get(PLUGIN_PARAMS);
        if (params != null) {
            for (JsonNode pair : params) {
                if (!pair.isArray() || pair.size() != 2) {
                    return ctxt.reportInputMismatch(
                            WorkflowTree.class,
                            "Parameters of node #%d must be [key, value] pairs: %s",
                            nodeId,
                            pair);
                }
                Object value = codec.treeToValue(pair.get(1), Object.class);
                plugin.getParameters().set(pair.get(0).asText(), value);
            }
        }
        return new NodeSnapshot(nodeId, parentId, childIds, plugin);
    }

    // Strings and fractions are rejected instead of being coerced.
    private static boolean isInt(JsonNode value) {
        return value != null && value.isIntegralNumber() && value.canConvertToInt();
    }
}
