package io.xrdflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.xrdflow.core.workflow.NodeSnapshot;
import io.xrdflow.core.workflow.WorkflowTree;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Writes a tree as a list of node records in ascending id order.
///
/// ```
/// - node_id: 1
///   parent: 0
///   children: [2]
///   plugin_class: CropPlugin
///   plugin_params:
///     - [label, ""]
///     - [x_start, 10]
/// ```
///
/// `plugin_params` keeps the parameter order of the plugin as `[key, value]` pairs.
///
/// @implNote Package-private. Registered by {@link XrdflowJacksonModule}.
/// @see WorkflowTreeDeserializer for the inverse operation
class WorkflowTreeSerializer extends StdSerializer<WorkflowTree> {

    @Serial private static final long serialVersionUID = 6091270413861625139L;

    static final String NODE_ID = "node_id";
    static final String PARENT = "parent";
    static final String CHILDREN = "children";
    static final String PLUGIN_CLASS = "plugin_class";
    static final String PLUGIN_PARAMS = "plugin_params";

    WorkflowTreeSerializer() {
        super(WorkflowTree.class);
    }

    @Override
    public void serialize(WorkflowTree tree, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartArray();
        for (NodeSnapshot node : tree.snapshot()) {
            gen.writeStartObject();
            gen.writeNumberField(NODE_ID, node.nodeId());
            if (node.parentId() == null) {
                gen.writeNullField(PARENT);
            } else {
                gen.writeNumberField(PARENT, node.parentId());
            }
            gen.writeArrayFieldStart(CHILDREN);
            for (Integer childId : node.childIds()) {
                gen.writeNumber(childId);
            }
            gen.writeEndArray();
            gen.writeStringField(PLUGIN_CLASS, node.plugin().getPluginClass());
            gen.writeArrayFieldStart(PLUGIN_PARAMS);
            for (Map.Entry<String, Object> param : node.plugin().getParameters().entries()) {
                gen.writeStartArray();
                gen.writeString(param.getKey());
                gen.writeObject(param.getValue());
                gen.writeEndArray();
            }
            gen.writeEndArray();
            gen.writeEndObject();
        }
        gen.writeEndArray();
    }
}
