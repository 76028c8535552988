package io.xrdflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.xrdflow.core.data.AxisMetadata;
import io.xrdflow.core.data.Dataset;
import io.xrdflow.core.results.ResultMetadata;
import io.xrdflow.core.results.WorkflowResults;
import java.io.IOException;
import java.io.Serial;

/// Writes the scan and every composite result array with its metadata.
///
/// ```
/// scan:    { scan_title, scan_dim, scan_dim0_label, ... }
/// state:   ALLOCATED_METADATA_COMPLETE
/// nodes:
///   - node_id, title, plugin_name, label, data_label, data_unit,
///     shape: [n0, ..., r0, ...],
///     axes:  [{label, unit, range}, ...]   one entry per composite axis
///     data:  [...]                         row-major, flat
/// ```
///
/// @implNote Package-private. Registered by {@link XrdflowJacksonModule}. Write-only.
class WorkflowResultsSerializer extends StdSerializer<WorkflowResults> {

    @Serial private static final long serialVersionUID = 4729020145539617081L;

    WorkflowResultsSerializer() {
        super(WorkflowResults.class);
    }

    @Override
    public void serialize(WorkflowResults results, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        provider.defaultSerializeField("scan", results.getScan(), gen);
        gen.writeStringField("state", results.getState().name());
        gen.writeArrayFieldStart("nodes");
        for (Integer nodeId : results.getNodeIdsWithResults()) {
            writeNode(results, nodeId, gen);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }

    private void writeNode(WorkflowResults results, int nodeId, JsonGenerator gen)
            throws IOException {
        Dataset composite = results.getResults(nodeId);
        ResultMetadata metadata = results.getResultMetadata(nodeId);

        gen.writeStartObject();
        gen.writeNumberField("node_id", nodeId);
        gen.writeStringField("title", metadata.title());
        gen.writeStringField("plugin_name", results.getPluginNames().get(nodeId));
        gen.writeStringField("label", results.getNodeLabels().get(nodeId));
        gen.writeStringField("data_label", metadata.dataLabel());
        gen.writeStringField("data_unit", metadata.dataUnit());

        int[] shape = composite.getShape();
        gen.writeFieldName("shape");
        gen.writeArray(shape, 0, shape.length);

        gen.writeArrayFieldStart("axes");
        for (AxisMetadata axis : metadata.axes()) {
            gen.writeStartObject();
            gen.writeStringField("label", axis.label());
            gen.writeStringField("unit", axis.unit());
            double[] range = axis.range();
            gen.writeFieldName("range");
            if (range == null) {
                gen.writeNull();
            } else {
                gen.writeArray(range, 0, range.length);
            }
            gen.writeEndObject();
        }
        gen.writeEndArray();

        double[] data = composite.getData();
        gen.writeFieldName("data");
        gen.writeArray(data, 0, data.length);
        gen.writeEndObject();
    }
}
