package io.xrdflow.serialization;

import static io.xrdflow.serialization.ScanGeometrySerializer.DIM;
import static io.xrdflow.serialization.ScanGeometrySerializer.TITLE;
import static io.xrdflow.serialization.ScanGeometrySerializer.key;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.xrdflow.core.scan.ScanGeometry;
import java.io.IOException;
import java.io.Serial;

/// Reads the flat scan description written by {@link ScanGeometrySerializer}.
///
/// `scan_dim` and every `scan_dim{i}_n_points` are required. Labels and units default to
/// empty strings, `delta` to 1 and `offset` to 0. Keys of dimensions beyond `scan_dim` are
/// ignored.
///
/// @implNote Package-private. Registered by {@link XrdflowJacksonModule}.
class ScanGeometryDeserializer extends StdDeserializer<ScanGeometry> {

    @Serial private static final long serialVersionUID = -6460829358911327316L;

    ScanGeometryDeserializer() {
        super(ScanGeometry.class);
    }

    @Override
    public ScanGeometry deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        JsonNode dim = root == null ? null : root.get(DIM);
        if (dim == null || !dim.canConvertToInt()) {
            return ctxt.reportInputMismatch(
                    ScanGeometry.class, "A scan needs an integer '%s' entry", DIM);
        }

        ScanGeometry.Builder builder = ScanGeometry.builder().title(text(root, TITLE));
        for (int d = 0; d < dim.asInt(); d++) {
            JsonNode nPoints = root.get(key(d, "n_points"));
            if (nPoints == null || !nPoints.canConvertToInt()) {
                return ctxt.reportInputMismatch(
                        ScanGeometry.class, "Missing integer '%s'", key(d, "n_points"));
            }
            builder.dimension(
                    text(root, key(d, "label")),
                    text(root, key(d, "unit")),
                    nPoints.asInt(),
                    number(root, key(d, "delta"), 1.0),
                    number(root, key(d, "offset"), 0.0));
        }
        return builder.build();
    }

    private static String text(JsonNode root, String key) {
        JsonNode value = root.get(key);
        return value == null || value.isNull() ? "" : value.asText();
    }

    private static double number(JsonNode root, String key, double defaultValue) {
        JsonNode value = root.get(key);
        return value == null || value.isNull() ? defaultValue : value.asDouble();
    }
}
