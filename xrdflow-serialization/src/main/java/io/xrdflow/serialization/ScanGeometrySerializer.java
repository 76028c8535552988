package io.xrdflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.xrdflow.core.scan.ScanDimension;
import io.xrdflow.core.scan.ScanGeometry;
import java.io.IOException;
import java.io.Serial;

/// Writes a scan as flat key-value pairs, one group of keys per dimension:
///
/// ```
/// scan_title: mesh
/// scan_dim: 2
/// scan_dim0_label: y
/// scan_dim0_unit: mm
/// scan_dim0_n_points: 4
/// scan_dim0_delta: 0.5
/// scan_dim0_offset: -1.0
/// scan_dim1_label: x
/// ...
/// ```
///
/// @implNote Package-private. Registered by {@link XrdflowJacksonModule}.
/// @see ScanGeometryDeserializer for the inverse operation
class ScanGeometrySerializer extends StdSerializer<ScanGeometry> {

    @Serial private static final long serialVersionUID = 2287514093301152790L;

    static final String TITLE = "scan_title";
    static final String DIM = "scan_dim";

    ScanGeometrySerializer() {
        super(ScanGeometry.class);
    }

    static String key(int dim, String suffix) {
        return DIM + dim + "_" + suffix;
    }

    @Override
    public void serialize(ScanGeometry scan, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField(TITLE, scan.getTitle());
        gen.writeNumberField(DIM, scan.getScanDim());
        for (int d = 0; d < scan.getScanDim(); d++) {
            ScanDimension dimension = scan.getDimension(d);
            gen.writeStringField(key(d, "label"), dimension.label());
            gen.writeStringField(key(d, "unit"), dimension.unit());
            gen.writeNumberField(key(d, "n_points"), dimension.nPoints());
            gen.writeNumberField(key(d, "delta"), dimension.delta());
            gen.writeNumberField(key(d, "offset"), dimension.offset());
        }
        gen.writeEndObject();
    }
}
