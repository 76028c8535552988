package io.xrdflow.core.results;

import io.xrdflow.core.data.AxisMetadata;
import java.util.List;

/// Metadata of one composite result array.
///
/// @param title result title of the node, never null
/// @param dataLabel label of the stored values, never null
/// @param dataUnit unit of the stored values, never null
/// @param axes one entry per composite dimension, every range set, never null
public record ResultMetadata(
        String title, String dataLabel, String dataUnit, List<AxisMetadata> axes) {

    public ResultMetadata {
        axes = List.copyOf(axes);
    }

    public List<String> axisLabels() {
        return axes.stream().map(AxisMetadata::label).toList();
    }

    public List<String> axisUnits() {
        return axes.stream().map(AxisMetadata::unit).toList();
    }

    public List<double[]> axisRanges() {
        return axes.stream().map(AxisMetadata::range).toList();
    }
}
