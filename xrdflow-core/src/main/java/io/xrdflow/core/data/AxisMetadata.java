package io.xrdflow.core.data;

import java.util.Arrays;

/// Label, unit and coordinate values of one array axis.
///
/// @param label axis label, never null (may be empty)
/// @param unit axis unit, never null (may be empty)
/// @param range coordinate value per index along the axis, may be null when unknown
public record AxisMetadata(String label, String unit, double[] range) {

    private static final AxisMetadata EMPTY = new AxisMetadata("", "", null);

    public AxisMetadata {
        label = label == null ? "" : label;
        unit = unit == null ? "" : unit;
        range = range == null ? null : range.clone();
    }

    /// Returns axis metadata with empty label and unit and no range.
    ///
    /// @return shared empty instance, never null
    public static AxisMetadata empty() {
        return EMPTY;
    }

    /// Returns plain index coordinates `0, 1, ..., length - 1`.
    ///
    /// @param length number of points, not negative
    /// @return new index range, never null
    public static double[] indexRange(int length) {
        double[] range = new double[length];
        for (int i = 0; i < length; i++) {
            range[i] = i;
        }
        return range;
    }

    @Override
    public double[] range() {
        return range == null ? null : range.clone();
    }

    /// Returns the range, or index coordinates when no range is set.
    ///
    /// @param length number of points along the axis
    /// @return coordinate values, never null
    public double[] rangeOrIndices(int length) {
        return range != null ? range.clone() : indexRange(length);
    }

    /// Returns a copy of this metadata restricted to `range[start, stop)`.
    public AxisMetadata slice(int start, int stop) {
        return new AxisMetadata(
                label, unit, range == null ? null : Arrays.copyOfRange(range, start, stop));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AxisMetadata other)) return false;
        return label.equals(other.label)
                && unit.equals(other.unit)
                && Arrays.equals(range, other.range);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * label.hashCode() + unit.hashCode()) + Arrays.hashCode(range);
    }

    @Override
    public String toString() {
        return "AxisMetadata{label='"
                + label
                + "', unit='"
                + unit
                + "', range="
                + (range == null ? "null" : range.length + " points")
                + "}";
    }
}
