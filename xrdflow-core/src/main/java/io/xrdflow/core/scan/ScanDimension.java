package io.xrdflow.core.scan;

import io.xrdflow.core.exception.ConfigException;

/// One axis of a scan.
///
/// @param label axis label, never null
/// @param unit axis unit, never null
/// @param nPoints number of scan points along the axis, at least 1
/// @param delta step width between two points
/// @param offset coordinate of the first point
public record ScanDimension(String label, String unit, int nPoints, double delta, double offset) {

    public ScanDimension {
        if (nPoints < 1) {
            throw new ConfigException(
                    "Scan dimension '" + label + "' needs at least one point, got " + nPoints);
        }
        label = label == null ? "" : label;
        unit = unit == null ? "" : unit;
    }

    /// Returns the coordinates `offset + i * delta` for `i` in `[0, nPoints)`.
    public double[] range() {
        double[] range = new double[nPoints];
        for (int i = 0; i < nPoints; i++) {
            range[i] = offset + i * delta;
        }
        return range;
    }
}
