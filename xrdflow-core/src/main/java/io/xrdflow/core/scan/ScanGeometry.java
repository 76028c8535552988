package io.xrdflow.core.scan;

import io.xrdflow.core.data.AxisMetadata;
import io.xrdflow.core.data.Shapes;
import io.xrdflow.core.exception.ConfigException;
import io.xrdflow.core.exception.IndexRangeException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Geometry of a scan with one to four dimensions.
///
/// Frames are numbered in row-major (C) order: the last dimension varies fastest. The
/// mapping between a frame index and its scan position is a bijection on `[0, nTotal)`:
///
/// ```
/// position[d] = (frameIndex / prod(shape[d+1:])) % shape[d]
/// ```
///
/// @implNote Immutable and thread-safe.
public final class ScanGeometry {

    public static final int MAX_DIMENSIONS = 4;

    private final String title;
    private final List<ScanDimension> dimensions;
    private final int[] shape;
    private final int[] strides;
    private final int nTotal;

    private ScanGeometry(Builder builder) {
        if (builder.dimensions.isEmpty() || builder.dimensions.size() > MAX_DIMENSIONS) {
            throw new ConfigException(
                    "A scan needs between 1 and "
                            + MAX_DIMENSIONS
                            + " dimensions, got "
                            + builder.dimensions.size());
        }
        this.title = builder.title;
        this.dimensions = List.copyOf(builder.dimensions);
        this.shape = dimensions.stream().mapToInt(ScanDimension::nPoints).toArray();
        this.nTotal = Shapes.product(shape);
        this.strides = new int[shape.length];
        int stride = 1;
        for (int d = shape.length - 1; d >= 0; d--) {
            strides[d] = stride;
            stride *= shape[d];
        }
    }

    /// Creates a one-dimensional scan over frame numbers `0..nPoints-1`.
    ///
    /// @param nPoints number of frames, at least 1
    /// @return new geometry, never null
    public static ScanGeometry linear(int nPoints) {
        return builder().dimension(new ScanDimension("Frame number", "", nPoints, 1.0, 0.0)).build();
    }

    public String getTitle() {
        return title;
    }

    public int getScanDim() {
        return dimensions.size();
    }

    public List<ScanDimension> getDimensions() {
        return dimensions;
    }

    public ScanDimension getDimension(int dim) {
        checkDimension(dim);
        return dimensions.get(dim);
    }

    /// Returns the number of points per dimension.
    public int[] getShape() {
        return shape.clone();
    }

    /// Returns the total number of frames.
    public int getNTotal() {
        return nTotal;
    }

    /// Converts a frame index into its scan position.
    ///
    /// @param frameIndex linear frame index
    /// @return one index per scan dimension, never null
    /// @throws IndexRangeException if `frameIndex` is not in `[0, nTotal)`
    public int[] frameToPosition(int frameIndex) {
        if (frameIndex < 0 || frameIndex >= nTotal) {
            throw new IndexRangeException(
                    "Frame index " + frameIndex + " is outside the scan range [0, " + nTotal + ")");
        }
        int[] position = new int[shape.length];
        for (int d = 0; d < shape.length; d++) {
            position[d] = (frameIndex / strides[d]) % shape[d];
        }
        return position;
    }

    /// Converts a scan position into its frame index.
    ///
    /// @param position one index per scan dimension
    /// @return linear frame index
    /// @throws IndexRangeException if the position has the wrong length or an index is out
    /// of range
    public int positionToFrame(int... position) {
        if (position.length != shape.length) {
            throw new IndexRangeException(
                    "Scan position "
                            + Arrays.toString(position)
                            + " does not match the scan dimensionality "
                            + shape.length);
        }
        int frame = 0;
        for (int d = 0; d < shape.length; d++) {
            if (position[d] < 0 || position[d] >= shape[d]) {
                throw new IndexRangeException(
                        "Index "
                                + position[d]
                                + " is outside the range of scan dimension "
                                + d
                                + " with "
                                + shape[d]
                                + " points");
            }
            frame += position[d] * strides[d];
        }
        return frame;
    }

    /// Returns the coordinates of one dimension.
    public double[] getRange(int dim) {
        return getDimension(dim).range();
    }

    /// Returns label, unit and coordinates of one dimension.
    public AxisMetadata getAxisMetadata(int dim) {
        ScanDimension dimension = getDimension(dim);
        return new AxisMetadata(dimension.label(), dimension.unit(), dimension.range());
    }

    private void checkDimension(int dim) {
        if (dim < 0 || dim >= dimensions.size()) {
            throw new IndexRangeException(
                    "Scan dimension " + dim + " does not exist in a " + dimensions.size() + "-D scan");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScanGeometry other)) return false;
        return title.equals(other.title) && dimensions.equals(other.dimensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, dimensions);
    }

    @Override
    public String toString() {
        return "ScanGeometry{title='" + title + "', shape=" + Shapes.format(shape) + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link ScanGeometry}.
    public static final class Builder {
        private String title = "";
        private final List<ScanDimension> dimensions = new ArrayList<>();

        private Builder() {}

        public Builder title(String title) {
            this.title = title == null ? "" : title;
            return this;
        }

        /// Appends a dimension; the first call defines the slowest axis.
        public Builder dimension(ScanDimension dimension) {
            this.dimensions.add(Objects.requireNonNull(dimension, "dimension"));
            return this;
        }

        public Builder dimension(String label, String unit, int nPoints, double delta, double offset) {
            return dimension(new ScanDimension(label, unit, nPoints, delta, offset));
        }

        /// Builds the geometry.
        ///
        /// @return new geometry, never null
        /// @throws ConfigException if there are no or more than four dimensions, or the scan
        /// has more than `Integer.MAX_VALUE` frames
        public ScanGeometry build() {
            return new ScanGeometry(this);
        }
    }
}
