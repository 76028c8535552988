package io.xrdflow.core.data;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Dense N-dimensional array of doubles with axis and data metadata.
///
/// Values are stored row-major (C order) in a single backing array. Every axis carries an
/// {@link AxisMetadata} entry; the dataset itself carries a data label and unit describing
/// the stored values.
///
/// ### Contracts
/// - **Invariant**: `getData().length == Shapes.product(getShape())`
/// - **Invariant**: the number of axis entries equals `ndim()`
///
/// @implNote **Not thread-safe**. Plugins commonly modify the backing array in place;
/// callers that hand one dataset to several consumers must {@link #copy()} it first.
public final class Dataset {

    private final double[] data;
    private final int[] shape;
    private final AxisMetadata[] axes;
    private String dataLabel = "";
    private String dataUnit = "";

    private Dataset(double[] data, int[] shape) {
        this.data = data;
        this.shape = shape;
        this.axes = new AxisMetadata[shape.length];
        Arrays.fill(axes, AxisMetadata.empty());
    }

    /// Creates a zero-filled dataset.
    ///
    /// @param shape extents per axis, each non-negative
    /// @return new dataset, never null
    /// @throws IllegalArgumentException if an extent is negative
    public static Dataset zeros(int... shape) {
        Objects.requireNonNull(shape, "shape");
        if (!Shapes.isResolved(shape)) {
            throw new IllegalArgumentException("Negative extent in shape " + Shapes.format(shape));
        }
        return new Dataset(new double[Shapes.product(shape)], shape.clone());
    }

    /// Wraps an existing row-major array. The array is not copied.
    ///
    /// @param data values in row-major order, not null
    /// @param shape extents per axis
    /// @return new dataset backed by `data`, never null
    /// @throws IllegalArgumentException if `data.length` does not match the shape
    public static Dataset of(double[] data, int... shape) {
        Objects.requireNonNull(data, "data");
        if (!Shapes.isResolved(shape) || Shapes.product(shape) != data.length) {
            throw new IllegalArgumentException(
                    "Cannot wrap "
                            + data.length
                            + " values in an array of shape "
                            + Shapes.format(shape));
        }
        return new Dataset(data, shape.clone());
    }

    public int[] getShape() {
        return shape.clone();
    }

    public boolean hasShape(int[] other) {
        return Arrays.equals(shape, other);
    }

    public int ndim() {
        return shape.length;
    }

    public int size() {
        return data.length;
    }

    /// Returns the live backing array.
    public double[] getData() {
        return data;
    }

    public double get(int... index) {
        return data[flatIndex(index)];
    }

    public void set(double value, int... index) {
        data[flatIndex(index)] = value;
    }

    /// Returns the sum of all values.
    public double sum() {
        double total = 0.0;
        for (double v : data) {
            total += v;
        }
        return total;
    }

    /// Writes `value` into the sub-array addressed by the leading indices.
    ///
    /// For a dataset of shape `(4, 6, 3)`, `setSlice(new int[] {2, 1}, v)` replaces the
    /// three values at `[2, 1, :]`, and `v` must have shape `(3,)`.
    ///
    /// @param leadingIndex indices along the first axes, not null
    /// @param value replacement values, shape must equal the remaining extents
    /// @throws IllegalArgumentException if `value` has the wrong shape
    public void setSlice(int[] leadingIndex, Dataset value) {
        int[] trailing = Arrays.copyOfRange(shape, leadingIndex.length, shape.length);
        if (!value.hasShape(trailing)) {
            throw new IllegalArgumentException(
                    "Slice has shape "
                            + Shapes.format(trailing)
                            + " but value has shape "
                            + Shapes.format(value.shape));
        }
        int blockSize = Shapes.product(trailing);
        System.arraycopy(value.data, 0, data, sliceOffset(leadingIndex, blockSize), blockSize);
    }

    /// Returns a copy of the sub-array addressed by the leading indices, with the trailing
    /// axis metadata and the data label and unit of this dataset.
    public Dataset getSlice(int... leadingIndex) {
        int[] trailing = Arrays.copyOfRange(shape, leadingIndex.length, shape.length);
        int blockSize = Shapes.product(trailing);
        double[] values = new double[blockSize];
        System.arraycopy(data, sliceOffset(leadingIndex, blockSize), values, 0, blockSize);
        Dataset slice = new Dataset(values, trailing);
        System.arraycopy(axes, leadingIndex.length, slice.axes, 0, trailing.length);
        slice.copyDataMetadataFrom(this);
        return slice;
    }

    /// Returns a copy with a different shape of the same number of elements. Axis metadata
    /// is reset; the data label and unit are kept.
    public Dataset reshape(int... newShape) {
        Dataset reshaped = Dataset.of(data.clone(), newShape);
        reshaped.copyDataMetadataFrom(this);
        return reshaped;
    }

    /// Returns a deep copy of values and metadata.
    public Dataset copy() {
        Dataset copy = new Dataset(data.clone(), shape.clone());
        System.arraycopy(axes, 0, copy.axes, 0, axes.length);
        copy.copyDataMetadataFrom(this);
        return copy;
    }

    public AxisMetadata getAxis(int axis) {
        return axes[axis];
    }

    public void setAxis(int axis, AxisMetadata metadata) {
        axes[axis] = metadata == null ? AxisMetadata.empty() : metadata;
    }

    public List<AxisMetadata> getAxes() {
        return List.of(axes);
    }

    public String getDataLabel() {
        return dataLabel;
    }

    public void setDataLabel(String dataLabel) {
        this.dataLabel = dataLabel == null ? "" : dataLabel;
    }

    public String getDataUnit() {
        return dataUnit;
    }

    public void setDataUnit(String dataUnit) {
        this.dataUnit = dataUnit == null ? "" : dataUnit;
    }

    /// Copies data label and unit from another dataset.
    public void copyDataMetadataFrom(Dataset other) {
        this.dataLabel = other.dataLabel;
        this.dataUnit = other.dataUnit;
    }

    private int flatIndex(int[] index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException(
                    "Expected " + shape.length + " indices, got " + index.length);
        }
        return sliceOffset(index, 1);
    }

    private int sliceOffset(int[] leadingIndex, int blockSize) {
        if (leadingIndex.length > shape.length) {
            throw new IllegalArgumentException(
                    "Too many indices for an array of shape " + Shapes.format(shape));
        }
        int offset = 0;
        for (int d = 0; d < leadingIndex.length; d++) {
            if (leadingIndex[d] < 0 || leadingIndex[d] >= shape[d]) {
                throw new IndexOutOfBoundsException(
                        "Index "
                                + leadingIndex[d]
                                + " out of range for axis "
                                + d
                                + " with extent "
                                + shape[d]);
            }
            offset = offset * shape[d] + leadingIndex[d];
        }
        return offset * blockSize;
    }

    @Override
    public String toString() {
        return "Dataset{shape=" + Shapes.format(shape) + ", dataLabel='" + dataLabel + "'}";
    }
}
