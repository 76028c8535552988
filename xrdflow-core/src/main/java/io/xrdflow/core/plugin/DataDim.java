package io.xrdflow.core.plugin;

/// Declared dimensionality of a plugin's input or output data.
///
/// Either a fixed non-negative number of axes, {@link #UNCHANGED} ("same as the input")
/// or {@link #UNKNOWN} ("any" for inputs, "unknown until run" for outputs).
///
/// @implNote Immutable and thread-safe.
public final class DataDim {

    public static final DataDim UNCHANGED = new DataDim(-2);
    public static final DataDim UNKNOWN = new DataDim(-1);

    private final int value;

    private DataDim(int value) {
        this.value = value;
    }

    /// Returns a fixed dimensionality.
    ///
    /// @param ndim number of axes, not negative
    /// @return dimensionality instance, never null
    /// @throws IllegalArgumentException if `ndim` is negative
    public static DataDim of(int ndim) {
        if (ndim < 0) {
            throw new IllegalArgumentException("Dimensionality must not be negative: " + ndim);
        }
        return new DataDim(ndim);
    }

    public boolean isFixed() {
        return value >= 0;
    }

    /// Returns the fixed number of axes.
    ///
    /// @throws IllegalStateException if this dimensionality is not fixed
    public int value() {
        if (!isFixed()) {
            throw new IllegalStateException("Dimensionality " + this + " is not fixed");
        }
        return value;
    }

    /// Returns true if data with this dimensionality can feed an input declaring `other`.
    /// Non-fixed values on either side match anything.
    public boolean isCompatibleWith(DataDim other) {
        return !isFixed() || !other.isFixed() || value == other.value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DataDim other && other.value == value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        if (this.value == UNCHANGED.value) {
            return "unchanged";
        }
        if (this.value == UNKNOWN.value) {
            return "unknown";
        }
        return Integer.toString(value);
    }
}
