package io.xrdflow.core.data;

import io.xrdflow.core.exception.ConfigException;
import java.util.Arrays;
import java.util.stream.Collectors;

/// Static helpers for array shapes.
public final class Shapes {

    private Shapes() {}

    /// Returns the number of elements of an array with the given shape.
    ///
    /// @throws ConfigException if the count does not fit into an `int`
    public static int product(int[] shape) {
        int n = 1;
        try {
            for (int extent : shape) {
                n = Math.multiplyExact(n, extent);
            }
        } catch (ArithmeticException e) {
            throw new ConfigException(
                    "Shape " + format(shape) + " has more than " + Integer.MAX_VALUE + " elements",
                    e);
        }
        return n;
    }

    /// Concatenates two shapes, `leading` first.
    public static int[] concat(int[] leading, int[] trailing) {
        int[] result = Arrays.copyOf(leading, leading.length + trailing.length);
        System.arraycopy(trailing, 0, result, leading.length, trailing.length);
        return result;
    }

    /// Returns true if every extent is non-negative.
    public static boolean isResolved(int[] shape) {
        if (shape == null) {
            return false;
        }
        for (int extent : shape) {
            if (extent < 0) {
                return false;
            }
        }
        return true;
    }

    /// Formats a shape as `(4, 6)`; a 1-D shape prints as `(5,)`.
    public static String format(int[] shape) {
        if (shape == null) {
            return "(unknown)";
        }
        if (shape.length == 1) {
            return "(" + shape[0] + ",)";
        }
        return Arrays.stream(shape)
                .mapToObj(String::valueOf)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
