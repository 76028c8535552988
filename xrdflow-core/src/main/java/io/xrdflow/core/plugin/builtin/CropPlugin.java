package io.xrdflow.core.plugin.builtin;

import io.xrdflow.core.data.Dataset;
import io.xrdflow.core.exception.ConfigException;
import io.xrdflow.core.exception.PluginExecutionException;
import io.xrdflow.core.plugin.AbstractPlugin;
import io.xrdflow.core.plugin.DataDim;
import io.xrdflow.core.plugin.PluginParameter;
import io.xrdflow.core.plugin.PluginResult;
import io.xrdflow.core.plugin.PluginType;
import java.util.Map;

/// Crops 1-D or 2-D data to a region of interest.
///
/// Bounds follow slice semantics: `start` is inclusive, `stop` exclusive, negative values
/// count from the end and an unset `stop` extends to the end. `x` addresses the last axis,
/// `y` the first axis of 2-D data.
public class CropPlugin extends AbstractPlugin {

    public static final String X_START = "x_start";
    public static final String X_STOP = "x_stop";
    public static final String Y_START = "y_start";
    public static final String Y_STOP = "y_stop";

    public CropPlugin() {
        super("Crop", PluginType.PROCESSING, DataDim.UNKNOWN, DataDim.UNCHANGED);
        getParameters().add(PluginParameter.ofInt(X_START, 0, "First index along x"));
        getParameters().add(PluginParameter.ofInt(X_STOP, null, "Stop index along x"));
        getParameters().add(PluginParameter.ofInt(Y_START, 0, "First index along y (2-D only)"));
        getParameters().add(PluginParameter.ofInt(Y_STOP, null, "Stop index along y (2-D only)"));
    }

    @Override
    public void calculateResultShape() {
        int[] in = requireInputShape();
        int[][] bounds = bounds(in);
        resultShape = new int[in.length];
        for (int d = 0; d < in.length; d++) {
            resultShape[d] = bounds[d][1] - bounds[d][0];
        }
    }

    @Override
    public PluginResult execute(Object data, Map<String, Object> kwargs)
            throws PluginExecutionException {
        Dataset input = requireDataset(data);
        int[] shape = input.getShape();
        int[][] bounds;
        try {
            bounds = bounds(shape);
        } catch (ConfigException e) {
            throw new PluginExecutionException(e.getMessage(), e);
        }

        Dataset cropped;
        if (shape.length == 1) {
            int[] x = bounds[0];
            cropped = Dataset.zeros(x[1] - x[0]);
            System.arraycopy(input.getData(), x[0], cropped.getData(), 0, x[1] - x[0]);
            cropped.setAxis(0, input.getAxis(0).slice(x[0], x[1]));
        } else {
            int[] y = bounds[0];
            int[] x = bounds[1];
            int width = x[1] - x[0];
            cropped = Dataset.zeros(y[1] - y[0], width);
            for (int row = y[0]; row < y[1]; row++) {
                System.arraycopy(
                        input.getData(),
                        row * shape[1] + x[0],
                        cropped.getData(),
                        (row - y[0]) * width,
                        width);
            }
            cropped.setAxis(0, input.getAxis(0).slice(y[0], y[1]));
            cropped.setAxis(1, input.getAxis(1).slice(x[0], x[1]));
        }
        cropped.copyDataMetadataFrom(input);
        return new PluginResult(cropped, kwargs);
    }

    private int[][] bounds(int[] shape) {
        if (shape.length == 1) {
            return new int[][] {resolve("x", X_START, X_STOP, shape[0])};
        }
        if (shape.length == 2) {
            return new int[][] {
                resolve("y", Y_START, Y_STOP, shape[0]), resolve("x", X_START, X_STOP, shape[1])
            };
        }
        throw new ConfigException("Crop supports 1-D and 2-D data, got " + shape.length + "-D");
    }

    private int[] resolve(String axis, String startKey, String stopKey, int extent) {
        Integer startValue = getParameters().getInt(startKey);
        Integer stopValue = getParameters().getInt(stopKey);
        int start = normalize(startValue == null ? 0 : startValue, extent);
        int stop = stopValue == null ? extent : normalize(stopValue, extent);
        if (stop <= start) {
            throw new ConfigException(
                    "Crop range along "
                            + axis
                            + " is empty: ["
                            + startValue
                            + ", "
                            + stopValue
                            + ") for extent "
                            + extent);
        }
        return new int[] {start, stop};
    }

    private static int normalize(int index, int extent) {
        int resolved = index < 0 ? extent + index : index;
        return Math.max(0, Math.min(extent, resolved));
    }

    @Override
    protected CropPlugin newInstance() {
        return new CropPlugin();
    }
}
