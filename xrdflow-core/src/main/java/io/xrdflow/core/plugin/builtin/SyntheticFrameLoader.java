package io.xrdflow.core.plugin.builtin;

import io.xrdflow.core.data.AxisMetadata;
import io.xrdflow.core.data.Dataset;
import io.xrdflow.core.exception.ConfigException;
import io.xrdflow.core.exception.PluginExecutionException;
import io.xrdflow.core.plugin.AbstractPlugin;
import io.xrdflow.core.plugin.DataDim;
import io.xrdflow.core.plugin.PluginParameter;
import io.xrdflow.core.plugin.PluginResult;
import io.xrdflow.core.plugin.PluginType;
import java.util.Map;

/// Input plugin producing deterministic detector frames without any file access.
///
/// Pixel `(r, c)` of frame `i` holds `background + frame_step * i + r * columns + c`, so
/// every frame is distinguishable and every value can be predicted. With `rows = 0` the
/// frame is one-dimensional with `columns` points.
///
/// Adds the keyword argument `frame_index` for downstream plugins.
public class SyntheticFrameLoader extends AbstractPlugin {

    public static final String ROWS = "rows";
    public static final String COLUMNS = "columns";
    public static final String FRAME_STEP = "frame_step";
    public static final String BACKGROUND = "background";

    public SyntheticFrameLoader() {
        super("Synthetic frame loader", PluginType.INPUT, DataDim.of(0), DataDim.UNKNOWN);
        getParameters()
                .add(
                        PluginParameter.ofInt(
                                ROWS, 8, "Number of detector rows; 0 yields a 1-D frame"));
        getParameters().add(PluginParameter.ofInt(COLUMNS, 8, "Number of detector columns"));
        getParameters()
                .add(PluginParameter.ofDouble(FRAME_STEP, 1.0, "Intensity increase per frame"));
        getParameters()
                .add(PluginParameter.ofDouble(BACKGROUND, 0.0, "Constant offset of all pixels"));
    }

    @Override
    public void calculateResultShape() {
        int rows = getParameters().getInt(ROWS);
        int columns = getParameters().getInt(COLUMNS);
        if (rows < 0 || columns < 1) {
            throw new ConfigException(
                    "Invalid synthetic frame size: rows=" + rows + ", columns=" + columns);
        }
        resultShape = rows == 0 ? new int[] {columns} : new int[] {rows, columns};
    }

    @Override
    public PluginResult execute(Object data, Map<String, Object> kwargs)
            throws PluginExecutionException {
        if (!(data instanceof Integer frameIndex)) {
            throw new PluginExecutionException(
                    "Synthetic frame loader expects an integer frame index, got " + data);
        }
        if (resultShape == null) {
            calculateResultShape();
        }
        double step = getParameters().getDouble(FRAME_STEP);
        double background = getParameters().getDouble(BACKGROUND);

        Dataset frame = Dataset.zeros(resultShape);
        double[] values = frame.getData();
        for (int i = 0; i < values.length; i++) {
            values[i] = background + step * frameIndex + i;
        }
        if (resultShape.length == 1) {
            frame.setAxis(0, pixelAxis("detector column", resultShape[0]));
        } else {
            frame.setAxis(0, pixelAxis("detector row", resultShape[0]));
            frame.setAxis(1, pixelAxis("detector column", resultShape[1]));
        }
        frame.setDataLabel("intensity");
        frame.setDataUnit("counts");

        kwargs.put("frame_index", frameIndex);
        return new PluginResult(frame, kwargs);
    }

    private static AxisMetadata pixelAxis(String label, int length) {
        return new AxisMetadata(label, "pixel", AxisMetadata.indexRange(length));
    }

    @Override
    protected SyntheticFrameLoader newInstance() {
        return new SyntheticFrameLoader();
    }
}
