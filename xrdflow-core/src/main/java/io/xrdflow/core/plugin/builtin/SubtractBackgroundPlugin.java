package io.xrdflow.core.plugin.builtin;

import io.xrdflow.core.data.Dataset;
import io.xrdflow.core.exception.PluginExecutionException;
import io.xrdflow.core.plugin.AbstractPlugin;
import io.xrdflow.core.plugin.DataDim;
import io.xrdflow.core.plugin.PluginParameter;
import io.xrdflow.core.plugin.PluginResult;
import io.xrdflow.core.plugin.PluginType;
import java.util.Map;

/// Subtracts a constant background in place, optionally clipping negative values to zero.
public class SubtractBackgroundPlugin extends AbstractPlugin {

    public static final String BACKGROUND = "background";
    public static final String CLIP_AT_ZERO = "clip_at_zero";

    public SubtractBackgroundPlugin() {
        super("Subtract background", PluginType.PROCESSING, DataDim.UNKNOWN, DataDim.UNCHANGED);
        getParameters().add(PluginParameter.ofDouble(BACKGROUND, 0.0, "Background level"));
        getParameters()
                .add(
                        PluginParameter.ofBoolean(
                                CLIP_AT_ZERO, true, "Set negative values to zero"));
    }

    @Override
    public PluginResult execute(Object data, Map<String, Object> kwargs)
            throws PluginExecutionException {
        Dataset dataset = requireDataset(data);
        double background = getParameters().getDouble(BACKGROUND);
        boolean clip = getParameters().getBoolean(CLIP_AT_ZERO);

        double[] values = dataset.getData();
        for (int i = 0; i < values.length; i++) {
            double v = values[i] - background;
            values[i] = clip && v < 0 ? 0.0 : v;
        }
        return new PluginResult(dataset, kwargs);
    }

    @Override
    protected SubtractBackgroundPlugin newInstance() {
        return new SubtractBackgroundPlugin();
    }
}
