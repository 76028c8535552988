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

/// Sums the input along one axis. Summing 1-D data yields shape `(1,)`.
public class AxisSumPlugin extends AbstractPlugin {

    public static final String AXIS = "axis";

    public AxisSumPlugin() {
        super("Sum along axis", PluginType.PROCESSING, DataDim.UNKNOWN, DataDim.UNKNOWN);
        getParameters().add(PluginParameter.ofInt(AXIS, 0, "Axis to sum over"));
    }

    @Override
    public void calculateResultShape() {
        resultShape = reducedShape(requireInputShape());
    }

    @Override
    public PluginResult execute(Object data, Map<String, Object> kwargs)
            throws PluginExecutionException {
        Dataset input = requireDataset(data);
        int[] in = input.getShape();
        int[] out;
        try {
            out = reducedShape(in);
        } catch (ConfigException e) {
            throw new PluginExecutionException(e.getMessage(), e);
        }
        int axis = getParameters().getInt(AXIS);

        int outer = 1;
        for (int d = 0; d < axis; d++) {
            outer *= in[d];
        }
        int inner = 1;
        for (int d = axis + 1; d < in.length; d++) {
            inner *= in[d];
        }
        int length = in[axis];

        Dataset reduced = Dataset.zeros(out);
        double[] src = input.getData();
        double[] dst = reduced.getData();
        for (int o = 0; o < outer; o++) {
            for (int k = 0; k < length; k++) {
                int base = (o * length + k) * inner;
                for (int i = 0; i < inner; i++) {
                    dst[o * inner + i] += src[base + i];
                }
            }
        }
        if (in.length > 1) {
            for (int d = 0, target = 0; d < in.length; d++) {
                if (d != axis) {
                    reduced.setAxis(target++, input.getAxis(d));
                }
            }
        }
        reduced.copyDataMetadataFrom(input);
        return new PluginResult(reduced, kwargs);
    }

    private int[] reducedShape(int[] in) {
        int axis = getParameters().getInt(AXIS);
        if (axis < 0 || axis >= in.length) {
            throw new ConfigException(
                    "Cannot sum along axis " + axis + " of " + in.length + "-D data");
        }
        if (in.length == 1) {
            return new int[] {1};
        }
        int[] out = new int[in.length - 1];
        for (int d = 0, target = 0; d < in.length; d++) {
            if (d != axis) {
                out[target++] = in[d];
            }
        }
        return out;
    }

    @Override
    protected AxisSumPlugin newInstance() {
        return new AxisSumPlugin();
    }
}
