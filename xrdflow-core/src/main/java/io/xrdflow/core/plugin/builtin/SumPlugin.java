package io.xrdflow.core.plugin.builtin;

import io.xrdflow.core.data.Dataset;
import io.xrdflow.core.exception.PluginExecutionException;
import io.xrdflow.core.plugin.AbstractPlugin;
import io.xrdflow.core.plugin.DataDim;
import io.xrdflow.core.plugin.PluginResult;
import io.xrdflow.core.plugin.PluginType;
import java.util.Map;

/// Sums all values of the input into a single-element result of shape `(1,)`.
public class SumPlugin extends AbstractPlugin {

    public SumPlugin() {
        super("Sum", PluginType.PROCESSING, DataDim.UNKNOWN, DataDim.of(1));
    }

    @Override
    public void calculateResultShape() {
        requireInputShape();
        resultShape = new int[] {1};
    }

    @Override
    public PluginResult execute(Object data, Map<String, Object> kwargs)
            throws PluginExecutionException {
        Dataset input = requireDataset(data);
        Dataset total = Dataset.of(new double[] {input.sum()}, 1);
        total.copyDataMetadataFrom(input);
        return new PluginResult(total, kwargs);
    }

    @Override
    protected SumPlugin newInstance() {
        return new SumPlugin();
    }
}
