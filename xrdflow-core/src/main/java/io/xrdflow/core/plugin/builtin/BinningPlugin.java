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

/// Rebins 1-D or 2-D data by averaging blocks of `binning` points per axis.
///
/// Trailing points that do not fill a complete block are dropped.
public class BinningPlugin extends AbstractPlugin {

    public static final String BINNING = "binning";

    public BinningPlugin() {
        super("Binning", PluginType.PROCESSING, DataDim.UNKNOWN, DataDim.UNCHANGED);
        getParameters().add(PluginParameter.ofInt(BINNING, 2, "Points per bin along each axis"));
    }

    @Override
    public void preExecute() {
        Integer binning = getParameters().getInt(BINNING);
        if (binning == null || binning < 1) {
            throw new ConfigException("Binning factor must be a positive integer: " + binning);
        }
    }

    @Override
    public void calculateResultShape() {
        resultShape = binnedShape(requireInputShape());
    }

    @Override
    public PluginResult execute(Object data, Map<String, Object> kwargs)
            throws PluginExecutionException {
        Dataset input = requireDataset(data);
        int[] in = input.getShape();
        int[] out;
        try {
            out = binnedShape(in);
        } catch (ConfigException e) {
            throw new PluginExecutionException(e.getMessage(), e);
        }
        int binning = getParameters().getInt(BINNING);

        Dataset binned = Dataset.zeros(out);
        double[] src = input.getData();
        double[] dst = binned.getData();
        int rows = out.length == 1 ? 1 : out[0];
        int columns = out[out.length - 1];
        int rowBinning = out.length == 1 ? 1 : binning;
        int inColumns = in[in.length - 1];
        double norm = (double) rowBinning * binning;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                double total = 0.0;
                for (int i = 0; i < rowBinning; i++) {
                    int base = (r * rowBinning + i) * inColumns + c * binning;
                    for (int j = 0; j < binning; j++) {
                        total += src[base + j];
                    }
                }
                dst[r * columns + c] = total / norm;
            }
        }
        for (int d = 0; d < out.length; d++) {
            binned.setAxis(d, binAxis(input.getAxis(d), out[d], binning));
        }
        binned.copyDataMetadataFrom(input);
        return new PluginResult(binned, kwargs);
    }

    private int[] binnedShape(int[] in) {
        if (in.length < 1 || in.length > 2) {
            throw new ConfigException("Binning supports 1-D and 2-D data, got " + in.length + "-D");
        }
        int binning = getParameters().getInt(BINNING);
        int[] out = new int[in.length];
        for (int d = 0; d < in.length; d++) {
            out[d] = in[d] / binning;
            if (out[d] == 0) {
                throw new ConfigException(
                        "Binning factor " + binning + " exceeds axis extent " + in[d]);
            }
        }
        return out;
    }

    private static AxisMetadata binAxis(AxisMetadata axis, int length, int binning) {
        double[] range = axis.range();
        if (range == null) {
            return new AxisMetadata(axis.label(), axis.unit(), null);
        }
        double[] binnedRange = new double[length];
        for (int i = 0; i < length; i++) {
            double total = 0.0;
            for (int j = 0; j < binning; j++) {
                total += range[i * binning + j];
            }
            binnedRange[i] = total / binning;
        }
        return new AxisMetadata(axis.label(), axis.unit(), binnedRange);
    }

    @Override
    protected BinningPlugin newInstance() {
        return new BinningPlugin();
    }
}
