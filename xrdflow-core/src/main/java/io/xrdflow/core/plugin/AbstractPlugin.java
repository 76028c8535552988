package io.xrdflow.core.plugin;

import io.xrdflow.core.data.Dataset;
import io.xrdflow.core.data.Shapes;
import io.xrdflow.core.exception.ConfigException;
import io.xrdflow.core.exception.PluginExecutionException;

/// Base class for plugins holding name, type, declared dimensionality, parameters and
/// propagated shapes.
///
/// Subclasses add their parameters in the constructor, implement {@link #newInstance()} for
/// {@link #copy()}, and override {@link #calculateResultShape()} unless the output shape
/// equals the input shape.
public abstract class AbstractPlugin implements Plugin {

    private final String name;
    private final PluginType pluginType;
    private final DataDim inputDataDim;
    private final DataDim outputDataDim;
    private final PluginParameters parameters = new PluginParameters();

    protected int[] inputShape;
    protected int[] resultShape;

    protected AbstractPlugin(
            String name, PluginType pluginType, DataDim inputDataDim, DataDim outputDataDim) {
        this.name = name;
        this.pluginType = pluginType;
        this.inputDataDim = inputDataDim;
        this.outputDataDim = outputDataDim;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public PluginType getPluginType() {
        return pluginType;
    }

    @Override
    public DataDim getInputDataDim() {
        return inputDataDim;
    }

    @Override
    public DataDim getOutputDataDim() {
        return outputDataDim;
    }

    @Override
    public PluginParameters getParameters() {
        return parameters;
    }

    @Override
    public void preExecute() {}

    @Override
    public int[] getInputShape() {
        return inputShape == null ? null : inputShape.clone();
    }

    @Override
    public void setInputShape(int[] inputShape) {
        this.inputShape = inputShape == null ? null : inputShape.clone();
    }

    @Override
    public int[] getResultShape() {
        return resultShape == null ? null : resultShape.clone();
    }

    /// Default shape rule: the result has the shape of the input.
    ///
    /// @throws ConfigException if no input shape has been propagated
    @Override
    public void calculateResultShape() {
        resultShape = requireInputShape().clone();
    }

    @Override
    public Plugin copy() {
        AbstractPlugin copy = newInstance();
        copy.parameters.setAll(parameters);
        copy.inputShape = getInputShape();
        copy.resultShape = getResultShape();
        return copy;
    }

    /// Creates a fresh instance of the concrete plugin with default parameters.
    protected abstract AbstractPlugin newInstance();

    /// Returns the propagated input shape.
    ///
    /// @throws ConfigException if shape propagation has not reached this plugin
    protected int[] requireInputShape() {
        if (!Shapes.isResolved(inputShape)) {
            throw new ConfigException(
                    "Plugin '" + name + "' cannot determine its result shape without an input shape");
        }
        if (inputDataDim.isFixed() && inputShape.length != inputDataDim.value()) {
            throw new ConfigException(
                    "Plugin '"
                            + name
                            + "' expects "
                            + inputDataDim
                            + "-dimensional input but received shape "
                            + Shapes.format(inputShape));
        }
        return inputShape;
    }

    /// Casts the incoming data of a downstream plugin.
    ///
    /// @throws PluginExecutionException if `data` is not a dataset
    protected Dataset requireDataset(Object data) throws PluginExecutionException {
        if (data instanceof Dataset dataset) {
            return dataset;
        }
        throw new PluginExecutionException(
                "Plugin '"
                        + name
                        + "' expects a Dataset as input, got "
                        + (data == null ? "null" : data.getClass().getSimpleName()));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name + "'}";
    }
}
