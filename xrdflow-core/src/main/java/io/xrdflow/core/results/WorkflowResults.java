package io.xrdflow.core.results;

import io.xrdflow.core.data.AxisMetadata;
import io.xrdflow.core.data.Dataset;
import io.xrdflow.core.data.Shapes;
import io.xrdflow.core.exception.ConfigException;
import io.xrdflow.core.exception.ShapeMismatchException;
import io.xrdflow.core.plugin.Plugin;
import io.xrdflow.core.plugin.PluginParameters;
import io.xrdflow.core.scan.ScanGeometry;
import io.xrdflow.core.workflow.WorkflowNode;
import io.xrdflow.core.workflow.WorkflowTree;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/// Aggregates per-frame results of a workflow tree into scan-shaped composite arrays.
///
/// Every retained node of the tree gets one composite array of shape
/// `scanShape + resultShape`. A result for frame `i` is written to the slot
/// `scan.frameToPosition(i)`, so results may arrive in any order; storing the same frame
/// again overwrites the slot.
///
/// The leading `scanDim` axes of every composite carry the scan's labels, units and
/// ranges. The trailing axes and the data label take the metadata of the first result
/// stored for the node.
///
/// ### Contracts
/// - **Precondition**: the tree is prepared before {@link #updateShapesFromScanAndWorkflow()}
/// - **Invariant**: `getResults(id)` at `frameToPosition(i)` equals the last result stored
///   for `(id, i)`
/// - **Invariant**: all composites share the same leading scan dimensions
///
/// @implNote **Not thread-safe**. A single coordinator owns the instance and is the only
/// caller of {@link #storeResults(int, Map)}; workers hand their results to it.
///
/// @see ResultsState
public class WorkflowResults {

    private static final Logger logger = Logger.getLogger(WorkflowResults.class.getName());

    /// Axis label of the merged scan axis in flattened views.
    public static final String CHRONOLOGICAL_AXIS_LABEL = "Chronological scan points";

    private final WorkflowTree tree;
    private ScanGeometry scan;

    private final Map<Integer, Dataset> composites = new TreeMap<>();
    private final Map<Integer, int[]> resultShapes = new TreeMap<>();
    private final Map<Integer, String> nodeLabels = new TreeMap<>();
    private final Map<Integer, String> pluginNames = new TreeMap<>();
    private final Map<Integer, String> resultTitles = new TreeMap<>();
    private final Set<Integer> metadataComplete = new HashSet<>();
    private ResultsState state = ResultsState.UNALLOCATED;

    /// Creates an unallocated aggregator.
    ///
    /// @param tree the workflow tree whose retained nodes are aggregated, not null
    /// @param scan the scan geometry, not null
    public WorkflowResults(WorkflowTree tree, ScanGeometry scan) {
        this.tree = Objects.requireNonNull(tree, "tree");
        this.scan = Objects.requireNonNull(scan, "scan");
    }

    /// Allocates zero-filled composites for every retained node.
    ///
    /// Discards all previously stored results.
    ///
    /// @throws ConfigException if the tree is not prepared
    /// @apiNote **Side effects**: moves to {@link ResultsState#ALLOCATED_METADATA_PENDING}.
    public void updateShapesFromScanAndWorkflow() {
        if (!tree.isPrepared()) {
            throw new ConfigException(
                    "The workflow tree must be prepared before results can be allocated");
        }
        clearAllResults();
        int[] scanShape = scan.getShape();
        for (WorkflowNode node : tree.getNodesWithResults()) {
            int nodeId = node.getNodeId();
            int[] resultShape = node.getResultShape();
            Dataset composite = Dataset.zeros(Shapes.concat(scanShape, resultShape));
            for (int d = 0; d < scanShape.length; d++) {
                composite.setAxis(d, scan.getAxisMetadata(d));
            }
            Plugin plugin = node.getPlugin();
            composites.put(nodeId, composite);
            resultShapes.put(nodeId, resultShape);
            nodeLabels.put(nodeId, plugin.getParameters().getString(PluginParameters.LABEL));
            pluginNames.put(nodeId, plugin.getName());
            resultTitles.put(nodeId, plugin.getResultTitle(nodeId));
        }
        state = ResultsState.ALLOCATED_METADATA_PENDING;
        logger.info(
                "Allocated "
                        + composites.size()
                        + " composite result arrays for scan shape "
                        + Shapes.format(scanShape));
    }

    /// Writes the results of one frame into the composites.
    ///
    /// Node ids without a composite are ignored. All shapes are checked before anything is
    /// written, so a rejected call leaves the composites untouched.
    ///
    /// @param frameIndex the frame the results belong to
    /// @param results result per node id, not null
    /// @throws IllegalStateException if no composites are allocated
    /// @throws io.xrdflow.core.exception.IndexRangeException if the frame index is outside
    /// the scan
    /// @throws ShapeMismatchException if a result's shape differs from the propagated shape
    public void storeResults(int frameIndex, Map<Integer, Dataset> results) {
        if (!state.isAllocated()) {
            throw new IllegalStateException(
                    "Results must be allocated with updateShapesFromScanAndWorkflow() first");
        }
        int[] position = scan.frameToPosition(frameIndex);
        for (Map.Entry<Integer, Dataset> entry : results.entrySet()) {
            int[] expected = resultShapes.get(entry.getKey());
            if (expected != null && !entry.getValue().hasShape(expected)) {
                throw new ShapeMismatchException(
                        "Result of node #"
                                + entry.getKey()
                                + " for frame "
                                + frameIndex
                                + " has shape "
                                + Shapes.format(entry.getValue().getShape())
                                + " but "
                                + Shapes.format(expected)
                                + " was propagated");
            }
        }
        for (Map.Entry<Integer, Dataset> entry : results.entrySet()) {
            Dataset composite = composites.get(entry.getKey());
            if (composite == null) {
                continue;
            }
            composite.setSlice(position, entry.getValue());
            if (metadataComplete.add(entry.getKey())) {
                mergeFrameMetadata(composite, entry.getValue());
            }
        }
        if (state == ResultsState.ALLOCATED_METADATA_PENDING
                && metadataComplete.containsAll(composites.keySet())) {
            state = ResultsState.ALLOCATED_METADATA_COMPLETE;
        }
    }

    /// Returns the live composite array of a node. Callers needing a stable snapshot while
    /// results are still stored must copy it.
    ///
    /// @throws ConfigException if the node has no composite
    public Dataset getResults(int nodeId) {
        Dataset composite = composites.get(nodeId);
        if (composite == null) {
            throw new ConfigException("The node #" + nodeId + " does not have any results");
        }
        return composite;
    }

    /// Returns a copy of one frame's result.
    ///
    /// @param nodeId node id
    /// @param scanPosition one index per scan dimension
    /// @throws io.xrdflow.core.exception.IndexRangeException if the position is outside the
    /// scan
    public Dataset getResultSubset(int nodeId, int... scanPosition) {
        Dataset composite = getResults(nodeId);
        scan.positionToFrame(scanPosition);
        return composite.getSlice(scanPosition);
    }

    /// Returns a copy of the composite with all scan dimensions merged into one
    /// chronological axis.
    public Dataset getResultsForFlattenedScan(int nodeId) {
        Dataset composite = getResults(nodeId);
        int[] resultShape = resultShapes.get(nodeId);
        int scanDim = scan.getScanDim();
        Dataset flattened = composite.reshape(Shapes.concat(new int[] {scan.getNTotal()}, resultShape));
        flattened.setAxis(0, chronologicalAxis());
        for (int d = 0; d < resultShape.length; d++) {
            flattened.setAxis(d + 1, composite.getAxis(scanDim + d));
        }
        return flattened;
    }

    public ResultMetadata getResultMetadata(int nodeId) {
        return getResultMetadata(nodeId, false);
    }

    /// Returns title, data label and unit, and per-axis metadata of a node's composite.
    /// Axes without a range report index coordinates.
    ///
    /// @param nodeId node id
    /// @param useScanTimeline describe the scan as one chronological axis
    /// @throws ConfigException if the node has no composite
    public ResultMetadata getResultMetadata(int nodeId, boolean useScanTimeline) {
        Dataset composite = getResults(nodeId);
        int[] shape = composite.getShape();
        int scanDim = scan.getScanDim();
        List<AxisMetadata> axes = new ArrayList<>();
        if (useScanTimeline) {
            axes.add(chronologicalAxis());
        }
        for (int d = useScanTimeline ? scanDim : 0; d < shape.length; d++) {
            AxisMetadata axis = composite.getAxis(d);
            axes.add(new AxisMetadata(axis.label(), axis.unit(), axis.rangeOrIndices(shape[d])));
        }
        return new ResultMetadata(
                resultTitles.get(nodeId), composite.getDataLabel(), composite.getDataUnit(), axes);
    }

    /// Returns a multi-line description of a node's composite axes.
    public String getNodeResultMetadataString(int nodeId) {
        ResultMetadata metadata = getResultMetadata(nodeId);
        StringBuilder sb = new StringBuilder(metadata.title()).append('\n');
        sb.append("  data: ").append(describe(metadata.dataLabel(), metadata.dataUnit()));
        List<AxisMetadata> axes = metadata.axes();
        for (int d = 0; d < axes.size(); d++) {
            AxisMetadata axis = axes.get(d);
            double[] range = axis.range();
            sb.append('\n')
                    .append("  axis #")
                    .append(d)
                    .append(d < scan.getScanDim() ? " (scan)" : "")
                    .append(": ")
                    .append(describe(axis.label(), axis.unit()))
                    .append(", ")
                    .append(range.length)
                    .append(" points");
            if (range.length > 0) {
                sb.append(" from ").append(range[0]).append(" to ").append(range[range.length - 1]);
            }
        }
        return sb.toString();
    }

    /// Discards all composites and metadata. Tree and scan stay unchanged.
    ///
    /// @apiNote **Side effects**: moves to {@link ResultsState#UNALLOCATED}.
    public void clearAllResults() {
        composites.clear();
        resultShapes.clear();
        nodeLabels.clear();
        pluginNames.clear();
        resultTitles.clear();
        metadataComplete.clear();
        state = ResultsState.UNALLOCATED;
    }

    /// Replaces the scan geometry and discards all results.
    public void setScan(ScanGeometry scan) {
        this.scan = Objects.requireNonNull(scan, "scan");
        clearAllResults();
    }

    public ScanGeometry getScan() {
        return scan;
    }

    public WorkflowTree getTree() {
        return tree;
    }

    public ResultsState getState() {
        return state;
    }

    /// Returns the ids of all nodes with a composite.
    public Set<Integer> getNodeIdsWithResults() {
        return Collections.unmodifiableSet(composites.keySet());
    }

    /// Returns the full composite shape per node id.
    public Map<Integer, int[]> getShapes() {
        Map<Integer, int[]> shapes = new LinkedHashMap<>();
        composites.forEach((id, composite) -> shapes.put(id, composite.getShape()));
        return shapes;
    }

    public Map<Integer, String> getNodeLabels() {
        return Collections.unmodifiableMap(nodeLabels);
    }

    public Map<Integer, String> getPluginNames() {
        return Collections.unmodifiableMap(pluginNames);
    }

    public Map<Integer, String> getResultTitles() {
        return Collections.unmodifiableMap(resultTitles);
    }

    public boolean isMetadataComplete(int nodeId) {
        return metadataComplete.contains(nodeId);
    }

    private void mergeFrameMetadata(Dataset composite, Dataset frameResult) {
        int scanDim = scan.getScanDim();
        for (int d = 0; d < frameResult.ndim(); d++) {
            composite.setAxis(scanDim + d, frameResult.getAxis(d));
        }
        composite.copyDataMetadataFrom(frameResult);
    }

    private AxisMetadata chronologicalAxis() {
        return new AxisMetadata(
                CHRONOLOGICAL_AXIS_LABEL, "", AxisMetadata.indexRange(scan.getNTotal()));
    }

    private static String describe(String label, String unit) {
        String name = label.isEmpty() ? "(no label)" : label;
        return unit.isEmpty() ? name : name + " [" + unit + "]";
    }
}
