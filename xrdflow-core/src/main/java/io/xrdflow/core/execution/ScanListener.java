package io.xrdflow.core.execution;

import io.xrdflow.core.data.Dataset;
import io.xrdflow.core.scan.ScanGeometry;
import java.util.Map;

/// Listener for scan progress.
///
/// All callbacks run on the coordinating thread of the {@link ScanRunner}, never on a
/// worker. All methods default to no-ops.
public interface ScanListener {

    /// Called after results were allocated and before the first frame is dispatched.
    ///
    /// @param scan the scan being processed, not null
    /// @param workerCount number of worker tree copies
    default void onScanStart(ScanGeometry scan, int workerCount) {}

    /// Called after a frame's results were stored.
    ///
    /// @param frameIndex the processed frame
    /// @param results the stored results by node id, not null
    default void onFrameComplete(int frameIndex, Map<Integer, Dataset> results) {}

    /// Called when a frame failed, before the failure policy is applied.
    ///
    /// @param frameIndex the failed frame
    /// @param error the failure, not null
    default void onFrameFailed(int frameIndex, Throwable error) {}

    /// Called once after the last frame, unless the run aborted.
    ///
    /// @param summary outcome of the run, not null
    default void onScanComplete(ScanSummary summary) {}

    /// No-op listener instance.
    ScanListener NOOP = new ScanListener() {};
}
