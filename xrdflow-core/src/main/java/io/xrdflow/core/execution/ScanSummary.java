package io.xrdflow.core.execution;

import java.time.Duration;
import java.util.List;

/// Outcome of one {@link ScanRunner#run()}.
///
/// @param totalFrames number of frames in the scan
/// @param processedFrames frames whose results were stored
/// @param failedFrames frames skipped after a plugin failure, ascending
/// @param stopped true if the run was stopped before all frames were dispatched
/// @param elapsed wall-clock duration of the run
public record ScanSummary(
        int totalFrames,
        int processedFrames,
        List<Integer> failedFrames,
        boolean stopped,
        Duration elapsed) {

    public ScanSummary {
        failedFrames = List.copyOf(failedFrames);
    }

    public boolean isComplete() {
        return !stopped && processedFrames == totalFrames;
    }
}
