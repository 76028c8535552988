package io.xrdflow.cli.execution;

import io.xrdflow.cli.ui.AnsiStyles;
import io.xrdflow.core.data.Dataset;
import io.xrdflow.core.execution.ScanListener;
import io.xrdflow.core.execution.ScanSummary;
import io.xrdflow.core.scan.ScanGeometry;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Map;

/// Scan listener printing one line per frame to the terminal.
///
/// ### Output Format
/// ```
/// ┌─────────────────────────────────────────────────────────────
///   * SCAN mesh → 4 workers
///   ✓ frame 13 at [2, 1]
///   ✗ frame 14 at [2, 2]: Detector glitch
/// └─────────────────────────────────────────────────────────────
/// ```
///
/// @implNote **Not thread-safe**. {@link io.xrdflow.core.execution.ScanRunner} calls it from
/// the coordinating thread only.
public class VerboseScanListener implements ScanListener {

    private final PrintStream out;
    private final AnsiStyles styles;
    private ScanGeometry scan;

    /// @param out output stream, typically `System.out`, not null
    /// @param useColor whether to apply ANSI color codes
    public VerboseScanListener(PrintStream out, boolean useColor) {
        this.out = out;
        this.styles = AnsiStyles.of(useColor);
    }

    @Override
    public void onScanStart(ScanGeometry scan, int workerCount) {
        this.scan = scan;
        out.println(styles.separatorTop());
        out.printf(
                "  %s %s %s %s %d workers%n",
                styles.accent("*"),
                styles.bold("SCAN"),
                scan.getTitle().isEmpty() ? "untitled" : scan.getTitle(),
                styles.arrow(),
                workerCount);
    }

    @Override
    public void onFrameComplete(int frameIndex, Map<Integer, Dataset> results) {
        out.printf("  %s frame %d at %s%n", styles.checkmark(), frameIndex, position(frameIndex));
    }

    @Override
    public void onFrameFailed(int frameIndex, Throwable error) {
        out.printf(
                "  %s frame %d at %s: %s%n",
                styles.crossmark(),
                frameIndex,
                position(frameIndex),
                styles.error(String.valueOf(error.getMessage())));
    }

    @Override
    public void onScanComplete(ScanSummary summary) {
        out.println(styles.separatorBottom());
    }

    private String position(int frameIndex) {
        return scan == null ? "?" : Arrays.toString(scan.frameToPosition(frameIndex));
    }
}
