package io.xrdflow.cli.commands;

import io.xrdflow.cli.execution.VerboseScanListener;
import io.xrdflow.cli.ui.AnsiStyles;
import io.xrdflow.core.ProcessingConfig;
import io.xrdflow.core.ProcessingContext;
import io.xrdflow.core.ProcessingFactory;
import io.xrdflow.core.execution.FailurePolicy;
import io.xrdflow.core.execution.ScanListener;
import io.xrdflow.core.execution.ScanSummary;
import io.xrdflow.core.scan.ScanGeometry;
import io.xrdflow.core.workflow.WorkflowTree;
import io.xrdflow.serialization.ResultsExporter;
import io.xrdflow.serialization.ScanSerializer;
import java.nio.file.Path;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// CLI command processing every frame of a scan through a workflow tree.
///
/// ### Usage
/// ```bash
/// xrdflow run -t tree.yaml -s scan.yaml [-w 4] [--skip-failed] [-o results.json] [--overwrite]
/// ```
///
/// Defaults come from the `xrdflow.*` system properties (see {@link ProcessingConfig}); the
/// options override them.
///
/// @see io.xrdflow.core.execution.ScanRunner
@Command(name = "run", description = "Process every frame of a scan")
class RunCommand extends TreeCommand {

    @Option(
            names = {"-s", "--scan"},
            required = true,
            description = "Scan geometry file (.yaml, .yml or .json)")
    private Path scanFile;

    @Option(
            names = {"-w", "--workers"},
            description = "Number of worker threads")
    private Integer workers;

    @Option(
            names = {"--skip-failed"},
            description = "Skip frames whose processing fails instead of aborting")
    private boolean skipFailed = false;

    @Option(
            names = {"-o", "--output"},
            description = "Write the results as JSON to this file")
    private Path output;

    @Option(
            names = {"--overwrite"},
            description = "Replace an existing output file")
    private boolean overwrite = false;

    @Option(
            names = {"-v", "--verbose"},
            description = "Print every processed frame")
    private boolean verbose = false;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output",
            negatable = true)
    private boolean color = true;

    @Override
    protected int execute() {
        AnsiStyles styles = AnsiStyles.of(color);
        try {
            WorkflowTree tree = loadTree();
            ScanGeometry scan = ScanSerializer.importFromFile(scanFile);

            ProcessingConfig config = ProcessingConfig.fromProperties(System.getProperties());
            if (workers != null) {
                config.setWorkerCount(workers);
            }
            if (skipFailed) {
                config.setFailurePolicy(FailurePolicy.SKIP);
            }

            System.out.printf(
                    "%n%s %s%n",
                    styles.checkmark(),
                    styles.bold("Scan loaded: " + describe(scan)));
            System.out.printf(
                    "%s%n%n",
                    styles.gray(
                            "  Nodes: "
                                    + tree.size()
                                    + " "
                                    + styles.bullet()
                                    + " Frames: "
                                    + scan.getNTotal()));

            try (ProcessingContext context =
                    ProcessingFactory.builder()
                            .config(config)
                            .pluginRegistry(getPluginRegistry())
                            .tree(tree)
                            .scan(scan)
                            .build()) {
                ScanListener listener =
                        verbose ? new VerboseScanListener(System.out, color) : ScanListener.NOOP;
                ScanSummary summary = context.getScanRunner().run(listener);
                printSummary(summary, styles);

                if (output != null) {
                    ResultsExporter.export(context.getResults(), summary, output, overwrite);
                    System.out.println("  Results written to " + output);
                }
                return summary.isComplete() ? 0 : 1;
            }
        } catch (Exception e) {
            System.err.println(" [FAIL] Processing failed: " + e.getMessage());
            return 1;
        }
    }

    private void printSummary(ScanSummary summary, AnsiStyles styles) {
        boolean complete = summary.isComplete();
        System.out.printf(
                "%n%s %s%n",
                complete ? styles.checkmark() : styles.crossmark(),
                styles.bold(complete ? "Scan processed successfully!" : "Scan incomplete"));
        System.out.printf(
                "  Frames: %s %s Skipped: %d %s Time: %.2f s%n",
                styles.successOrWarn(
                        summary.processedFrames() + "/" + summary.totalFrames(), complete),
                styles.bullet(),
                summary.failedFrames().size(),
                styles.bullet(),
                summary.elapsed().toMillis() / 1000.0);
        if (!summary.failedFrames().isEmpty()) {
            System.out.println(styles.warn("  Skipped frames: " + summary.failedFrames()));
        }
    }

    private static String describe(ScanGeometry scan) {
        String title = scan.getTitle().isEmpty() ? "untitled" : scan.getTitle();
        StringBuilder shape = new StringBuilder();
        for (int n : scan.getShape()) {
            if (shape.length() > 0) {
                shape.append(" x ");
            }
            shape.append(n);
        }
        return title + " (" + shape + ")";
    }
}
