package io.xrdflow.cli.commands;

import io.xrdflow.cli.visualizer.TreeVisualizer;
import io.xrdflow.core.workflow.WorkflowTree;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// CLI command rendering a workflow tree.
///
/// ### Usage
/// ```bash
/// xrdflow show -t tree.yaml [--format text|yaml] [--no-color]
/// ```
///
/// @see TreeVisualizer
@Command(name = "show", description = "Render a workflow tree")
class ShowCommand extends TreeCommand {

    @Option(
            names = {"-f", "--format"},
            description = "Output format: text or yaml (default: text)")
    private String format = "text";

    @Option(
            names = {"--no-color"},
            description = "Disable colored output",
            negatable = true)
    private boolean color = true;

    private final TreeVisualizer visualizer = new TreeVisualizer();

    @Override
    protected int execute() {
        try {
            WorkflowTree tree = loadTree();
            System.out.println();
            System.out.print(visualizer.visualize(tree, format, color));
            return 0;
        } catch (Exception e) {
            System.err.println(" [FAIL] Cannot show workflow tree: " + e.getMessage());
            return 1;
        }
    }
}
