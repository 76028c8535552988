package io.xrdflow.cli.commands;

import io.xrdflow.core.data.Shapes;
import io.xrdflow.core.workflow.ConsistencyReport;
import io.xrdflow.core.workflow.TreeLayout;
import io.xrdflow.core.workflow.WorkflowNode;
import io.xrdflow.core.workflow.WorkflowTree;
import java.util.Map;
import java.util.stream.Collectors;
import picocli.CommandLine.Command;

/// CLI command checking that a tree can be prepared for execution.
///
/// Loads the tree, runs {@link WorkflowTree#prepareExecution()} and reports:
/// - the result shape of every node
/// - nodes whose input dimensionality does not match their parent's output
///
/// ### Usage
/// ```bash
/// xrdflow validate -t tree.yaml
/// ```
@Command(name = "validate", description = "Validate a workflow tree")
class ValidateCommand extends TreeCommand {

    @Override
    protected int execute() {
        try {
            WorkflowTree tree = loadTree();
            tree.prepareExecution();
            Map<Integer, int[]> shapes = tree.getAllResultShapes();

            System.out.println(" [OK] Workflow tree is valid!");
            System.out.println("   Nodes: " + tree.size());
            System.out.println("   Retained results: " + tree.getNodesWithResults().size());
            for (int nodeId : TreeLayout.of(tree).getDepthFirstOrder()) {
                WorkflowNode node = tree.getNodeOrThrow(nodeId);
                System.out.printf(
                        "   #%03d %s -> %s%n",
                        nodeId, node.getPlugin().getName(), Shapes.format(shapes.get(nodeId)));
            }

            ConsistencyReport report = tree.getConsistentAndInconsistentNodes();
            if (!report.isConsistent()) {
                System.out.println(
                        " [WARN] Inconsistent nodes: "
                                + report.inconsistentNodeIds().stream()
                                        .map(id -> "#" + id)
                                        .collect(Collectors.joining(", ")));
                return 1;
            }
            return 0;
        } catch (Exception e) {
            System.err.println(" [FAIL] Validation failed: " + e.getMessage());
            return 1;
        }
    }
}
