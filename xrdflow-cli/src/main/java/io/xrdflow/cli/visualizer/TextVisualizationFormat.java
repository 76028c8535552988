package io.xrdflow.cli.visualizer;

import io.xrdflow.cli.ui.AnsiStyles;
import io.xrdflow.core.data.Shapes;
import io.xrdflow.core.plugin.Plugin;
import io.xrdflow.core.plugin.PluginParameters;
import io.xrdflow.core.plugin.PluginType;
import io.xrdflow.core.workflow.TreeLayout;
import io.xrdflow.core.workflow.WorkflowNode;
import io.xrdflow.core.workflow.WorkflowTree;

/// Indented text rendering of a workflow tree.
///
/// ```
/// Workflow tree: 4 nodes
/// ──────────────────────────────────────────────────
/// #000 Synthetic frame loader [input]
///   └─ #001 Crop "roi"
///     └─ #002 Binning (2, 2) [kept]
///   └─ #003 Sum (1,) [kept]
/// ```
///
/// Result shapes are shown once the tree is prepared. Nodes whose results are retained
/// carry `[kept]`.
///
/// @implNote Thread-safe. Each render call creates its own AnsiStyles instance.
public class TextVisualizationFormat implements VisualizationFormat {

    @Override
    public String getName() {
        return "text";
    }

    @Override
    public String render(WorkflowTree tree, boolean useColor) {
        AnsiStyles styles = AnsiStyles.of(useColor);
        StringBuilder sb = new StringBuilder();
        sb.append(
                String.format(
                        "%s %s%n",
                        styles.bold("Workflow tree:"), styles.accent(tree.size() + " nodes")));
        sb.append(styles.gray("─".repeat(50))).append(System.lineSeparator());

        TreeLayout layout = TreeLayout.of(tree);
        for (int nodeId : layout.getDepthFirstOrder()) {
            int depth = layout.getDepth(nodeId);
            if (depth > 0) {
                sb.append("  ".repeat(depth)).append(styles.branch()).append(' ');
            }
            sb.append(renderNode(tree.getNodeOrThrow(nodeId), tree.isPrepared(), styles));
            sb.append(System.lineSeparator());
        }
        return sb.toString();
    }

    /// Renders the single line describing one node, without indentation.
    String renderNode(WorkflowNode node, boolean withShape, AnsiStyles styles) {
        Plugin plugin = node.getPlugin();
        StringBuilder sb = new StringBuilder();
        sb.append(styles.gray(String.format("#%03d", node.getNodeId())))
                .append(' ')
                .append(styles.accent(plugin.getName()));

        String label = plugin.getParameters().getString(PluginParameters.LABEL);
        if (label != null && !label.isEmpty()) {
            sb.append(" \"").append(label).append('"');
        }
        if (withShape && node.getResultShape() != null) {
            sb.append(' ').append(styles.dim(Shapes.format(node.getResultShape())));
        }
        if (plugin.getPluginType() == PluginType.INPUT) {
            sb.append(' ').append(styles.gray("[input]"));
        }
        if (node.isRetained()) {
            sb.append(' ').append(styles.success("[kept]"));
        }
        return sb.toString();
    }
}
