package io.xrdflow.cli.visualizer;

import io.xrdflow.core.workflow.WorkflowTree;
import io.xrdflow.serialization.TreeSerializer;

/// Renders the tree exactly as `TreeSerializer` exports it. Colors are never applied.
public class YamlVisualizationFormat implements VisualizationFormat {

    @Override
    public String getName() {
        return "yaml";
    }

    @Override
    public String render(WorkflowTree tree, boolean useColor) {
        return TreeSerializer.toYaml(tree);
    }
}
