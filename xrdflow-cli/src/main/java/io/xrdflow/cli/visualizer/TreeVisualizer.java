package io.xrdflow.cli.visualizer;

import io.xrdflow.core.workflow.WorkflowTree;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Registry and dispatcher for tree visualization formats.
///
/// @implNote Thread-safe after construction. The format map is never modified.
/// @see VisualizationFormat
public class TreeVisualizer {

    private final Map<String, VisualizationFormat> formats = new LinkedHashMap<>();

    /// Creates a visualizer with the `text` and `yaml` formats.
    public TreeVisualizer() {
        this(List.of(new TextVisualizationFormat(), new YamlVisualizationFormat()));
    }

    /// @param formats available formats, names must be unique, not null
    public TreeVisualizer(List<? extends VisualizationFormat> formats) {
        for (VisualizationFormat format : formats) {
            this.formats.put(format.getName(), format);
        }
    }

    /// Renders a tree using the specified format.
    ///
    /// @param tree the tree to render, not null
    /// @param formatName the format name, not null
    /// @param useColor whether ANSI color codes may be used
    /// @return rendered tree, never null
    /// @throws IllegalArgumentException if the format is not registered
    public String visualize(WorkflowTree tree, String formatName, boolean useColor) {
        VisualizationFormat format = formats.get(formatName);
        if (format == null) {
            throw new IllegalArgumentException(
                    "Unsupported format: "
                            + formatName
                            + ". Available: "
                            + String.join(", ", formats.keySet()));
        }
        return format.render(tree, useColor);
    }

    public Set<String> getAvailableFormats() {
        return formats.keySet();
    }
}
