package io.xrdflow.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.xrdflow.core.exception.ConfigException;
import io.xrdflow.core.plugin.DefaultPluginRegistry;
import io.xrdflow.core.plugin.PluginParameters;
import io.xrdflow.core.plugin.PluginRegistry;
import io.xrdflow.core.plugin.builtin.BinningPlugin;
import io.xrdflow.core.plugin.builtin.CropPlugin;
import io.xrdflow.core.plugin.builtin.SumPlugin;
import io.xrdflow.core.plugin.builtin.SyntheticFrameLoader;
import io.xrdflow.core.workflow.WorkflowNode;
import io.xrdflow.core.workflow.WorkflowTree;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TreeSerializerTest {

    private final PluginRegistry registry = new DefaultPluginRegistry();
    private WorkflowTree tree;

    /// 0 loader -> 1 crop -> 2 binning, 0 -> 3 sum
    @BeforeEach
    void setUp() {
        SyntheticFrameLoader loader = new SyntheticFrameLoader();
        loader.getParameters().set(SyntheticFrameLoader.ROWS, 4);
        loader.getParameters().set(SyntheticFrameLoader.COLUMNS, 6);

        CropPlugin crop = new CropPlugin();
        crop.getParameters().set(CropPlugin.X_START, 1);
        crop.getParameters().set(CropPlugin.X_STOP, 5);
        crop.getParameters().set(PluginParameters.LABEL, "roi");

        SumPlugin sum = new SumPlugin();
        sum.getParameters().set(PluginParameters.KEEP_RESULTS, true);

        tree = new WorkflowTree();
        tree.createAndAddNode(loader);
        tree.createAndAddNode(crop, 0);
        tree.createAndAddNode(new BinningPlugin(), 1);
        tree.createAndAddNode(sum, 0);
    }

    @Nested
    class RoundTripTest {

        @Test
        void shouldRestoreStructureAndParametersFromYaml() {
            // Given
            String yaml = TreeSerializer.toYaml(tree);

            // When
            WorkflowTree restored = TreeSerializer.fromYaml(yaml, registry);

            // Then
            assertSameTree(restored);
        }

        @Test
        void shouldRestoreStructureAndParametersFromJson() {
            String json = TreeSerializer.toJson(tree);

            WorkflowTree restored = TreeSerializer.fromJson(json, registry);

            assertSameTree(restored);
        }

        @Test
        void shouldPropagateShapesAfterImport() {
            WorkflowTree restored = TreeSerializer.fromYaml(TreeSerializer.toYaml(tree), registry);

            restored.prepareExecution();

            assertThat(restored.getAllResultShapes().get(1)).containsExactly(4, 4);
            assertThat(restored.getAllResultShapes().get(2)).containsExactly(2, 2);
        }

        @Test
        void shouldRoundTripEmptyTree() {
            WorkflowTree restored =
                    TreeSerializer.fromJson(TreeSerializer.toJson(new WorkflowTree()), registry);

            assertThat(restored.isEmpty()).isTrue();
        }

        private void assertSameTree(WorkflowTree restored) {
            assertThat(restored.getNodeIds()).containsExactly(0, 1, 2, 3);
            assertThat(restored.getRoot().getNodeId()).isZero();
            assertThat(restored.getNodeOrThrow(0).getChildIds()).containsExactly(1, 3);
            assertThat(restored.getNodeOrThrow(2).getParentId()).isEqualTo(1);

            WorkflowNode crop = restored.getNodeOrThrow(1);
            assertThat(crop.getPlugin()).isInstanceOf(CropPlugin.class);
            assertThat(crop.getPlugin().getParameters().getInt(CropPlugin.X_STOP)).isEqualTo(5);
            assertThat(crop.getPlugin().getParameters().getInt(CropPlugin.Y_STOP)).isNull();
            assertThat(crop.getPlugin().getParameters().getString(PluginParameters.LABEL))
                    .isEqualTo("roi");
            assertThat(
                            restored.getNodeOrThrow(3)
                                    .getPlugin()
                                    .getParameters()
                                    .getBoolean(PluginParameters.KEEP_RESULTS))
                    .isTrue();
        }
    }

    @Nested
    class FormatTest {

        @Test
        void shouldWriteNodeRecordsWithOrderedParameterPairs() {
            String yaml = TreeSerializer.toYaml(tree);

            assertThat(yaml)
                    .doesNotStartWith("---")
                    .contains("node_id: 0", "plugin_class: CropPlugin", "x_start");
            assertThat(yaml.indexOf("x_start")).isLessThan(yaml.indexOf("x_stop"));
        }

        @Test
        void shouldAcceptRecordsInAnyOrder() {
            String json =
                    """
                    [
                      {"node_id": 1, "parent": 0, "children": [],
                       "plugin_class": "SumPlugin", "plugin_params": [["label", "total"]]},
                      {"node_id": 0, "parent": null, "children": [1],
                       "plugin_class": "SyntheticFrameLoader",
                       "plugin_params": [["rows", 0], ["columns", 5]]}
                    ]
                    """;

            WorkflowTree restored = TreeSerializer.fromJson(json, registry);

            assertThat(restored.getRoot().getPlugin()).isInstanceOf(SyntheticFrameLoader.class);
            assertThat(restored.getNodeOrThrow(1).getPlugin().getParameters().getString("label"))
                    .isEqualTo("total");
        }
    }

    @Nested
    class ErrorsTest {

        @Test
        void shouldRejectUnknownPluginClass() {
            String json =
                    """
                    [{"node_id": 0, "parent": null, "children": [],
                      "plugin_class": "FitPeakPlugin", "plugin_params": []}]
                    """;

            assertThatThrownBy(() -> TreeSerializer.fromJson(json, registry))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("node #0")
                    .hasMessageContaining("FitPeakPlugin");
        }

        @Test
        void shouldRejectUnknownParameter() {
            String json =
                    """
                    [{"node_id": 0, "parent": null, "children": [],
                      "plugin_class": "SyntheticFrameLoader", "plugin_params": [["gain", 2]]}]
                    """;

            assertThatThrownBy(() -> TreeSerializer.fromJson(json, registry))
                    .isInstanceOf(ConfigException.class)
                    .hasMessage("Unknown plugin parameter: gain");
        }

        @Test
        void shouldRejectInconsistentStructure() {
            String json =
                    """
                    [{"node_id": 0, "parent": null, "children": [],
                      "plugin_class": "SyntheticFrameLoader"},
                     {"node_id": 1, "parent": 7, "children": [],
                      "plugin_class": "SumPlugin"}]
                    """;

            assertThatThrownBy(() -> TreeSerializer.fromJson(json, registry))
                    .isInstanceOf(ConfigException.class)
                    .hasMessage("Parent node #7 of node #1 does not exist");
        }

        @Test
        void shouldRejectRecordWithoutPluginClass() {
            assertThatThrownBy(() -> TreeSerializer.fromJson("[{\"node_id\": 0}]", registry))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Failed to deserialize WorkflowTree");
        }

        @Test
        void shouldRejectNonNumericParent() {
            String yaml =
                    """
                    - node_id: 0
                      plugin_class: SyntheticFrameLoader
                    - node_id: 1
                      parent: abc
                      plugin_class: SumPlugin
                    """;

            assertThatThrownBy(() -> TreeSerializer.fromYaml(yaml, registry))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("'parent' of node #1 must be an integer or null");
        }

        @Test
        void shouldRejectFractionalNodeId() {
            String json =
                    """
                    [{"node_id": 1.5, "parent": null, "children": [],
                      "plugin_class": "SyntheticFrameLoader"}]
                    """;

            assertThatThrownBy(() -> TreeSerializer.fromJson(json, registry))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("integer 'node_id'");
        }

        @Test
        void shouldRejectNonNumericChildIds() {
            String json =
                    """
                    [{"node_id": 0, "parent": null, "children": ["one"],
                      "plugin_class": "SyntheticFrameLoader"}]
                    """;

            assertThatThrownBy(() -> TreeSerializer.fromJson(json, registry))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("'children' of node #0 must be a list of integers");
        }

        @Test
        void shouldRejectDocumentThatIsNoList() {
            assertThatThrownBy(() -> TreeSerializer.fromYaml("node_id: 0", registry))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("list of node records");
        }
    }

    @Nested
    class FileExportTest {

        @TempDir Path tempDir;

        @Test
        void shouldExportAndImportYamlFile() throws Exception {
            Path file = tempDir.resolve("workflow.yaml");

            TreeSerializer.exportToFile(tree, file, false);
            WorkflowTree restored = TreeSerializer.importFromFile(file, registry);

            assertThat(Files.readString(file)).contains("plugin_class: BinningPlugin");
            assertThat(restored.getNodeIds()).containsExactly(0, 1, 2, 3);
        }

        @Test
        void shouldSelectJsonByExtension() throws Exception {
            Path file = tempDir.resolve("workflow.json");

            TreeSerializer.exportToFile(tree, file, false);

            assertThat(Files.readString(file)).startsWith("[").contains("\"node_id\" : 0");
            assertThat(TreeSerializer.importFromFile(file, registry).size()).isEqualTo(4);
        }

        @Test
        void shouldNotOverwriteWithoutPermission() throws Exception {
            Path file = tempDir.resolve("workflow.yml");
            Files.writeString(file, "keep");

            assertThatThrownBy(() -> TreeSerializer.exportToFile(tree, file, false))
                    .isInstanceOf(FileAlreadyExistsException.class);
            assertThat(Files.readString(file)).isEqualTo("keep");

            TreeSerializer.exportToFile(tree, file, true);
            assertThat(Files.readString(file)).contains("node_id");
        }

        @Test
        void shouldRejectUnknownExtension() {
            assertThatThrownBy(
                            () -> TreeSerializer.exportToFile(tree, tempDir.resolve("tree.xml"), true))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining(".json, .yaml or .yml");
        }
    }
}
