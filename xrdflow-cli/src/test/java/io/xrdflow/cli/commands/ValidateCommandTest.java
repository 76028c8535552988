package io.xrdflow.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import io.xrdflow.core.plugin.builtin.SyntheticFrameLoader;
import io.xrdflow.core.workflow.WorkflowTree;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ValidateCommandTest extends BaseCommandTest {

    @TempDir Path tempDir;

    private int validate(Path treeFile) {
        return new CommandLine(new ValidateCommand()).execute("--tree", treeFile.toString());
    }

    @Test
    void shouldValidateTreeSuccessfully() throws Exception {
        // Given
        Path treeFile = writeTree(tempDir, createSumTree());

        // When
        int exitCode = validate(treeFile);

        // Then
        assertThat(exitCode).isZero();
        String output = outContent.toString();
        assertThat(output).contains("Workflow tree is valid");
        assertThat(output).contains("Nodes: 2");
        assertThat(output).contains("Retained results: 1");
        assertThat(output).contains("#000 Synthetic frame loader -> (3,)");
        assertThat(output).contains("#001 Sum -> (1,)");
    }

    @Test
    void shouldWarnAboutInconsistentNodes() throws Exception {
        // Given
        WorkflowTree tree = createSumTree();
        tree.createAndAddNode(new SyntheticFrameLoader(), 1);
        Path treeFile = writeTree(tempDir, tree);

        // When
        int exitCode = validate(treeFile);

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(outContent.toString()).contains("[WARN] Inconsistent nodes: #2");
    }

    @Test
    void shouldReportUnknownPluginClass() throws Exception {
        Path treeFile = tempDir.resolve("tree.yaml");
        Files.writeString(
                treeFile,
                """
                - node_id: 0
                  parent: null
                  children: []
                  plugin_class: FitPeakPlugin
                  plugin_params: []
                """);

        int exitCode = validate(treeFile);

        assertThat(exitCode).isEqualTo(1);
        assertThat(errContent.toString())
                .contains("Validation failed")
                .contains("FitPeakPlugin");
    }

    @Test
    void shouldReportUnresolvableShapes() throws Exception {
        WorkflowTree tree = createSumTree();
        tree.getNodeOrThrow(0).getPlugin().getParameters().set(SyntheticFrameLoader.COLUMNS, 0);
        Path treeFile = writeTree(tempDir, tree);

        int exitCode = validate(treeFile);

        assertThat(exitCode).isEqualTo(1);
        assertThat(errContent.toString()).contains("Invalid synthetic frame size");
    }
}
