package io.xrdflow.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.xrdflow.core.execution.ScanSummary;
import io.xrdflow.core.plugin.builtin.SumPlugin;
import io.xrdflow.core.plugin.builtin.SyntheticFrameLoader;
import io.xrdflow.core.results.WorkflowResults;
import io.xrdflow.core.scan.ScanGeometry;
import io.xrdflow.core.workflow.WorkflowTree;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResultsExporterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private WorkflowResults results;

    /// Loader of 1-D frames `f, f + 1, f + 2` followed by a total sum `3f + 3`.
    @BeforeEach
    void setUp() throws Exception {
        SyntheticFrameLoader loader = new SyntheticFrameLoader();
        loader.getParameters().set(SyntheticFrameLoader.ROWS, 0);
        loader.getParameters().set(SyntheticFrameLoader.COLUMNS, 3);

        WorkflowTree tree = new WorkflowTree();
        tree.createAndAddNode(loader);
        tree.createAndAddNode(new SumPlugin(), 0);
        tree.prepareExecution();

        results = new WorkflowResults(tree, ScanGeometry.linear(2));
        results.updateShapesFromScanAndWorkflow();
        for (int frame = 0; frame < 2; frame++) {
            results.storeResults(frame, tree.executeProcess(frame));
        }
    }

    @Test
    void shouldWriteScanAndCompositeOfEveryRetainedNode() throws Exception {
        // When
        JsonNode document = mapper.readTree(ResultsExporter.toJson(results, null));

        // Then
        assertThat(document.has("summary")).isFalse();
        JsonNode exported = document.get("results");
        assertThat(exported.get("scan").get("scan_dim").asInt()).isEqualTo(1);
        assertThat(exported.get("state").asText()).isEqualTo(results.getState().name());

        JsonNode node = exported.get("nodes").get(0);
        assertThat(exported.get("nodes")).hasSize(1);
        assertThat(node.get("node_id").asInt()).isEqualTo(1);
        assertThat(node.get("shape").get(0).asInt()).isEqualTo(2);
        assertThat(node.get("data").get(0).asDouble()).isEqualTo(3.0);
        assertThat(node.get("data").get(1).asDouble()).isEqualTo(6.0);
        assertThat(node.get("axes").get(0).get("label").asText()).isEqualTo("Frame number");
    }

    @Test
    void shouldIncludeRunSummary() throws Exception {
        ScanSummary summary = new ScanSummary(2, 2, List.of(), false, Duration.ofMillis(1500));

        JsonNode document = mapper.readTree(ResultsExporter.toJson(results, summary));

        assertThat(document.get("summary").get("processedFrames").asInt()).isEqualTo(2);
        assertThat(document.get("summary").get("elapsed").asText()).isEqualTo("PT1.5S");
    }

    @Test
    void shouldExportToFileOnlyOnce(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("results.json");

        ResultsExporter.export(results, null, file, false);

        assertThat(Files.readString(file)).contains("\"nodes\"");
        assertThatThrownBy(() -> ResultsExporter.export(results, null, file, false))
                .isInstanceOf(FileAlreadyExistsException.class);
    }
}
