package io.xrdflow.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.xrdflow.core.execution.ScanSummary;
import io.xrdflow.core.plugin.DefaultPluginRegistry;
import io.xrdflow.core.results.WorkflowResults;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/// Writes the composite results of a scan as a JSON document.
///
/// ```
/// {
///   "summary": { "totalFrames": 20, "processedFrames": 20, "failedFrames": [], ... },
///   "results": { "scan": {...}, "state": "...", "nodes": [...] }
/// }
/// ```
///
/// `summary` is omitted when no run summary is given.
///
/// @see WorkflowResultsSerializer for the layout of `results`
public final class ResultsExporter {

    private static final Logger logger = Logger.getLogger(ResultsExporter.class.getName());

    private ResultsExporter() {}

    /// Builds the results document.
    ///
    /// @param results allocated results, not null
    /// @param summary summary of the run that produced them, may be null
    /// @return pretty-printed JSON, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(WorkflowResults results, ScanSummary summary) {
        ObjectMapper mapper = TreeSerializer.createMapper(new DefaultPluginRegistry());
        ObjectNode document = mapper.createObjectNode();
        if (summary != null) {
            document.set("summary", mapper.valueToTree(summary));
        }
        document.set("results", mapper.valueToTree(results));
        return TreeSerializer.write(mapper, document);
    }

    /// Writes the results document to a file.
    ///
    /// @param results allocated results, not null
    /// @param summary summary of the run, may be null
    /// @param file target file, not null
    /// @param overwrite whether an existing file may be replaced
    /// @throws java.nio.file.FileAlreadyExistsException if the file exists and `overwrite`
    ///     is false
    /// @throws IOException if writing fails
    public static void export(
            WorkflowResults results, ScanSummary summary, Path file, boolean overwrite)
            throws IOException {
        Files.writeString(file, toJson(results, summary), FileFormat.openOptions(overwrite));
        logger.info(
                "Exported results of "
                        + results.getNodeIdsWithResults().size()
                        + " nodes to "
                        + file);
    }
}
