package io.xrdflow.serialization;

import io.xrdflow.core.plugin.DefaultPluginRegistry;
import io.xrdflow.core.scan.ScanGeometry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/// Utility class for exporting and importing scan geometries as YAML or JSON.
///
/// The document is a flat mapping of `scan_title`, `scan_dim` and one
/// `scan_dim{i}_label/_unit/_n_points/_delta/_offset` group per dimension.
///
/// @see ScanGeometrySerializer
public final class ScanSerializer {

    private static final Logger logger = Logger.getLogger(ScanSerializer.class.getName());

    private ScanSerializer() {}

    public static String toYaml(ScanGeometry scan) {
        return TreeSerializer.write(TreeSerializer.createYamlMapper(new DefaultPluginRegistry()), scan);
    }

    public static String toJson(ScanGeometry scan) {
        return TreeSerializer.write(TreeSerializer.createMapper(new DefaultPluginRegistry()), scan);
    }

    /// @throws io.xrdflow.core.exception.ConfigException if the values describe no valid scan
    /// @throws IllegalArgumentException if the document is malformed
    public static ScanGeometry fromYaml(String yaml) {
        return TreeSerializer.read(
                TreeSerializer.createYamlMapper(new DefaultPluginRegistry()), yaml, ScanGeometry.class);
    }

    /// @throws io.xrdflow.core.exception.ConfigException if the values describe no valid scan
    /// @throws IllegalArgumentException if the document is malformed
    public static ScanGeometry fromJson(String json) {
        return TreeSerializer.read(
                TreeSerializer.createMapper(new DefaultPluginRegistry()), json, ScanGeometry.class);
    }

    /// Writes a scan to a `.yaml`, `.yml` or `.json` file.
    ///
    /// @throws java.nio.file.FileAlreadyExistsException if the file exists and `overwrite`
    ///     is false
    public static void exportToFile(ScanGeometry scan, Path file, boolean overwrite)
            throws IOException {
        String content = FileFormat.of(file) == FileFormat.JSON ? toJson(scan) : toYaml(scan);
        Files.writeString(file, content, FileFormat.openOptions(overwrite));
        logger.info("Exported scan '" + scan.getTitle() + "' to " + file);
    }

    public static ScanGeometry importFromFile(Path file) throws IOException {
        String content = Files.readString(file);
        return FileFormat.of(file) == FileFormat.JSON ? fromJson(content) : fromYaml(content);
    }
}
