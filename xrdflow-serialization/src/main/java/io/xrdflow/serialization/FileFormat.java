package io.xrdflow.serialization;

import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Locale;

/// File formats selected by file extension.
enum FileFormat {
    JSON,
    YAML;

    /// @throws IllegalArgumentException if the extension is neither `.json`, `.yaml` nor `.yml`
    static FileFormat of(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            return JSON;
        }
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return YAML;
        }
        throw new IllegalArgumentException(
                "Unsupported file extension, expected .json, .yaml or .yml: " + file);
    }

    /// `CREATE_NEW` fails with `FileAlreadyExistsException` if the file exists.
    static OpenOption[] openOptions(boolean overwrite) {
        return overwrite
                ? new OpenOption[] {
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE
                }
                : new OpenOption[] {StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE};
    }
}
