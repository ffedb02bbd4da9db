package dev.tributary.connector.local;

import dev.tributary.config.ConfigurationException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.jspecify.annotations.Nullable;

/**
 * Settings for the {@code local} connector.
 *
 * @param inputPath file or directory to ingest
 * @param recursive descend into subdirectories
 * @param fileGlob  optional glob matched against the file name or the relative path
 */
public record LocalConnectorConfig(Path inputPath, boolean recursive, @Nullable String fileGlob) {

    public LocalConnectorConfig {
        if (inputPath == null) {
            throw new ConfigurationException("Local connector requires --remote-url pointing to a file or directory");
        }
        inputPath = inputPath.toAbsolutePath().normalize();
        if (!Files.exists(inputPath)) {
            throw new ConfigurationException("Local input path does not exist: " + inputPath);
        }
        if (fileGlob != null && fileGlob.isBlank()) {
            fileGlob = null;
        }
    }

    public boolean isSingleFile() {
        return Files.isRegularFile(inputPath);
    }

    /** Directory that relative paths are computed against. */
    public Path root() {
        return isSingleFile() ? inputPath.getParent() : inputPath;
    }
}
