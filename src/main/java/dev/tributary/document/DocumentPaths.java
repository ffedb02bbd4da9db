package dev.tributary.document;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Pure mapping from a record's source-relative path to its filesystem locations.
 *
 * <p>The same relative path always maps to the same files, across runs and across workers, which
 * is what makes the path-presence cache and the one-writer-per-path guarantee hold:
 *
 * <ul>
 *   <li>raw content: {@code downloadDir/<relative>}
 *   <li>processed artifact: {@code outputDir/<relative>.json}
 *   <li>intermediate artifacts: {@code workDir/<stage>/<relative>.json}
 * </ul>
 *
 * @param downloadDir root for raw downloaded content
 * @param outputDir   root for processed artifacts
 * @param workDir     root for per-stage intermediate artifacts
 */
public record DocumentPaths(Path downloadDir, Path outputDir, Path workDir) {

    public DocumentPaths {
        Objects.requireNonNull(downloadDir, "downloadDir must not be null");
        Objects.requireNonNull(outputDir, "outputDir must not be null");
        Objects.requireNonNull(workDir, "workDir must not be null");
        downloadDir = downloadDir.toAbsolutePath().normalize();
        outputDir = outputDir.toAbsolutePath().normalize();
        workDir = workDir.toAbsolutePath().normalize();
    }

    public Path downloadPath(String relativePath) {
        return resolveWithin(downloadDir, relativePath, "");
    }

    public Path outputPath(String relativePath) {
        return resolveWithin(outputDir, relativePath, ".json");
    }

    public Path artifactPath(StageName stage, String relativePath) {
        return resolveWithin(workDir.resolve(stage.value()), relativePath, ".json");
    }

    private static Path resolveWithin(Path root, String relativePath, String suffix) {
        if (relativePath == null || relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
        String trimmed = relativePath.replace('\\', '/');
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        Path resolved = root.resolve(trimmed + suffix).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IllegalArgumentException("Relative path escapes its root: " + relativePath);
        }
        return resolved;
    }
}
