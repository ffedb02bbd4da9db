package dev.tributary.connector.local;

import dev.tributary.connector.ConnectionException;
import dev.tributary.connector.Connector;
import dev.tributary.document.DocumentRecord;
import dev.tributary.document.DocumentRecordFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connector over the local filesystem. The source identity is the path relative to the input
 * root, with {@code /} separators, so it is stable across machines and runs.
 */
public class LocalConnector implements Connector {

    public static final String ID = "local";

    private static final Logger log = LoggerFactory.getLogger(LocalConnector.class);

    private final LocalConnectorConfig config;
    private final DocumentRecordFactory recordFactory;
    private final @Nullable PathMatcher globMatcher;

    public LocalConnector(LocalConnectorConfig config, DocumentRecordFactory recordFactory) {
        this.config = config;
        this.recordFactory = recordFactory;
        this.globMatcher = config.fileGlob() == null
                ? null
                : FileSystems.getDefault().getPathMatcher("glob:" + config.fileGlob());
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public void initialize() throws ConnectionException {
        if (!Files.isReadable(config.inputPath())) {
            throw new ConnectionException("Local input path is not readable: " + config.inputPath());
        }
    }

    @Override
    public List<DocumentRecord> listDocuments() throws ConnectionException {
        Path root = config.root();
        if (config.isSingleFile()) {
            return List.of(toRecord(root, config.inputPath()));
        }
        int depth = config.recursive() ? Integer.MAX_VALUE : 1;
        List<Path> files;
        try (Stream<Path> walk = Files.walk(root, depth)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(file -> matchesGlob(root.relativize(file)))
                    .sorted()
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new ConnectionException("Failed to list " + root, e);
        }
        List<DocumentRecord> records = new ArrayList<>(files.size());
        for (Path file : files) {
            records.add(toRecord(root, file));
        }
        log.info("Found {} files under {} (recursive={})", records.size(), root, config.recursive());
        return records;
    }

    @Override
    public InputStream openContent(DocumentRecord record) throws IOException {
        return Files.newInputStream(config.root().resolve(record.relativePath()));
    }

    @Override
    public void cleanup() {
        log.debug("Local connector for {} has no sessions to release", config.inputPath());
    }

    private boolean matchesGlob(Path relative) {
        if (globMatcher == null) {
            return true;
        }
        Path fileName = relative.getFileName();
        return globMatcher.matches(relative) || (fileName != null && globMatcher.matches(fileName));
    }

    private DocumentRecord toRecord(Path root, Path file) {
        String relativePath = root.relativize(file).toString().replace('\\', '/');
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("file_path", file.toString());
        Long size = null;
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            size = attributes.size();
            metadata.put("last_modified", attributes.lastModifiedTime().toString());
        } catch (IOException e) {
            log.warn("Cannot read attributes of {}: {}", file, e.getMessage());
        }
        return recordFactory.create(relativePath, relativePath, size, metadata);
    }
}
