package dev.tributary.document;

import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link DocumentRecord}s for one source, resolving their file type at enumeration time.
 *
 * <p>Items whose type cannot be resolved still produce a record, already failed at the {@link
 * StageName#INDEX} stage, so the batch summary can report them while the pipeline never
 * dispatches them to the downloader.
 */
public final class DocumentRecordFactory {

    private static final Logger log = LoggerFactory.getLogger(DocumentRecordFactory.class);

    private final DocumentPaths paths;

    public DocumentRecordFactory(DocumentPaths paths) {
        this.paths = Objects.requireNonNull(paths, "paths must not be null");
    }

    public DocumentPaths paths() {
        return paths;
    }

    /**
     * Create a record for a discovered item.
     *
     * @param sourceIdentity stable, source-unique key
     * @param relativePath   source-relative path mirrored on disk
     * @param sizeBytes      size reported by the source, null if unknown
     * @param metadata       source-specific attributes
     * @param contentType    MIME type declared by the source, null if none
     * @return the record, in state {@code DISCOVERED} or {@code FAILED(index)}
     */
    public DocumentRecord create(String sourceIdentity,
                                 String relativePath,
                                 @Nullable Long sizeBytes,
                                 Map<String, Object> metadata,
                                 @Nullable String contentType) {
        FileType fileType = null;
        UnsupportedFiletypeException rejection = null;
        try {
            fileType = FiletypeResolver.resolve(relativePath, contentType);
        } catch (UnsupportedFiletypeException e) {
            rejection = e;
        }
        DocumentRecord record = new DocumentRecord(
                sourceIdentity, relativePath, fileType, sizeBytes, metadata, paths);
        if (rejection != null) {
            log.warn("Rejecting {}: {}", sourceIdentity, rejection.getMessage());
            record.fail(StageName.INDEX, rejection);
        }
        return record;
    }

    public DocumentRecord create(String sourceIdentity, String relativePath,
                                 @Nullable Long sizeBytes, Map<String, Object> metadata) {
        return create(sourceIdentity, relativePath, sizeBytes, metadata, null);
    }
}
