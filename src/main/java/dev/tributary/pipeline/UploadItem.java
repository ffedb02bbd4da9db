package dev.tributary.pipeline;

import dev.tributary.document.DocumentRecord;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A processed record together with the artifact to push to the destination.
 *
 * @param record   the record
 * @param artifact staged artifact, or the processed output when no stager is configured
 */
public record UploadItem(DocumentRecord record, Path artifact) {

    public UploadItem {
        Objects.requireNonNull(record, "record must not be null");
        Objects.requireNonNull(artifact, "artifact must not be null");
    }
}
