package dev.tributary.document;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * One discovered source item: immutable identity plus its lifecycle state.
 *
 * <p>Lifecycle: {@code DISCOVERED → DOWNLOADED → PROCESSED → UPLOADED}. Any non-terminal state may
 * move to {@code FAILED}, which is terminal for this record only. Transitions are synchronized
 * because the orchestrator may fail a record on deadline while its worker is still running; the
 * first terminal transition wins and later ones are ignored.
 *
 * <p>Records live in memory for one batch. The files at {@link #downloadPath()} and {@link
 * #outputPath()} outlive them and act as the durable record of completed work.
 */
public final class DocumentRecord {

    /** Lifecycle states, ordered by progress. */
    public enum Status {
        DISCOVERED,
        DOWNLOADED,
        PROCESSED,
        UPLOADED,
        FAILED
    }

    private final String sourceIdentity;
    private final String relativePath;
    private final @Nullable FileType fileType;
    private final @Nullable Long sizeBytes;
    private final Map<String, Object> metadata;
    private final DocumentPaths paths;
    private final Path downloadPath;
    private final Path outputPath;

    private Status status = Status.DISCOVERED;
    private @Nullable StageFailure failure;
    private volatile StageName currentStage = StageName.INDEX;

    public DocumentRecord(String sourceIdentity,
                          String relativePath,
                          @Nullable FileType fileType,
                          @Nullable Long sizeBytes,
                          Map<String, Object> metadata,
                          DocumentPaths paths) {
        this.sourceIdentity = Objects.requireNonNull(sourceIdentity, "sourceIdentity must not be null");
        this.relativePath = Objects.requireNonNull(relativePath, "relativePath must not be null");
        this.fileType = fileType;
        this.sizeBytes = sizeBytes;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        this.paths = Objects.requireNonNull(paths, "paths must not be null");
        this.downloadPath = paths.downloadPath(relativePath);
        this.outputPath = paths.outputPath(relativePath);
    }

    public String sourceIdentity() {
        return sourceIdentity;
    }

    public String relativePath() {
        return relativePath;
    }

    /** Resolved document category; null only for records rejected at enumeration. */
    public @Nullable FileType fileType() {
        return fileType;
    }

    /** Size reported by the source before download; null when the source does not know. */
    public @Nullable Long sizeBytes() {
        return sizeBytes;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public Path downloadPath() {
        return downloadPath;
    }

    public Path outputPath() {
        return outputPath;
    }

    /** Location of this record's intermediate artifact for {@code stage}. */
    public Path artifactPath(StageName stage) {
        return paths.artifactPath(stage, relativePath);
    }

    public synchronized Status status() {
        return status;
    }

    public synchronized Optional<StageFailure> failure() {
        return Optional.ofNullable(failure);
    }

    public synchronized boolean isFailed() {
        return status == Status.FAILED;
    }

    public StageName currentStage() {
        return currentStage;
    }

    /** Records which stage a worker is about to run, so deadline failures can name it. */
    public void enterStage(StageName stage) {
        this.currentStage = Objects.requireNonNull(stage, "stage must not be null");
    }

    /**
     * Move forward to {@code next}.
     *
     * @return false if the record already failed (the transition is dropped)
     * @throws IllegalStateException on a backward or repeated transition, or when {@code next} is
     *     {@code FAILED} (use {@link #fail})
     */
    public synchronized boolean advanceTo(Status next) {
        if (next == Status.FAILED) {
            throw new IllegalStateException("Use fail(stage, cause) to fail a record");
        }
        if (status == Status.FAILED) {
            return false;
        }
        if (next.ordinal() <= status.ordinal()) {
            throw new IllegalStateException(
                    "Illegal transition " + status + " -> " + next + " for " + sourceIdentity);
        }
        status = next;
        return true;
    }

    /**
     * Fail this record at {@code stage}.
     *
     * @return false if the record was already terminal ({@code FAILED} or {@code UPLOADED})
     */
    public synchronized boolean fail(StageName stage, Throwable cause) {
        return fail(StageFailure.of(stage, cause));
    }

    /** Variant for policy rejections that carry a reason but no exception. */
    public synchronized boolean reject(StageName stage, String reason) {
        return fail(new StageFailure(stage, reason, null));
    }

    private boolean fail(StageFailure stageFailure) {
        if (status == Status.FAILED || status == Status.UPLOADED) {
            return false;
        }
        status = Status.FAILED;
        failure = stageFailure;
        return true;
    }

    @Override
    public String toString() {
        return "DocumentRecord[" + sourceIdentity + ", " + status() + "]";
    }
}
