package dev.tributary.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Names of the pipeline stages in execution order. The lowercase value is the key used in the
 * {@code tributary.pipeline.stages} configuration map and the directory name for per-stage
 * artifacts under the work directory.
 */
public enum StageName {
    INDEX("indexer"),
    DOWNLOAD("downloader"),
    PARTITION("partitioner"),
    CHUNK("chunker"),
    EMBED("embedder"),
    STAGE("stager"),
    UPLOAD("uploader");

    private final String value;

    StageName(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static StageName fromValue(String value) {
        for (StageName name : values()) {
            if (name.value.equalsIgnoreCase(value)) {
                return name;
            }
        }
        throw new IllegalArgumentException("Unknown stage name: " + value);
    }
}
