package dev.tributary.pipeline;

import dev.tributary.document.StageName;

/**
 * Per-record failure attributed to one stage. Caught at the record boundary; never aborts the
 * batch.
 */
public class StageException extends Exception {

    private final StageName stage;

    public StageException(StageName stage, String message) {
        super(message);
        this.stage = stage;
    }

    public StageException(StageName stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public StageName getStage() {
        return stage;
    }
}
