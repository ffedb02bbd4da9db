package dev.tributary.pipeline;

import dev.tributary.document.StageName;

/** A processing stage could not turn its input into an artifact. */
public class ProcessingException extends StageException {

    public ProcessingException(StageName stage, String message) {
        super(stage, message);
    }

    public ProcessingException(StageName stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
