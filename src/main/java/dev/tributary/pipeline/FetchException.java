package dev.tributary.pipeline;

import dev.tributary.document.StageName;

/** Raw content could not be transferred from the source. */
public class FetchException extends StageException {

    public FetchException(String message, Throwable cause) {
        super(StageName.DOWNLOAD, message, cause);
    }
}
