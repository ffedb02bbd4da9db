package dev.tributary.document;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Why and where a record left the pipeline.
 *
 * @param stage  the stage that was executing when the record failed
 * @param reason human-readable reason, taken from the cause when there is one
 * @param cause  the underlying exception, null for policy rejections
 */
public record StageFailure(StageName stage, String reason, @Nullable Throwable cause) {

    public StageFailure {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    public static StageFailure of(StageName stage, Throwable cause) {
        String message = cause.getMessage();
        String reason = message == null || message.isBlank()
                ? cause.getClass().getSimpleName()
                : cause.getClass().getSimpleName() + ": " + message;
        return new StageFailure(stage, reason, cause);
    }
}
