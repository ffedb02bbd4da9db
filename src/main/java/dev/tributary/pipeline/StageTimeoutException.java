package dev.tributary.pipeline;

import dev.tributary.document.StageName;
import java.time.Duration;

/** A record was still running its stage when the run deadline passed. */
public class StageTimeoutException extends StageException {

    public StageTimeoutException(StageName stage, Duration runTimeout) {
        super(stage, "Run timeout of " + runTimeout + " exceeded during " + stage.value());
    }
}
