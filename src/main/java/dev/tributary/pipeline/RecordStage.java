package dev.tributary.pipeline;

import dev.tributary.document.DocumentRecord;
import java.nio.file.Path;

/**
 * A stage that turns one record's input file into one output artifact.
 *
 * <p>The orchestrator owns the paths: {@code input} is the previous stage's artifact (or the
 * downloaded raw content) and {@code output} is a temp file that is moved into place only if this
 * method returns normally. Implementations must not write anywhere else.
 */
public interface RecordStage extends Stage {

    /**
     * @param record the record being processed, read-only apart from its metadata
     * @param input  file produced by the previous stage
     * @param output file to write
     * @throws ProcessingException if the input cannot be processed; the record fails at this stage
     */
    void process(DocumentRecord record, Path input, Path output) throws ProcessingException;
}
