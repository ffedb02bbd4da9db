package dev.tributary.pipeline;

import dev.tributary.document.StageName;
import java.io.IOException;
import java.util.List;

/**
 * Terminal stage: pushes every staged record of a batch to the destination in one call.
 *
 * <p>The call is all-or-nothing from the orchestrator's point of view: if it throws, every item
 * of the batch fails at the upload stage.
 */
public interface Uploader extends Stage {

    @Override
    default StageName name() {
        return StageName.UPLOAD;
    }

    void upload(List<UploadItem> items) throws IOException;
}
