package dev.tributary.pipeline;

import dev.tributary.document.StageName;

/**
 * A pipeline step, wired by name through a {@link StageFactory}.
 */
public interface Stage {

    StageName name();
}
