package dev.tributary.pipeline;

import dev.tributary.document.StageName;

/**
 * Creates one stage variant from its settings. Implementations are Spring beans collected by
 * {@link StageRegistry}.
 *
 * @param <S> the stage type this factory produces
 */
public interface StageFactory<S extends Stage> {

    StageName stage();

    String variant();

    /**
     * @throws dev.tributary.config.ConfigurationException on invalid options
     */
    S create(StageSettings settings);
}
