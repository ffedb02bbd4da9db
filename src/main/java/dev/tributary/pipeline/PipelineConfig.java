package dev.tributary.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.tributary.cleanup.CleanupCoordinator;
import dev.tributary.document.ElementArtifacts;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Wires the orchestrator and its built-in stages.
 *
 * <p>The stage chain and the pipeline are lazy: they are assembled from {@code
 * tributary.pipeline.stages} on first use, so invoking the CLI without a connector does not load
 * any stage dependencies (such as the embedding model).
 */
@Configuration
public class PipelineConfig {

    @Bean
    public ElementArtifacts elementArtifacts(ObjectMapper objectMapper) {
        return new ElementArtifacts(objectMapper);
    }

    @Bean
    public SourceIndexer sourceIndexer(PipelineProperties properties) {
        return new SourceIndexer(properties);
    }

    @Bean
    public Downloader downloader(PipelineProperties properties) {
        return new Downloader(properties);
    }

    @Bean
    @Lazy
    public PipelineStages pipelineStages(StageRegistry registry, PipelineProperties properties) {
        return PipelineStages.assemble(registry, properties.stages());
    }

    @Bean
    @Lazy
    public Pipeline pipeline(PipelineProperties properties,
                             PipelineStages stages,
                             SourceIndexer indexer,
                             Downloader downloader,
                             CleanupCoordinator cleanupCoordinator,
                             Clock clock) {
        return new Pipeline(properties, stages, indexer, downloader, cleanupCoordinator, clock);
    }
}
