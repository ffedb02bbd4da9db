package dev.tributary.pipeline;

import dev.tributary.config.ConfigurationException;
import dev.tributary.document.StageName;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The configured stage chain after the downloader.
 *
 * @param processing partitioner, then the optional chunker and embedder, in execution order; the
 *                   last one writes the record's output path
 * @param stager     optional reshaping for the destination
 * @param uploader   terminal batch stage
 */
public record PipelineStages(List<RecordStage> processing, @Nullable RecordStage stager, Uploader uploader) {

    private static final Logger log = LoggerFactory.getLogger(PipelineStages.class);

    public PipelineStages {
        if (processing == null || processing.isEmpty()) {
            throw new ConfigurationException("A partitioner stage is required");
        }
        if (processing.get(0).name() != StageName.PARTITION) {
            throw new ConfigurationException("The first processing stage must be the partitioner");
        }
        if (uploader == null) {
            throw new ConfigurationException("An uploader stage is required");
        }
        processing = List.copyOf(processing);
    }

    /**
     * Assemble the chain from {@code tributary.pipeline.stages.<name>} entries.
     *
     * @param registry variant registry
     * @param settings settings keyed by stage name ({@code partitioner}, {@code chunker}, ...)
     * @throws ConfigurationException if a required stage is missing, a stage name or variant is
     *     unknown
     */
    public static PipelineStages assemble(StageRegistry registry, Map<String, StageSettings> settings) {
        for (String name : settings.keySet()) {
            StageName stage;
            try {
                stage = StageName.fromValue(name);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown stage '" + name + "' in tributary.pipeline.stages", e);
            }
            if (stage == StageName.INDEX || stage == StageName.DOWNLOAD) {
                throw new ConfigurationException("Stage '" + name + "' is built in and has no variants");
            }
        }
        List<RecordStage> processing = new ArrayList<>();
        processing.add(registry.create(StageName.PARTITION, require(settings, StageName.PARTITION), RecordStage.class));
        optional(settings, StageName.CHUNK)
                .ifPresent(s -> processing.add(registry.create(StageName.CHUNK, s, RecordStage.class)));
        optional(settings, StageName.EMBED)
                .ifPresent(s -> processing.add(registry.create(StageName.EMBED, s, RecordStage.class)));
        RecordStage stager = optional(settings, StageName.STAGE)
                .map(s -> registry.create(StageName.STAGE, s, RecordStage.class))
                .orElse(null);
        Uploader uploader = registry.create(StageName.UPLOAD, require(settings, StageName.UPLOAD), Uploader.class);

        PipelineStages stages = new PipelineStages(processing, stager, uploader);
        log.info("Pipeline stages: {}", stages.describe());
        return stages;
    }

    public String describe() {
        List<String> names = new ArrayList<>();
        names.add(StageName.INDEX.value());
        names.add(StageName.DOWNLOAD.value());
        processing.forEach(stage -> names.add(stage.name().value()));
        if (stager != null) {
            names.add(stager.name().value());
        }
        names.add(uploader.name().value());
        return String.join(" -> ", names);
    }

    private static StageSettings require(Map<String, StageSettings> settings, StageName stage) {
        return optional(settings, stage).orElseThrow(() ->
                new ConfigurationException("Missing required stage configuration: tributary.pipeline.stages."
                        + stage.value()));
    }

    private static Optional<StageSettings> optional(Map<String, StageSettings> settings, StageName stage) {
        return Optional.ofNullable(settings.get(stage.value()));
    }
}
