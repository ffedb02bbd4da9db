package dev.tributary.embedding;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.tributary.document.ElementArtifacts;
import dev.tributary.document.StageName;
import dev.tributary.pipeline.StageFactory;
import dev.tributary.pipeline.StageSettings;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Embedder variant {@code embedding-model}, backed by the {@link EmbeddingModel} bean. Option
 * {@code batch-size} (default 256).
 */
@Component
public class EmbeddingModelStageFactory implements StageFactory<EmbeddingStage> {

    static final String VARIANT = "embedding-model";
    static final int DEFAULT_BATCH_SIZE = 256;

    private final ObjectProvider<EmbeddingModel> embeddingModel;
    private final ElementArtifacts artifacts;

    public EmbeddingModelStageFactory(ObjectProvider<EmbeddingModel> embeddingModel, ElementArtifacts artifacts) {
        this.embeddingModel = embeddingModel;
        this.artifacts = artifacts;
    }

    @Override
    public StageName stage() {
        return StageName.EMBED;
    }

    @Override
    public String variant() {
        return VARIANT;
    }

    @Override
    public EmbeddingStage create(StageSettings settings) {
        return new EmbeddingStage(embeddingModel.getObject(), artifacts,
                settings.positiveIntOption("batch-size", DEFAULT_BATCH_SIZE));
    }
}
