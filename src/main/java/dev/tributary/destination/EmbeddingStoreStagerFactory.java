package dev.tributary.destination;

import dev.tributary.document.ElementArtifacts;
import dev.tributary.document.StageName;
import dev.tributary.pipeline.StageFactory;
import dev.tributary.pipeline.StageSettings;
import org.springframework.stereotype.Component;

@Component
public class EmbeddingStoreStagerFactory implements StageFactory<EmbeddingStoreUploadStager> {

    static final String VARIANT = "embedding-store";

    private final ElementArtifacts artifacts;

    public EmbeddingStoreStagerFactory(ElementArtifacts artifacts) {
        this.artifacts = artifacts;
    }

    @Override
    public StageName stage() {
        return StageName.STAGE;
    }

    @Override
    public String variant() {
        return VARIANT;
    }

    @Override
    public EmbeddingStoreUploadStager create(StageSettings settings) {
        return new EmbeddingStoreUploadStager(artifacts);
    }
}
