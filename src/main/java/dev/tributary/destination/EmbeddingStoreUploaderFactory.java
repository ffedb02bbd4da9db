package dev.tributary.destination;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.tributary.document.StageName;
import dev.tributary.pipeline.StageFactory;
import dev.tributary.pipeline.StageSettings;
import java.nio.file.Path;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Uploader variant {@code embedding-store}. The store is persisted to {@code
 * tributary.destination.store-file} after every batch when that property is set.
 */
@Component
public class EmbeddingStoreUploaderFactory implements StageFactory<EmbeddingStoreUploader> {

    static final String VARIANT = "embedding-store";

    private final EmbeddingStore<TextSegment> embeddingStore;
    private final ObjectMapper objectMapper;
    private final String storeFile;

    public EmbeddingStoreUploaderFactory(EmbeddingStore<TextSegment> embeddingStore,
                                         ObjectMapper objectMapper,
                                         @Value("${tributary.destination.store-file:}") String storeFile) {
        this.embeddingStore = embeddingStore;
        this.objectMapper = objectMapper;
        this.storeFile = storeFile;
    }

    @Override
    public StageName stage() {
        return StageName.UPLOAD;
    }

    @Override
    public String variant() {
        return VARIANT;
    }

    @Override
    public EmbeddingStoreUploader create(StageSettings settings) {
        return new EmbeddingStoreUploader(embeddingStore, objectMapper,
                storeFile.isBlank() ? null : Path.of(storeFile));
    }
}
