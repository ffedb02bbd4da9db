package dev.tributary.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Configures the embedding model and the destination embedding store.
 *
 * <p>Uses the ONNX-based bge-small-en-v1.5 quantized model (384 dimensions) running in-process,
 * avoiding any external embedding API. The model is created lazily so runs that do not configure
 * an embedder never load the ONNX runtime.
 *
 * <p>The default destination is an {@link InMemoryEmbeddingStore}. When {@code
 * tributary.destination.store-file} is set, the store is restored from that file at startup and
 * the embedding-store uploader writes it back after every batch.
 */
@Configuration
public class EmbeddingConfig {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

    /**
     * Provides the in-process ONNX embedding model (bge-small-en-v1.5 quantized, 384 dimensions).
     *
     * @return a ready-to-use embedding model requiring no external API
     */
    @Bean
    @Lazy
    @ConditionalOnMissingBean
    public EmbeddingModel embeddingModel() {
        return new BgeSmallEnV15QuantizedEmbeddingModel();
    }

    /**
     * Provides the destination store, restored from {@code storeFile} when it exists.
     *
     * @param storeFile optional JSON file backing the in-memory store
     * @return the embedding store the uploader writes into
     */
    @Bean
    @ConditionalOnMissingBean
    public EmbeddingStore<TextSegment> embeddingStore(
            @Value("${tributary.destination.store-file:}") String storeFile) {
        if (!storeFile.isBlank() && Files.isRegularFile(Path.of(storeFile))) {
            log.info("Restoring embedding store from {}", storeFile);
            return InMemoryEmbeddingStore.fromFile(Path.of(storeFile));
        }
        return new InMemoryEmbeddingStore<>();
    }
}
