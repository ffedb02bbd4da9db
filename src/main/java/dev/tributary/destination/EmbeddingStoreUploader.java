package dev.tributary.destination;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import dev.tributary.pipeline.UploadItem;
import dev.tributary.pipeline.Uploader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uploads staged rows into the langchain4j {@link EmbeddingStore} with replacement semantics:
 * every row previously stored for a record of the batch is removed before the new rows are added,
 * so re-running a batch never duplicates content.
 *
 * <p>All rows are read before the store is touched; an unreadable artifact fails the batch without
 * mutating the store.
 */
public class EmbeddingStoreUploader implements Uploader {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingStoreUploader.class);

    private final EmbeddingStore<TextSegment> embeddingStore;
    private final ObjectMapper objectMapper;
    private final @Nullable Path storeFile;

    public EmbeddingStoreUploader(EmbeddingStore<TextSegment> embeddingStore,
                                  ObjectMapper objectMapper,
                                  @Nullable Path storeFile) {
        this.embeddingStore = embeddingStore;
        this.objectMapper = objectMapper;
        this.storeFile = storeFile;
    }

    @Override
    public void upload(List<UploadItem> items) throws IOException {
        Set<String> recordIds = new LinkedHashSet<>();
        List<Embedding> embeddings = new ArrayList<>();
        List<TextSegment> segments = new ArrayList<>();
        for (UploadItem item : items) {
            recordIds.add(item.record().sourceIdentity());
            for (StagedRow row : StagedRows.read(objectMapper, item.artifact())) {
                embeddings.add(row.toEmbedding());
                segments.add(row.toTextSegment());
            }
        }

        embeddingStore.removeAll(metadataKey(EmbeddingStoreUploadStager.RECORD_ID).isIn(recordIds));
        if (!segments.isEmpty()) {
            embeddingStore.addAll(embeddings, segments);
        }
        log.info("Stored {} rows for {} records", segments.size(), recordIds.size());

        persist();
    }

    private void persist() throws IOException {
        if (storeFile == null) {
            return;
        }
        if (embeddingStore instanceof InMemoryEmbeddingStore<TextSegment> inMemory) {
            Path parent = storeFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            inMemory.serializeToFile(storeFile);
            log.info("Persisted embedding store to {}", storeFile);
        } else {
            log.debug("Embedding store {} persists itself, ignoring store-file", embeddingStore.getClass().getSimpleName());
        }
    }
}
