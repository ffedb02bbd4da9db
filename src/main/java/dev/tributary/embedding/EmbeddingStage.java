package dev.tributary.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.tributary.document.DocumentRecord;
import dev.tributary.document.Element;
import dev.tributary.document.ElementArtifacts;
import dev.tributary.document.StageName;
import dev.tributary.pipeline.ProcessingException;
import dev.tributary.pipeline.RecordStage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedder stage: attaches an embedding vector to every element, calling the model in batches of
 * at most {@code batchSize} texts.
 */
public class EmbeddingStage implements RecordStage {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingStage.class);

    private final EmbeddingModel embeddingModel;
    private final ElementArtifacts artifacts;
    private final int batchSize;

    public EmbeddingStage(EmbeddingModel embeddingModel, ElementArtifacts artifacts, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        this.embeddingModel = embeddingModel;
        this.artifacts = artifacts;
        this.batchSize = batchSize;
    }

    @Override
    public StageName name() {
        return StageName.EMBED;
    }

    @Override
    public void process(DocumentRecord record, Path input, Path output) throws ProcessingException {
        List<Element> elements;
        try {
            elements = artifacts.read(input);
        } catch (IOException e) {
            throw new ProcessingException(name(), "Failed to read elements of " + record.sourceIdentity(), e);
        }

        List<Element> embedded = new ArrayList<>(elements.size());
        for (int start = 0; start < elements.size(); start += batchSize) {
            List<Element> batch = elements.subList(start, Math.min(start + batchSize, elements.size()));
            List<Embedding> embeddings = embedBatch(record, batch);
            for (int i = 0; i < batch.size(); i++) {
                embedded.add(batch.get(i).withEmbeddings(embeddings.get(i).vector()));
            }
        }

        try {
            artifacts.write(output, embedded);
        } catch (IOException e) {
            throw new ProcessingException(name(), "Failed to write embeddings of " + record.sourceIdentity(), e);
        }
        log.debug("Embedded {} elements of {}", embedded.size(), record.sourceIdentity());
    }

    private List<Embedding> embedBatch(DocumentRecord record, List<Element> batch) throws ProcessingException {
        List<TextSegment> segments = batch.stream()
                .map(element -> TextSegment.from(element.text()))
                .toList();
        List<Embedding> embeddings;
        try {
            embeddings = embeddingModel.embedAll(segments).content();
        } catch (RuntimeException e) {
            throw new ProcessingException(name(),
                    "Embedding model failed for " + record.sourceIdentity() + ": " + e.getMessage(), e);
        }
        if (embeddings == null || embeddings.size() != batch.size()) {
            throw new ProcessingException(name(), "Embedding model returned "
                    + (embeddings == null ? 0 : embeddings.size()) + " vectors for " + batch.size() + " texts");
        }
        return embeddings;
    }
}
