package dev.tributary.destination;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One destination row as written by the embedding-store stager.
 *
 * @param id        element id
 * @param text      chunk text
 * @param embedding vector
 * @param metadata  flat string or number attributes, always including {@code record_id}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StagedRow(String id, String text, float[] embedding, Map<String, Object> metadata) {

    public StagedRow {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(embedding, "embedding must not be null");
        metadata = metadata == null ? Map.of() : new LinkedHashMap<>(metadata);
    }

    public TextSegment toTextSegment() {
        Map<String, Object> values = new LinkedHashMap<>(metadata);
        values.put("element_id", id);
        return TextSegment.from(text, Metadata.from(values));
    }

    public Embedding toEmbedding() {
        return Embedding.from(embedding);
    }
}
