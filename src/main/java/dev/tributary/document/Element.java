package dev.tributary.document;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A unit of partitioned content, the common currency of the partition, chunk, embed and stage
 * artifacts. Serialized as one entry of the JSON array written to each stage's artifact file.
 *
 * @param elementId  deterministic id, see {@link #idFor}
 * @param type       element category
 * @param text       plain text of the element
 * @param metadata   attributes such as {@code source_identity}, {@code page_number}, {@code
 *     section}; values are strings or numbers
 * @param embeddings embedding vector; null until the embedder stage ran
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Element(
        @JsonProperty("element_id") String elementId,
        ElementType type,
        String text,
        Map<String, Object> metadata,
        float @Nullable [] embeddings) {

    public Element {
        Objects.requireNonNull(elementId, "elementId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Element(String elementId, ElementType type, String text, Map<String, Object> metadata) {
        this(elementId, type, text, metadata, null);
    }

    public Element withEmbeddings(float[] vector) {
        return new Element(elementId, type, text, metadata, vector);
    }

    /** Returns a copy with {@code key} added to (or replaced in) the metadata. */
    public Element withMetadata(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new Element(elementId, type, text, copy, embeddings);
    }

    /**
     * Deterministic element id: the same record, position and text always yield the same id, so
     * re-running a batch replaces rather than duplicates rows in the destination.
     */
    public static String idFor(String sourceIdentity, int index, String text) {
        return ContentHasher.sha256Prefix(sourceIdentity + "\u0000" + index + "\u0000" + text, 32);
    }
}
