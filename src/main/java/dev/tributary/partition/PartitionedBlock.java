package dev.tributary.partition;

import dev.tributary.document.ElementType;
import java.util.Map;
import java.util.Objects;

/**
 * One block of a parsed document before it receives an element id.
 *
 * @param type element category
 * @param text plain text, never blank
 * @param metadata format-specific attributes (heading level, page number, code language)
 */
public record PartitionedBlock(ElementType type, String text, Map<String, Object> metadata) {

  public PartitionedBlock {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(text, "text must not be null");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public PartitionedBlock(ElementType type, String text) {
    this(type, text, Map.of());
  }
}
