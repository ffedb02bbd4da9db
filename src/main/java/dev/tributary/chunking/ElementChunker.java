package dev.tributary.chunking;

import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.document.splitter.DocumentSplitters;
import dev.langchain4j.data.segment.TextSegment;
import dev.tributary.document.Element;
import dev.tributary.document.ElementType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Combines consecutive elements into CompositeElement chunks of at most {@code maxCharacters}.
 *
 * <p>Element texts within a chunk are separated by a blank line. An element longer than the limit
 * is never merged: it is split on its own with the langchain4j recursive splitter (paragraphs,
 * then lines, sentences, words) with {@code overlap} characters shared between pieces.
 *
 * <p>Chunks keep the document-level metadata of their first element. Under {@link
 * ChunkingStrategy#BY_TITLE} each chunk also records the title it falls under as {@code section}.
 */
public class ElementChunker {

  static final String SEPARATOR = "\n\n";

  private static final Set<String> INHERITED_METADATA =
      Set.of("source_identity", "relative_path", "filename", "filetype", "page_number");

  private final ChunkingStrategy strategy;
  private final int maxCharacters;
  private final DocumentSplitter splitter;

  public ElementChunker(ChunkingStrategy strategy, int maxCharacters, int overlap) {
    if (maxCharacters < 1) {
      throw new IllegalArgumentException("maxCharacters must be >= 1");
    }
    if (overlap < 0 || overlap >= maxCharacters) {
      throw new IllegalArgumentException("overlap must be in [0, maxCharacters)");
    }
    this.strategy = strategy;
    this.maxCharacters = maxCharacters;
    this.splitter = DocumentSplitters.recursive(maxCharacters, overlap);
  }

  public ChunkingStrategy strategy() {
    return strategy;
  }

  /**
   * @param elements partitioned elements of one record, in document order
   * @param sourceIdentity record identity, used for chunk ids
   * @return chunks in document order
   */
  public List<Element> chunk(List<Element> elements, String sourceIdentity) {
    List<Element> chunks = new ArrayList<>();
    List<Element> pending = new ArrayList<>();
    int pendingLength = 0;
    @Nullable String section = null;

    for (Element element : elements) {
      String text = element.text();
      if (text.isBlank()) {
        continue;
      }
      if (strategy == ChunkingStrategy.BY_TITLE && element.type() == ElementType.TITLE) {
        flush(chunks, pending, section, sourceIdentity);
        pendingLength = 0;
        section = text;
      }
      if (text.length() > maxCharacters) {
        flush(chunks, pending, section, sourceIdentity);
        pendingLength = 0;
        for (TextSegment piece : splitter.split(Document.from(text))) {
          addChunk(chunks, piece.text(), element, 1, section, sourceIdentity);
        }
        continue;
      }
      int added = pending.isEmpty() ? text.length() : SEPARATOR.length() + text.length();
      if (pendingLength + added > maxCharacters) {
        flush(chunks, pending, section, sourceIdentity);
        pendingLength = 0;
        added = text.length();
      }
      pending.add(element);
      pendingLength += added;
    }
    flush(chunks, pending, section, sourceIdentity);
    return chunks;
  }

  private void flush(
      List<Element> chunks, List<Element> pending, @Nullable String section, String sourceIdentity) {
    if (pending.isEmpty()) {
      return;
    }
    StringBuilder text = new StringBuilder();
    for (Element element : pending) {
      if (text.length() > 0) {
        text.append(SEPARATOR);
      }
      text.append(element.text());
    }
    addChunk(chunks, text.toString(), pending.get(0), pending.size(), section, sourceIdentity);
    pending.clear();
  }

  private void addChunk(
      List<Element> chunks,
      String text,
      Element first,
      int elementCount,
      @Nullable String section,
      String sourceIdentity) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    first.metadata().forEach((key, value) -> {
      if (INHERITED_METADATA.contains(key)) {
        metadata.put(key, value);
      }
    });
    metadata.put("orig_element_count", elementCount);
    metadata.put("chunking_strategy", strategy.value());
    if (strategy == ChunkingStrategy.BY_TITLE && section != null) {
      metadata.put("section", section);
    }
    int index = chunks.size();
    chunks.add(new Element(
        Element.idFor(sourceIdentity, index, text), ElementType.COMPOSITE_ELEMENT, text, metadata));
  }
}
