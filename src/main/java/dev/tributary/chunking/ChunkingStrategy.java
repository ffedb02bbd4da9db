package dev.tributary.chunking;

/** How consecutive elements are grouped into chunks. */
public enum ChunkingStrategy {
  /** Fill chunks up to the size limit regardless of document structure. */
  BASIC("basic"),
  /** Like {@link #BASIC}, but every Title element starts a new chunk. */
  BY_TITLE("by_title");

  private final String value;

  ChunkingStrategy(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
