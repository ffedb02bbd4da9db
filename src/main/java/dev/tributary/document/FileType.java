package dev.tributary.document;

import java.util.List;

/**
 * Document categories the pipeline knows how to partition, with the file extensions and MIME
 * types that resolve to each.
 */
public enum FileType {
    TEXT(List.of(".txt", ".text", ".log"), List.of("text/plain")),
    MARKDOWN(List.of(".md", ".markdown"), List.of("text/markdown", "text/x-markdown")),
    HTML(List.of(".html", ".htm"), List.of("text/html", "application/xhtml+xml")),
    PDF(List.of(".pdf"), List.of("application/pdf")),
    CSV(List.of(".csv"), List.of("text/csv"));

    private final List<String> extensions;
    private final List<String> mimeTypes;

    FileType(List<String> extensions, List<String> mimeTypes) {
        this.extensions = extensions;
        this.mimeTypes = mimeTypes;
    }

    /** Lowercase extensions including the leading dot. */
    public List<String> extensions() {
        return extensions;
    }

    public List<String> mimeTypes() {
        return mimeTypes;
    }
}
