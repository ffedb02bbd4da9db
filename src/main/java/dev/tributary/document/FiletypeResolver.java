package dev.tributary.document;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * Static utility resolving a filename or declared content type to a {@link FileType}.
 *
 * <p>The last extension of the filename wins (case-insensitive); the declared content type is only
 * consulted when the extension is missing or unknown.
 */
public final class FiletypeResolver {

    private FiletypeResolver() {
        // utility class
    }

    /**
     * Resolve the document category of a source item.
     *
     * @param filename            the item name or path; only the last segment is inspected
     * @param declaredContentType MIME type reported by the source, may be null
     * @return the resolved file type
     * @throws UnsupportedFiletypeException if neither the extension nor the content type is known
     */
    public static FileType resolve(String filename, @Nullable String declaredContentType)
            throws UnsupportedFiletypeException {
        String extension = extensionOf(filename);
        if (extension != null) {
            for (FileType type : FileType.values()) {
                if (type.extensions().contains(extension)) {
                    return type;
                }
            }
        }
        if (declaredContentType != null && !declaredContentType.isBlank()) {
            String mime = declaredContentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
            for (FileType type : FileType.values()) {
                if (type.mimeTypes().contains(mime)) {
                    return type;
                }
            }
        }
        if (extension == null) {
            throw new UnsupportedFiletypeException(filename, "Unsupported file without extension: " + filename);
        }
        throw new UnsupportedFiletypeException(filename,
                "Extension " + extension + " not supported for " + filename
                        + ". Value must be one of " + supportedExtensions() + ".");
    }

    /** Convenience overload for sources that do not report a content type. */
    public static FileType resolve(String filename) throws UnsupportedFiletypeException {
        return resolve(filename, null);
    }

    /**
     * Returns the lowercase last extension of the final path segment including the dot, or null
     * when the name has none. Leading dots (hidden files) do not count as an extension.
     */
    static @Nullable String extensionOf(String filename) {
        String name = filename;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return null;
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static String supportedExtensions() {
        return Arrays.stream(FileType.values())
                .flatMap(type -> type.extensions().stream())
                .collect(Collectors.joining(", "));
    }
}
