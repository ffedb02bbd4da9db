package dev.tributary.document;

/**
 * Raised at enumeration time when a source item has no extension, or an extension (and declared
 * content type) outside the recognized {@link FileType} set. The item is rejected before any
 * download cost is paid.
 */
public class UnsupportedFiletypeException extends Exception {

    private final String filename;

    public UnsupportedFiletypeException(String filename, String message) {
        super(message);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
