package dev.tributary.connector;

import dev.tributary.document.DocumentRecord;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * A source of documents: cloud storage, a SaaS document store, a database, the local filesystem.
 *
 * <p>Enumeration and fetch are deliberately separate operations. The orchestrator lists every
 * record first, applies its global filters, and only then fetches content on its worker pool.
 *
 * <p>A connector owns its external sessions for exactly its own lifetime: they are established by
 * {@link #initialize()} and released by {@link #cleanup()}.
 */
public interface Connector {

    /** Connector id, also the CLI subcommand name (e.g. {@code local}, {@code dropbox}). */
    String id();

    /**
     * Establish external sessions. Idempotent: a second call must not open another session.
     *
     * @throws ConnectionException if credentials are rejected or the endpoint is unreachable
     */
    void initialize() throws ConnectionException;

    /**
     * Enumerate every item under the configured root, honoring the connector's {@code recursive}
     * setting. Must not download content. Items of unsupported type are returned already failed
     * at the index stage.
     *
     * @return the discovered records, in a stable order
     * @throws ConnectionException if the source cannot be listed
     */
    List<DocumentRecord> listDocuments() throws ConnectionException;

    /**
     * Open a stream over the raw bytes of one record. The caller closes the stream.
     *
     * @param record a record previously returned by {@link #listDocuments()}
     * @return the content stream
     * @throws IOException on transfer errors
     */
    InputStream openContent(DocumentRecord record) throws IOException;

    /**
     * Release external sessions and locks. Safe to call more than once and after a partial
     * failure; errors are logged, never thrown.
     */
    void cleanup();
}
