package dev.tributary.pipeline;

import dev.tributary.connector.ConnectionException;
import dev.tributary.connector.Connector;
import dev.tributary.document.DocumentRecord;
import dev.tributary.document.StageName;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Indexer stage: enumerates the connector and applies the global filters before any fetch cost is
 * paid. Filtered records are rejected at {@link StageName#INDEX} and never reach the downloader.
 */
public class SourceIndexer {

    private static final Logger log = LoggerFactory.getLogger(SourceIndexer.class);

    private final long maxFileSizeBytes;
    private final IndexScopeFilter scopeFilter;

    public SourceIndexer(PipelineProperties properties) {
        this.maxFileSizeBytes = properties.maxFileSizeBytes();
        this.scopeFilter = new IndexScopeFilter(properties.includePatterns(), properties.excludePatterns());
    }

    /**
     * @return every enumerated record, filtered ones already failed at the index stage
     * @throws ConnectionException if the connector cannot enumerate its source
     */
    public List<DocumentRecord> index(Connector connector) throws ConnectionException {
        List<DocumentRecord> records = connector.listDocuments();
        Set<String> seen = new HashSet<>();
        int rejected = 0;
        for (DocumentRecord record : records) {
            if (!seen.add(record.sourceIdentity())) {
                reject(record, "duplicate source identity");
            } else if (maxFileSizeBytes > 0 && record.sizeBytes() != null && record.sizeBytes() > maxFileSizeBytes) {
                reject(record, "size " + record.sizeBytes() + " exceeds max-file-size-bytes " + maxFileSizeBytes);
            } else if (!scopeFilter.isAllowed(record.relativePath())) {
                reject(record, "excluded by include/exclude patterns");
            }
            if (record.isFailed()) {
                rejected++;
            }
        }
        log.info("Indexed {} records from {} ({} rejected)", records.size(), connector.id(), rejected);
        return records;
    }

    private static void reject(DocumentRecord record, String reason) {
        if (record.reject(StageName.INDEX, reason)) {
            log.debug("Rejecting {}: {}", record.sourceIdentity(), reason);
        }
    }
}
