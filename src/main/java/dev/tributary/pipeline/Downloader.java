package dev.tributary.pipeline;

import dev.tributary.cache.CacheGuard;
import dev.tributary.cleanup.ResourceScope;
import dev.tributary.connector.Connector;
import dev.tributary.document.DocumentRecord;
import dev.tributary.document.StageName;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;

/**
 * Downloader stage: materializes a record's raw content at its download path.
 *
 * <p>Skipped entirely when the download path is already a non-empty file. Transfers are retried
 * on {@link IOException} with exponential backoff; each attempt rewrites the temp file from the
 * start. Objects larger than the large-object threshold are copied in bounded chunks instead of
 * being read into memory.
 */
public class Downloader {

    private static final Logger log = LoggerFactory.getLogger(Downloader.class);

    private final long largeObjectThresholdBytes;
    private final int chunkBytes;
    private final RetryTemplate retryTemplate;

    public Downloader(PipelineProperties properties) {
        this.largeObjectThresholdBytes = properties.largeObjectThresholdBytes();
        this.chunkBytes = properties.downloadChunkBytes();
        this.retryTemplate = retryTemplate(properties.retry());
    }

    /**
     * Fetch raw content and advance the record to {@code DOWNLOADED}.
     *
     * @param record    a record in state {@code DISCOVERED}
     * @param connector the record's source
     * @param scope     batch scope owning temp files
     * @throws FetchException when every attempt failed
     */
    public void fetch(DocumentRecord record, Connector connector, ResourceScope scope) throws FetchException {
        record.enterStage(StageName.DOWNLOAD);
        Path target = record.downloadPath();
        try {
            boolean transferred = CacheGuard.materialize(target, scope,
                    temp -> retryTemplate.<Void, IOException>execute(context -> {
                        if (context.getRetryCount() > 0) {
                            log.info("Retrying download of {} (attempt {})",
                                    record.sourceIdentity(), context.getRetryCount() + 1);
                        }
                        transfer(record, connector, temp);
                        return null;
                    }));
            if (transferred) {
                log.debug("Downloaded {} to {}", record.sourceIdentity(), target);
            }
        } catch (IOException e) {
            throw new FetchException("Failed to download " + record.sourceIdentity(), e);
        }
        record.advanceTo(DocumentRecord.Status.DOWNLOADED);
    }

    boolean isLargeObject(DocumentRecord record) {
        return record.sizeBytes() != null && record.sizeBytes() > largeObjectThresholdBytes;
    }

    private void transfer(DocumentRecord record, Connector connector, Path temp) throws IOException {
        try (InputStream in = connector.openContent(record);
             OutputStream out = Files.newOutputStream(temp)) {
            if (isLargeObject(record)) {
                log.info("Streaming large object {} ({} bytes) in {}-byte chunks",
                        record.sourceIdentity(), record.sizeBytes(), chunkBytes);
                copyChunked(in, out);
            } else {
                out.write(in.readAllBytes());
            }
        }
    }

    private void copyChunked(InputStream in, OutputStream out) throws IOException {
        byte[] buffer = new byte[chunkBytes];
        int read;
        while ((read = in.read(buffer)) != -1) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedIOException("Download interrupted");
            }
            out.write(buffer, 0, read);
        }
    }

    private static RetryTemplate retryTemplate(PipelineProperties.Retry retry) {
        RetryTemplateBuilder builder = RetryTemplate.builder()
                .maxAttempts(retry.maxAttempts())
                .retryOn(IOException.class);
        long delay = retry.delayMs();
        if (delay < 1) {
            builder.noBackoff();
        } else if (retry.multiplier() > 1.0) {
            builder.exponentialBackoff(delay, retry.multiplier(), delay * 30);
        } else {
            builder.fixedBackoff(delay);
        }
        return builder.build();
    }
}
