package dev.tributary.pipeline;

import dev.tributary.cache.CacheGuard;
import dev.tributary.cleanup.CleanupCoordinator;
import dev.tributary.cleanup.ResourceScope;
import dev.tributary.connector.ConnectionException;
import dev.tributary.connector.Connector;
import dev.tributary.document.DocumentRecord;
import dev.tributary.document.StageName;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Orchestrates one batch: index, then download and process every record on a bounded worker pool,
 * then upload all staged records in one call.
 *
 * <p><strong>Failure semantics:</strong> only connection-level errors (credentials rejected, source
 * unreachable at start, enumeration outliving the run timeout) escape {@link #run}. Every per-record error is caught at the record
 * boundary, logged with its identity and stage, and reported in the {@link BatchSummary}; a record
 * failing at one stage is excluded from the following ones while its siblings continue.
 *
 * <p>Each processing stage is wrapped in {@link CacheGuard} on its target path, so a rerun after an
 * interruption resumes from the last completed artifact of every record.
 */
public class Pipeline {

    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final PipelineStages stages;
    private final SourceIndexer indexer;
    private final Downloader downloader;
    private final CleanupCoordinator cleanupCoordinator;
    private final Clock clock;
    private final int concurrency;
    private final @Nullable Duration runTimeout;

    public Pipeline(PipelineProperties properties,
                    PipelineStages stages,
                    SourceIndexer indexer,
                    Downloader downloader,
                    CleanupCoordinator cleanupCoordinator,
                    Clock clock) {
        this.stages = stages;
        this.indexer = indexer;
        this.downloader = downloader;
        this.cleanupCoordinator = cleanupCoordinator;
        this.clock = clock;
        this.concurrency = properties.concurrency();
        this.runTimeout = properties.runTimeout();
    }

    public BatchSummary run(Connector connector) throws ConnectionException {
        return run(connector, new BatchCancellation());
    }

    /**
     * Run one batch against {@code connector}. The connector is initialized here and cleaned up on
     * every exit path.
     *
     * @param connector    a configured, not yet initialized connector
     * @param cancellation signal that stops dispatch of further records
     * @return the batch summary
     * @throws ConnectionException if the source cannot be reached or enumerated before the run deadline
     */
    public BatchSummary run(Connector connector, BatchCancellation cancellation) throws ConnectionException {
        Instant started = clock.instant();
        Instant deadline = runTimeout == null ? null : started.plus(runTimeout);
        try (ResourceScope scope = cleanupCoordinator.openScope("batch:" + connector.id())) {
            scope.register("connector:" + connector.id(), connector::cleanup);
            ExecutorService workers = Executors.newFixedThreadPool(
                    concurrency, new CustomizableThreadFactory("tributary-worker-"));
            ResourceScope.Registration pool = scope.register("workers", workers::shutdownNow);

            List<DocumentRecord> records = enumerate(connector, workers, deadline);

            Map<DocumentRecord, Future<?>> inFlight = new LinkedHashMap<>();
            for (DocumentRecord record : records) {
                if (record.isFailed()) {
                    continue;
                }
                record.enterStage(StageName.DOWNLOAD);
                inFlight.put(record, workers.submit(() -> processRecord(record, connector, scope, cancellation)));
            }
            awaitRecords(inFlight, deadline);
            pool.release();

            upload(records, deadline);

            BatchSummary summary = BatchSummary.of(records, Duration.between(started, clock.instant()));
            log.info("Batch {} finished: {}", connector.id(), summary);
            for (BatchSummary.Failure failure : summary.failures()) {
                log.info("  failed {} at {}: {}", failure.sourceIdentity(), failure.stage().value(), failure.reason());
            }
            return summary;
        }
    }

    /**
     * Initialize the connector and index the source on a worker, bounded by the run deadline. A
     * listing that outlives the deadline is interrupted and reported as a connection failure.
     */
    private List<DocumentRecord> enumerate(Connector connector, ExecutorService workers, @Nullable Instant deadline)
            throws ConnectionException {
        Future<List<DocumentRecord>> listing = workers.submit(() -> {
            connector.initialize();
            return indexer.index(connector);
        });
        try {
            return deadline == null
                    ? listing.get()
                    : listing.get(remainingNanos(deadline), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            listing.cancel(true);
            log.warn("Enumeration of {} did not finish within {}, abandoning the batch", connector.id(), runTimeout);
            throw new ConnectionException("Enumeration of " + connector.id()
                    + " did not finish within the run timeout of " + runTimeout, e);
        } catch (InterruptedException e) {
            listing.cancel(true);
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while enumerating " + connector.id(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ConnectionException connectionFailure) {
                throw connectionFailure;
            }
            if (cause instanceof RuntimeException runtimeFailure) {
                throw runtimeFailure;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new ConnectionException("Enumeration of " + connector.id() + " failed", cause);
        }
    }

    private long remainingNanos(Instant deadline) {
        return Math.max(0, Duration.between(clock.instant(), deadline).toNanos());
    }

    /**
     * Wait for each record in submission order. At the deadline every unfinished record is
     * interrupted and failed at the stage it was running.
     */
    private void awaitRecords(Map<DocumentRecord, Future<?>> inFlight, @Nullable Instant deadline) {
        boolean interrupted = false;
        for (Map.Entry<DocumentRecord, Future<?>> entry : inFlight.entrySet()) {
            DocumentRecord record = entry.getKey();
            Future<?> future = entry.getValue();
            try {
                if (deadline == null) {
                    future.get();
                } else {
                    future.get(remainingNanos(deadline), TimeUnit.NANOSECONDS);
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                failTimedOut(record);
            } catch (ExecutionException e) {
                failRecord(record, record.currentStage(), e.getCause());
            } catch (CancellationException e) {
                log.debug("Record {} was cancelled", record.sourceIdentity());
            } catch (InterruptedException e) {
                interrupted = true;
                inFlight.values().forEach(f -> f.cancel(true));
                log.warn("Interrupted while waiting for records, cancelling the remaining work");
                break;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void failTimedOut(DocumentRecord record) {
        StageName stage = record.currentStage();
        if (record.fail(stage, new StageTimeoutException(stage, runTimeout))) {
            log.warn("Record {} timed out during {}", record.sourceIdentity(), stage.value());
        }
    }

    /**
     * Worker body for one record: download, then every processing stage, then the optional stager.
     * Never throws.
     */
    private void processRecord(DocumentRecord record, Connector connector, ResourceScope scope,
                               BatchCancellation cancellation) {
        if (cancellation.isCancelled()) {
            log.debug("Batch cancelled, not dispatching {}", record.sourceIdentity());
            return;
        }
        if (record.isFailed()) {
            return;
        }
        try {
            downloader.fetch(record, connector, scope);
            Path input = record.downloadPath();
            List<RecordStage> processing = stages.processing();
            for (int i = 0; i < processing.size(); i++) {
                RecordStage stage = processing.get(i);
                Path output = i == processing.size() - 1 ? record.outputPath() : record.artifactPath(stage.name());
                runStage(stage, record, input, output, scope);
                input = output;
            }
            if (!record.advanceTo(DocumentRecord.Status.PROCESSED)) {
                return;
            }
            RecordStage stager = stages.stager();
            if (stager != null) {
                runStage(stager, record, input, record.artifactPath(StageName.STAGE), scope);
            }
        } catch (StageException e) {
            failRecord(record, e.getStage(), e);
        } catch (Exception e) {
            failRecord(record, record.currentStage(), e);
        }
    }

    private static void runStage(RecordStage stage, DocumentRecord record, Path input, Path output,
                                 ResourceScope scope) throws ProcessingException {
        record.enterStage(stage.name());
        try {
            CacheGuard.materialize(output, scope, temp -> stage.process(record, input, temp));
        } catch (IOException e) {
            throw new ProcessingException(stage.name(),
                    "Failed to write " + stage.name().value() + " artifact for " + record.sourceIdentity(), e);
        }
    }

    private void upload(List<DocumentRecord> records, @Nullable Instant deadline) {
        List<UploadItem> items = new ArrayList<>();
        for (DocumentRecord record : records) {
            if (record.status() == DocumentRecord.Status.PROCESSED) {
                Path artifact = stages.stager() != null ? record.artifactPath(StageName.STAGE) : record.outputPath();
                items.add(new UploadItem(record, artifact));
            }
        }
        if (items.isEmpty()) {
            log.info("Nothing to upload");
            return;
        }
        items.forEach(item -> item.record().enterStage(StageName.UPLOAD));
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            items.forEach(item -> failTimedOut(item.record()));
            return;
        }
        try {
            stages.uploader().upload(items);
        } catch (Exception e) {
            log.error("Upload of {} records failed: {}", items.size(), e.getMessage(), e);
            items.forEach(item -> item.record().fail(StageName.UPLOAD, e));
            return;
        }
        for (UploadItem item : items) {
            item.record().advanceTo(DocumentRecord.Status.UPLOADED);
        }
        log.info("Uploaded {} records", items.size());
    }

    private static void failRecord(DocumentRecord record, StageName stage, Throwable cause) {
        if (record.fail(stage, cause)) {
            log.warn("Record {} failed at {}: {}", record.sourceIdentity(), stage.value(), cause.getMessage());
            log.debug("Failure detail for {}", record.sourceIdentity(), cause);
        }
    }
}
