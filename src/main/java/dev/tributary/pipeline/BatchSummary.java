package dev.tributary.pipeline;

import dev.tributary.document.DocumentRecord;
import dev.tributary.document.StageFailure;
import dev.tributary.document.StageName;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * End-of-run report.
 *
 * <p>A record counts as succeeded once uploaded, as skipped when it was rejected at indexing or
 * never dispatched (cancellation), and as failed otherwise.
 */
public record BatchSummary(
        int total,
        int succeeded,
        int skipped,
        int failed,
        List<Failure> failures,
        Duration elapsed
) {

    public BatchSummary {
        failures = List.copyOf(failures);
    }

    public record Failure(String sourceIdentity, StageName stage, String reason) {
    }

    public static BatchSummary of(List<DocumentRecord> records, Duration elapsed) {
        int succeeded = 0;
        int skipped = 0;
        List<Failure> failures = new ArrayList<>();
        for (DocumentRecord record : records) {
            Optional<StageFailure> failure = record.failure();
            if (record.status() == DocumentRecord.Status.UPLOADED) {
                succeeded++;
            } else if (failure.isEmpty() || failure.get().stage() == StageName.INDEX) {
                skipped++;
            } else {
                StageFailure f = failure.get();
                failures.add(new Failure(record.sourceIdentity(), f.stage(), f.reason()));
            }
        }
        return new BatchSummary(records.size(), succeeded, skipped, failures.size(), failures, elapsed);
    }

    @Override
    public String toString() {
        return "total=" + total + ", succeeded=" + succeeded + ", skipped=" + skipped
                + ", failed=" + failed + ", elapsed=" + elapsed.toMillis() + "ms";
    }
}
