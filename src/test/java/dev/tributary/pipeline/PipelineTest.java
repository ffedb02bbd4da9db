package dev.tributary.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.tributary.cleanup.CleanupCoordinator;
import dev.tributary.connector.ConnectionException;
import dev.tributary.document.DocumentRecordFactory;
import dev.tributary.document.StageName;
import dev.tributary.fixture.CopyStage;
import dev.tributary.fixture.InMemoryConnector;
import dev.tributary.fixture.PipelinePropertiesBuilder;
import dev.tributary.fixture.RecordingUploader;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PipelineTest {

  @TempDir Path tempDir;

  private final CleanupCoordinator cleanupCoordinator = new CleanupCoordinator();
  private PipelineProperties properties;
  private DocumentRecordFactory recordFactory;

  @BeforeEach
  void setUp() {
    configure(new PipelinePropertiesBuilder(tempDir));
  }

  // --- happy path and isolation ---

  @Test
  void everyRecordIsProcessedAndUploadedInOneBatch() throws Exception {
    var connector = new InMemoryConnector(recordFactory).withFile("a.txt", "alpha").withFile("docs/b.md", "# beta");
    var uploader = new RecordingUploader();

    BatchSummary summary = pipeline(new CopyStage(StageName.PARTITION), uploader).run(connector);

    assertThat(summary.total()).isEqualTo(2);
    assertThat(summary.succeeded()).isEqualTo(2);
    assertThat(summary.failures()).isEmpty();
    assertThat(uploader.batches()).hasSize(1);
    assertThat(uploader.batches().get(0)).extracting(item -> item.record().sourceIdentity())
        .containsExactly("a.txt", "docs/b.md");
    assertThat(tempDir.resolve("output/docs/b.md.json")).hasContent("# beta");
  }

  @Test
  void oneFailingRecordDoesNotAffectItsSiblings() throws Exception {
    var connector = new InMemoryConnector(recordFactory)
        .withFile("a.txt", "a").withFile("b.txt", "b").withFile("c.txt", "c").withFile("d.txt", "d");
    var partition = new CopyStage(StageName.PARTITION).failingFor("c.txt");

    BatchSummary summary = pipeline(partition, new RecordingUploader()).run(connector);

    assertThat(summary.succeeded()).isEqualTo(3);
    assertThat(summary.failed()).isEqualTo(1);
    assertThat(summary.failures()).singleElement()
        .satisfies(failure -> {
          assertThat(failure.sourceIdentity()).isEqualTo("c.txt");
          assertThat(failure.stage()).isEqualTo(StageName.PARTITION);
          assertThat(failure.reason()).contains("simulated failure");
        });
    assertThat(tempDir.resolve("output/c.txt.json")).doesNotExist();
  }

  @Test
  void unsupportedFilesAreSkippedWithoutFetching() throws Exception {
    var connector = new InMemoryConnector(recordFactory).withFile("a.txt", "a").withFile("logo.bmp", "BM");

    BatchSummary summary = pipeline(new CopyStage(StageName.PARTITION), new RecordingUploader()).run(connector);

    assertThat(connector.fetchCount("logo.bmp")).isZero();
    assertThat(summary.skipped()).isEqualTo(1);
    assertThat(summary.succeeded()).isEqualTo(1);
  }

  @Test
  void intermediateArtifactsGoToWorkDirAndLastStageToOutput() throws Exception {
    var connector = new InMemoryConnector(recordFactory).withFile("a.txt", "alpha");
    var stages = new PipelineStages(
        List.of(new CopyStage(StageName.PARTITION), new CopyStage(StageName.CHUNK)),
        new CopyStage(StageName.STAGE),
        new RecordingUploader());
    var uploader = (RecordingUploader) stages.uploader();

    pipeline(stages).run(connector);

    assertThat(tempDir.resolve("work/partitioner/a.txt.json")).hasContent("alpha");
    assertThat(tempDir.resolve("output/a.txt.json")).hasContent("alpha");
    assertThat(uploader.batches().get(0).get(0).artifact())
        .isEqualTo(tempDir.resolve("work/stager/a.txt.json").toAbsolutePath().normalize());
  }

  // --- failures and cleanup ---

  @Test
  void downloadFailureIsRetriedThenRecordedAndResourcesReleased() throws Exception {
    configure(new PipelinePropertiesBuilder(tempDir).retry(2));
    var connector = new InMemoryConnector(recordFactory).withFile("a.txt", "a").withFile("b.txt", "b")
        .failingFetch("b.txt");

    BatchSummary summary = pipeline(new CopyStage(StageName.PARTITION), new RecordingUploader()).run(connector);

    assertThat(connector.fetchCount("b.txt")).isEqualTo(2);
    assertThat(summary.failures()).singleElement()
        .satisfies(failure -> assertThat(failure.stage()).isEqualTo(StageName.DOWNLOAD));
    assertThat(connector.cleanupCount()).isEqualTo(1);
    assertThat(cleanupCoordinator.openScopeCount()).isZero();
  }

  @Test
  void connectionFailurePropagatesAfterCleanup() {
    var connector = new InMemoryConnector(recordFactory).withFile("a.txt", "a")
        .failingInitialize(new ConnectionException("credentials rejected"));

    assertThatThrownBy(() -> pipeline(new CopyStage(StageName.PARTITION), new RecordingUploader())
        .run(connector))
        .isInstanceOf(ConnectionException.class)
        .hasMessage("credentials rejected");
    assertThat(connector.cleanupCount()).isEqualTo(1);
    assertThat(connector.totalFetchCount()).isZero();
    assertThat(cleanupCoordinator.openScopeCount()).isZero();
  }

  @Test
  void uploadFailureFailsEveryStagedRecord() throws Exception {
    var connector = new InMemoryConnector(recordFactory).withFile("a.txt", "a").withFile("b.txt", "b");

    BatchSummary summary = pipeline(new CopyStage(StageName.PARTITION), new RecordingUploader().failing())
        .run(connector);

    assertThat(summary.succeeded()).isZero();
    assertThat(summary.failures()).hasSize(2)
        .allSatisfy(failure -> assertThat(failure.stage()).isEqualTo(StageName.UPLOAD));
  }

  @Test
  void recordsStillRunningAtDeadlineAreTimedOut() throws Exception {
    configure(new PipelinePropertiesBuilder(tempDir).runTimeout(Duration.ofMillis(300)));
    var connector = new InMemoryConnector(recordFactory).withFile("slow.txt", "s").blockingFetch("slow.txt");

    try {
      BatchSummary summary = pipeline(new CopyStage(StageName.PARTITION), new RecordingUploader())
          .run(connector);

      assertThat(summary.failures()).singleElement()
          .satisfies(failure -> {
            assertThat(failure.stage()).isEqualTo(StageName.DOWNLOAD);
            assertThat(failure.reason()).startsWith("StageTimeoutException");
          });
    } finally {
      connector.releaseBlockedFetches();
    }
    assertThat(cleanupCoordinator.openScopeCount()).isZero();
  }

  @Test
  void listingThatOutlivesTheDeadlineFailsTheBatch() {
    configure(new PipelinePropertiesBuilder(tempDir).runTimeout(Duration.ofMillis(300)));
    var connector = new InMemoryConnector(recordFactory).withFile("a.txt", "a").blockingListing();
    long started = System.nanoTime();

    try {
      assertThatThrownBy(() -> pipeline(new CopyStage(StageName.PARTITION), new RecordingUploader())
          .run(connector))
          .isInstanceOf(ConnectionException.class)
          .hasMessageContaining("run timeout");
    } finally {
      connector.releaseBlockedFetches();
    }
    assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(2));
    assertThat(connector.totalFetchCount()).isZero();
    assertThat(connector.cleanupCount()).isEqualTo(1);
    assertThat(cleanupCoordinator.openScopeCount()).isZero();
  }

  @Test
  void cancelledBatchDispatchesNothing() throws Exception {
    var connector = new InMemoryConnector(recordFactory).withFile("a.txt", "a").withFile("b.txt", "b");
    var uploader = new RecordingUploader();
    var cancellation = new BatchCancellation();
    cancellation.cancel();

    BatchSummary summary = pipeline(new CopyStage(StageName.PARTITION), uploader).run(connector, cancellation);

    assertThat(connector.totalFetchCount()).isZero();
    assertThat(summary.skipped()).isEqualTo(2);
    assertThat(summary.failed()).isZero();
    assertThat(uploader.batches()).isEmpty();
  }

  // --- resumability ---

  @Test
  void rerunReusesCachedDownloadsAndArtifacts() throws Exception {
    pipeline(new CopyStage(StageName.PARTITION), new RecordingUploader())
        .run(new InMemoryConnector(recordFactory).withFile("a.txt", "alpha"));

    var connector = new InMemoryConnector(recordFactory).withFile("a.txt", "alpha");
    var partition = new CopyStage(StageName.PARTITION);
    var uploader = new RecordingUploader();
    BatchSummary summary = pipeline(partition, uploader).run(connector);

    assertThat(connector.totalFetchCount()).isZero();
    assertThat(partition.invocations()).isZero();
    assertThat(summary.succeeded()).isEqualTo(1);
    assertThat(uploader.batches()).hasSize(1);
  }

  private void configure(PipelinePropertiesBuilder builder) {
    properties = builder.build();
    recordFactory = new DocumentRecordFactory(properties.documentPaths("memory", "memory://test"));
  }

  private Pipeline pipeline(RecordStage partition, RecordingUploader uploader) {
    return pipeline(new PipelineStages(List.of(partition), null, uploader));
  }

  private Pipeline pipeline(PipelineStages stages) {
    return new Pipeline(properties, stages, new SourceIndexer(properties), new Downloader(properties),
        cleanupCoordinator, Clock.systemUTC());
  }
}
