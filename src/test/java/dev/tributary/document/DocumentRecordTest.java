package dev.tributary.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DocumentRecordTest {

  private final DocumentPaths paths =
      new DocumentPaths(Path.of("/d/download"), Path.of("/d/output"), Path.of("/d/work"));

  private DocumentRecord record() {
    return new DocumentRecord("id-1", "docs/a.md", FileType.MARKDOWN, 10L, Map.of("k", "v"), paths);
  }

  @Test
  void newRecordIsDiscoveredAtIndexStage() {
    DocumentRecord record = record();

    assertThat(record.status()).isEqualTo(DocumentRecord.Status.DISCOVERED);
    assertThat(record.currentStage()).isEqualTo(StageName.INDEX);
    assertThat(record.failure()).isEmpty();
    assertThat(record.downloadPath()).isEqualTo(Path.of("/d/download/docs/a.md"));
    assertThat(record.outputPath()).isEqualTo(Path.of("/d/output/docs/a.md.json"));
  }

  @Test
  void forwardTransitionsAreAccepted() {
    DocumentRecord record = record();

    assertThat(record.advanceTo(DocumentRecord.Status.DOWNLOADED)).isTrue();
    assertThat(record.advanceTo(DocumentRecord.Status.PROCESSED)).isTrue();
    assertThat(record.advanceTo(DocumentRecord.Status.UPLOADED)).isTrue();
    assertThat(record.status()).isEqualTo(DocumentRecord.Status.UPLOADED);
  }

  @Test
  void backwardTransitionIsRejected() {
    DocumentRecord record = record();
    record.advanceTo(DocumentRecord.Status.PROCESSED);

    assertThatThrownBy(() -> record.advanceTo(DocumentRecord.Status.DOWNLOADED))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void failIsTerminalAndFirstFailureWins() {
    DocumentRecord record = record();

    assertThat(record.fail(StageName.PARTITION, new IOException("broken"))).isTrue();
    assertThat(record.fail(StageName.CHUNK, new IOException("later"))).isFalse();
    assertThat(record.advanceTo(DocumentRecord.Status.PROCESSED)).isFalse();

    assertThat(record.status()).isEqualTo(DocumentRecord.Status.FAILED);
    assertThat(record.failure()).hasValueSatisfying(failure -> {
      assertThat(failure.stage()).isEqualTo(StageName.PARTITION);
      assertThat(failure.reason()).isEqualTo("IOException: broken");
    });
  }

  @Test
  void uploadedRecordCannotFail() {
    DocumentRecord record = record();
    record.advanceTo(DocumentRecord.Status.UPLOADED);

    assertThat(record.reject(StageName.UPLOAD, "late")).isFalse();
    assertThat(record.status()).isEqualTo(DocumentRecord.Status.UPLOADED);
  }

  @Test
  void advancingToFailedDirectlyIsRejected() {
    assertThatThrownBy(() -> record().advanceTo(DocumentRecord.Status.FAILED))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void metadataIsUnmodifiable() {
    assertThatThrownBy(() -> record().metadata().put("x", "y"))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
