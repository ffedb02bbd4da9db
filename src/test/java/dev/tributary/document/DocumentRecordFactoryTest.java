package dev.tributary.document;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DocumentRecordFactoryTest {

  private final DocumentRecordFactory factory = new DocumentRecordFactory(
      new DocumentPaths(Path.of("/d/download"), Path.of("/d/output"), Path.of("/d/work")));

  @Test
  void supportedItemIsDiscoveredWithResolvedType() {
    DocumentRecord record = factory.create("id", "docs/a.pdf", 42L, Map.of());

    assertThat(record.status()).isEqualTo(DocumentRecord.Status.DISCOVERED);
    assertThat(record.fileType()).isEqualTo(FileType.PDF);
    assertThat(record.sizeBytes()).isEqualTo(42L);
  }

  @Test
  void unsupportedItemIsRejectedAtIndex() {
    DocumentRecord record = factory.create("id", "images/cat.png", 42L, Map.of());

    assertThat(record.isFailed()).isTrue();
    assertThat(record.fileType()).isNull();
    assertThat(record.failure()).hasValueSatisfying(failure ->
        assertThat(failure.stage()).isEqualTo(StageName.INDEX));
  }

  @Test
  void declaredContentTypeRescuesExtensionlessItem() {
    DocumentRecord record = factory.create("id", "export", null, Map.of(), "text/csv");

    assertThat(record.fileType()).isEqualTo(FileType.CSV);
  }
}
