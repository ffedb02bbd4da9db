package dev.tributary.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import dev.tributary.connector.Connector;
import dev.tributary.document.DocumentPaths;
import dev.tributary.document.DocumentRecord;
import dev.tributary.document.DocumentRecordFactory;
import dev.tributary.document.StageFailure;
import dev.tributary.document.StageName;
import dev.tributary.fixture.InMemoryConnector;
import dev.tributary.fixture.PipelinePropertiesBuilder;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SourceIndexerTest {

  @TempDir Path tempDir;

  @Mock Connector connector;

  private DocumentRecordFactory recordFactory;

  @BeforeEach
  void setUp() {
    recordFactory = new DocumentRecordFactory(
        new DocumentPaths(tempDir.resolve("d"), tempDir.resolve("o"), tempDir.resolve("w")));
  }

  @Test
  void allRecordsPassWithoutFilters() throws Exception {
    var memory = new InMemoryConnector(recordFactory).withFile("a.txt", "a").withFile("b.md", "b");

    List<DocumentRecord> records = new SourceIndexer(new PipelinePropertiesBuilder(tempDir).build()).index(memory);

    assertThat(records).hasSize(2).noneMatch(DocumentRecord::isFailed);
  }

  @Test
  void oversizedRecordsAreRejectedAtIndex() throws Exception {
    var memory = new InMemoryConnector(recordFactory).withFile("small.txt", "ok").withFile("big.txt", "0123456789");
    var indexer = new SourceIndexer(new PipelinePropertiesBuilder(tempDir).maxFileSizeBytes(5).build());

    List<DocumentRecord> records = indexer.index(memory);

    assertThat(records.get(0).isFailed()).isFalse();
    assertThat(records.get(1).failure()).get()
        .extracting(StageFailure::stage)
        .isEqualTo(StageName.INDEX);
  }

  @Test
  void recordsOutsideScopeAreRejected() throws Exception {
    var memory = new InMemoryConnector(recordFactory).withFile("keep/a.txt", "a").withFile("skip/b.txt", "b");
    var indexer = new SourceIndexer(new PipelinePropertiesBuilder(tempDir).excludePatterns("skip/**").build());

    List<DocumentRecord> records = indexer.index(memory);

    assertThat(records).filteredOn(DocumentRecord::isFailed)
        .extracting(DocumentRecord::relativePath)
        .containsExactly("skip/b.txt");
  }

  @Test
  void duplicateIdentitiesKeepOnlyTheFirst() throws Exception {
    when(connector.id()).thenReturn("mock");
    when(connector.listDocuments()).thenReturn(List.of(
        recordFactory.create("same", "one.txt", 1L, Map.of()),
        recordFactory.create("same", "two.txt", 1L, Map.of())));

    List<DocumentRecord> records = new SourceIndexer(new PipelinePropertiesBuilder(tempDir).build()).index(connector);

    assertThat(records.get(0).isFailed()).isFalse();
    assertThat(records.get(1).failure()).get()
        .extracting(StageFailure::reason)
        .isEqualTo("duplicate source identity");
  }
}
