package dev.tributary.destination;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.tributary.document.DocumentPaths;
import dev.tributary.document.DocumentRecord;
import dev.tributary.document.DocumentRecordFactory;
import dev.tributary.document.Element;
import dev.tributary.document.ElementArtifacts;
import dev.tributary.document.ElementType;
import dev.tributary.pipeline.ProcessingException;
import dev.tributary.pipeline.StageSettings;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EmbeddingStoreUploadStagerTest {

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final ElementArtifacts artifacts = new ElementArtifacts(objectMapper);
  private DocumentRecord record;

  @BeforeEach
  void setUp() {
    record = new DocumentRecordFactory(new DocumentPaths(tempDir, tempDir, tempDir))
        .create("docs/a.md", "docs/a.md", 10L, Map.of());
  }

  @Test
  void embeddedElementsBecomeRows() throws Exception {
    Path input = tempDir.resolve("embedded.json");
    artifacts.write(input, List.of(new Element("e1", ElementType.COMPOSITE_ELEMENT, "hello",
        Map.of("page_number", 2, "flag", true)).withEmbeddings(new float[] {0.5f, 0.25f})));
    Path output = tempDir.resolve("staged.json");

    new EmbeddingStoreStagerFactory(artifacts).create(StageSettings.of("embedding-store")).process(record, input, output);

    List<StagedRow> rows = StagedRows.read(objectMapper, output);
    assertThat(rows).singleElement().satisfies(row -> {
      assertThat(row.id()).isEqualTo("e1");
      assertThat(row.embedding()).containsExactly(0.5f, 0.25f);
      assertThat(row.metadata())
          .containsEntry("record_id", "docs/a.md")
          .containsEntry("element_type", "CompositeElement")
          .containsEntry("page_number", 2)
          .containsEntry("flag", "true");
    });
    assertThat(rows.get(0).toTextSegment().metadata().getString("element_id")).isEqualTo("e1");
  }

  @Test
  void elementWithoutEmbeddingIsRejected() throws Exception {
    Path input = tempDir.resolve("chunks.json");
    artifacts.write(input, List.of(new Element("e1", ElementType.NARRATIVE_TEXT, "hello", Map.of())));

    assertThatThrownBy(() -> new EmbeddingStoreUploadStager(artifacts)
        .process(record, input, tempDir.resolve("staged.json")))
        .isInstanceOf(ProcessingException.class)
        .hasMessageContaining("no embedding");
  }
}
