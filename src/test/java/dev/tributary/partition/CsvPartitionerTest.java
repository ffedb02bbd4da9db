package dev.tributary.partition;

import static org.assertj.core.api.Assertions.assertThat;

import dev.tributary.document.ElementType;
import java.util.List;
import org.junit.jupiter.api.Test;

class CsvPartitionerTest {

  private final CsvPartitioner partitioner = new CsvPartitioner();

  @Test
  void wholeFileBecomesOneTable() {
    List<PartitionedBlock> blocks = partitioner.partition("name,age\nAnn,30\nBob,41\n");

    assertThat(blocks).singleElement().satisfies(block -> {
      assertThat(block.type()).isEqualTo(ElementType.TABLE);
      assertThat(block.text()).isEqualTo("name age\nAnn 30\nBob 41");
      assertThat(block.metadata()).containsEntry("row_count", 3);
      assertThat((String) block.metadata().get("text_as_html"))
          .startsWith("<table><tr><td>name</td>")
          .endsWith("</tr></table>");
    });
  }

  @Test
  void quotedCellsMayContainSeparatorsQuotesAndNewlines() {
    List<List<String>> rows = CsvPartitioner.parse("a,\"b, c\",\"say \"\"hi\"\"\"\r\n\"multi\nline\",x\n");

    assertThat(rows).containsExactly(
        List.of("a", "b, c", "say \"hi\""),
        List.of("multi\nline", "x"));
  }

  @Test
  void cellsAreEscapedInHtml() {
    List<PartitionedBlock> blocks = partitioner.partition("<script>,&\n");

    assertThat((String) blocks.get(0).metadata().get("text_as_html"))
        .contains("&lt;script&gt;")
        .contains("&amp;");
  }

  @Test
  void emptyFileYieldsNothing() {
    assertThat(partitioner.partition("")).isEmpty();
  }
}
