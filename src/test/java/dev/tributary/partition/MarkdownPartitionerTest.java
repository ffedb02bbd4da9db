package dev.tributary.partition;

import static org.assertj.core.api.Assertions.assertThat;

import dev.tributary.document.ElementType;
import java.util.List;
import org.junit.jupiter.api.Test;

class MarkdownPartitionerTest {

  private final MarkdownPartitioner partitioner = new MarkdownPartitioner();

  @Test
  void headingsBecomeTitlesWithLevel() {
    List<PartitionedBlock> blocks = partitioner.partition("# Guide\n\nIntro text.\n\n## Setup\n\nRun it.");

    assertThat(blocks).extracting(PartitionedBlock::type).containsExactly(
        ElementType.TITLE, ElementType.NARRATIVE_TEXT, ElementType.TITLE, ElementType.NARRATIVE_TEXT);
    assertThat(blocks.get(0).text()).isEqualTo("Guide");
    assertThat(blocks.get(0).metadata()).containsEntry("heading_level", 1);
    assertThat(blocks.get(2).metadata()).containsEntry("heading_level", 2);
  }

  @Test
  void eachListItemIsItsOwnElement() {
    List<PartitionedBlock> blocks = partitioner.partition("- first\n- second\n\n1. one\n2. two\n");

    assertThat(blocks).extracting(PartitionedBlock::type).containsOnly(ElementType.LIST_ITEM);
    assertThat(blocks).extracting(PartitionedBlock::text).containsExactly("first", "second", "one", "two");
  }

  @Test
  void fencedCodeKeepsLanguageAndLiteral() {
    List<PartitionedBlock> blocks = partitioner.partition("```java\nint x = 1;\n```\n");

    assertThat(blocks).singleElement().satisfies(block -> {
      assertThat(block.type()).isEqualTo(ElementType.CODE_SNIPPET);
      assertThat(block.text()).isEqualTo("int x = 1;");
      assertThat(block.metadata()).containsEntry("language", "java");
    });
  }

  @Test
  void gfmTablesBecomeTableElements() {
    List<PartitionedBlock> blocks = partitioner.partition("| Name | Age |\n|------|-----|\n| Ann | 30 |\n");

    assertThat(blocks).singleElement().satisfies(block -> {
      assertThat(block.type()).isEqualTo(ElementType.TABLE);
      assertThat(block.text()).contains("Name", "Ann", "30");
    });
  }

  @Test
  void blankDocumentYieldsNothing() {
    assertThat(partitioner.partition("\n\n   \n")).isEmpty();
  }
}
