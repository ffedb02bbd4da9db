package dev.tributary.partition;

import dev.tributary.document.ElementType;
import dev.tributary.document.FileType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.Heading;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.ListBlock;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.Paragraph;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.text.TextContentRenderer;
import org.springframework.stereotype.Component;

/**
 * AST-based Markdown partitioner. Walks the top-level blocks of the commonmark document:
 *
 * <ul>
 *   <li>headings become Title elements carrying {@code heading_level}
 *   <li>paragraphs and block quotes become NarrativeText
 *   <li>every item of a bullet or ordered list becomes a ListItem
 *   <li>fenced and indented code become CodeSnippet, with {@code language} when declared
 *   <li>GFM tables become Table
 * </ul>
 */
@Component
public class MarkdownPartitioner implements DocumentPartitioner {

  private final Parser parser;
  private final TextContentRenderer textRenderer;

  public MarkdownPartitioner() {
    var extensions = List.of(TablesExtension.create());
    this.parser = Parser.builder().extensions(extensions).build();
    this.textRenderer = TextContentRenderer.builder().extensions(extensions).build();
  }

  @Override
  public FileType fileType() {
    return FileType.MARKDOWN;
  }

  @Override
  public List<PartitionedBlock> partition(Path file) throws IOException {
    return partition(Files.readString(file, StandardCharsets.UTF_8));
  }

  List<PartitionedBlock> partition(String markdown) {
    List<PartitionedBlock> blocks = new ArrayList<>();
    Node child = parser.parse(markdown).getFirstChild();
    while (child != null) {
      visit(child, blocks);
      child = child.getNext();
    }
    return blocks;
  }

  private void visit(Node node, List<PartitionedBlock> blocks) {
    if (node instanceof Heading heading) {
      add(blocks, ElementType.TITLE, render(heading), Map.of("heading_level", heading.getLevel()));
    } else if (node instanceof Paragraph || node instanceof BlockQuote) {
      add(blocks, ElementType.NARRATIVE_TEXT, render(node), Map.of());
    } else if (node instanceof ListBlock list) {
      Node item = list.getFirstChild();
      while (item != null) {
        if (item instanceof ListItem) {
          add(blocks, ElementType.LIST_ITEM, renderChildren(item), Map.of());
        }
        item = item.getNext();
      }
    } else if (node instanceof FencedCodeBlock code) {
      String info = code.getInfo() == null ? "" : code.getInfo().strip();
      Map<String, Object> metadata =
          info.isEmpty() ? Map.of() : Map.of("language", info.split("\\s+")[0]);
      add(blocks, ElementType.CODE_SNIPPET, code.getLiteral(), metadata);
    } else if (node instanceof IndentedCodeBlock code) {
      add(blocks, ElementType.CODE_SNIPPET, code.getLiteral(), Map.of());
    } else if (node instanceof TableBlock) {
      add(blocks, ElementType.TABLE, render(node), Map.of());
    }
  }

  private String render(Node node) {
    return textRenderer.render(node);
  }

  // list item markers come from the enclosing list, so only the item's content is rendered
  private String renderChildren(Node node) {
    StringBuilder text = new StringBuilder();
    Node child = node.getFirstChild();
    while (child != null) {
      text.append(render(child).strip()).append('\n');
      child = child.getNext();
    }
    return text.toString();
  }

  private static void add(
      List<PartitionedBlock> blocks, ElementType type, String text, Map<String, Object> metadata) {
    String stripped = text.strip();
    if (!stripped.isEmpty()) {
      blocks.add(new PartitionedBlock(type, stripped, metadata));
    }
  }
}
