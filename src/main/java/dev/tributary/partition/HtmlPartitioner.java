package dev.tributary.partition;

import dev.tributary.document.ElementType;
import dev.tributary.document.FileType;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * HTML partitioner on jsoup. Traverses the body depth-first in document order; once an element is
 * captured its children are not visited, so nested content is never emitted twice.
 */
@Component
public class HtmlPartitioner implements DocumentPartitioner {

  @Override
  public FileType fileType() {
    return FileType.HTML;
  }

  @Override
  public List<PartitionedBlock> partition(Path file) throws IOException {
    return partition(Jsoup.parse(file.toFile(), null));
  }

  List<PartitionedBlock> partition(String html) {
    return partition(Jsoup.parse(html));
  }

  private List<PartitionedBlock> partition(Document document) {
    List<PartitionedBlock> blocks = new ArrayList<>();
    Element root = document.body() != null ? document.body() : document;
    traverse(root, blocks);
    return blocks;
  }

  private void traverse(Element element, List<PartitionedBlock> blocks) {
    String tag = element.normalName();
    switch (tag) {
      case "h1", "h2", "h3", "h4", "h5", "h6" -> {
        add(blocks, ElementType.TITLE, element.text(),
            Map.of("heading_level", Integer.parseInt(tag.substring(1))));
        return;
      }
      case "p", "blockquote" -> {
        add(blocks, ElementType.NARRATIVE_TEXT, element.text(), Map.of());
        return;
      }
      case "li" -> {
        add(blocks, ElementType.LIST_ITEM, element.text(), Map.of());
        return;
      }
      case "pre" -> {
        add(blocks, ElementType.CODE_SNIPPET, element.wholeText(), Map.of());
        return;
      }
      case "table" -> {
        add(blocks, ElementType.TABLE, element.text(), Map.of("text_as_html", element.outerHtml()));
        return;
      }
      case "script", "style", "nav", "noscript" -> {
        return;
      }
      default -> {
        // container: descend
      }
    }
    for (Element child : element.children()) {
      traverse(child, blocks);
    }
  }

  private static void add(
      List<PartitionedBlock> blocks, ElementType type, String text, Map<String, Object> metadata) {
    String stripped = text == null ? "" : text.strip();
    if (!stripped.isEmpty()) {
      blocks.add(new PartitionedBlock(type, stripped, metadata));
    }
  }
}
