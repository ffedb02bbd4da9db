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
import java.util.stream.Collectors;
import org.jsoup.nodes.Entities;
import org.springframework.stereotype.Component;

/**
 * CSV partitioner: the whole file becomes one Table element. The text joins cells with spaces
 * and rows with newlines; {@code text_as_html} keeps the tabular structure.
 */
@Component
public class CsvPartitioner implements DocumentPartitioner {

  @Override
  public FileType fileType() {
    return FileType.CSV;
  }

  @Override
  public List<PartitionedBlock> partition(Path file) throws IOException {
    return partition(Files.readString(file, StandardCharsets.UTF_8));
  }

  List<PartitionedBlock> partition(String csv) {
    List<List<String>> rows = parse(csv);
    if (rows.isEmpty()) {
      return List.of();
    }
    String text = rows.stream()
        .map(row -> String.join(" ", row).strip())
        .filter(line -> !line.isEmpty())
        .collect(Collectors.joining("\n"));
    if (text.isEmpty()) {
      return List.of();
    }
    return List.of(new PartitionedBlock(
        ElementType.TABLE, text, Map.of("text_as_html", toHtml(rows), "row_count", rows.size())));
  }

  /** RFC 4180 reader: quoted cells may contain commas, doubled quotes and line breaks. */
  static List<List<String>> parse(String csv) {
    List<List<String>> rows = new ArrayList<>();
    List<String> row = new ArrayList<>();
    StringBuilder cell = new StringBuilder();
    boolean quoted = false;
    for (int i = 0; i < csv.length(); i++) {
      char c = csv.charAt(i);
      if (quoted) {
        if (c == '"' && i + 1 < csv.length() && csv.charAt(i + 1) == '"') {
          cell.append('"');
          i++;
        } else if (c == '"') {
          quoted = false;
        } else {
          cell.append(c);
        }
      } else if (c == '"') {
        quoted = true;
      } else if (c == ',') {
        row.add(cell.toString());
        cell.setLength(0);
      } else if (c == '\n' || c == '\r') {
        if (c == '\r' && i + 1 < csv.length() && csv.charAt(i + 1) == '\n') {
          i++;
        }
        row.add(cell.toString());
        cell.setLength(0);
        rows.add(row);
        row = new ArrayList<>();
      } else {
        cell.append(c);
      }
    }
    if (cell.length() > 0 || !row.isEmpty()) {
      row.add(cell.toString());
      rows.add(row);
    }
    return rows;
  }

  private static String toHtml(List<List<String>> rows) {
    StringBuilder html = new StringBuilder("<table>");
    for (List<String> row : rows) {
      html.append("<tr>");
      for (String cell : row) {
        html.append("<td>").append(Entities.escape(cell)).append("</td>");
      }
      html.append("</tr>");
    }
    return html.append("</table>").toString();
  }
}
