package dev.tributary.partition;

import dev.tributary.document.ElementType;
import dev.tributary.document.FileType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Plain text: every blank-line separated paragraph becomes a NarrativeText element. */
@Component
public class TextPartitioner implements DocumentPartitioner {

  static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\R\\s*\\R");

  @Override
  public FileType fileType() {
    return FileType.TEXT;
  }

  @Override
  public List<PartitionedBlock> partition(Path file) throws IOException {
    return paragraphs(Files.readString(file, StandardCharsets.UTF_8));
  }

  static List<PartitionedBlock> paragraphs(String text) {
    return Arrays.stream(PARAGRAPH_BREAK.split(text))
        .map(String::strip)
        .filter(paragraph -> !paragraph.isEmpty())
        .map(paragraph -> new PartitionedBlock(ElementType.NARRATIVE_TEXT, paragraph))
        .toList();
  }
}
