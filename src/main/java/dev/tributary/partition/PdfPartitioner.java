package dev.tributary.partition;

import dev.tributary.document.FileType;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/**
 * PDF partitioner on Apache PDFBox. Extracts text one page at a time and splits each page into
 * paragraphs, tagging every element with its 1-based {@code page_number}.
 */
@Component
public class PdfPartitioner implements DocumentPartitioner {

  @Override
  public FileType fileType() {
    return FileType.PDF;
  }

  @Override
  public List<PartitionedBlock> partition(Path file) throws IOException {
    List<PartitionedBlock> blocks = new ArrayList<>();
    try (PDDocument document = Loader.loadPDF(file.toFile())) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);
      for (int page = 1; page <= document.getNumberOfPages(); page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        String text = stripper.getText(document);
        for (PartitionedBlock paragraph : TextPartitioner.paragraphs(text)) {
          blocks.add(new PartitionedBlock(
              paragraph.type(), paragraph.text(), Map.of("page_number", page)));
        }
      }
    }
    return blocks;
  }
}
