package dev.tributary.partition;

import dev.tributary.document.DocumentRecord;
import dev.tributary.document.Element;
import dev.tributary.document.ElementArtifacts;
import dev.tributary.document.FileType;
import dev.tributary.document.StageName;
import dev.tributary.pipeline.ProcessingException;
import dev.tributary.pipeline.RecordStage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partitioner stage: dispatches on the record's file type to a {@link DocumentPartitioner} and
 * writes the resulting elements as a JSON array.
 *
 * <p>Every element carries {@code source_identity}, {@code relative_path}, {@code filename} and
 * {@code filetype} metadata in addition to what its partitioner adds.
 */
public class PartitionStage implements RecordStage {

  private static final Logger log = LoggerFactory.getLogger(PartitionStage.class);

  private final Map<FileType, DocumentPartitioner> partitioners = new EnumMap<>(FileType.class);
  private final ElementArtifacts artifacts;

  public PartitionStage(List<DocumentPartitioner> partitioners, ElementArtifacts artifacts) {
    for (DocumentPartitioner partitioner : partitioners) {
      this.partitioners.put(partitioner.fileType(), partitioner);
    }
    this.artifacts = artifacts;
  }

  @Override
  public StageName name() {
    return StageName.PARTITION;
  }

  @Override
  public void process(DocumentRecord record, Path input, Path output) throws ProcessingException {
    FileType fileType = record.fileType();
    DocumentPartitioner partitioner = fileType == null ? null : partitioners.get(fileType);
    if (partitioner == null) {
      throw new ProcessingException(name(), "No partitioner for file type " + fileType
          + " of " + record.sourceIdentity());
    }
    List<PartitionedBlock> blocks;
    try {
      blocks = partitioner.partition(input);
    } catch (IOException | RuntimeException e) {
      throw new ProcessingException(name(),
          "Failed to partition " + record.sourceIdentity() + ": " + e.getMessage(), e);
    }
    if (blocks.isEmpty()) {
      log.warn("No text extracted from {}", record.sourceIdentity());
    }

    List<Element> elements = new ArrayList<>(blocks.size());
    for (int i = 0; i < blocks.size(); i++) {
      PartitionedBlock block = blocks.get(i);
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("source_identity", record.sourceIdentity());
      metadata.put("relative_path", record.relativePath());
      metadata.put("filename", fileName(record.relativePath()));
      metadata.put("filetype", fileType.mimeTypes().get(0));
      metadata.putAll(block.metadata());
      elements.add(new Element(
          Element.idFor(record.sourceIdentity(), i, block.text()), block.type(), block.text(), metadata));
    }
    try {
      artifacts.write(output, elements);
    } catch (IOException e) {
      throw new ProcessingException(name(), "Failed to write elements of " + record.sourceIdentity(), e);
    }
    log.debug("Partitioned {} into {} elements", record.sourceIdentity(), elements.size());
  }

  private static String fileName(String relativePath) {
    int slash = relativePath.lastIndexOf('/');
    return slash < 0 ? relativePath : relativePath.substring(slash + 1);
  }
}
