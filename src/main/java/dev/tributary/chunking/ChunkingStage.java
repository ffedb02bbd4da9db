package dev.tributary.chunking;

import dev.tributary.document.DocumentRecord;
import dev.tributary.document.Element;
import dev.tributary.document.ElementArtifacts;
import dev.tributary.document.StageName;
import dev.tributary.pipeline.ProcessingException;
import dev.tributary.pipeline.RecordStage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Chunker stage: reads partitioned elements, writes composite chunks. */
public class ChunkingStage implements RecordStage {

  private static final Logger log = LoggerFactory.getLogger(ChunkingStage.class);

  private final ElementChunker chunker;
  private final ElementArtifacts artifacts;

  public ChunkingStage(ElementChunker chunker, ElementArtifacts artifacts) {
    this.chunker = chunker;
    this.artifacts = artifacts;
  }

  @Override
  public StageName name() {
    return StageName.CHUNK;
  }

  @Override
  public void process(DocumentRecord record, Path input, Path output) throws ProcessingException {
    try {
      List<Element> elements = artifacts.read(input);
      List<Element> chunks = chunker.chunk(elements, record.sourceIdentity());
      artifacts.write(output, chunks);
      log.debug("Chunked {}: {} elements -> {} {} chunks",
          record.sourceIdentity(), elements.size(), chunks.size(), chunker.strategy().value());
    } catch (IOException e) {
      throw new ProcessingException(name(), "Failed to chunk " + record.sourceIdentity(), e);
    }
  }
}
