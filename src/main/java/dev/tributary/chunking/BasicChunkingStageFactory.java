package dev.tributary.chunking;

import dev.tributary.document.ElementArtifacts;
import org.springframework.stereotype.Component;

@Component
public class BasicChunkingStageFactory extends ChunkingStageFactory {

  public BasicChunkingStageFactory(ElementArtifacts artifacts) {
    super(ChunkingStrategy.BASIC, artifacts);
  }
}
