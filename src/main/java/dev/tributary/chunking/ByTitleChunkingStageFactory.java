package dev.tributary.chunking;

import dev.tributary.document.ElementArtifacts;
import org.springframework.stereotype.Component;

@Component
public class ByTitleChunkingStageFactory extends ChunkingStageFactory {

  public ByTitleChunkingStageFactory(ElementArtifacts artifacts) {
    super(ChunkingStrategy.BY_TITLE, artifacts);
  }
}
