package dev.tributary.chunking;

import dev.tributary.config.ConfigurationException;
import dev.tributary.document.ElementArtifacts;
import dev.tributary.document.StageName;
import dev.tributary.pipeline.StageFactory;
import dev.tributary.pipeline.StageSettings;

/**
 * Shared construction of the chunker variants. Options: {@code max-characters} (default 500) and
 * {@code overlap} (default 0, only used when an oversized element is split).
 */
abstract class ChunkingStageFactory implements StageFactory<ChunkingStage> {

  static final int DEFAULT_MAX_CHARACTERS = 500;

  private final ChunkingStrategy strategy;
  private final ElementArtifacts artifacts;

  ChunkingStageFactory(ChunkingStrategy strategy, ElementArtifacts artifacts) {
    this.strategy = strategy;
    this.artifacts = artifacts;
  }

  @Override
  public StageName stage() {
    return StageName.CHUNK;
  }

  @Override
  public String variant() {
    return strategy.value();
  }

  @Override
  public ChunkingStage create(StageSettings settings) {
    int maxCharacters = settings.positiveIntOption("max-characters", DEFAULT_MAX_CHARACTERS);
    int overlap = settings.intOption("overlap", 0, 0);
    if (overlap >= maxCharacters) {
      throw new ConfigurationException(
          "Chunker option overlap (" + overlap + ") must be smaller than max-characters (" + maxCharacters + ")");
    }
    return new ChunkingStage(new ElementChunker(strategy, maxCharacters, overlap), artifacts);
  }
}
