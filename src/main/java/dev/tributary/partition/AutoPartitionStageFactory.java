package dev.tributary.partition;

import dev.tributary.document.ElementArtifacts;
import dev.tributary.document.StageName;
import dev.tributary.pipeline.StageFactory;
import dev.tributary.pipeline.StageSettings;
import java.util.List;
import org.springframework.stereotype.Component;

/** Partitioner variant {@code auto}: picks the partitioner from the record's file type. */
@Component
public class AutoPartitionStageFactory implements StageFactory<PartitionStage> {

  static final String VARIANT = "auto";

  private final List<DocumentPartitioner> partitioners;
  private final ElementArtifacts artifacts;

  public AutoPartitionStageFactory(List<DocumentPartitioner> partitioners, ElementArtifacts artifacts) {
    this.partitioners = partitioners;
    this.artifacts = artifacts;
  }

  @Override
  public StageName stage() {
    return StageName.PARTITION;
  }

  @Override
  public String variant() {
    return VARIANT;
  }

  @Override
  public PartitionStage create(StageSettings settings) {
    return new PartitionStage(partitioners, artifacts);
  }
}
