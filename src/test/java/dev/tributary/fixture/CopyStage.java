package dev.tributary.fixture;

import dev.tributary.document.DocumentRecord;
import dev.tributary.document.StageName;
import dev.tributary.pipeline.ProcessingException;
import dev.tributary.pipeline.RecordStage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Record stage that copies its input, optionally failing for chosen identities. */
public final class CopyStage implements RecordStage {

  private final StageName name;
  private final Set<String> failing = ConcurrentHashMap.newKeySet();
  private final AtomicInteger invocations = new AtomicInteger();

  public CopyStage(StageName name) {
    this.name = name;
  }

  public CopyStage failingFor(String sourceIdentity) {
    failing.add(sourceIdentity);
    return this;
  }

  public int invocations() {
    return invocations.get();
  }

  @Override
  public StageName name() {
    return name;
  }

  @Override
  public void process(DocumentRecord record, Path input, Path output) throws ProcessingException {
    invocations.incrementAndGet();
    if (failing.contains(record.sourceIdentity())) {
      throw new ProcessingException(name, "simulated failure for " + record.sourceIdentity());
    }
    try {
      Files.copy(input, output, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new ProcessingException(name, "copy failed", e);
    }
  }
}
