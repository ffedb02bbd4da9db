package dev.tributary.fixture;

import dev.tributary.pipeline.UploadItem;
import dev.tributary.pipeline.Uploader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** Uploader that remembers every batch it receives and can be told to fail. */
public final class RecordingUploader implements Uploader {

  private final List<List<UploadItem>> batches = new ArrayList<>();
  private boolean failing;

  public RecordingUploader failing() {
    this.failing = true;
    return this;
  }

  public synchronized List<List<UploadItem>> batches() {
    return List.copyOf(batches);
  }

  @Override
  public synchronized void upload(List<UploadItem> items) throws IOException {
    batches.add(List.copyOf(items));
    if (failing) {
      throw new IOException("destination unavailable");
    }
  }
}
