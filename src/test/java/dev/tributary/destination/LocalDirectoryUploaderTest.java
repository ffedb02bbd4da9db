package dev.tributary.destination;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.tributary.config.ConfigurationException;
import dev.tributary.document.DocumentPaths;
import dev.tributary.document.DocumentRecordFactory;
import dev.tributary.pipeline.StageSettings;
import dev.tributary.pipeline.UploadItem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalDirectoryUploaderTest {

  @TempDir Path tempDir;

  @Test
  void artifactsMirrorTheSourceHierarchy() throws Exception {
    var recordFactory = new DocumentRecordFactory(new DocumentPaths(tempDir, tempDir, tempDir));
    Path artifact = Files.writeString(tempDir.resolve("artifact.json"), "[]");
    Path uploadDir = tempDir.resolve("upload");

    new LocalUploaderFactory()
        .create(new StageSettings("local", Map.of("upload-dir", uploadDir.toString())))
        .upload(List.of(new UploadItem(recordFactory.create("x", "docs/guide.md", 2L, Map.of()), artifact)));

    assertThat(uploadDir.resolve("docs/guide.md.json")).hasContent("[]");
  }

  @Test
  void uploadDirIsRequired() {
    assertThatThrownBy(() -> new LocalUploaderFactory().create(StageSettings.of("local")))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("upload-dir");
  }
}
