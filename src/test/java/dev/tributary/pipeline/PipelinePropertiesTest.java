package dev.tributary.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.tributary.config.ConfigurationException;
import dev.tributary.document.DocumentPaths;
import dev.tributary.fixture.PipelinePropertiesBuilder;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PipelinePropertiesTest {

  @TempDir Path tempDir;

  @Test
  void concurrencyMustBePositive() {
    assertThatThrownBy(() -> new PipelinePropertiesBuilder(tempDir).concurrency(0).build())
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("concurrency");
  }

  @Test
  void runTimeoutMustBePositive() {
    assertThatThrownBy(() -> new PipelinePropertiesBuilder(tempDir).runTimeout(Duration.ZERO).build())
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("run-timeout");
  }

  @Test
  void retryRejectsZeroAttempts() {
    assertThatThrownBy(() -> new PipelineProperties.Retry(0, 10, 2.0))
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void defaultDownloadDirIsScopedBySourceRoot() {
    PipelineProperties properties = new PipelinePropertiesBuilder(tempDir).build();

    DocumentPaths first = properties.documentPaths("local", "/data/a");
    DocumentPaths second = properties.documentPaths("local", "/data/b");

    Path base = tempDir.resolve("work/download/local").toAbsolutePath().normalize();
    assertThat(first.downloadDir().getParent()).isEqualTo(base);
    assertThat(first.downloadDir().getFileName().toString()).hasSize(10);
    assertThat(first.downloadDir()).isNotEqualTo(second.downloadDir());
    assertThat(properties.documentPaths("local", "/data/a")).isEqualTo(first);
  }

  @Test
  void explicitDownloadDirWins() {
    Path downloads = tempDir.resolve("downloads");

    DocumentPaths paths = new PipelinePropertiesBuilder(tempDir).downloadDir(downloads).build()
        .documentPaths("dropbox", "dropbox://x");

    assertThat(paths.downloadDir()).isEqualTo(downloads.toAbsolutePath().normalize());
  }
}
