package dev.tributary.document;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based tests for deterministic record paths: the same relative path always maps to the
 * same files, and those files never leave their configured roots.
 */
class DocumentPathsPropertyTest {

  private static final Path DOWNLOAD = Path.of("/tributary/download").toAbsolutePath();
  private static final Path OUTPUT = Path.of("/tributary/output").toAbsolutePath();
  private static final Path WORK = Path.of("/tributary/work").toAbsolutePath();

  @Provide
  Arbitrary<String> relativePaths() {
    Arbitrary<String> segment = Arbitraries.strings().withCharRange('a', 'z').ofMinLength(1).ofMaxLength(8);
    Arbitrary<String> extension = Arbitraries.of(".txt", ".md", ".html", ".pdf", ".csv", "");
    return segment.list().ofMinSize(1).ofMaxSize(4)
        .flatMap(parts -> extension.map(ext -> String.join("/", parts) + ext));
  }

  @Property
  void samePathTwiceYieldsIdenticalLocations(@ForAll("relativePaths") String relativePath) {
    DocumentPaths first = new DocumentPaths(DOWNLOAD, OUTPUT, WORK);
    DocumentPaths second = new DocumentPaths(DOWNLOAD, OUTPUT, WORK);

    assertThat(first.downloadPath(relativePath)).isEqualTo(second.downloadPath(relativePath));
    assertThat(first.outputPath(relativePath)).isEqualTo(second.outputPath(relativePath));
  }

  @Property
  void recordsCreatedTwiceShareTheirPaths(@ForAll("relativePaths") String relativePath) {
    DocumentPaths paths = new DocumentPaths(DOWNLOAD, OUTPUT, WORK);

    DocumentRecord first = new DocumentRecord(relativePath, relativePath, FileType.TEXT, 1L, Map.of(), paths);
    DocumentRecord second = new DocumentRecord(relativePath, relativePath, FileType.TEXT, 1L, Map.of(), paths);

    assertThat(first.downloadPath()).isEqualTo(second.downloadPath());
    assertThat(first.outputPath()).isEqualTo(second.outputPath());
  }

  @Property
  void locationsStayWithinTheirRoots(@ForAll("relativePaths") String relativePath) {
    DocumentPaths paths = new DocumentPaths(DOWNLOAD, OUTPUT, WORK);

    assertThat(paths.downloadPath(relativePath)).startsWith(DOWNLOAD);
    assertThat(paths.outputPath(relativePath)).startsWith(OUTPUT);
    for (StageName stage : List.of(StageName.PARTITION, StageName.CHUNK, StageName.STAGE)) {
      assertThat(paths.artifactPath(stage, relativePath)).startsWith(WORK.resolve(stage.value()));
    }
  }

  @Property
  void distinctRelativePathsNeverShareADownloadPath(
      @ForAll("relativePaths") String left, @ForAll("relativePaths") String right) {
    DocumentPaths paths = new DocumentPaths(DOWNLOAD, OUTPUT, WORK);

    if (!left.equals(right)) {
      assertThat(paths.downloadPath(left)).isNotEqualTo(paths.downloadPath(right));
    }
  }
}
