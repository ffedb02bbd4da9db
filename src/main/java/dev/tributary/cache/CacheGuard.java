package dev.tributary.cache;

import dev.tributary.cleanup.ResourceScope;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Path-presence cache policy wrapped around any fetch or process step.
 *
 * <p>A non-empty file at the target path is the only cache signal: when it exists the step is
 * skipped and logged, never re-executed. Otherwise the step writes into a temp sibling of the
 * target (registered in the caller's {@link ResourceScope}) which is atomically moved into place
 * once the step returns. A step that throws therefore never leaves a partial file that a later run
 * would mistake for a cache hit.
 *
 * <p>Parent directories are created lazily and idempotently on first need.
 */
public final class CacheGuard {

  private static final Logger log = LoggerFactory.getLogger(CacheGuard.class);

  private CacheGuard() {
    // utility class
  }

  /** Writes an artifact to the given (temporary) path. */
  @FunctionalInterface
  public interface ArtifactWriter<E extends Exception> {
    void write(Path target) throws E;
  }

  /**
   * Check the cache signal for a target path.
   *
   * @param target artifact location
   * @return true if the target exists as a regular, non-empty file
   */
  public static boolean isCached(Path target) {
    try {
      return Files.isRegularFile(target) && Files.size(target) > 0;
    } catch (IOException e) {
      log.debug("Cannot stat {}, treating as not cached: {}", target, e.getMessage());
      return false;
    }
  }

  /**
   * Produce {@code target} with {@code writer} unless it is already cached.
   *
   * @param target artifact location
   * @param scope scope that owns the temp file until it is moved into place
   * @param writer the guarded step
   * @return true if the step ran, false if it was skipped as cached
   * @throws E when the step fails; the target is left untouched
   * @throws IOException when preparing directories or moving the artifact fails
   */
  public static <E extends Exception> boolean materialize(
      Path target, ResourceScope scope, ArtifactWriter<E> writer) throws E, IOException {
    if (isCached(target)) {
      log.info("Skipping {}: already exists", target);
      return false;
    }
    Path parent = target.toAbsolutePath().getParent();
    Files.createDirectories(parent);
    Path temp = Files.createTempFile(parent, "." + target.getFileName() + ".", ".part");
    try (ResourceScope.Registration ignored = scope.registerTempFile(temp)) {
      writer.write(temp);
      moveIntoPlace(temp, target);
    }
    return true;
  }

  private static void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
