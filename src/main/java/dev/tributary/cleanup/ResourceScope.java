package dev.tributary.cleanup;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scoped registry of resources (connector sessions, temp files, worker pools) that must be
 * released on every exit path of the owning scope.
 *
 * <p>{@link #close()} releases every live registration exactly once, in reverse registration
 * order. Release failures are logged and never propagate, so one broken resource cannot keep the
 * others from being released. A registration may also be released early through its {@link
 * Registration} handle, in which case the scope skips it on close.
 *
 * <p>Thread-safe: workers register and release temp files concurrently.
 */
public final class ResourceScope implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ResourceScope.class);

  private final String name;
  private final Set<Registration> live = new LinkedHashSet<>();
  private final @Nullable Consumer<ResourceScope> onClose;
  private boolean closed;

  public ResourceScope(String name) {
    this(name, null);
  }

  ResourceScope(String name, @Nullable Consumer<ResourceScope> onClose) {
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.onClose = onClose;
  }

  public String name() {
    return name;
  }

  /**
   * Register a resource to be released when this scope closes.
   *
   * @param resourceName label used in log messages
   * @param resource release action
   * @return handle allowing early release
   * @throws IllegalStateException if the scope is already closed
   */
  public Registration register(String resourceName, AutoCloseable resource) {
    Objects.requireNonNull(resource, "resource must not be null");
    Registration registration = new Registration(resourceName, resource);
    synchronized (live) {
      if (closed) {
        throw new IllegalStateException("Scope " + name + " is closed");
      }
      live.add(registration);
    }
    return registration;
  }

  /** Register a temp file to be deleted (if it still exists) when this scope closes. */
  public Registration registerTempFile(Path path) {
    return register("temp file " + path, () -> deleteQuietly(path));
  }

  public boolean isClosed() {
    synchronized (live) {
      return closed;
    }
  }

  /** Number of registrations not yet released. */
  public int liveCount() {
    synchronized (live) {
      return live.size();
    }
  }

  @Override
  public void close() {
    List<Registration> toRelease;
    synchronized (live) {
      if (closed) {
        return;
      }
      closed = true;
      toRelease = new ArrayList<>(live);
    }
    Collections.reverse(toRelease);
    log.debug("Closing scope {} ({} resources)", name, toRelease.size());
    for (Registration registration : toRelease) {
      registration.release();
    }
    if (onClose != null) {
      onClose.accept(this);
    }
  }

  private static void deleteQuietly(Path path) throws IOException {
    Files.deleteIfExists(path);
  }

  /** Handle to one registered resource. Releasing is idempotent. */
  public final class Registration implements AutoCloseable {

    private final String resourceName;
    private final AutoCloseable resource;
    private final AtomicBoolean released = new AtomicBoolean(false);

    private Registration(String resourceName, AutoCloseable resource) {
      this.resourceName = resourceName;
      this.resource = resource;
    }

    /** Release the resource now if it has not been released yet. */
    public void release() {
      if (!released.compareAndSet(false, true)) {
        return;
      }
      synchronized (live) {
        live.remove(this);
      }
      try {
        resource.close();
      } catch (Exception e) {
        log.warn("Failed to release {} in scope {}: {}", resourceName, name, e.getMessage());
      }
    }

    public boolean isReleased() {
      return released.get();
    }

    @Override
    public void close() {
      release();
    }
  }
}
