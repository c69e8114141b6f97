package nl.adgroot.bookingest.pages;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Run-scoped temporary directory for downloaded page images. {@link #close()} deletes every file
 * handed out by {@link #fileFor}, then the directory itself if nothing else is left in it.
 * Deletion problems are logged and never thrown.
 */
public final class ScratchWorkspace implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ScratchWorkspace.class);

  private final Path directory;
  private final Set<Path> files = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean closed = new AtomicBoolean();

  private ScratchWorkspace(Path directory) {
    this.directory = directory;
  }

  /** Creates a fresh, uniquely named directory under {@code root}. */
  public static ScratchWorkspace create(Path root) throws IOException {
    Files.createDirectories(root);
    Path dir = Files.createTempDirectory(root, "ingest-" + System.currentTimeMillis() + "-");
    log.debug("Created scratch workspace {}", dir);
    return new ScratchWorkspace(dir);
  }

  public Path directory() {
    return directory;
  }

  public Path fileFor(int pageNumber, String extension) {
    if (closed.get()) {
      throw new IllegalStateException("Scratch workspace already closed: " + directory);
    }
    Path file = directory.resolve("page-" + pageNumber + "." + extension);
    files.add(file);
    return file;
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }

    int deleted = 0;
    for (Path file : files) {
      try {
        if (Files.deleteIfExists(file)) {
          deleted++;
        }
      } catch (IOException e) {
        log.warn("Could not delete scratch file {}: {}", file, e.toString());
      }
    }

    try {
      if (isEmpty(directory)) {
        Files.deleteIfExists(directory);
        log.debug("Removed scratch workspace {} ({} files deleted)", directory, deleted);
      } else {
        log.warn("Scratch workspace {} not empty after cleanup; leaving it in place", directory);
      }
    } catch (IOException e) {
      log.warn("Could not remove scratch workspace {}: {}", directory, e.toString());
    }
  }

  private static boolean isEmpty(Path dir) throws IOException {
    if (!Files.isDirectory(dir)) return false;
    try (Stream<Path> entries = Files.list(dir)) {
      return entries.findAny().isEmpty();
    }
  }
}
