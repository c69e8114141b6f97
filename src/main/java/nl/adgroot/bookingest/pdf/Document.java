package nl.adgroot.bookingest.pdf;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * The uploaded source file. Owned by the caller; the pipeline only reads it.
 */
public record Document(Path path, long sizeBytes) {

  public Document {
    Objects.requireNonNull(path, "path");
  }

  public static Document of(Path path) throws IOException {
    return new Document(path, Files.size(path));
  }

  public String fileName() {
    return path.getFileName().toString();
  }
}
