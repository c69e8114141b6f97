package nl.adgroot.bookingest;

import java.nio.file.Path;
import java.util.List;

import nl.adgroot.bookingest.metadata.BookMetadata;
import nl.adgroot.bookingest.pages.PageArtifact;
import nl.adgroot.bookingest.pages.PageStorageStrategy;

/**
 * @param pages         one artifact per page, ordered by page number
 * @param scratchFolder the run's workspace path; already removed when the result is returned
 */
public record IngestionResult(
    BookMetadata metadata,
    List<PageArtifact> pages,
    Path scratchFolder,
    String originalSourceId,
    String originalSourceVersion,
    PageStorageStrategy strategy
) {

  public IngestionResult {
    pages = List.copyOf(pages);
  }
}
