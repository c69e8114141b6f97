package nl.adgroot.bookingest.render;

/**
 * What the render provider hands back once a source document is registered. Stable for one run
 * and reused to build every page locator.
 */
public record RenderHandle(String sourceId, String sourceVersion, int pageCount) {

  public RenderHandle {
    if (sourceId == null || sourceId.isBlank()) {
      throw new IllegalArgumentException("sourceId is required");
    }
    if (pageCount < 1) {
      throw new IllegalArgumentException("pageCount must be >= 1, was " + pageCount);
    }
    sourceVersion = sourceVersion == null ? "" : sourceVersion;
  }
}
