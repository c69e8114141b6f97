package nl.adgroot.bookingest.pages;

/**
 * Durable result for one page. Immutable; {@code pageId} is unique across runs.
 */
public record PageArtifact(
    String pageId,
    int pageNumber,
    String pageUrl,
    String storageObjectId
) {}
