package nl.adgroot.bookingest.render;

import java.util.concurrent.CompletableFuture;

import nl.adgroot.bookingest.pdf.Document;

public interface RenderProvider {

  /**
   * Uploads the document once. Completes exceptionally with
   * {@link nl.adgroot.bookingest.errors.UploadException} when the provider rejects it.
   */
  CompletableFuture<RenderHandle> registerSource(Document document);

  /**
   * Locator of page {@code pageNumber} rendered as an image. Pure and deterministic.
   *
   * @throws IllegalArgumentException when {@code pageNumber} is outside {@code 1..pageCount}
   */
  String pageLocator(RenderHandle handle, int pageNumber);

  static void checkPageNumber(RenderHandle handle, int pageNumber) {
    if (pageNumber < 1 || pageNumber > handle.pageCount()) {
      throw new IllegalArgumentException(
          "pageNumber " + pageNumber + " outside 1.." + handle.pageCount());
    }
  }
}
