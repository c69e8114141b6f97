package nl.adgroot.bookingest.ocr;

import java.util.concurrent.CompletableFuture;

public interface OcrProvider {

  /**
   * Recognizes the text on the image at {@code imageUrl}. Completes exceptionally with
   * {@link nl.adgroot.bookingest.errors.OcrException} when the backend fails.
   */
  CompletableFuture<String> recognize(String imageUrl, String language);
}
