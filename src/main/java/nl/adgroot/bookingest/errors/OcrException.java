package nl.adgroot.bookingest.errors;

/** Text recognition failed or produced nothing but whitespace. */
public class OcrException extends IngestionException {

  public OcrException(String message) {
    super(Stage.OCR, message, null);
  }

  public OcrException(String message, Throwable cause) {
    super(Stage.OCR, message, cause);
  }
}
