package nl.adgroot.bookingest.errors;

/** The render provider rejected the source document. */
public class UploadException extends IngestionException {

  public UploadException(String message) {
    super(Stage.UPLOAD, message, null);
  }

  public UploadException(String message, Throwable cause) {
    super(Stage.UPLOAD, message, cause);
  }
}
