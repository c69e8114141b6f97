package nl.adgroot.bookingest.errors;

/**
 * Every model candidate failed. The cause is the last candidate's failure; earlier failures are
 * attached as suppressed exceptions.
 */
public class MetadataExtractionException extends IngestionException {

  public MetadataExtractionException(String message, Throwable cause) {
    super(Stage.METADATA, message, cause);
  }
}
