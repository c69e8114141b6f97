package nl.adgroot.bookingest.errors;

/**
 * Base type of every error the ingestion pipeline reports to its caller.
 * The {@link Stage} tells which step of the run failed.
 */
public abstract class IngestionException extends RuntimeException {

  private final Stage stage;

  protected IngestionException(Stage stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
  }

  public Stage stage() {
    return stage;
  }
}
