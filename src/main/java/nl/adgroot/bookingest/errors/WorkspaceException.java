package nl.adgroot.bookingest.errors;

/** The run's scratch workspace could not be created. */
public class WorkspaceException extends IngestionException {

  public WorkspaceException(String message, Throwable cause) {
    super(Stage.WORKSPACE, message, cause);
  }
}
