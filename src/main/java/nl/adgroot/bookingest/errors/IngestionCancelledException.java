package nl.adgroot.bookingest.errors;

public class IngestionCancelledException extends IngestionException {

  public IngestionCancelledException(String checkpoint) {
    super(Stage.CANCELLED, "Ingestion cancelled before " + checkpoint, null);
  }
}
