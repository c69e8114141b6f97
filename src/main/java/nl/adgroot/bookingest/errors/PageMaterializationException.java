package nl.adgroot.bookingest.errors;

public class PageMaterializationException extends IngestionException {

  private final int pageNumber;

  public PageMaterializationException(int pageNumber, String message, Throwable cause) {
    super(Stage.PAGES, "Page " + pageNumber + ": " + message, cause);
    this.pageNumber = pageNumber;
  }

  public int pageNumber() {
    return pageNumber;
  }
}
