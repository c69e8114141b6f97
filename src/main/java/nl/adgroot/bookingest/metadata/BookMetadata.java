package nl.adgroot.bookingest.metadata;

public record BookMetadata(String title, String author) {

  public static final String UNKNOWN = "Unknown";

  public BookMetadata {
    if (title == null || title.isBlank()) {
      throw new IllegalArgumentException("title is required");
    }
    if (author == null || author.isBlank()) {
      throw new IllegalArgumentException("author is required");
    }
  }
}
