package nl.adgroot.bookingest.pages;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

/**
 * Builds ids of the form {@code page_<bookId>_<pageNumber>_<epochMillis>_<suffix>}. Uniqueness is
 * probabilistic: the suffix is 9 random base-36 characters, so two runs in the same millisecond
 * still do not collide in practice.
 */
public class PageIdGenerator {

  private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
  private static final int SUFFIX_LENGTH = 9;

  private final Clock clock;
  private final Random random;

  public PageIdGenerator() {
    this(Clock.systemUTC(), new SecureRandom());
  }

  public PageIdGenerator(Clock clock, Random random) {
    this.clock = clock;
    this.random = random;
  }

  public String newPageId(String bookId, int pageNumber) {
    return "page_" + sanitize(bookId) + "_" + pageNumber + "_" + clock.millis() + "_" + suffix();
  }

  private String suffix() {
    StringBuilder sb = new StringBuilder(SUFFIX_LENGTH);
    synchronized (random) {
      for (int i = 0; i < SUFFIX_LENGTH; i++) {
        sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
      }
    }
    return sb.toString();
  }

  // ids end up in storage paths
  static String sanitize(String key) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("bookId is required");
    }
    return key.trim().replaceAll("[^A-Za-z0-9-]", "-");
  }
}
