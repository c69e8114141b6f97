package nl.adgroot.bookingest.errors;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class Failures {

  private Failures() {
    // utility class
  }

  /** Strips the CompletionException / ExecutionException layers futures wrap around failures. */
  public static Throwable unwrap(Throwable ex) {
    Throwable t = ex;
    while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }
}
