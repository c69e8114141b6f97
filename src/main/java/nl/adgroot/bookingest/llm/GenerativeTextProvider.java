package nl.adgroot.bookingest.llm;

import java.util.concurrent.CompletableFuture;

public interface GenerativeTextProvider {

  /**
   * Sends {@code prompt} to {@code modelName} and completes with the generated text, or exceptionally
   * with {@link ProviderException}.
   */
  CompletableFuture<String> generate(String modelName, String prompt);

  /** Short name used in logs, e.g. "gemini". */
  String name();
}
