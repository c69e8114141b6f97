package nl.adgroot.bookingest.llm;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;

/** One named model on one provider, tried in a fixed fallback order. */
public record ModelCandidate(GenerativeTextProvider provider, String modelName) {

  public ModelCandidate {
    Objects.requireNonNull(provider, "provider");
    if (modelName == null || modelName.isBlank()) {
      throw new IllegalArgumentException("modelName is required");
    }
  }

  public CompletableFuture<String> generate(String prompt) {
    return provider.generate(modelName, prompt);
  }

  @NotNull
  @Override
  public String toString() {
    return provider.name() + "/" + modelName;
  }
}
