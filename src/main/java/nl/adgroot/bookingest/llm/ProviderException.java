package nl.adgroot.bookingest.llm;

import java.io.IOException;

/** A generative text provider failed to answer for one model. */
public class ProviderException extends IOException {

  private final String modelName;

  public ProviderException(String modelName, String message, Throwable cause) {
    super(modelName + ": " + message, cause);
    this.modelName = modelName;
  }

  public String modelName() {
    return modelName;
  }
}
