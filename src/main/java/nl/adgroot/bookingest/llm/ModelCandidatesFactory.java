package nl.adgroot.bookingest.llm;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import nl.adgroot.bookingest.config.AppConfig;

public final class ModelCandidatesFactory {

  private ModelCandidatesFactory() {
    // utility class
  }

  /**
   * Creates the ordered candidate list from {@code cfg.models}.
   *
   * Rules:
   * - order is kept exactly as configured
   * - each provider name maps to one shared client instance
   * - clients are only built for providers the list refers to
   * - an unknown provider name is a configuration error
   */
  public static List<ModelCandidate> create(AppConfig cfg) {
    Map<String, Supplier<GenerativeTextProvider>> factories = Map.of(
        "gemini", () -> new GeminiClient(cfg.gemini),
        "ollama", () -> new OllamaClient(cfg.ollama)
    );
    return create(cfg.models, providersFor(cfg.models, factories));
  }

  static Map<String, GenerativeTextProvider> providersFor(
      List<AppConfig.ModelConfig> models,
      Map<String, Supplier<GenerativeTextProvider>> factories
  ) {
    Map<String, GenerativeTextProvider> providers = new HashMap<>();
    if (models == null) {
      return providers;
    }
    for (AppConfig.ModelConfig m : models) {
      Supplier<GenerativeTextProvider> factory = factories.get(m.provider);
      if (factory != null) {
        providers.computeIfAbsent(m.provider, name -> factory.get());
      }
    }
    return providers;
  }

  public static List<ModelCandidate> create(
      List<AppConfig.ModelConfig> models,
      Map<String, GenerativeTextProvider> providers
  ) {
    if (models == null || models.isEmpty()) {
      throw new IllegalArgumentException("At least one model candidate must be configured");
    }

    List<ModelCandidate> candidates = new ArrayList<>(models.size());
    for (AppConfig.ModelConfig m : models) {
      GenerativeTextProvider provider = providers.get(m.provider);
      if (provider == null) {
        throw new IllegalArgumentException("Unknown model provider: " + m.provider);
      }
      candidates.add(new ModelCandidate(provider, m.model));
    }
    return List.copyOf(candidates);
  }
}
