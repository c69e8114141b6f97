package nl.adgroot.bookingest.config;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {

  public CloudinaryConfig cloudinary = new CloudinaryConfig();
  public OcrConfig ocr = new OcrConfig();
  public GeminiConfig gemini = new GeminiConfig();
  public OllamaConfig ollama = new OllamaConfig();
  public List<ModelConfig> models = defaultModels();
  public PagesConfig pages = new PagesConfig();

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class CloudinaryConfig {
    public String cloudName = "";
    public String apiKey = "";
    public String apiSecret = "";

    public String apiBaseUrl = "https://api.cloudinary.com/v1_1";
    public String deliveryBaseUrl = "https://res.cloudinary.com";

    // source PDFs land in {sourceFolderPrefix}/{timestamp}
    public String sourceFolderPrefix = "books";
    public String pageFormat = "jpg";
    public int timeoutSeconds = 120;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class OcrConfig {
    public String baseUrl = "https://api.ocr.space";
    public String apiKey = "";
    public String language = "eng";
    public int timeoutSeconds = 60;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class GeminiConfig {
    public String baseUrl = "https://generativelanguage.googleapis.com";
    public String apiKey = "";
    public int timeoutSeconds = 60;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class OllamaConfig {
    public String host = "127.0.0.1";
    public int basePort = 11434;
    public String generatePath = "/api/generate";

    public double temperature = 0.0;
    public int timeoutSeconds = 120;
    public int concurrency = 2;
  }

  /** One entry of the ordered model fallback list. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ModelConfig {
    public String provider = "gemini";
    public String model;

    public ModelConfig() {
    }

    public ModelConfig(String provider, String model) {
      this.provider = provider;
      this.model = model;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class PagesConfig {
    public int maxConcurrentTransfers = 8;
    public String storageFolderPrefix = "books";

    // empty: use java.io.tmpdir
    public String scratchRoot = "";
    public int downloadTimeoutSeconds = 60;
  }

  private static List<ModelConfig> defaultModels() {
    List<ModelConfig> list = new ArrayList<>();
    list.add(new ModelConfig("gemini", "gemini-1.5-flash"));
    list.add(new ModelConfig("gemini", "gemini-1.5-pro"));
    list.add(new ModelConfig("gemini", "gemini-1.0-pro"));
    return list;
  }
}
