package nl.adgroot.bookingest.llm;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import nl.adgroot.bookingest.config.AppConfig;
import nl.adgroot.bookingest.errors.Failures;
import nl.adgroot.bookingest.http.AsyncCalls;
import nl.adgroot.bookingest.http.HttpClients;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

public class OllamaClient implements GenerativeTextProvider {

  private static final MediaType JSON = MediaType.parse("application/json");
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final OkHttpClient http;
  private final String url;
  private final double temperature;

  public OllamaClient(AppConfig.OllamaConfig cfg) {
    this(cfg, HttpClients.create(cfg.timeoutSeconds, cfg.concurrency));
  }

  public OllamaClient(AppConfig.OllamaConfig cfg, OkHttpClient http) {
    this.url = "http://" + cfg.host + ":" + cfg.basePort + cfg.generatePath;
    this.temperature = cfg.temperature;
    this.http = http;
  }

  @Override
  public CompletableFuture<String> generate(String modelName, String prompt) {
    ObjectNode req = MAPPER.createObjectNode();
    req.put("model", modelName);
    req.put("prompt", prompt);
    req.put("stream", false);
    req.put("temperature", temperature);

    Request request = new Request.Builder()
        .url(url)
        .post(RequestBody.create(req.toString(), JSON))
        .build();

    return AsyncCalls.bodyAsync(http, request)
        .handle((body, ex) -> {
          if (ex != null) {
            throw new CompletionException(
                new ProviderException(modelName, "Ollama call failed", Failures.unwrap(ex)));
          }
          try {
            JsonNode json = MAPPER.readTree(body);
            return json.path("response").asText("");
          } catch (Exception e) {
            throw new CompletionException(
                new ProviderException(modelName, "Ollama returned a non-JSON body", e));
          }
        });
  }

  @Override
  public String name() {
    return "ollama";
  }

  public String getUrl() {
    return url;
  }
}
