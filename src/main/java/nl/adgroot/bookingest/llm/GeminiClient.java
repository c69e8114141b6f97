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
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

/** Google Gemini {@code generateContent} REST adapter. */
public class GeminiClient implements GenerativeTextProvider {

  private static final MediaType JSON = MediaType.parse("application/json");
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final OkHttpClient http;
  private final HttpUrl baseUrl;
  private final String apiKey;

  public GeminiClient(AppConfig.GeminiConfig cfg) {
    this(cfg, HttpClients.create(cfg.timeoutSeconds, 4));
  }

  public GeminiClient(AppConfig.GeminiConfig cfg, OkHttpClient http) {
    this.http = http;
    this.baseUrl = HttpUrl.get(cfg.baseUrl);
    this.apiKey = cfg.apiKey;
  }

  @Override
  public CompletableFuture<String> generate(String modelName, String prompt) {
    ObjectNode req = MAPPER.createObjectNode();
    req.putArray("contents")
        .addObject()
        .putArray("parts")
        .addObject()
        .put("text", prompt);

    HttpUrl url = baseUrl.newBuilder()
        .addPathSegment("v1beta")
        .addPathSegment("models")
        .addPathSegment(modelName + ":generateContent")
        .build();

    Request request = new Request.Builder()
        .url(url)
        .header("x-goog-api-key", apiKey)
        .post(RequestBody.create(req.toString(), JSON))
        .build();

    return AsyncCalls.bodyAsync(http, request)
        .handle((body, ex) -> {
          if (ex != null) {
            throw new CompletionException(
                new ProviderException(modelName, "Gemini call failed", Failures.unwrap(ex)));
          }
          return extractText(modelName, body);
        });
  }

  @Override
  public String name() {
    return "gemini";
  }

  static String extractText(String modelName, String body) {
    JsonNode json;
    try {
      json = MAPPER.readTree(body);
    } catch (Exception e) {
      throw new CompletionException(new ProviderException(modelName, "non-JSON body", e));
    }

    JsonNode parts = json.path("candidates").path(0).path("content").path("parts");
    if (!parts.isArray() || parts.isEmpty()) {
      String reason = json.path("promptFeedback").path("blockReason").asText("no candidates");
      throw new CompletionException(new ProviderException(modelName, "empty answer (" + reason + ")", null));
    }

    StringBuilder text = new StringBuilder();
    for (JsonNode part : parts) {
      text.append(part.path("text").asText(""));
    }
    return text.toString();
  }
}
