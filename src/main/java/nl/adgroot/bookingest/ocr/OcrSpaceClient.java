package nl.adgroot.bookingest.ocr;

import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import nl.adgroot.bookingest.config.AppConfig;
import nl.adgroot.bookingest.errors.Failures;
import nl.adgroot.bookingest.errors.OcrException;
import nl.adgroot.bookingest.http.AsyncCalls;
import nl.adgroot.bookingest.http.HttpClients;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;

/** OCR.space REST adapter: the service fetches the image URL itself. */
public class OcrSpaceClient implements OcrProvider {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final OkHttpClient http;
  private final String url;
  private final String apiKey;

  public OcrSpaceClient(AppConfig.OcrConfig cfg) {
    this(cfg, HttpClients.create(cfg.timeoutSeconds, 2));
  }

  public OcrSpaceClient(AppConfig.OcrConfig cfg, OkHttpClient http) {
    this.http = http;
    this.url = (cfg.baseUrl.endsWith("/") ? cfg.baseUrl.substring(0, cfg.baseUrl.length() - 1) : cfg.baseUrl)
        + "/parse/image";
    this.apiKey = cfg.apiKey;
  }

  @Override
  public CompletableFuture<String> recognize(String imageUrl, String language) {
    Request request = new Request.Builder()
        .url(url)
        .header("apikey", apiKey)
        .post(new FormBody.Builder()
            .add("url", imageUrl)
            .add("language", language)
            .add("OCREngine", "2")
            .build())
        .build();

    return AsyncCalls.bodyAsync(http, request)
        .handle((body, ex) -> {
          if (ex != null) {
            throw new OcrException("OCR request failed for " + imageUrl, Failures.unwrap(ex));
          }
          return parseText(body);
        });
  }

  static String parseText(String body) {
    JsonNode json;
    try {
      json = MAPPER.readTree(body);
    } catch (Exception e) {
      throw new OcrException("OCR response is not JSON", e);
    }

    if (json.path("IsErroredOnProcessing").asBoolean(false)) {
      throw new OcrException("OCR backend error: " + json.path("ErrorMessage").toString());
    }

    StringBuilder text = new StringBuilder();
    for (JsonNode result : json.path("ParsedResults")) {
      text.append(result.path("ParsedText").asText(""));
    }
    return text.toString();
  }
}
