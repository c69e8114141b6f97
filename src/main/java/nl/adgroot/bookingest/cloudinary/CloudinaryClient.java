package nl.adgroot.bookingest.cloudinary;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import nl.adgroot.bookingest.config.AppConfig;
import nl.adgroot.bookingest.http.AsyncCalls;
import nl.adgroot.bookingest.http.HttpClients;
import okhttp3.FormBody;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

/**
 * Minimal signed client for the Cloudinary image upload API. Shared by the render provider (PDF
 * upload) and the page object storage (page image upload + destroy).
 */
public class CloudinaryClient {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final OkHttpClient http;
  private final AppConfig.CloudinaryConfig cfg;
  private final Clock clock;

  public CloudinaryClient(AppConfig.CloudinaryConfig cfg, int maxConcurrentRequests) {
    this(cfg, HttpClients.create(cfg.timeoutSeconds, maxConcurrentRequests), Clock.systemUTC());
  }

  public CloudinaryClient(AppConfig.CloudinaryConfig cfg, OkHttpClient http, Clock clock) {
    this.cfg = cfg;
    this.http = http;
    this.clock = clock;
  }

  /** Uploads {@code file} as an image resource with the given (signed) upload parameters. */
  public CompletableFuture<JsonNode> uploadAsync(Path file, MediaType mediaType, Map<String, String> params) {
    Map<String, String> signed = signed(params);

    MultipartBody.Builder body = new MultipartBody.Builder().setType(MultipartBody.FORM)
        .addFormDataPart("file", file.getFileName().toString(), RequestBody.create(file.toFile(), mediaType));
    signed.forEach(body::addFormDataPart);

    Request request = new Request.Builder()
        .url(endpoint("upload"))
        .post(body.build())
        .build();

    return AsyncCalls.bodyAsync(http, request).thenApply(CloudinaryClient::readJson);
  }

  /** Deletes an uploaded image by its public id. */
  public CompletableFuture<JsonNode> destroyAsync(String publicId) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("public_id", publicId);

    FormBody.Builder body = new FormBody.Builder();
    signed(params).forEach(body::add);

    Request request = new Request.Builder()
        .url(endpoint("destroy"))
        .post(body.build())
        .build();

    return AsyncCalls.bodyAsync(http, request).thenApply(CloudinaryClient::readJson);
  }

  /**
   * Delivery URL of an image, e.g. {@code .../image/upload/pg_3/v17/books/1/file.jpg}.
   * Pure: no network call.
   */
  public String deliveryUrl(String transformation, String version, String publicId, String format) {
    StringBuilder sb = new StringBuilder()
        .append(stripTrailingSlash(cfg.deliveryBaseUrl))
        .append('/').append(cfg.cloudName)
        .append("/image/upload/");
    if (transformation != null && !transformation.isEmpty()) {
      sb.append(transformation).append('/');
    }
    if (version != null && !version.isEmpty()) {
      sb.append('v').append(version).append('/');
    }
    sb.append(publicId);
    if (format != null && !format.isEmpty()) {
      sb.append('.').append(format);
    }
    return sb.toString();
  }

  private Map<String, String> signed(Map<String, String> params) {
    Map<String, String> all = new LinkedHashMap<>(params);
    all.put("timestamp", String.valueOf(clock.instant().getEpochSecond()));
    all.put("signature", CloudinarySigner.sign(all, cfg.apiSecret));
    all.put("api_key", cfg.apiKey);
    return all;
  }

  private String endpoint(String action) {
    return stripTrailingSlash(cfg.apiBaseUrl) + "/" + cfg.cloudName + "/image/" + action;
  }

  private static String stripTrailingSlash(String s) {
    return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
  }

  private static JsonNode readJson(String body) {
    try {
      return MAPPER.readTree(body);
    } catch (Exception e) {
      throw new IllegalStateException("Cloudinary returned a non-JSON body", e);
    }
  }
}
