package nl.adgroot.bookingest.http;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** Bridges OkHttp's enqueue() callbacks to CompletableFuture. */
public final class AsyncCalls {

  private AsyncCalls() {
    // utility class
  }

  /**
   * Completes with the response body for 2xx answers; otherwise completes exceptionally with
   * {@link HttpStatusException} or the transport {@link IOException}.
   */
  public static CompletableFuture<String> bodyAsync(OkHttpClient http, Request request) {
    CompletableFuture<String> future = new CompletableFuture<>();

    http.newCall(request).enqueue(new Callback() {
      @Override
      public void onFailure(Call call, IOException e) {
        future.completeExceptionally(e);
      }

      @Override
      public void onResponse(Call call, Response resp) {
        try (Response r = resp) {
          if (!r.isSuccessful()) {
            future.completeExceptionally(statusException(r));
            return;
          }
          future.complete(Objects.requireNonNull(r.body()).string());
        } catch (Exception e) {
          future.completeExceptionally(e);
        }
      }
    });

    return future;
  }

  public static HttpStatusException statusException(Response r) {
    return new HttpStatusException(r.request().url().toString(), r.code(), r.message(),
        readBodySafely(r.body()));
  }

  private static String readBodySafely(ResponseBody body) {
    if (body == null) return "";
    try {
      return body.string();
    } catch (IOException ignored) {
      return "";
    }
  }
}
