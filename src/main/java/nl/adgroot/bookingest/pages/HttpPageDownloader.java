package nl.adgroot.bookingest.pages;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import nl.adgroot.bookingest.http.AsyncCalls;
import nl.adgroot.bookingest.http.HttpClients;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class HttpPageDownloader implements PageDownloader {

  private static final Logger log = LoggerFactory.getLogger(HttpPageDownloader.class);

  private final OkHttpClient http;

  public HttpPageDownloader(int timeoutSeconds, int maxConcurrentDownloads) {
    this(HttpClients.create(timeoutSeconds, maxConcurrentDownloads));
  }

  public HttpPageDownloader(OkHttpClient http) {
    this.http = http;
  }

  @Override
  public CompletableFuture<Path> download(String url, Path target) {
    CompletableFuture<Path> future = new CompletableFuture<>();

    Request request = new Request.Builder().url(url).get().build();

    http.newCall(request).enqueue(new Callback() {
      @Override
      public void onFailure(Call call, IOException e) {
        future.completeExceptionally(e);
      }

      @Override
      public void onResponse(Call call, Response resp) {
        try (Response r = resp) {
          if (!r.isSuccessful()) {
            future.completeExceptionally(AsyncCalls.statusException(r));
            return;
          }
          try (InputStream in = Objects.requireNonNull(r.body()).byteStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
          }
          future.complete(target);
        } catch (Exception e) {
          deletePartial(target);
          future.completeExceptionally(e);
        }
      }
    });

    return future;
  }

  private static void deletePartial(Path target) {
    try {
      Files.deleteIfExists(target);
    } catch (IOException e) {
      log.warn("Could not delete partial download {}: {}", target, e.toString());
    }
  }
}
