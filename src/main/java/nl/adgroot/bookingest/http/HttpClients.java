package nl.adgroot.bookingest.http;

import java.time.Duration;

import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;

public final class HttpClients {

  private HttpClients() {
    // utility class
  }

  /**
   * Builds a client whose connect, read, write and whole-call timeouts are all {@code timeoutSeconds},
   * with at most {@code maxRequests} calls in flight.
   */
  public static OkHttpClient create(int timeoutSeconds, int maxRequests) {
    Duration t = Duration.ofSeconds(Math.max(1, timeoutSeconds));

    Dispatcher dispatcher = new Dispatcher();
    dispatcher.setMaxRequests(Math.max(1, maxRequests));
    dispatcher.setMaxRequestsPerHost(Math.max(1, maxRequests));

    return new OkHttpClient.Builder()
        .dispatcher(dispatcher)
        .connectTimeout(t)
        .readTimeout(t)
        .writeTimeout(t)
        .callTimeout(t)
        .build();
  }
}
