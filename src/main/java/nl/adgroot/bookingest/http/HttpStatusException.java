package nl.adgroot.bookingest.http;

import java.io.IOException;

/** Non-2xx answer from a remote service. */
public class HttpStatusException extends IOException {

  private final int code;

  public HttpStatusException(String url, int code, String message, String body) {
    super("HTTP " + code + " " + message + " from " + url + (body.isEmpty() ? "" : "\n" + body));
    this.code = code;
  }

  public int code() {
    return code;
  }
}
