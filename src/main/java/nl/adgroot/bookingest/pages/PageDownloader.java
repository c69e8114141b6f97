package nl.adgroot.bookingest.pages;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

public interface PageDownloader {

  /**
   * Fetches {@code url} into {@code target}. On failure no partial file is left behind.
   */
  CompletableFuture<Path> download(String url, Path target);
}
