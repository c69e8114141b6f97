package nl.adgroot.bookingest.pages;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntFunction;

import nl.adgroot.bookingest.CancellationToken;
import nl.adgroot.bookingest.errors.Failures;
import nl.adgroot.bookingest.errors.IngestionException;
import nl.adgroot.bookingest.errors.PageMaterializationException;
import nl.adgroot.bookingest.render.RenderHandle;
import nl.adgroot.bookingest.render.RenderProvider;
import nl.adgroot.bookingest.storage.ObjectStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a registered document into one {@link PageArtifact} per page.
 *
 * <p>With {@link PageStorageStrategy#REHOST_TO_STORAGE} every page is downloaded first; uploads
 * only start once all downloads succeeded. Both phases run concurrently up to the permit limit.
 * A failing page fails the whole call: transfers not yet started are skipped, transfers in flight
 * are awaited, and pages already uploaded are deleted again before the failure is reported.
 */
public class PageMaterializer {

  private static final Logger log = LoggerFactory.getLogger(PageMaterializer.class);

  private final RenderProvider renderProvider;
  private final PageDownloader downloader;
  private final ObjectStorage storage;
  private final PageIdGenerator pageIds;
  private final TransferPermits permits;
  private final Executor permitExecutor;
  private final String storageFolderPrefix;
  private final String pageFormat;

  public PageMaterializer(
      RenderProvider renderProvider,
      PageDownloader downloader,
      ObjectStorage storage,
      PageIdGenerator pageIds,
      TransferPermits permits,
      Executor permitExecutor,
      String storageFolderPrefix,
      String pageFormat
  ) {
    this.renderProvider = renderProvider;
    this.downloader = downloader;
    this.storage = storage;
    this.pageIds = pageIds;
    this.permits = permits;
    this.permitExecutor = permitExecutor;
    this.storageFolderPrefix = storageFolderPrefix;
    this.pageFormat = pageFormat;
  }

  /**
   * @param bookId    owner of the pages; required for {@link PageStorageStrategy#REHOST_TO_STORAGE},
   *                  optional for passthrough (the render source id is used instead)
   * @param workspace where downloaded pages are written; only used when rehosting
   * @return artifacts ordered by page number
   */
  public CompletableFuture<List<PageArtifact>> materialize(
      RenderHandle handle,
      PageStorageStrategy strategy,
      String bookId,
      ScratchWorkspace workspace,
      CancellationToken token
  ) {
    try {
      token.throwIfCancelled("page materialization");
      return switch (strategy) {
        case PASSTHROUGH_RENDER_URL -> CompletableFuture.completedFuture(passthrough(handle, bookId));
        case REHOST_TO_STORAGE -> rehost(handle, bookId, workspace, token);
      };
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private List<PageArtifact> passthrough(RenderHandle handle, String bookId) {
    String owner = bookId != null ? bookId : handle.sourceId();
    List<PageArtifact> pages = new ArrayList<>(handle.pageCount());
    for (int n = 1; n <= handle.pageCount(); n++) {
      pages.add(new PageArtifact(
          pageIds.newPageId(owner, n),
          n,
          renderProvider.pageLocator(handle, n),
          handle.sourceId()));
    }
    log.info("Using {} render URLs as page addresses for {}", pages.size(), handle.sourceId());
    return pages;
  }

  private CompletableFuture<List<PageArtifact>> rehost(
      RenderHandle handle,
      String bookId,
      ScratchWorkspace workspace,
      CancellationToken token
  ) {
    if (bookId == null || bookId.isBlank()) {
      throw new IllegalArgumentException("bookId is required to rehost pages");
    }
    String folder = storageFolderPrefix + "/" + bookId;
    int pageCount = handle.pageCount();

    log.info("Downloading {} pages into {}", pageCount, workspace.directory());

    return runAll(pageCount, "download", token, n -> downloader.download(
            renderProvider.pageLocator(handle, n),
            workspace.fileFor(n, pageFormat)))
        .thenCompose(downloads -> {
          if (downloads.failure() != null) {
            return CompletableFuture.<List<PageArtifact>>failedFuture(downloads.failure());
          }
          List<Path> files = successes(downloads);
          log.info("All {} pages downloaded; uploading to {}", files.size(), folder);

          return runAll(pageCount, "upload", token, n -> {
            String pageId = pageIds.newPageId(bookId, n);
            return storage.upload(files.get(n - 1), folder, pageId)
                .thenApply(obj -> new PageArtifact(pageId, n, obj.publicUrl(), obj.objectHandle()));
          }).thenCompose(this::rollbackIfFailed);
        })
        .thenApply(pages -> pages.stream()
            .sorted(Comparator.comparingInt(PageArtifact::pageNumber))
            .toList());
  }

  /** Outcome of one phase: every page's future (all settled) plus the first failure seen. */
  private record Transfers<T>(List<CompletableFuture<T>> futures, Throwable failure) {}

  private <T> CompletableFuture<Transfers<T>> runAll(
      int pageCount,
      String phase,
      CancellationToken token,
      IntFunction<CompletableFuture<T>> transfer
  ) {
    TransferProgress progress = new TransferProgress(phase, pageCount);
    AtomicReference<Throwable> firstFailure = new AtomicReference<>();
    List<CompletableFuture<T>> futures = new ArrayList<>(pageCount);

    for (int n = 1; n <= pageCount; n++) {
      int pageNumber = n;
      long[] startNs = new long[1];

      CompletableFuture<T> f = permits.<T>withPermit(permitExecutor, () -> {
            token.throwIfCancelled(phase + " of page " + pageNumber);
            Throwable earlier = firstFailure.get();
            if (earlier != null) {
              return CompletableFuture.failedFuture(earlier);
            }
            startNs[0] = System.nanoTime();
            int inFlight = progress.start();
            log.debug("START {} page={}/{} in-flight={}", phase, pageNumber, pageCount, inFlight);
            return transfer.apply(pageNumber)
                .whenComplete((r, ex) -> {
                  progress.finish(ex == null);
                  long millis = (System.nanoTime() - startNs[0]) / 1_000_000;
                  log.debug("END   {} page={}/{} took={}ms {}", phase, pageNumber, pageCount, millis,
                      ex != null ? "ERROR=" + Failures.unwrap(ex) : progress.formatStatus(millis));
                });
          })
          .handle((r, ex) -> {
            if (ex != null) {
              Throwable failure = asPageFailure(pageNumber, phase, ex);
              firstFailure.compareAndSet(null, failure);
              throw new CompletionException(failure);
            }
            return r;
          });
      futures.add(f);
    }

    // settle every page before reporting, so nothing still writes into the workspace afterwards
    return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
        .handle((v, ex) -> new Transfers<>(futures, firstFailure.get()));
  }

  private CompletableFuture<List<PageArtifact>> rollbackIfFailed(Transfers<PageArtifact> uploads) {
    if (uploads.failure() == null) {
      return CompletableFuture.completedFuture(successes(uploads));
    }

    List<PageArtifact> uploaded = uploads.futures().stream()
        .filter(f -> !f.isCompletedExceptionally())
        .map(CompletableFuture::join)
        .toList();
    if (uploaded.isEmpty()) {
      return CompletableFuture.failedFuture(uploads.failure());
    }

    log.warn("Upload failed; deleting {} pages already stored", uploaded.size());
    List<CompletableFuture<Void>> deletes = new ArrayList<>(uploaded.size());
    for (PageArtifact page : uploaded) {
      deletes.add(storage.delete(page.storageObjectId())
          .exceptionally(ex -> {
            log.warn("Could not delete stored page {} ({}): {}",
                page.pageNumber(), page.storageObjectId(), Failures.unwrap(ex).toString());
            return null;
          }));
    }

    return CompletableFuture.allOf(deletes.toArray(new CompletableFuture[0]))
        .thenCompose(v -> CompletableFuture.<List<PageArtifact>>failedFuture(uploads.failure()));
  }

  private static <T> List<T> successes(Transfers<T> transfers) {
    return transfers.futures().stream().map(CompletableFuture::join).toList();
  }

  private static Throwable asPageFailure(int pageNumber, String phase, Throwable ex) {
    Throwable cause = Failures.unwrap(ex);
    if (cause instanceof IngestionException) {
      return cause;
    }
    return new PageMaterializationException(pageNumber, phase + " failed: " + cause.getMessage(), cause);
  }
}
