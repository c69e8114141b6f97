package nl.adgroot.bookingest;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import nl.adgroot.bookingest.errors.Failures;
import nl.adgroot.bookingest.errors.IngestionException;
import nl.adgroot.bookingest.errors.UploadException;
import nl.adgroot.bookingest.errors.WorkspaceException;
import nl.adgroot.bookingest.metadata.BookMetadata;
import nl.adgroot.bookingest.metadata.MetadataExtractor;
import nl.adgroot.bookingest.pages.PageArtifact;
import nl.adgroot.bookingest.pages.PageMaterializer;
import nl.adgroot.bookingest.pages.PageStorageStrategy;
import nl.adgroot.bookingest.pages.ScratchWorkspace;
import nl.adgroot.bookingest.pdf.Document;
import nl.adgroot.bookingest.render.RenderHandle;
import nl.adgroot.bookingest.render.RenderProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One uploaded PDF to metadata + page artifacts:
 * - register the source with the render provider
 * - OCR the cover (page 1) and resolve title/author through the model candidates
 * - materialize all pages with the chosen {@link PageStorageStrategy}
 * - remove the run's scratch workspace, whatever happened before
 *
 * Runs share no mutable state; each gets its own workspace.
 */
public class IngestionPipeline {

  private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);
  private static final AtomicInteger RUN_COUNTER = new AtomicInteger();

  private final RenderProvider renderProvider;
  private final MetadataExtractor metadataExtractor;
  private final PageMaterializer pageMaterializer;
  private final Path scratchRoot;
  private final Consumer<PipelineState> stateListener;

  public IngestionPipeline(
      RenderProvider renderProvider,
      MetadataExtractor metadataExtractor,
      PageMaterializer pageMaterializer,
      Path scratchRoot
  ) {
    this(renderProvider, metadataExtractor, pageMaterializer, scratchRoot, s -> {});
  }

  /** Injectable state listener for tests / progress reporting. */
  public IngestionPipeline(
      RenderProvider renderProvider,
      MetadataExtractor metadataExtractor,
      PageMaterializer pageMaterializer,
      Path scratchRoot,
      Consumer<PipelineState> stateListener
  ) {
    this.renderProvider = renderProvider;
    this.metadataExtractor = metadataExtractor;
    this.pageMaterializer = pageMaterializer;
    this.scratchRoot = scratchRoot;
    this.stateListener = stateListener;
  }

  /** Lightweight preview ingestion: pages keep the render provider's URLs. */
  public IngestionResult extractOnly(Document document) {
    return await(runAsync(document, PageStorageStrategy.PASSTHROUGH_RENDER_URL, null, new CancellationToken()));
  }

  /**
   * Permanent ingestion: every page is re-hosted under {@code bookId}.
   *
   * @throws IllegalArgumentException when {@code bookId} is null or blank; nothing is uploaded then
   */
  public IngestionResult ingest(Document document, String bookId) {
    return await(runAsync(document, PageStorageStrategy.REHOST_TO_STORAGE, bookId, new CancellationToken()));
  }

  public CompletableFuture<IngestionResult> runAsync(
      Document document,
      PageStorageStrategy strategy,
      String bookId,
      CancellationToken token
  ) {
    Objects.requireNonNull(strategy, "strategy");
    if (strategy == PageStorageStrategy.REHOST_TO_STORAGE && (bookId == null || bookId.isBlank())) {
      throw new IllegalArgumentException("bookId is required to rehost pages");
    }

    Run run = new Run(strategy);
    run.transition(PipelineState.STARTED);

    ScratchWorkspace workspace;
    try {
      workspace = ScratchWorkspace.create(scratchRoot);
    } catch (IOException e) {
      run.transition(PipelineState.FAILED);
      return CompletableFuture.failedFuture(
          new WorkspaceException("Could not create scratch workspace under " + scratchRoot, e));
    }

    CompletableFuture<IngestionResult> flow;
    try {
      flow = register(document)
          .thenCompose(handle -> {
            run.transition(PipelineState.REGISTERED);
            String coverLocator = renderProvider.pageLocator(handle, 1);

            return metadataExtractor.recognizeCover(coverLocator, token)
                .thenCompose(coverText -> {
                  run.transition(PipelineState.COVER_EXTRACTED);
                  return metadataExtractor.resolve(coverText, token);
                })
                .thenCompose(metadata -> {
                  run.transition(PipelineState.METADATA_RESOLVED);
                  return pageMaterializer.materialize(handle, strategy, bookId, workspace, token)
                      .thenApply(pages -> {
                        run.transition(PipelineState.PAGES_MATERIALIZED);
                        return result(metadata, pages, workspace, handle, strategy);
                      });
                });
          });
    } catch (RuntimeException e) {
      flow = CompletableFuture.failedFuture(e);
    }

    return flow.whenComplete((res, ex) -> {
      workspace.close();
      if (ex == null) {
        run.transition(PipelineState.CLEANED);
        run.transition(PipelineState.DONE);
        log.info("[{}] {} pages of \"{}\" ingested", run.id, res.pages().size(), res.metadata().title());
      } else {
        Throwable cause = Failures.unwrap(ex);
        run.transition(PipelineState.FAILED);
        log.error("[{}] ingestion failed{}: {}", run.id,
            cause instanceof IngestionException ie ? " at stage " + ie.stage() : "", cause.toString());
      }
    });
  }

  /**
   * Waits for a run and rethrows its failure without the CompletionException layer.
   */
  public static IngestionResult await(CompletableFuture<IngestionResult> run) {
    try {
      return run.join();
    } catch (CompletionException e) {
      Throwable cause = Failures.unwrap(e);
      if (cause instanceof RuntimeException re) {
        throw re;
      }
      if (cause instanceof Error err) {
        throw err;
      }
      throw e;
    }
  }

  private CompletableFuture<RenderHandle> register(Document document) {
    CompletableFuture<RenderHandle> call;
    try {
      call = renderProvider.registerSource(document);
    } catch (RuntimeException e) {
      call = CompletableFuture.failedFuture(e);
    }

    return call.handle((handle, ex) -> {
      if (ex == null) {
        return handle;
      }
      Throwable cause = Failures.unwrap(ex);
      if (cause instanceof UploadException ue) {
        throw ue;
      }
      throw new UploadException("Source registration failed: " + cause.getMessage(), cause);
    });
  }

  private static IngestionResult result(
      BookMetadata metadata,
      List<PageArtifact> pages,
      ScratchWorkspace workspace,
      RenderHandle handle,
      PageStorageStrategy strategy
  ) {
    return new IngestionResult(
        metadata,
        pages,
        workspace.directory(),
        handle.sourceId(),
        handle.sourceVersion(),
        strategy);
  }

  private final class Run {
    private final String id;

    private Run(PageStorageStrategy strategy) {
      this.id = "run-" + RUN_COUNTER.incrementAndGet() + "-" + strategy.name().toLowerCase();
    }

    private void transition(PipelineState state) {
      log.info("[{}] {}", id, state);
      stateListener.accept(state);
    }
  }
}
