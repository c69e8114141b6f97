package nl.adgroot.bookingest.render;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.databind.JsonNode;
import nl.adgroot.bookingest.cloudinary.CloudinaryClient;
import nl.adgroot.bookingest.config.AppConfig;
import nl.adgroot.bookingest.errors.Failures;
import nl.adgroot.bookingest.errors.UploadException;
import nl.adgroot.bookingest.pdf.Document;
import nl.adgroot.bookingest.pdf.PdfPageCounter;
import okhttp3.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers PDFs with Cloudinary, which rasterizes any page on request through the {@code pg_N}
 * transformation.
 */
public class CloudinaryRenderProvider implements RenderProvider {

  private static final Logger log = LoggerFactory.getLogger(CloudinaryRenderProvider.class);
  private static final MediaType PDF = MediaType.parse("application/pdf");

  private final CloudinaryClient client;
  private final PdfPageCounter pageCounter;
  private final AppConfig.CloudinaryConfig cfg;
  private final Clock clock;

  public CloudinaryRenderProvider(AppConfig.CloudinaryConfig cfg, CloudinaryClient client) {
    this(cfg, client, new PdfPageCounter(), Clock.systemUTC());
  }

  public CloudinaryRenderProvider(
      AppConfig.CloudinaryConfig cfg,
      CloudinaryClient client,
      PdfPageCounter pageCounter,
      Clock clock
  ) {
    this.cfg = cfg;
    this.client = client;
    this.pageCounter = pageCounter;
    this.clock = clock;
  }

  @Override
  public CompletableFuture<RenderHandle> registerSource(Document document) {
    int localPageCount;
    try {
      localPageCount = pageCounter.countPages(document.path());
    } catch (IOException e) {
      return CompletableFuture.failedFuture(
          new UploadException("Not a readable PDF: " + document.fileName(), e));
    }
    if (localPageCount < 1) {
      return CompletableFuture.failedFuture(
          new UploadException("PDF has no pages: " + document.fileName()));
    }

    Map<String, String> params = new LinkedHashMap<>();
    params.put("folder", cfg.sourceFolderPrefix + "/" + clock.millis());
    params.put("use_filename", "true");
    params.put("unique_filename", "true");

    log.info("Uploading {} ({} bytes, {} pages) to render provider",
        document.fileName(), document.sizeBytes(), localPageCount);

    return client.uploadAsync(document.path(), PDF, params)
        .handle((json, ex) -> {
          if (ex != null) {
            throw new UploadException("Render provider rejected " + document.fileName(), Failures.unwrap(ex));
          }
          return toHandle(json, localPageCount);
        });
  }

  @Override
  public String pageLocator(RenderHandle handle, int pageNumber) {
    RenderProvider.checkPageNumber(handle, pageNumber);
    return client.deliveryUrl("pg_" + pageNumber, handle.sourceVersion(), handle.sourceId(), cfg.pageFormat);
  }

  private static RenderHandle toHandle(JsonNode json, int localPageCount) {
    String publicId = json.path("public_id").asText("");
    if (publicId.isEmpty()) {
      throw new UploadException("Render provider response has no public_id");
    }
    String version = json.path("version").asText("");
    int pages = json.path("pages").asInt(0);
    if (pages < 1) {
      log.debug("Render provider did not report a page count; using local count {}", localPageCount);
      pages = localPageCount;
    }
    return new RenderHandle(publicId, version, pages);
  }
}
