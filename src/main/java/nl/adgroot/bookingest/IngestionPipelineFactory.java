package nl.adgroot.bookingest;

import java.io.IOException;
import java.nio.file.Path;

import nl.adgroot.bookingest.cloudinary.CloudinaryClient;
import nl.adgroot.bookingest.config.AppConfig;
import nl.adgroot.bookingest.llm.ModelCandidatesFactory;
import nl.adgroot.bookingest.metadata.MetadataExtractor;
import nl.adgroot.bookingest.ocr.OcrSpaceClient;
import nl.adgroot.bookingest.pages.HttpPageDownloader;
import nl.adgroot.bookingest.pages.PageIdGenerator;
import nl.adgroot.bookingest.pages.PageMaterializer;
import nl.adgroot.bookingest.pages.TransferPermits;
import nl.adgroot.bookingest.prompts.PromptTemplate;
import nl.adgroot.bookingest.render.CloudinaryRenderProvider;
import nl.adgroot.bookingest.storage.CloudinaryObjectStorage;

/** Wires the production adapters from configuration. */
public final class IngestionPipelineFactory {

  static final String COVER_PROMPT_RESOURCE = "cover-prompt.txt";

  private IngestionPipelineFactory() {
    // utility class
  }

  public static IngestionPipeline create(AppConfig cfg, AppExecutors executors) throws IOException {
    int transfers = AppExecutors.transferThreads(cfg);

    CloudinaryClient cloudinary = new CloudinaryClient(cfg.cloudinary, transfers);
    CloudinaryRenderProvider renderProvider = new CloudinaryRenderProvider(cfg.cloudinary, cloudinary);

    MetadataExtractor extractor = new MetadataExtractor(
        new OcrSpaceClient(cfg.ocr),
        ModelCandidatesFactory.create(cfg),
        PromptTemplate.fromResource(COVER_PROMPT_RESOURCE),
        cfg.ocr.language);

    PageMaterializer materializer = new PageMaterializer(
        renderProvider,
        new HttpPageDownloader(cfg.pages.downloadTimeoutSeconds, transfers),
        new CloudinaryObjectStorage(cloudinary),
        new PageIdGenerator(),
        new TransferPermits(transfers, true),
        executors.permitPoolExecutor(),
        cfg.pages.storageFolderPrefix,
        cfg.cloudinary.pageFormat);

    return new IngestionPipeline(renderProvider, extractor, materializer, scratchRoot(cfg));
  }

  static Path scratchRoot(AppConfig cfg) {
    String root = cfg.pages.scratchRoot;
    if (root == null || root.isBlank()) {
      return Path.of(System.getProperty("java.io.tmpdir"), "book-ingest");
    }
    return Path.of(root);
  }
}
