package nl.adgroot.bookingest;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import nl.adgroot.bookingest.errors.IngestionCancelledException;
import nl.adgroot.bookingest.errors.MetadataExtractionException;
import nl.adgroot.bookingest.errors.PageMaterializationException;
import nl.adgroot.bookingest.errors.Stage;
import nl.adgroot.bookingest.errors.UploadException;
import nl.adgroot.bookingest.fakes.FakeObjectStorage;
import nl.adgroot.bookingest.fakes.FakeOcrProvider;
import nl.adgroot.bookingest.fakes.FakePageDownloader;
import nl.adgroot.bookingest.fakes.FakeRenderProvider;
import nl.adgroot.bookingest.fakes.ScriptedTextProvider;
import nl.adgroot.bookingest.llm.ModelCandidate;
import nl.adgroot.bookingest.metadata.BookMetadata;
import nl.adgroot.bookingest.metadata.MetadataExtractor;
import nl.adgroot.bookingest.pages.PageArtifact;
import nl.adgroot.bookingest.pages.PageIdGenerator;
import nl.adgroot.bookingest.pages.PageMaterializer;
import nl.adgroot.bookingest.pages.PageStorageStrategy;
import nl.adgroot.bookingest.pages.TransferPermits;
import nl.adgroot.bookingest.pdf.Document;
import nl.adgroot.bookingest.prompts.PromptTemplate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IngestionPipelineTest {

  private static final String ANSWER = "{\"bookName\": \"Learning Docker\", \"authorName\": \"Pethuru Raj\"}";

  @TempDir
  Path scratchRoot;

  @TempDir
  Path inputDir;

  private final ExecutorService permitExec = Executors.newCachedThreadPool();
  private final ExecutorService transferExec = Executors.newFixedThreadPool(8);
  private final List<PipelineState> states = new CopyOnWriteArrayList<>();

  @AfterEach
  void tearDown() {
    permitExec.shutdownNow();
    transferExec.shutdownNow();
  }

  @Test
  void ingest_success_returnsMetadataAndAllPages_andRemovesWorkspace() throws Exception {
    FakeRenderProvider render = new FakeRenderProvider(7);
    FakeObjectStorage storage = new FakeObjectStorage();
    FakeOcrProvider ocr = FakeOcrProvider.returning("LEARNING DOCKER\nPethuru Raj");
    IngestionPipeline pipeline = pipeline(render, ocr, answering("m1"), Set.of(), storage);

    IngestionResult result = pipeline.ingest(document(), "42");

    assertEquals(new BookMetadata("Learning Docker", "Pethuru Raj"), result.metadata());
    assertEquals(IntStream.rangeClosed(1, 7).boxed().toList(),
        result.pages().stream().map(PageArtifact::pageNumber).toList());
    assertEquals(7, result.pages().stream().map(PageArtifact::pageId).distinct().count());
    assertEquals("books/1700000000000/scan_abc", result.originalSourceId());
    assertEquals("42", result.originalSourceVersion());
    assertEquals(PageStorageStrategy.REHOST_TO_STORAGE, result.strategy());

    assertEquals(List.of("https://render.test/books/1700000000000/scan_abc/v42/pg_1.jpg"), ocr.requested,
        "only the cover is sent to OCR");
    assertFalse(Files.exists(result.scratchFolder()));
    assertEquals(0, countEntries(scratchRoot));
    assertEquals(List.of(
        PipelineState.STARTED,
        PipelineState.REGISTERED,
        PipelineState.COVER_EXTRACTED,
        PipelineState.METADATA_RESOLVED,
        PipelineState.PAGES_MATERIALIZED,
        PipelineState.CLEANED,
        PipelineState.DONE), states);
  }

  @Test
  void ingest_pageDownloadFails_reportsPage_andStillRemovesWorkspace() throws Exception {
    FakeRenderProvider render = new FakeRenderProvider(5);
    FakeObjectStorage storage = new FakeObjectStorage();
    IngestionPipeline pipeline = pipeline(render, FakeOcrProvider.returning("cover"), answering("m1"),
        Set.of(3), storage);

    PageMaterializationException e = assertThrows(PageMaterializationException.class,
        () -> pipeline.ingest(document(), "42"));

    assertEquals(3, e.pageNumber());
    assertEquals(Stage.PAGES, e.stage());
    assertTrue(storage.objects.isEmpty());
    assertEquals(0, countEntries(scratchRoot), "scratch workspace must not leak on failure");
    assertEquals(PipelineState.FAILED, states.get(states.size() - 1));
  }

  @Test
  void ingest_twiceOnSameSource_neverReusesPageIdsOrObjectIds() throws Exception {
    FakeRenderProvider render = new FakeRenderProvider(10);
    FakeObjectStorage storage = new FakeObjectStorage();
    IngestionPipeline pipeline = pipeline(render, FakeOcrProvider.returning("cover"), answering("m1"),
        Set.of(), storage);
    Document doc = document();

    IngestionResult first = pipeline.ingest(doc, "42");
    IngestionResult second = pipeline.ingest(doc, "42");

    Set<String> ids = new HashSet<>();
    Set<String> objects = new HashSet<>();
    for (PageArtifact p : Stream.concat(first.pages().stream(), second.pages().stream()).toList()) {
      assertTrue(ids.add(p.pageId()), "duplicate pageId " + p.pageId());
      assertTrue(objects.add(p.storageObjectId()), "duplicate object " + p.storageObjectId());
    }
    assertEquals(20, storage.objects.size());
    assertNotEquals(first.scratchFolder(), second.scratchFolder());
  }

  @Test
  void extractOnly_passesRenderUrlsThrough() throws Exception {
    FakeRenderProvider render = new FakeRenderProvider(3);
    FakeObjectStorage storage = new FakeObjectStorage();
    IngestionPipeline pipeline = pipeline(render, FakeOcrProvider.returning("cover"), answering("m1"),
        Set.of(), storage);

    IngestionResult result = pipeline.extractOnly(document());

    assertEquals(PageStorageStrategy.PASSTHROUGH_RENDER_URL, result.strategy());
    assertEquals("https://render.test/books/1700000000000/scan_abc/v42/pg_2.jpg", result.pages().get(1).pageUrl());
    assertEquals(0, storage.uploadCalls.get());
    assertNotNull(result.scratchFolder());
    assertFalse(Files.exists(result.scratchFolder()));
  }

  @Test
  void ingest_sourceRejected_failsAtUpload_withoutOcr() throws Exception {
    FakeRenderProvider render = new FakeRenderProvider(3).rejecting();
    FakeOcrProvider ocr = FakeOcrProvider.returning("cover");
    IngestionPipeline pipeline = pipeline(render, ocr, answering("m1"), Set.of(), new FakeObjectStorage());

    UploadException e = assertThrows(UploadException.class, () -> pipeline.ingest(document(), "42"));

    assertEquals(Stage.UPLOAD, e.stage());
    assertTrue(ocr.requested.isEmpty());
    assertEquals(0, countEntries(scratchRoot));
    assertEquals(List.of(PipelineState.STARTED, PipelineState.FAILED), states);
  }

  @Test
  void ingest_allModelsFail_failsAtMetadata_andTransfersNothing() throws Exception {
    FakeRenderProvider render = new FakeRenderProvider(3);
    FakeObjectStorage storage = new FakeObjectStorage();
    IngestionPipeline pipeline = pipeline(render, FakeOcrProvider.returning("cover"),
        new ScriptedTextProvider(), Set.of(), storage);

    MetadataExtractionException e = assertThrows(MetadataExtractionException.class,
        () -> pipeline.ingest(document(), "42"));

    assertEquals(Stage.METADATA, e.stage());
    assertEquals(0, storage.uploadCalls.get());
    assertFalse(states.contains(PipelineState.METADATA_RESOLVED));
    assertEquals(0, countEntries(scratchRoot));
  }

  @Test
  void runAsync_cancelledBeforeStart_registersButDoesNoFurtherWork() throws Exception {
    FakeRenderProvider render = new FakeRenderProvider(3);
    FakeOcrProvider ocr = FakeOcrProvider.returning("cover");
    IngestionPipeline pipeline = pipeline(render, ocr, answering("m1"), Set.of(), new FakeObjectStorage());
    CancellationToken token = new CancellationToken();
    token.cancel();

    IngestionCancelledException e = assertThrows(IngestionCancelledException.class, () -> IngestionPipeline.await(
        pipeline.runAsync(document(), PageStorageStrategy.REHOST_TO_STORAGE, "42", token)));

    assertEquals(Stage.CANCELLED, e.stage());
    assertTrue(ocr.requested.isEmpty());
    assertEquals(0, countEntries(scratchRoot));
  }

  @Test
  void ingest_blankBookId_isRejectedBeforeAnyRemoteCall() throws Exception {
    FakeRenderProvider render = new FakeRenderProvider(3);
    FakeOcrProvider ocr = FakeOcrProvider.returning("cover");
    IngestionPipeline pipeline = pipeline(render, ocr, answering("m1"), Set.of(), new FakeObjectStorage());
    Document doc = document();

    assertThrows(IllegalArgumentException.class, () -> pipeline.ingest(doc, "  "));
    assertThrows(IllegalArgumentException.class, () -> pipeline.ingest(doc, null));

    assertEquals(0, render.registrations.get());
    assertTrue(ocr.requested.isEmpty());
    assertTrue(states.isEmpty());
    assertEquals(0, countEntries(scratchRoot));
  }

  private IngestionPipeline pipeline(
      FakeRenderProvider render,
      FakeOcrProvider ocr,
      ScriptedTextProvider llm,
      Set<Integer> failingDownloads,
      FakeObjectStorage storage
  ) {
    MetadataExtractor extractor = new MetadataExtractor(
        ocr,
        List.of(new ModelCandidate(llm, "m0"), new ModelCandidate(llm, "m1")),
        new PromptTemplate("{{content}}"),
        "eng");

    PageMaterializer materializer = new PageMaterializer(
        render,
        new FakePageDownloader(transferExec, failingDownloads, 0),
        storage,
        new PageIdGenerator(),
        new TransferPermits(4, true),
        permitExec,
        "books",
        "jpg");

    return new IngestionPipeline(render, extractor, materializer, scratchRoot, states::add);
  }

  private static ScriptedTextProvider answering(String model) {
    return new ScriptedTextProvider().answer(model, ANSWER);
  }

  private Document document() throws Exception {
    Path pdf = inputDir.resolve("book.pdf");
    if (!Files.exists(pdf)) {
      Files.writeString(pdf, "%PDF-1.4 fake");
    }
    return Document.of(pdf);
  }

  private static long countEntries(Path dir) throws Exception {
    try (Stream<Path> entries = Files.list(dir)) {
      return entries.collect(Collectors.toList()).size();
    }
  }
}
