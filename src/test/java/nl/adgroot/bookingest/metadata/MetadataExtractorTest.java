package nl.adgroot.bookingest.metadata;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionException;

import nl.adgroot.bookingest.CancellationToken;
import nl.adgroot.bookingest.errors.Failures;
import nl.adgroot.bookingest.errors.IngestionCancelledException;
import nl.adgroot.bookingest.errors.MetadataExtractionException;
import nl.adgroot.bookingest.errors.OcrException;
import nl.adgroot.bookingest.errors.Stage;
import nl.adgroot.bookingest.fakes.FakeOcrProvider;
import nl.adgroot.bookingest.fakes.ScriptedTextProvider;
import nl.adgroot.bookingest.llm.ModelCandidate;
import nl.adgroot.bookingest.llm.ProviderException;
import nl.adgroot.bookingest.prompts.PromptTemplate;
import org.junit.jupiter.api.Test;

class MetadataExtractorTest {

  private static final String COVER = "https://render.test/pg_1.jpg";
  private static final String GOOD = "{\"bookName\": \"Dune\", \"authorName\": \"Frank Herbert\"}";

  private final PromptTemplate template = new PromptTemplate("Cover text:\n{{content}}");

  @Test
  void extract_firstCandidatesFailLastSucceeds_usesLastAnswer() {
    ScriptedTextProvider llm = new ScriptedTextProvider().answer("c", GOOD);
    MetadataExtractor extractor = extractor(FakeOcrProvider.returning("DUNE\nFrank Herbert"), llm, "a", "b", "c");

    BookMetadata m = extractor.extract(COVER, new CancellationToken()).join();

    assertEquals(new BookMetadata("Dune", "Frank Herbert"), m);
    assertEquals(List.of("a", "b", "c"), llm.calls, "candidates are tried in configured order");
  }

  @Test
  void extract_firstCandidateSucceeds_doesNotCallOthers() {
    ScriptedTextProvider llm = new ScriptedTextProvider().answer("a", GOOD).answer("b", GOOD);
    MetadataExtractor extractor = extractor(FakeOcrProvider.returning("DUNE"), llm, "a", "b");

    extractor.extract(COVER, new CancellationToken()).join();

    assertEquals(List.of("a"), llm.calls);
  }

  @Test
  void extract_allCandidatesFail_reportsLastFailureAsCause() {
    ScriptedTextProvider llm = new ScriptedTextProvider();
    MetadataExtractor extractor = extractor(FakeOcrProvider.returning("DUNE"), llm, "a", "b", "c");

    CompletionException ex = assertThrows(CompletionException.class,
        () -> extractor.extract(COVER, new CancellationToken()).join());

    MetadataExtractionException e = assertInstanceOf(MetadataExtractionException.class, Failures.unwrap(ex));
    assertEquals(Stage.METADATA, e.stage());
    ProviderException last = assertInstanceOf(ProviderException.class, e.getCause());
    assertEquals("c", last.modelName());
    assertEquals(2, e.getSuppressed().length, "earlier failures are kept as suppressed");
    assertEquals(List.of("a", "b", "c"), llm.calls, "each candidate is tried exactly once");
  }

  @Test
  void extract_incompleteAnswer_fallsBackToNextCandidate() {
    ScriptedTextProvider llm = new ScriptedTextProvider()
        .answer("a", "{\"bookName\": \"Dune\"}")
        .answer("b", "no json at all")
        .answer("c", GOOD);
    MetadataExtractor extractor = extractor(FakeOcrProvider.returning("DUNE"), llm, "a", "b", "c");

    BookMetadata m = extractor.extract(COVER, new CancellationToken()).join();

    assertEquals("Frank Herbert", m.author());
    assertEquals(3, llm.calls.size());
  }

  @Test
  void extract_promptEmbedsTrimmedOcrText() {
    ScriptedTextProvider llm = new ScriptedTextProvider().answer("a", GOOD);
    MetadataExtractor extractor = extractor(FakeOcrProvider.returning("  \n DUNE by Frank Herbert \n"), llm, "a");

    extractor.extract(COVER, new CancellationToken()).join();

    assertEquals("Cover text:\nDUNE by Frank Herbert", llm.prompts.get(0));
  }

  @Test
  void extract_blankOcrText_failsWithOcrException_andSkipsModels() {
    ScriptedTextProvider llm = new ScriptedTextProvider().answer("a", GOOD);
    MetadataExtractor extractor = extractor(FakeOcrProvider.returning(" \n\t "), llm, "a");

    CompletionException ex = assertThrows(CompletionException.class,
        () -> extractor.extract(COVER, new CancellationToken()).join());

    assertInstanceOf(OcrException.class, Failures.unwrap(ex));
    assertTrue(llm.calls.isEmpty());
  }

  @Test
  void extract_ocrBackendError_failsWithOcrException() {
    ScriptedTextProvider llm = new ScriptedTextProvider().answer("a", GOOD);
    MetadataExtractor extractor = extractor(FakeOcrProvider.failing(), llm, "a");

    CompletionException ex = assertThrows(CompletionException.class,
        () -> extractor.extract(COVER, new CancellationToken()).join());

    assertEquals(Stage.OCR, assertInstanceOf(OcrException.class, Failures.unwrap(ex)).stage());
  }

  @Test
  void extract_cancelledBeforeStart_doesNotCallOcr() {
    FakeOcrProvider ocr = FakeOcrProvider.returning("DUNE");
    MetadataExtractor extractor = extractor(ocr, new ScriptedTextProvider(), "a");
    CancellationToken token = new CancellationToken();
    token.cancel();

    CompletionException ex = assertThrows(CompletionException.class,
        () -> extractor.extract(COVER, token).join());

    assertInstanceOf(IngestionCancelledException.class, Failures.unwrap(ex));
    assertTrue(ocr.requested.isEmpty());
  }

  @Test
  void constructor_withoutCandidates_isRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new MetadataExtractor(FakeOcrProvider.returning("x"), List.of(), template, "eng"));
  }

  private MetadataExtractor extractor(FakeOcrProvider ocr, ScriptedTextProvider llm, String... models) {
    List<ModelCandidate> candidates = Arrays.stream(models)
        .map(m -> new ModelCandidate(llm, m))
        .toList();
    return new MetadataExtractor(ocr, candidates, template, "eng");
  }
}
