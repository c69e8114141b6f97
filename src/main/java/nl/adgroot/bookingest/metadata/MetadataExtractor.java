package nl.adgroot.bookingest.metadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import nl.adgroot.bookingest.CancellationToken;
import nl.adgroot.bookingest.errors.Failures;
import nl.adgroot.bookingest.errors.IngestionCancelledException;
import nl.adgroot.bookingest.errors.MetadataExtractionException;
import nl.adgroot.bookingest.errors.OcrException;
import nl.adgroot.bookingest.llm.ModelCandidate;
import nl.adgroot.bookingest.ocr.OcrProvider;
import nl.adgroot.bookingest.prompts.PromptTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cover image to {@link BookMetadata}: one OCR attempt, then the OCR text goes through the model
 * candidates in order until one gives a complete answer.
 */
public class MetadataExtractor {

  private static final Logger log = LoggerFactory.getLogger(MetadataExtractor.class);

  private final OcrProvider ocr;
  private final List<ModelCandidate> candidates;
  private final PromptTemplate promptTemplate;
  private final BookMetadataParser parser;
  private final String language;

  public MetadataExtractor(
      OcrProvider ocr,
      List<ModelCandidate> candidates,
      PromptTemplate promptTemplate,
      String language
  ) {
    this(ocr, candidates, promptTemplate, new BookMetadataParser(), language);
  }

  public MetadataExtractor(
      OcrProvider ocr,
      List<ModelCandidate> candidates,
      PromptTemplate promptTemplate,
      BookMetadataParser parser,
      String language
  ) {
    if (candidates == null || candidates.isEmpty()) {
      throw new IllegalArgumentException("At least one model candidate is required");
    }
    this.ocr = ocr;
    this.candidates = List.copyOf(candidates);
    this.promptTemplate = promptTemplate;
    this.parser = parser;
    this.language = language;
  }

  public CompletableFuture<BookMetadata> extract(String coverLocator, CancellationToken token) {
    return recognizeCover(coverLocator, token)
        .thenCompose(text -> resolve(text, token));
  }

  /** Structured-extraction step: first candidate with a complete answer wins. */
  public CompletableFuture<BookMetadata> resolve(String coverText, CancellationToken token) {
    String prompt = promptTemplate.render(Map.of("content", coverText));
    return tryCandidate(0, prompt, new ArrayList<>(), token);
  }

  /** OCR step: a single attempt; blank text is a failure. */
  public CompletableFuture<String> recognizeCover(String coverLocator, CancellationToken token) {
    CompletableFuture<String> call;
    try {
      token.throwIfCancelled("OCR");
      call = ocr.recognize(coverLocator, language);
    } catch (RuntimeException e) {
      call = CompletableFuture.failedFuture(e);
    }

    return call.handle((text, ex) -> {
      if (ex != null) {
        Throwable cause = Failures.unwrap(ex);
        if (cause instanceof OcrException || cause instanceof IngestionCancelledException) {
          throw (RuntimeException) cause;
        }
        throw new OcrException("OCR failed: " + cause.getMessage(), cause);
      }
      String trimmed = text == null ? "" : text.trim();
      if (trimmed.isEmpty()) {
        throw new OcrException("OCR returned no text for " + coverLocator);
      }
      log.debug("OCR extracted {} characters from the cover", trimmed.length());
      return trimmed;
    });
  }

  private CompletableFuture<BookMetadata> tryCandidate(
      int index,
      String prompt,
      List<Throwable> failures,
      CancellationToken token
  ) {
    if (index >= candidates.size()) {
      return CompletableFuture.failedFuture(exhausted(failures));
    }

    ModelCandidate candidate = candidates.get(index);
    CompletableFuture<String> call;
    try {
      token.throwIfCancelled("model candidate " + candidate);
      call = candidate.generate(prompt);
    } catch (IngestionCancelledException e) {
      return CompletableFuture.failedFuture(e);
    } catch (RuntimeException e) {
      call = CompletableFuture.failedFuture(e);
    }

    return call
        .handle((answer, ex) -> {
          Throwable failure = ex == null ? null : Failures.unwrap(ex);
          if (failure == null) {
            try {
              BookMetadata metadata = parser.parse(answer);
              log.info("Metadata resolved by {}: \"{}\" by {}", candidate, metadata.title(), metadata.author());
              return CompletableFuture.completedFuture(metadata);
            } catch (BookMetadataParser.UnparsableAnswerException e) {
              failure = e;
            }
          }

          log.warn("Model candidate {} ({}/{}) failed: {}",
              candidate, index + 1, candidates.size(), failure.getMessage());
          failures.add(failure);
          return tryCandidate(index + 1, prompt, failures, token);
        })
        .thenCompose(f -> f);
  }

  private static MetadataExtractionException exhausted(List<Throwable> failures) {
    Throwable last = failures.get(failures.size() - 1);
    MetadataExtractionException e = new MetadataExtractionException(
        "All " + failures.size() + " model candidates failed; last error: " + last.getMessage(), last);
    for (int i = 0; i < failures.size() - 1; i++) {
      e.addSuppressed(failures.get(i));
    }
    return e;
  }
}
