package nl.adgroot.bookingest.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Pulls {@code bookName} / {@code authorName} out of a free-form model answer. The answer may wrap
 * the JSON in prose or markdown fences; the first balanced {@code {...}} block is used.
 */
public class BookMetadataParser {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static final class UnparsableAnswerException extends Exception {
    public UnparsableAnswerException(String message) {
      super(message);
    }

    public UnparsableAnswerException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public BookMetadata parse(String answer) throws UnparsableAnswerException {
    String block = firstBalancedObject(answer);
    if (block == null) {
      throw new UnparsableAnswerException("No JSON object in model answer");
    }

    JsonNode json;
    try {
      json = MAPPER.readTree(block);
    } catch (Exception e) {
      throw new UnparsableAnswerException("Model answer is not valid JSON", e);
    }

    String title = json.path("bookName").asText("").trim();
    String author = json.path("authorName").asText("").trim();
    if (title.isEmpty() || author.isEmpty()) {
      throw new UnparsableAnswerException("Incomplete book information: " + block);
    }
    return new BookMetadata(title, author);
  }

  /**
   * Returns the first {@code {...}} substring whose braces balance, ignoring braces inside JSON
   * string literals; {@code null} if there is none.
   */
  static String firstBalancedObject(String text) {
    if (text == null) return null;

    int start = text.indexOf('{');
    while (start >= 0) {
      int end = matchingBrace(text, start);
      if (end >= 0) {
        return text.substring(start, end + 1);
      }
      start = text.indexOf('{', start + 1);
    }
    return null;
  }

  private static int matchingBrace(String text, int start) {
    int depth = 0;
    boolean inString = false;
    boolean escaped = false;

    for (int i = start; i < text.length(); i++) {
      char c = text.charAt(i);
      if (inString) {
        if (escaped) {
          escaped = false;
        } else if (c == '\\') {
          escaped = true;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }

      if (c == '"') {
        inString = true;
      } else if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
        if (depth == 0) return i;
      }
    }
    return -1;
  }
}
