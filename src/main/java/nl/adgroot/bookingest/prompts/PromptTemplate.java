package nl.adgroot.bookingest.prompts;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/** Text with {@code {{name}}} placeholders. */
public class PromptTemplate {

  private final String template;

  public PromptTemplate(String template) {
    this.template = Objects.requireNonNull(template, "template");
  }

  public static PromptTemplate fromResource(String name) throws IOException {
    try (InputStream in = PromptTemplate.class.getClassLoader().getResourceAsStream(name)) {
      if (in == null) {
        throw new IOException("Prompt resource not found: " + name);
      }
      return new PromptTemplate(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }
  }

  /** Replaces every {@code {{key}}}; unknown placeholders are left as they are. */
  public String render(Map<String, String> values) {
    String out = template;
    for (Map.Entry<String, String> e : values.entrySet()) {
      out = out.replace("{{" + e.getKey() + "}}", e.getValue() == null ? "" : e.getValue());
    }
    return out;
  }
}
