package nl.adgroot.bookingest;

import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import nl.adgroot.bookingest.config.AppConfig;
import nl.adgroot.bookingest.config.ConfigLoader;
import nl.adgroot.bookingest.errors.IngestionException;
import nl.adgroot.bookingest.pdf.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Usage: {@code Main <pdf> [bookId] [--config <config.json>]}. Without a bookId the extract-only
 * flow runs; with one, every page is re-hosted under that id.
 */
public class Main {

  private static final Logger log = LoggerFactory.getLogger(Main.class);

  public static void main(String[] args) throws Exception {
    Path pdfPath = null;
    String bookId = null;
    Path configPath = null;

    for (int i = 0; i < args.length; i++) {
      if ("--config".equals(args[i]) && i + 1 < args.length) {
        configPath = Paths.get(args[++i]);
      } else if (pdfPath == null) {
        pdfPath = Paths.get(args[i]);
      } else if (bookId == null) {
        bookId = args[i];
      }
    }

    if (pdfPath == null) {
      System.err.println("Usage: Main <pdf> [bookId] [--config <config.json>]");
      System.exit(2);
      return;
    }

    AppConfig cfg = ConfigLoader.load(configPath != null ? configPath : classpathConfig());

    int exitCode = 0;
    try (AppExecutors exec = AppExecutors.create(cfg)) {
      IngestionPipeline pipeline = IngestionPipelineFactory.create(cfg, exec);
      Document document = Document.of(pdfPath);

      IngestionResult result = bookId == null
          ? pipeline.extractOnly(document)
          : pipeline.ingest(document, bookId);

      ObjectMapper mapper = new ObjectMapper()
          .enable(SerializationFeature.INDENT_OUTPUT);
      System.out.println(mapper.writeValueAsString(result));
    } catch (IngestionException e) {
      log.error("Ingestion failed at stage {}: {}", e.stage(), e.getMessage(), e);
      exitCode = 1;
    } catch (IllegalArgumentException e) {
      log.error("Invalid request: {}", e.getMessage());
      exitCode = 2;
    }
    System.exit(exitCode);
  }

  private static Path classpathConfig() throws Exception {
    URL resource = Main.class.getClassLoader().getResource("config.json");
    if (resource == null) {
      throw new IllegalStateException("No --config given and no config.json on the classpath");
    }
    return Paths.get(resource.toURI());
  }
}
