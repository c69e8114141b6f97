package nl.adgroot.bookingest.pdf;

import java.io.IOException;
import java.nio.file.Path;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;

public class PdfPageCounter {

  /**
   * Opens the PDF with PDFBox and returns its number of pages.
   *
   * @throws IOException if the file is missing or not a readable PDF
   */
  public int countPages(Path pdfPath) throws IOException {
    try (PDDocument document = Loader.loadPDF(pdfPath.toFile())) {
      return document.getNumberOfPages();
    }
  }
}
