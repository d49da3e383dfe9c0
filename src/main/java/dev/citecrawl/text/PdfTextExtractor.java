package dev.citecrawl.text;

import java.io.IOException;
import java.nio.file.Path;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Extracts plain text from PDF files with Apache PDFBox, one page after another. */
@Component
public class PdfTextExtractor {

  private static final Logger log = LoggerFactory.getLogger(PdfTextExtractor.class);

  /**
   * Extract the text of every page, pages separated by a newline.
   *
   * @param pdf path to the PDF file
   * @return the text, or an empty string if the file cannot be read as a PDF
   */
  public String extract(Path pdf) {
    try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
      PDFTextStripper stripper = new PDFTextStripper();
      StringBuilder text = new StringBuilder();
      for (int page = 1; page <= document.getNumberOfPages(); page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        String pageText = stripper.getText(document);
        if (pageText != null && !pageText.isBlank()) {
          if (text.length() > 0) {
            text.append('\n');
          }
          text.append(pageText.strip());
        }
      }
      return text.toString();
    } catch (IOException e) {
      log.warn("PDF extraction failed for {}: {}", pdf, e.getMessage());
      return "";
    }
  }
}
