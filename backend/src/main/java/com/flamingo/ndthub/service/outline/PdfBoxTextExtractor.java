package com.flamingo.ndthub.service.outline;

import com.flamingo.ndthub.exception.DocumentProcessingException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/** {@link PdfTextExtractor} backed by Apache PDFBox 3.x, stripping one page at a time. */
@Component
@Slf4j
public class PdfBoxTextExtractor implements PdfTextExtractor {

  @Override
  public ExtractedPages extract(byte[] pdfBytes, String fileName) {
    try (PDDocument pdfDoc = Loader.loadPDF(pdfBytes)) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);

      int pageCount = pdfDoc.getNumberOfPages();
      List<String> pageTexts = new ArrayList<>(pageCount);
      for (int page = 1; page <= pageCount; page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        String text = stripper.getText(pdfDoc);
        pageTexts.add(text != null ? text : "");
      }

      log.debug("Extracted text from {} pages of {}", pageCount, fileName);
      return new ExtractedPages(pageTexts);
    } catch (IOException e) {
      log.warn("PDFBox could not read {}: {}", fileName, e.getMessage());
      throw new DocumentProcessingException(fileName, "Failed to parse PDF: " + e.getMessage(), e);
    }
  }
}
