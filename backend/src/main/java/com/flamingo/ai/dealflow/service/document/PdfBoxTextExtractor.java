package com.flamingo.ai.dealflow.service.document;

import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/** {@link PdfTextExtractor} backed by Apache PDFBox 3.x. */
@Component
@Slf4j
public class PdfBoxTextExtractor implements PdfTextExtractor {

  @Override
  public String extractText(byte[] pdf) throws IOException {
    try (PDDocument document = Loader.loadPDF(pdf)) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);
      String text = stripper.getText(document);
      log.debug("Extracted {} chars from {} PDF pages", text.length(), document.getNumberOfPages());
      return text;
    }
  }
}
