package com.flamingo.ai.dealflow.service.document;

import java.io.IOException;

/** Extracts the text layer of a PDF document. */
public interface PdfTextExtractor {

  /**
   * Extracts plain text from PDF bytes.
   *
   * @param pdf the PDF content
   * @return extracted text, possibly empty for scanned documents
   * @throws IOException if the bytes are not a readable PDF
   */
  String extractText(byte[] pdf) throws IOException;
}
