package com.flamingo.ai.dealflow.service.normalize;

/**
 * Canonical visual text of a document plus a map from each text position back to a position in
 * the raw source.
 *
 * @param text normalized text
 * @param sourceOffsets source offset of every character of {@code text}
 */
public record NormalizedText(String text, int[] sourceOffsets) {

  /** Returns the first {@code window} characters (or the whole text when shorter). */
  public String prefix(int window) {
    return text.length() <= window ? text : text.substring(0, window);
  }

  /** Maps an inclusive start offset in the normalized text to the raw source. */
  public int sourceStart(int normalizedStart) {
    if (sourceOffsets.length == 0) {
      return 0;
    }
    int index = Math.max(0, Math.min(normalizedStart, sourceOffsets.length - 1));
    return sourceOffsets[index];
  }

  /** Maps an exclusive end offset in the normalized text to the raw source. */
  public int sourceEnd(int normalizedEnd) {
    if (sourceOffsets.length == 0 || normalizedEnd <= 0) {
      return 0;
    }
    int index = Math.min(normalizedEnd, sourceOffsets.length) - 1;
    return sourceOffsets[index] + 1;
  }

  public boolean isBlank() {
    return text.isBlank();
  }

  /** Number of whitespace-separated words. */
  public int wordCount() {
    String trimmed = text.trim();
    return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
  }
}
