package com.flamingo.ai.dealflow.service.extraction;

import org.apache.commons.text.similarity.LevenshteinDistance;

/** Edit-distance similarity of normalized names, in [0, 1]. */
public final class NameSimilarity {

  private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

  private NameSimilarity() {}

  /** One minus the edit distance over the longer length; 0 when either side is blank. */
  public static double ratio(String left, String right) {
    if (left == null || right == null || left.isBlank() || right.isBlank()) {
      return 0.0;
    }
    if (left.equals(right)) {
      return 1.0;
    }
    int longest = Math.max(left.length(), right.length());
    return 1.0 - (double) LEVENSHTEIN.apply(left, right) / longest;
  }
}
