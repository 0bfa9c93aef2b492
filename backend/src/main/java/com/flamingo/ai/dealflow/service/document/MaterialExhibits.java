package com.flamingo.ai.dealflow.service.document;

import com.flamingo.ai.dealflow.config.DealflowConfig;
import com.flamingo.ai.dealflow.domain.entity.SourceDocument;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Spots financing exhibits whose content a reviewer must see even when parsing fails. */
@Component
@RequiredArgsConstructor
public class MaterialExhibits {

  private final DealflowConfig config;

  /** Whether the exhibit description or file name carries a financing keyword. */
  public boolean isMaterial(SourceDocument document) {
    String label =
        (nullToEmpty(document.getDescription()) + " " + nullToEmpty(document.getSequence()))
            .toLowerCase(Locale.ROOT);
    return config.getMaterial().getKeywords().stream()
        .anyMatch(keyword -> label.contains(keyword.toLowerCase(Locale.ROOT)));
  }

  /** Whether extracted text is too thin to trust. */
  public boolean isPoorText(int wordCount) {
    return wordCount < config.getMaterial().getMinWords();
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
