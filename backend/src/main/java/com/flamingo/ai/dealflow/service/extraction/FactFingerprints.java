package com.flamingo.ai.dealflow.service.extraction;

import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/** Stable fact identities; re-extracting the same evidence yields the same fingerprint. */
public final class FactFingerprints {

  private FactFingerprints() {}

  /** Fingerprint of an automatic fact anchored to a text span or table cell. */
  public static String automatic(
      UUID documentId, String source, FactKind kind, String anchor, Map<String, String> payload) {
    String material =
        documentId + "|" + source + "|" + kind + "|" + anchor + "|" + new TreeMap<>(payload);
    return Hashing.sha256().hashString(material, StandardCharsets.UTF_8).toString();
  }

  /** Manual facts are never de-duplicated against each other. */
  public static String manual() {
    return "manual:" + UUID.randomUUID();
  }
}
