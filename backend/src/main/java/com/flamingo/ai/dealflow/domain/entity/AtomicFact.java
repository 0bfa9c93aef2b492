package com.flamingo.ai.dealflow.domain.entity;

import com.flamingo.ai.dealflow.domain.converter.FactPayloadConverter;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.domain.enums.FactProvenance;
import com.flamingo.ai.dealflow.domain.enums.PartyRole;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * Immutable, evidence-linked unit of extracted information.
 *
 * <p>Facts never reference a deal directly; attachment lives in {@link FactAttachment} so merges
 * only reassign attachment rows. Corrections are new facts with {@link FactProvenance#MANUAL}.
 */
@Entity
@Immutable
@Table(
    name = "atomic_facts",
    indexes = {
      @Index(name = "idx_fact_document", columnList = "documentId"),
      @Index(name = "idx_fact_fingerprint", columnList = "fingerprint", unique = true)
    })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class AtomicFact {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private FactKind kind;

  /** Source document; null for manual facts entered directly against a deal. */
  private UUID documentId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private FactProvenance provenance = FactProvenance.AUTOMATIC;

  /** Rule name that produced the fact, or {@code manual}. */
  @Column(nullable = false)
  private String extractionSource;

  @Column(nullable = false)
  private double confidence;

  @Convert(converter = FactPayloadConverter.class)
  @Column(columnDefinition = "TEXT", nullable = false)
  private Map<String, String> payload;

  /** Evidence span in the normalized text (inclusive start, exclusive end). */
  private Integer evidenceStart;

  private Integer evidenceEnd;

  /** Evidence span mapped back to the raw source markup. */
  private Integer sourceStart;

  private Integer sourceEnd;

  /** Table cell coordinates for table-derived facts, e.g. {@code t0:r3:c1}. */
  private String tableCoordinates;

  @Column(columnDefinition = "TEXT")
  private String evidenceSnippet;

  /** Filing date of the source document, or the entry date of a manual fact. */
  private LocalDate observedOn;

  /** Deal a manual correction is aimed at, if entered against a deal. */
  private UUID targetDealId;

  /** Alert whose resolution produced this manual fact. */
  private UUID sourceAlertId;

  private String enteredBy;

  @Column(columnDefinition = "TEXT")
  private String note;

  /** Stable identity of an automatic fact; re-extraction of the same span is a no-op. */
  @Column(nullable = false, unique = true)
  private String fingerprint;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
  }

  public boolean isManual() {
    return provenance == FactProvenance.MANUAL;
  }

  /** Confidence used for ranking; manual facts outrank any automatic fact. */
  public double effectiveConfidence() {
    return isManual() ? Double.POSITIVE_INFINITY : confidence;
  }

  /** Returns a payload value, or empty when absent or blank. */
  public Optional<String> payloadValue(String key) {
    if (payload == null) {
      return Optional.empty();
    }
    String value = payload.get(key);
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
  }

  /** Party role carried by identity facts; {@link PartyRole#UNKNOWN} otherwise. */
  public PartyRole partyRole() {
    if (kind == null || !kind.isIdentity()) {
      return PartyRole.UNKNOWN;
    }
    return payloadValue(PayloadKeys.ROLE).map(PartyRole::valueOf).orElse(PartyRole.UNKNOWN);
  }
}
