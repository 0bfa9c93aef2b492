package com.flamingo.ai.dealflow.domain.entity;

import com.flamingo.ai.dealflow.domain.converter.StringListConverter;
import com.flamingo.ai.dealflow.domain.enums.InstrumentFamily;
import com.flamingo.ai.dealflow.domain.enums.MarketTag;
import com.flamingo.ai.dealflow.domain.enums.ReconciliationStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A financing event assembled from a financing fact; owned by a deal once reconciled. */
@Entity
@Table(name = "financing_events")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FinancingEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  /** The {@code FINANCING_MENTION} fact this event was assembled from. */
  @Column(nullable = false, unique = true)
  private UUID sourceFactId;

  private UUID documentId;

  @Enumerated(EnumType.STRING)
  @Builder.Default
  private InstrumentFamily instrumentFamily = InstrumentFamily.UNKNOWN;

  /** Instrument wording as found, e.g. {@code Senior Notes} or {@code Term Loan B}. */
  private String instrumentType;

  @Enumerated(EnumType.STRING)
  private MarketTag marketTag;

  @Column(precision = 20, scale = 2)
  private BigDecimal amount;

  private String interestRate;

  private Integer maturityYear;

  @Column(columnDefinition = "TEXT")
  private String purpose;

  private String purposeTargetNormalized;

  /** Normalized registrant name of the issuing document; the acquirer-side signal. */
  private String issuerNameNormalized;

  private String issuerIdentifier;

  /** Normalized sponsor names mentioned in the issuing document. */
  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> sponsorNamesNormalized = new ArrayList<>();

  @Column(columnDefinition = "TEXT")
  private String evidenceSnippet;

  private UUID dealId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private ReconciliationStatus reconciliationStatus = ReconciliationStatus.UNLINKED;

  private Double reconciliationConfidence;

  @Column(columnDefinition = "TEXT")
  private String reconciliationExplanation;

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> candidateDealIds = new ArrayList<>();

  @Column(precision = 20, scale = 2)
  private BigDecimal modeledFee;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime reconciledAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }

  public boolean isLinked() {
    return reconciliationStatus == ReconciliationStatus.LINKED;
  }

  /** Links the event to a deal. */
  public void link(UUID dealId, double confidence, String explanation) {
    this.dealId = dealId;
    this.reconciliationStatus = ReconciliationStatus.LINKED;
    this.reconciliationConfidence = confidence;
    this.reconciliationExplanation = explanation;
    this.candidateDealIds = new ArrayList<>();
    this.reconciledAt = LocalDateTime.now();
  }

  /** Holds the event for review with the given candidate deals. */
  public void holdForReview(List<UUID> candidates, double confidence, String explanation) {
    this.dealId = null;
    this.reconciliationStatus = ReconciliationStatus.PENDING_REVIEW;
    this.reconciliationConfidence = confidence;
    this.reconciliationExplanation = explanation;
    this.candidateDealIds = new ArrayList<>(candidates.stream().map(UUID::toString).toList());
    this.reconciledAt = LocalDateTime.now();
  }
}
