package com.flamingo.ai.dealflow.domain.entity;

import com.flamingo.ai.dealflow.domain.enums.ClusteringKeyTier;
import com.flamingo.ai.dealflow.domain.enums.DealState;
import com.flamingo.ai.dealflow.domain.enums.MarketTag;
import com.flamingo.ai.dealflow.domain.enums.SponsorBacking;
import com.flamingo.ai.dealflow.exception.InvalidDealStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Clustered aggregate representing one M&amp;A transaction and its financing. */
@Entity
@Table(name = "deals")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Deal {

  /** Review reason recorded for deals keyed on names only. */
  public static final String NAME_KEY_REVIEW_REASON = "Keyed on party names only";

  static final String MERGED_KEY_SUFFIX = "#merged:";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Version private Long version;

  @Column(nullable = false, unique = true)
  private String dealKey;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private ClusteringKeyTier keyTier;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private DealState state = DealState.CANDIDATE;

  /** State held before the deal was sent to review; restored on resume. */
  @Enumerated(EnumType.STRING)
  private DealState stateBeforeReview;

  /** Set when the deal is keyed on names only or otherwise needs a reviewer's confirmation. */
  @Builder.Default private boolean reviewRequired = false;

  @Column(columnDefinition = "TEXT")
  private String reviewReason;

  /** Why the deal is in {@link DealState#NEEDS_REVIEW}. */
  @Column(columnDefinition = "TEXT")
  private String conflictReason;

  private String acquirerIdentifier;
  private String acquirerNameRaw;
  private String acquirerNameDisplay;
  private String acquirerNameNormalized;
  private Double acquirerConfidence;

  /** Whether the acquirer identity came from a manual fact; automatic facts never replace it. */
  @Builder.Default private boolean acquirerManual = false;

  private String targetIdentifier;
  private String targetNameRaw;
  private String targetNameDisplay;
  private String targetNameNormalized;
  private Double targetConfidence;

  @Builder.Default private boolean targetManual = false;

  private String sponsorNameRaw;
  private String sponsorNameDisplay;
  private String sponsorNameNormalized;
  private Double sponsorConfidence;
  private Boolean sponsorUnresolved;

  private LocalDate agreementDate;
  private Double agreementDateConfidence;

  @Column(precision = 20, scale = 2)
  private BigDecimal dealValue;

  private Double dealValueConfidence;

  @Enumerated(EnumType.STRING)
  @Builder.Default
  private SponsorBacking sponsorBacking = SponsorBacking.UNKNOWN;

  @Enumerated(EnumType.STRING)
  private MarketTag marketTag;

  @Column(precision = 20, scale = 2)
  private BigDecimal advisoryFeeEstimate;

  @Column(precision = 20, scale = 2)
  private BigDecimal underwritingFeeEstimate;

  /** Surviving deal after a merge; set only on superseded deals. */
  private UUID mergedIntoDealId;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  private LocalDateTime promotedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  /** Whether this deal has been superseded by a merge. */
  public boolean isSuperseded() {
    return mergedIntoDealId != null;
  }

  /** Promotes a candidate deal to {@link DealState#OPEN}. */
  public void promote() {
    if (state != DealState.CANDIDATE) {
      throw new InvalidDealStateException(id, state, "promote");
    }
    this.state = DealState.OPEN;
    this.promotedAt = LocalDateTime.now();
  }

  /** Sends the deal to review, remembering the state to resume to. */
  public void sendToReview(String reason) {
    if (state != DealState.NEEDS_REVIEW) {
      this.stateBeforeReview = state;
      this.state = DealState.NEEDS_REVIEW;
    }
    this.conflictReason = reason;
  }

  /**
   * Resumes a deal held for review.
   *
   * @param resumeTo target state, or null to restore the state held before review
   */
  public void resume(DealState resumeTo) {
    if (state != DealState.NEEDS_REVIEW) {
      throw new InvalidDealStateException(id, state, "resume");
    }
    DealState next = resumeTo != null ? resumeTo : stateBeforeReview;
    if (next == null || next == DealState.NEEDS_REVIEW) {
      next = DealState.CANDIDATE;
    }
    this.state = next;
    this.stateBeforeReview = null;
    this.conflictReason = null;
  }

  /** Freezes the deal against automatic attachment. */
  public void lock() {
    if (isSuperseded()) {
      throw new InvalidDealStateException(id, state, "lock");
    }
    this.state = DealState.LOCKED;
  }

  /** Closes the deal. */
  public void close() {
    if (state == DealState.LOCKED) {
      throw new InvalidDealStateException(id, state, "close");
    }
    this.state = DealState.CLOSED;
  }

  /**
   * Marks this deal as superseded by {@code survivorId}. The key gets a merge suffix so the
   * survivor may take it over.
   */
  public void supersedeBy(UUID survivorId) {
    if (!state.acceptsFacts()) {
      throw new InvalidDealStateException(id, state, "merge");
    }
    this.mergedIntoDealId = survivorId;
    this.dealKey = dealKey + MERGED_KEY_SUFFIX + survivorId;
    this.state = DealState.CLOSED;
  }

  /** Replaces the clustering key. */
  public void rekey(String newKey, ClusteringKeyTier tier) {
    this.dealKey = newKey;
    this.keyTier = tier;
    if (tier != ClusteringKeyTier.NAMES && NAME_KEY_REVIEW_REASON.equals(reviewReason)) {
      this.reviewRequired = false;
      this.reviewReason = null;
    }
  }
}
