package com.flamingo.ai.dealflow.domain.entity;

import com.flamingo.ai.dealflow.domain.enums.AttachmentDisposition;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Ownership record linking an atomic fact to a deal. One row per fact at most. */
@Entity
@Table(
    name = "fact_attachments",
    indexes = {
      @Index(name = "idx_attachment_fact", columnList = "factId", unique = true),
      @Index(name = "idx_attachment_deal", columnList = "dealId")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FactAttachment {

  public static final String CLUSTERING = "clustering";
  public static final String RECONCILIATION = "reconciliation";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false, unique = true)
  private UUID factId;

  /** Owning deal; null for dismissed facts that never attached. */
  private UUID dealId;

  /** Document of the fact, denormalized for per-document lookups. */
  private UUID documentId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private AttachmentDisposition disposition = AttachmentDisposition.ATTACHED;

  /** Stage or reviewer that created the attachment. */
  private String attachedBy;

  @Column(columnDefinition = "TEXT")
  private String note;

  @Column(nullable = false)
  private LocalDateTime attachedAt;

  @PrePersist
  protected void onCreate() {
    if (attachedAt == null) {
      attachedAt = LocalDateTime.now();
    }
  }

  /** Creates an attachment of {@code fact} to {@code dealId}. */
  public static FactAttachment attach(AtomicFact fact, UUID dealId, String attachedBy) {
    return FactAttachment.builder()
        .factId(fact.getId())
        .dealId(dealId)
        .documentId(fact.getDocumentId())
        .attachedBy(attachedBy)
        .attachedAt(LocalDateTime.now())
        .build();
  }

  public boolean isAttached() {
    return disposition == AttachmentDisposition.ATTACHED;
  }

  /** Reassigns this attachment to the surviving deal of a merge. */
  public void reassignTo(UUID survivingDealId) {
    this.dealId = survivingDealId;
  }

  /** Sets the fact aside after human review. */
  public void dismiss(String reviewer, String reason) {
    this.disposition = AttachmentDisposition.DISMISSED;
    this.attachedBy = reviewer;
    this.note = reason;
  }
}
