package com.flamingo.ai.dealflow.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** Audit row written for every deal merge. */
@Entity
@Table(name = "deal_merge_records")
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DealMergeRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private UUID survivingDealId;

  @Column(nullable = false)
  private UUID supersededDealId;

  @Column(nullable = false)
  private String supersededDealKey;

  private int reassignedFactCount;

  private int reassignedEventCount;

  @Column(nullable = false)
  private String mergedBy;

  @Column(columnDefinition = "TEXT")
  private String reason;

  @Column(nullable = false, updatable = false)
  private LocalDateTime mergedAt;

  @PrePersist
  protected void onCreate() {
    mergedAt = LocalDateTime.now();
  }
}
