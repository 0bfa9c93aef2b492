package com.flamingo.ai.dealflow.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** An institution participating in a financing event in a given role. */
@Entity
@Table(
    name = "financing_participants",
    indexes = @Index(name = "idx_participant_event", columnList = "financingEventId"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FinancingParticipant {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private UUID financingEventId;

  /** Fact the participant came from; null for participants typed into a manual fact. */
  private UUID sourceFactId;

  @Column(nullable = false)
  private String institutionNameRaw;

  private String institutionNameNormalized;

  private String role;

  private String roleNormalized;

  private Double roleWeight;

  @Column(precision = 20, scale = 2)
  private BigDecimal estimatedFee;

  private String tableCoordinates;
}
