package com.flamingo.ai.dealflow.domain.entity;

import com.flamingo.ai.dealflow.domain.converter.StringListConverter;
import com.flamingo.ai.dealflow.domain.enums.AlertKind;
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
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Extraction failure or ambiguity recorded for human resolution. Never deleted. */
@Entity
@Table(name = "processing_alerts")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProcessingAlert {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private AlertKind kind;

  /** Identity of the condition; raising an alert with an existing key is a no-op. */
  @Column(nullable = false, unique = true)
  private String dedupKey;

  private UUID documentId;

  private UUID dealId;

  private UUID factId;

  private UUID financingEventId;

  @Column(nullable = false)
  private String title;

  @Column(columnDefinition = "TEXT")
  private String description;

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> fieldsNeeded = new ArrayList<>();

  private String preambleHash;

  @Column(columnDefinition = "TEXT")
  private String preamblePreview;

  @Builder.Default private boolean resolved = false;

  private LocalDateTime resolvedAt;

  private String resolvedBy;

  @Column(columnDefinition = "TEXT")
  private String resolutionNotes;

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> resolutionFactIds = new ArrayList<>();

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }

  /** Appends resolver metadata. */
  public void resolve(String resolver, String notes, List<UUID> manualFactIds) {
    this.resolved = true;
    this.resolvedAt = LocalDateTime.now();
    this.resolvedBy = resolver;
    this.resolutionNotes = notes;
    this.resolutionFactIds = new ArrayList<>(manualFactIds.stream().map(UUID::toString).toList());
  }
}
