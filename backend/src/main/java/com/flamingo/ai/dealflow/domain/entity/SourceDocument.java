package com.flamingo.ai.dealflow.domain.entity;

import com.flamingo.ai.dealflow.domain.enums.DocumentKind;
import com.flamingo.ai.dealflow.domain.enums.DocumentStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A single filing or exhibit submitted by the document supplier. */
@Entity
@Table(
    name = "source_documents",
    uniqueConstraints = @UniqueConstraint(columnNames = {"accessionNumber", "sequence"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SourceDocument {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  /** Registry accession number of the filing this document belongs to. */
  @Column(nullable = false)
  private String accessionNumber;

  /** Exhibit sequence or file name within the filing; {@code 0} for the primary document. */
  @Column(nullable = false)
  private String sequence;

  /** Canonical identifier (CIK) of the registrant that filed the document. */
  private String registrantIdentifier;

  private String registrantName;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private DocumentKind kind;

  /** Exhibit description from the filing index, used to spot material exhibits. */
  private String description;

  @Column(nullable = false)
  private String mimeType;

  private LocalDate filedOn;

  @Column(columnDefinition = "TEXT")
  private String rawContent;

  @Column(columnDefinition = "TEXT")
  private String normalizedText;

  /** Normalizer version that produced {@link #normalizedText}. */
  private Integer normalizerVersion;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private DocumentStatus status = DocumentStatus.PENDING;

  @Column(columnDefinition = "TEXT")
  private String processingError;

  @Column(nullable = false, updatable = false)
  private LocalDateTime receivedAt;

  private LocalDateTime processedAt;

  @PrePersist
  protected void onCreate() {
    receivedAt = LocalDateTime.now();
  }

  /** Whether the document needs (re-)normalization under the given normalizer version. */
  public boolean needsNormalization(int currentVersion) {
    return normalizedText == null
        || normalizerVersion == null
        || normalizerVersion < currentVersion;
  }

  /** Stores normalized text produced by the given normalizer version. */
  public void applyNormalization(String text, int version) {
    this.normalizedText = text;
    this.normalizerVersion = version;
  }

  /** Marks the document as processing. */
  public void startProcessing() {
    this.status = DocumentStatus.PROCESSING;
  }

  /** Marks the document as extracted. */
  public void markExtracted() {
    this.status = DocumentStatus.EXTRACTED;
    this.processingError = null;
    this.processedAt = LocalDateTime.now();
  }

  /** Marks the document as failed with an error message. */
  public void markFailed(String errorMessage) {
    this.status = DocumentStatus.FAILED;
    this.processingError = errorMessage;
    this.processedAt = LocalDateTime.now();
  }

  /** Human-readable source reference, e.g. {@code 0001193125-24-000001/EX-2.1}. */
  public String sourceReference() {
    return accessionNumber + "/" + sequence;
  }
}
