package com.flamingo.ai.docextract.domain.entity;

import com.flamingo.ai.docextract.domain.converter.ExtractionStatusConverter;
import com.flamingo.ai.docextract.domain.enums.ExtractionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * An uploaded file and the state of its extraction job.
 *
 * <p>The overall status and the two sub-pipeline statuses move independently. The overall status is
 * terminal once it reaches {@link ExtractionStatus#COMPLETED} or {@link ExtractionStatus#ERROR}.
 */
@Entity
@Table(name = "document_extraction_files")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExtractionFile {

  @Id private UUID id;

  @Column(name = "user_id")
  private String userId;

  private String name;

  @Column(name = "mime_type")
  private String mimeType;

  @Column(name = "file_url", columnDefinition = "TEXT")
  private String fileUrl;

  @Convert(converter = ExtractionStatusConverter.class)
  @Column(name = "extraction_status")
  @Builder.Default
  private ExtractionStatus extractionStatus = ExtractionStatus.PENDING;

  /** Status of the whole-document transcription pipeline. */
  @Convert(converter = ExtractionStatusConverter.class)
  @Column(name = "gemini_extraction_status")
  private ExtractionStatus fullTextStatus;

  @Convert(converter = ExtractionStatusConverter.class)
  @Column(name = "layout_extraction_status")
  private ExtractionStatus layoutStatus;

  /** Layout pages and blocks as JSON. */
  @Column(name = "layout_data", columnDefinition = "TEXT")
  private String layoutData;

  /** Refined per-block text as JSON. */
  @Column(name = "extracted_text", columnDefinition = "TEXT")
  private String extractedText;

  @Column(name = "gemini_full_text", columnDefinition = "TEXT")
  private String fullText;

  @Column(name = "error_message", columnDefinition = "TEXT")
  private String errorMessage;

  @Column(name = "gemini_error_message", columnDefinition = "TEXT")
  private String fullTextErrorMessage;

  @Column(name = "layout_error_message", columnDefinition = "TEXT")
  private String layoutErrorMessage;

  @Column(name = "created_at", updatable = false)
  private LocalDateTime createdAt;

  @Column(name = "updated_at")
  private LocalDateTime updatedAt;

  @Column(name = "completed_at")
  private LocalDateTime completedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
    if (updatedAt == null) {
      updatedAt = createdAt;
    }
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  public boolean isProcessing() {
    return extractionStatus == ExtractionStatus.PROCESSING;
  }
}
