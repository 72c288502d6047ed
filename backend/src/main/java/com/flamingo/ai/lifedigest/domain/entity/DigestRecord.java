package com.flamingo.ai.lifedigest.domain.entity;

import com.flamingo.ai.lifedigest.domain.enums.DigestStatus;
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
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Status and output of one digester for one file. At most one row per (file, digester). */
@Entity
@Table(
    name = "digests",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_digests_file_digester",
            columnNames = {"file_path", "digester"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DigestRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "file_path", nullable = false)
  private String filePath;

  @Column(nullable = false)
  private String digester;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private DigestStatus status = DigestStatus.PENDING;

  /** Opaque text or JSON payload; null when the digester had nothing to produce. */
  @Column(columnDefinition = "TEXT")
  private String content;

  @Column(columnDefinition = "TEXT")
  private String error;

  @Column(nullable = false)
  @Builder.Default
  private int attempts = 0;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(nullable = false)
  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    if (createdAt == null) {
      createdAt = now;
    }
    if (updatedAt == null) {
      updatedAt = now;
    }
  }

  public boolean isCompleted() {
    return status == DigestStatus.COMPLETED;
  }

  public boolean hasContent() {
    return content != null && !content.isEmpty();
  }

  public void markInProgress(LocalDateTime now) {
    this.status = DigestStatus.IN_PROGRESS;
    this.updatedAt = now;
  }

  public void markCompleted(String content, LocalDateTime now) {
    this.status = DigestStatus.COMPLETED;
    this.content = content;
    this.error = null;
    this.attempts = 0;
    this.updatedAt = now;
  }

  public void markFailed(String error, LocalDateTime now) {
    this.status = DigestStatus.FAILED;
    this.error = error;
    this.attempts = attempts + 1;
    this.updatedAt = now;
  }

  public void markSkipped(LocalDateTime now) {
    this.status = DigestStatus.SKIPPED;
    this.updatedAt = now;
  }

  /** Puts the record back in the queue with a fresh attempt budget. */
  public void resetToPending(LocalDateTime now) {
    this.status = DigestStatus.PENDING;
    this.error = null;
    this.attempts = 0;
    this.updatedAt = now;
  }
}
