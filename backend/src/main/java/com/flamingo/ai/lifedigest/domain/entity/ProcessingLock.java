package com.flamingo.ai.lifedigest.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Marks a file as owned by a worker. The row exists only while the file is being processed. */
@Entity
@Table(name = "processing_locks")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProcessingLock {

  @Id
  @Column(name = "file_path", nullable = false)
  private String filePath;

  @Column(name = "owner_id", nullable = false)
  private String ownerId;

  @Column(name = "acquired_at", nullable = false)
  private LocalDateTime acquiredAt;
}
