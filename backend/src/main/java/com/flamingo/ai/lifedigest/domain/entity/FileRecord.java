package com.flamingo.ai.lifedigest.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.Locale;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A file or folder known to the system, identified by its path relative to the data root. Written
 * by file discovery; the digest pipeline only reads it.
 */
@Entity
@Table(name = "files")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FileRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, unique = true)
  private String path;

  @Column(nullable = false)
  private String name;

  private String mimeType;

  private Long size;

  /** Content hash; changes when the file content changes. */
  private String hash;

  @Column(name = "is_folder", nullable = false)
  private boolean folder;

  /** Leading characters of text files. */
  @Column(columnDefinition = "TEXT")
  private String textPreview;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime modifiedAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
  }

  public String mimeTypeOrEmpty() {
    return mimeType == null ? "" : mimeType.toLowerCase(Locale.ROOT);
  }

  public boolean isImage() {
    return mimeTypeOrEmpty().startsWith("image/");
  }

  public boolean isAudioOrVideo() {
    String type = mimeTypeOrEmpty();
    return type.startsWith("audio/") || type.startsWith("video/");
  }

  /** Lower-case extension including the dot, or empty. */
  public String extension() {
    int slash = path.lastIndexOf('/');
    int dot = path.lastIndexOf('.');
    if (dot <= slash + 1) {
      return "";
    }
    return path.substring(dot).toLowerCase(Locale.ROOT);
  }

  /** Returns true for a Markdown file whose preview is a bare http(s) URL. */
  public boolean isUrlBookmark() {
    if (folder || !".md".equals(extension()) || textPreview == null) {
      return false;
    }
    String preview = textPreview.strip();
    return preview.startsWith("http://") || preview.startsWith("https://");
  }
}
