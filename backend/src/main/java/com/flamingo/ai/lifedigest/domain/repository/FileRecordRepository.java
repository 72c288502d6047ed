package com.flamingo.ai.lifedigest.domain.repository;

import com.flamingo.ai.lifedigest.domain.entity.FileRecord;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for FileRecord entities. */
@Repository
public interface FileRecordRepository extends JpaRepository<FileRecord, Long> {

  /** Finds a file by its path relative to the data root. */
  Optional<FileRecord> findByPath(String path);
}
