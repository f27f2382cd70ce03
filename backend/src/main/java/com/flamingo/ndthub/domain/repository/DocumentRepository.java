package com.flamingo.ndthub.domain.repository;

import com.flamingo.ndthub.domain.entity.Document;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Document entities. */
@Repository
public interface DocumentRepository extends JpaRepository<Document, Long> {

  /** Finds all documents of a manufacturer, newest first. */
  List<Document> findByManufacturerIdOrderByUploadedAtDesc(Long manufacturerId);

  /** Finds documents of a manufacturer whose title contains the given text, newest first. */
  List<Document> findByManufacturerIdAndTitleContainingIgnoreCaseOrderByUploadedAtDesc(
      Long manufacturerId, String title);
}
