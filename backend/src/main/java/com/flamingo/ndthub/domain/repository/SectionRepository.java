package com.flamingo.ndthub.domain.repository;

import com.flamingo.ndthub.domain.entity.Section;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Section entities. */
@Repository
public interface SectionRepository extends JpaRepository<Section, Long> {

  /** Sections of a document in detection order. */
  List<Section> findByDocumentIdOrderByOrderIndexAsc(Long documentId);

  long countByDocumentId(Long documentId);
}
